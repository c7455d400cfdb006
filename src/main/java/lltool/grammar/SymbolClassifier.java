package lltool.grammar;

import java.util.HashSet;
import java.util.Set;

/**
 * Decides whether a symbol name on the right hand side of a production denotes a non terminal.
 */
@FunctionalInterface
public interface SymbolClassifier {

	/**
	 * @param name symbol name
	 * @param heads names of all symbols that have productions
	 * @return true if the name denotes a non terminal
	 */
	boolean isNonTerminal(String name, Set<String> heads);

	/**
	 * Names starting with an uppercase letter are non terminals
	 */
	SymbolClassifier CASING = (name, heads) -> !name.isEmpty() && Character.isUpperCase(name.charAt(0));

	/**
	 * Exactly the names with productions are non terminals
	 */
	SymbolClassifier HEADS = (name, heads) -> heads.contains(name);

	/**
	 * Uses a fixed table of non terminal names
	 */
	static SymbolClassifier of(Set<String> nonTerminalNames){
		Set<String> names = new HashSet<>(nonTerminalNames);
		return (name, heads) -> names.contains(name);
	}

	/**
	 * Classifier for the passed configuration value ("casing" or "heads")
	 *
	 * @throws IllegalArgumentException for any other name
	 */
	static SymbolClassifier forName(String name){
		switch (name){
			case "casing":
				return CASING;
			case "heads":
				return HEADS;
			default:
				throw new IllegalArgumentException(String.format("Unknown classifier \"%s\", use \"casing\" or \"heads\"", name));
		}
	}
}
