package lltool.io;

import java.util.List;
import java.util.Map;
import java.util.Set;

import lltool.analysis.FirstSets;
import lltool.analysis.FollowSets;
import lltool.grammar.Grammar;
import lltool.grammar.NonTerminal;
import lltool.grammar.Symbol;
import lltool.transform.EliminationWarning;

import static lltool.util.Utils.join;
import static lltool.util.Utils.sorted;

/**
 * Formats grammars and analysis results for the command line.
 */
public class GrammarFormatter {

	public static String details(Grammar grammar){
		return "--- Grammar Details ---\n" +
				"Non-Terminals: [" + join(sorted(grammar.allNonTerminals()), ", ") + "]\n" +
				"Terminals:     [" + join(sorted(grammar.getTerminals()), ", ") + "]\n" +
				"Start Symbol:  " + grammar.startSymbol();
	}

	public static String grammar(String title, Grammar grammar){
		return "--- " + title + " ---\n" + grammar;
	}

	public static String firstSets(FirstSets firstSets){
		return "--- FIRST Sets ---\n" + sets("FIRST", firstSets.asMap());
	}

	public static String followSets(FollowSets followSets){
		return "--- FOLLOW Sets ---\n" + sets("FOLLOW", followSets.asMap());
	}

	public static String warnings(List<EliminationWarning> warnings){
		StringBuilder builder = new StringBuilder("--- Warnings ---");
		for (EliminationWarning warning : warnings) {
			builder.append("\n").append(warning.getMessage());
		}
		return builder.toString();
	}

	private static String sets(String name, Map<NonTerminal, Set<Symbol>> sets){
		StringBuilder builder = new StringBuilder();
		for (Map.Entry<NonTerminal, Set<Symbol>> entry : sets.entrySet()) {
			if (builder.length() > 0){
				builder.append("\n");
			}
			builder.append(String.format("%s(%s) = [%s]", name, entry.getKey(), join(sorted(entry.getValue()), ", ")));
		}
		return builder.toString();
	}
}
