package lltool.grammar;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import lltool.EmptyGrammarException;
import lltool.MalformedProductionException;
import lltool.UndefinedSymbolException;
import lltool.analysis.FirstSetResolver;
import lltool.analysis.FirstSets;
import lltool.analysis.FollowSetResolver;
import lltool.analysis.FollowSets;

import static lltool.util.Utils.join;

/**
 * Immutable grammar consisting of terminals, non terminals, their productions and a start non terminal.
 *
 * The order of the non terminals and of the productions of each non terminal is kept. Transformations
 * create new grammars.
 *
 * Use the {@link GrammarBuilder} to build a grammar instance conveniently.
 */
public class Grammar implements Serializable {

	private final NonTerminal start;

	private final Map<NonTerminal, List<Production>> productionsPerNonTerminal;

	private final Set<Terminal> terminals;

	private transient FirstSets firstSets;

	private transient FollowSets followSets;

	/**
	 * Create a new grammar whose terminal alphabet consists of the terminals used in the productions.
	 *
	 * @see #Grammar(NonTerminal, Map, Set)
	 */
	public Grammar(NonTerminal start, Map<NonTerminal, ? extends List<Production>> productions) {
		this(start, productions, null);
	}

	/**
	 * Create a new grammar and validate it.
	 *
	 * @param start start non terminal, has to be a key of the productions map
	 * @param productions productions per non terminal, in the order they should be kept
	 * @param alphabet declared terminals or {@code null} to use the terminals of the productions
	 * @throws EmptyGrammarException if there are no non terminals
	 * @throws UndefinedSymbolException if the start symbol, a used non terminal or a used terminal isn't defined
	 * @throws MalformedProductionException if a production is filed under a different non terminal
	 */
	public Grammar(NonTerminal start, Map<NonTerminal, ? extends List<Production>> productions,
	               Set<Terminal> alphabet) {
		if (productions.isEmpty()){
			throw new EmptyGrammarException();
		}
		Map<NonTerminal, List<Production>> prods = new LinkedHashMap<>();
		for (Map.Entry<NonTerminal, ? extends List<Production>> entry : productions.entrySet()) {
			prods.put(entry.getKey(), Collections.unmodifiableList(new ArrayList<>(entry.getValue())));
		}
		this.productionsPerNonTerminal = Collections.unmodifiableMap(prods);
		if (start == null || !prods.containsKey(start)){
			String name = start == null ? "null" : start.name;
			throw new UndefinedSymbolException(name, String.format("Start symbol '%s' has no productions", name));
		}
		this.start = start;
		Set<Terminal> usedTerminals = new LinkedHashSet<>();
		for (Map.Entry<NonTerminal, List<Production>> entry : prods.entrySet()) {
			for (Production production : entry.getValue()) {
				if (!production.left.equals(entry.getKey())){
					throw new MalformedProductionException(String.format("Production %s is listed under %s",
							production, entry.getKey()));
				}
				for (NonTerminal nonTerminal : production.nonTerminals) {
					if (!prods.containsKey(nonTerminal)){
						throw new UndefinedSymbolException(nonTerminal.name, String.format(
								"Undefined non terminal '%s' used in %s", nonTerminal, production));
					}
				}
				for (Terminal terminal : production.terminals) {
					if (alphabet != null && !alphabet.contains(terminal)){
						throw new UndefinedSymbolException(terminal.name, String.format(
								"Undefined terminal '%s' used in %s", terminal, production));
					}
					usedTerminals.add(terminal);
				}
			}
		}
		if (alphabet != null){
			usedTerminals.addAll(alphabet);
		}
		this.terminals = Collections.unmodifiableSet(usedTerminals);
	}

	/**
	 * Productions of the passed non terminal, in their original order
	 *
	 * @throws UndefinedSymbolException if the non terminal isn't part of this grammar
	 */
	public List<Production> productionsOf(NonTerminal nonTerminal){
		List<Production> productions = productionsPerNonTerminal.get(nonTerminal);
		if (productions == null){
			throw new UndefinedSymbolException(nonTerminal.name);
		}
		return productions;
	}

	/**
	 * Non terminals in the order of their definition
	 */
	public Set<NonTerminal> allNonTerminals(){
		return productionsPerNonTerminal.keySet();
	}

	public Set<Terminal> getTerminals(){
		return terminals;
	}

	public NonTerminal startSymbol(){
		return start;
	}

	/**
	 * All productions, grouped by non terminal
	 */
	public List<Production> getProductions(){
		List<Production> productions = new ArrayList<>();
		productionsPerNonTerminal.values().forEach(productions::addAll);
		return Collections.unmodifiableList(productions);
	}

	public Map<NonTerminal, List<Production>> asMap(){
		return productionsPerNonTerminal;
	}

	public boolean contains(Symbol symbol){
		switch (symbol.kind){
			case TERMINAL:
				return terminals.contains(symbol);
			case NON_TERMINAL:
				return productionsPerNonTerminal.containsKey(symbol);
			default:
				return false;
		}
	}

	/**
	 * Look up a non terminal by its name
	 *
	 * @throws UndefinedSymbolException if there is no such non terminal
	 */
	public NonTerminal getNonTerminal(String name){
		NonTerminal nonTerminal = new NonTerminal(name);
		if (!productionsPerNonTerminal.containsKey(nonTerminal)){
			throw new UndefinedSymbolException(name, "No such non terminal " + name);
		}
		return nonTerminal;
	}

	/**
	 * Names of all terminals and non terminals
	 */
	public Set<String> symbolNames(){
		Set<String> names = new LinkedHashSet<>();
		productionsPerNonTerminal.keySet().forEach(n -> names.add(n.name));
		terminals.forEach(t -> names.add(t.name));
		return names;
	}

	/**
	 * First sets of this grammar, calculated on the first call
	 */
	public FirstSets firstSets(){
		if (firstSets == null){
			firstSets = new FirstSetResolver().resolve(this);
		}
		return firstSets;
	}

	/**
	 * Follow sets of this grammar relative to its start symbol, calculated on the first call
	 */
	public FollowSets followSets(){
		if (followSets == null){
			followSets = new FollowSetResolver().resolve(this, firstSets());
		}
		return followSets;
	}

	public String longDescription(){
		return "Start non terminal: " + start + "\n" +
				"NonTerminals: " + join(allNonTerminals(), ", ") + "\n" +
				"Terminals: " + join(terminals, ", ") + "\n" +
				"Productions: \n" + join(getProductions(), "\n");
	}

	@Override
	public boolean equals(Object obj) {
		if (!(obj instanceof Grammar)){
			return false;
		}
		Grammar other = (Grammar)obj;
		return start.equals(other.start)
				&& new ArrayList<>(productionsPerNonTerminal.keySet()).equals(new ArrayList<>(other.productionsPerNonTerminal.keySet()))
				&& productionsPerNonTerminal.equals(other.productionsPerNonTerminal)
				&& terminals.equals(other.terminals);
	}

	@Override
	public int hashCode() {
		return Objects.hash(start, productionsPerNonTerminal);
	}

	/**
	 * One line per non terminal: <pre>A -> x y | z</pre>
	 */
	@Override
	public String toString() {
		List<String> lines = new ArrayList<>();
		for (Map.Entry<NonTerminal, List<Production>> entry : productionsPerNonTerminal.entrySet()) {
			List<String> alternatives = new ArrayList<>();
			for (Production production : entry.getValue()) {
				alternatives.add(production.formatRightSide());
			}
			lines.add(entry.getKey() + " -> " + join(alternatives, " | "));
		}
		return join(lines, "\n");
	}
}
