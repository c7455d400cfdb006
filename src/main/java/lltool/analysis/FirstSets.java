package lltool.analysis;

import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Function;

import lltool.UndefinedSymbolException;
import lltool.grammar.Grammar;
import lltool.grammar.NonTerminal;
import lltool.grammar.Symbol;

import static lltool.grammar.Epsilon.EPSILON;
import static lltool.util.Utils.formatSet;

/**
 * The first(1) sets of all symbols of a grammar.
 *
 * Each set contains terminals and possibly ε. Instances are created by the {@link FirstSetResolver} and
 * never change afterwards.
 */
public class FirstSets {

	private final Grammar grammar;

	private final Map<NonTerminal, Set<Symbol>> sets;

	private final int passes;

	FirstSets(Grammar grammar, Map<NonTerminal, Set<Symbol>> sets, int passes) {
		this.grammar = grammar;
		Map<NonTerminal, Set<Symbol>> copy = new LinkedHashMap<>();
		for (NonTerminal nonTerminal : grammar.allNonTerminals()) {
			copy.put(nonTerminal, Collections.unmodifiableSet(new TreeSet<>(sets.get(nonTerminal))));
		}
		this.sets = Collections.unmodifiableMap(copy);
		this.passes = passes;
	}

	/**
	 * First set of the passed symbol, <pre>{t}</pre> for a terminal t and <pre>{ε}</pre> for ε.
	 *
	 * @throws UndefinedSymbolException if the symbol isn't a terminal or non terminal of the grammar
	 */
	public Set<Symbol> of(Symbol symbol){
		switch (symbol.kind){
			case NON_TERMINAL:
				Set<Symbol> set = sets.get(symbol);
				if (set != null){
					return set;
				}
				break;
			case TERMINAL:
				if (grammar.contains(symbol)){
					return Collections.singleton(symbol);
				}
				break;
			case EPSILON:
				return Collections.singleton(EPSILON);
			default:
				break;
		}
		throw new UndefinedSymbolException(symbol.name, String.format("No first set for symbol '%s'", symbol));
	}

	/**
	 * First set of a sequence of symbols, <pre>{ε}</pre> for the empty sequence
	 */
	public Set<Symbol> firstOfSequence(List<? extends Symbol> sequence){
		Set<Symbol> result = new TreeSet<>();
		if (addFirstOfSequence(sequence, this::of, result)){
			result.add(EPSILON);
		}
		return Collections.unmodifiableSet(result);
	}

	/**
	 * Can the passed symbol derive the empty word?
	 */
	public boolean isNullable(Symbol symbol){
		return of(symbol).contains(EPSILON);
	}

	/**
	 * Adds the first set of the sequence without ε to the target set.
	 *
	 * @param firstOfSymbol first set of a single symbol
	 * @return true if every symbol of the sequence is nullable, i.e. ε belongs to the first set of the sequence
	 */
	static boolean addFirstOfSequence(List<? extends Symbol> sequence, Function<Symbol, Set<Symbol>> firstOfSymbol,
	                                  Set<Symbol> target){
		for (Symbol symbol : sequence) {
			if (symbol.isEpsilon()){
				continue;
			}
			Set<Symbol> first = firstOfSymbol.apply(symbol);
			boolean nullable = false;
			for (Symbol sym : first) {
				if (sym.isEpsilon()){
					nullable = true;
				} else {
					target.add(sym);
				}
			}
			if (!nullable){
				return false;
			}
		}
		return true;
	}

	public Map<NonTerminal, Set<Symbol>> asMap(){
		return sets;
	}

	public Grammar getGrammar(){
		return grammar;
	}

	/**
	 * Number of passes the fix point iteration needed
	 */
	public int passes(){
		return passes;
	}

	/**
	 * Non terminals that can derive the empty word
	 */
	public Set<NonTerminal> nullableNonTerminals(){
		Set<NonTerminal> nullable = new HashSet<>();
		sets.forEach((nonTerminal, set) -> {
			if (set.contains(EPSILON)){
				nullable.add(nonTerminal);
			}
		});
		return nullable;
	}

	@Override
	public String toString() {
		StringBuilder builder = new StringBuilder();
		for (Map.Entry<NonTerminal, Set<Symbol>> entry : sets.entrySet()) {
			if (builder.length() > 0){
				builder.append("\n");
			}
			builder.append("FIRST(").append(entry.getKey()).append(") = ").append(formatSet(entry.getValue()));
		}
		return builder.toString();
	}
}
