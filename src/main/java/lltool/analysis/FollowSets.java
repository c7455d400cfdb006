package lltool.analysis;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import lltool.UndefinedSymbolException;
import lltool.grammar.NonTerminal;
import lltool.grammar.Symbol;

import static lltool.util.Utils.formatSet;

/**
 * The follow(1) sets of all non terminals of a grammar, relative to a start non terminal.
 *
 * Each set contains terminals and possibly the end marker.
 */
public class FollowSets {

	private final NonTerminal start;

	private final Map<NonTerminal, Set<Symbol>> sets;

	private final int passes;

	FollowSets(NonTerminal start, Map<NonTerminal, Set<Symbol>> sets, int passes) {
		this.start = start;
		Map<NonTerminal, Set<Symbol>> copy = new LinkedHashMap<>();
		sets.forEach((nonTerminal, set) -> copy.put(nonTerminal, Collections.unmodifiableSet(new TreeSet<>(set))));
		this.sets = Collections.unmodifiableMap(copy);
		this.passes = passes;
	}

	/**
	 * @throws UndefinedSymbolException if the non terminal isn't part of the analysed grammar
	 */
	public Set<Symbol> of(NonTerminal nonTerminal){
		Set<Symbol> set = sets.get(nonTerminal);
		if (set == null){
			throw new UndefinedSymbolException(nonTerminal.name, String.format("No follow set for symbol '%s'", nonTerminal));
		}
		return set;
	}

	public NonTerminal getStart(){
		return start;
	}

	public Map<NonTerminal, Set<Symbol>> asMap(){
		return sets;
	}

	public int passes(){
		return passes;
	}

	@Override
	public String toString() {
		StringBuilder builder = new StringBuilder();
		for (Map.Entry<NonTerminal, Set<Symbol>> entry : sets.entrySet()) {
			if (builder.length() > 0){
				builder.append("\n");
			}
			builder.append("FOLLOW(").append(entry.getKey()).append(") = ").append(formatSet(entry.getValue()));
		}
		return builder.toString();
	}
}
