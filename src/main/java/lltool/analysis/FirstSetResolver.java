package lltool.analysis;

import java.util.*;
import java.util.logging.Level;
import java.util.logging.Logger;

import lltool.grammar.Grammar;
import lltool.grammar.NonTerminal;
import lltool.grammar.Production;
import lltool.grammar.Symbol;

import static lltool.grammar.Epsilon.EPSILON;

/**
 * Calculates the first(1) sets of all non terminals of a grammar.
 *
 * Uses a fix point iteration: starting with empty sets, every pass walks all productions
 * <pre>A → s1 … sk</pre> and adds first(s1) \ {ε} to first(A), continuing with s2 as long as the
 * previous symbols are nullable. ε is added if the production is the ε production or all of its symbols are
 * nullable. The passes are repeated until no set changes. The sets only grow and are bounded by the terminals
 * and ε, therefore the iteration terminates, even for left recursive non terminals like <pre>A → A b | c</pre>.
 */
public class FirstSetResolver {

	private static final Logger LOG = Logger.getLogger("Analysis");

	public FirstSets resolve(Grammar grammar){
		return resolve(grammar, FixpointListener.NONE);
	}

	/**
	 * Calculate the first sets
	 *
	 * @param grammar analysed grammar
	 * @param listener notified after every pass
	 * @return first sets of all symbols of the grammar
	 */
	public FirstSets resolve(Grammar grammar, FixpointListener listener){
		Map<NonTerminal, Set<Symbol>> first = new LinkedHashMap<>();
		for (NonTerminal nonTerminal : grammar.allNonTerminals()) {
			first.put(nonTerminal, new HashSet<>());
		}
		int pass = 0;
		boolean firstChanged;
		do {
			firstChanged = false;
			pass++;
			for (NonTerminal nonTerminal : grammar.allNonTerminals()) {
				Set<Symbol> set = first.get(nonTerminal);
				for (Production production : grammar.productionsOf(nonTerminal)) {
					if (production.isEpsilonProduction()){
						firstChanged |= set.add(EPSILON);
						continue;
					}
					int oldSize = set.size();
					boolean nullable = FirstSets.addFirstOfSequence(production.right,
							sym -> sym.isNonTerminal() ? first.get(sym) : Collections.singleton(sym), set);
					if (nullable){
						set.add(EPSILON);
					}
					firstChanged |= set.size() != oldSize;
				}
			}
			if (LOG.isLoggable(Level.FINEST)){
				LOG.finest(String.format("first sets after pass %d: %s", pass, first));
			}
			listener.passCompleted(pass, snapshot(first), firstChanged);
		} while (firstChanged);
		LOG.fine(String.format("Calculated the first sets of %d non terminals in %d passes", first.size(), pass));
		return new FirstSets(grammar, first, pass);
	}

	static Map<NonTerminal, Set<Symbol>> snapshot(Map<NonTerminal, Set<Symbol>> sets){
		Map<NonTerminal, Set<Symbol>> copy = new LinkedHashMap<>();
		sets.forEach((nonTerminal, set) -> copy.put(nonTerminal, Collections.unmodifiableSet(new TreeSet<>(set))));
		return Collections.unmodifiableMap(copy);
	}
}
