package lltool.analysis;

import java.util.*;
import java.util.logging.Level;
import java.util.logging.Logger;

import lltool.UndefinedSymbolException;
import lltool.grammar.Grammar;
import lltool.grammar.NonTerminal;
import lltool.grammar.Production;
import lltool.grammar.Symbol;

import static lltool.grammar.EndMarker.END_MARKER;
import static lltool.grammar.Epsilon.EPSILON;

/**
 * Calculates the follow(1) sets of all non terminals of a grammar.
 *
 * <ul>
 *     <li>The end marker is put into follow(S), S being the start non terminal.</li>
 *     <li>For each production <pre>A → αBβ</pre> everything in first(β) except ε is put into follow(B).</li>
 *     <li>For each production <pre>A → αB</pre> or <pre>A → αBβ</pre> with ε ∈ first(β) everything
 *     in follow(A) is put into follow(B).</li>
 * </ul>
 * These rules are applied until no follow set changes.
 */
public class FollowSetResolver {

	private static final Logger LOG = Logger.getLogger("Analysis");

	/**
	 * Calculate the follow sets relative to the start symbol of the grammar
	 */
	public FollowSets resolve(Grammar grammar, FirstSets firstSets){
		return resolve(grammar, firstSets, grammar.startSymbol(), FixpointListener.NONE);
	}

	public FollowSets resolve(Grammar grammar, FirstSets firstSets, NonTerminal start){
		return resolve(grammar, firstSets, start, FixpointListener.NONE);
	}

	/**
	 * Calculate the follow sets
	 *
	 * @param grammar analysed grammar
	 * @param firstSets first sets of the same grammar
	 * @param start non terminal that is followed by the end marker
	 * @param listener notified after every pass
	 * @throws UndefinedSymbolException if the start symbol isn't a non terminal of the grammar or the first sets
	 *                                  lack a symbol of the grammar
	 */
	public FollowSets resolve(Grammar grammar, FirstSets firstSets, NonTerminal start, FixpointListener listener){
		if (!grammar.contains(start)){
			throw new UndefinedSymbolException(start.name, String.format("Start symbol '%s' isn't a non terminal of the grammar", start));
		}
		Map<NonTerminal, Set<Symbol>> follow = new LinkedHashMap<>();
		for (NonTerminal nonTerminal : grammar.allNonTerminals()) {
			firstSets.of(nonTerminal);
			follow.put(nonTerminal, new HashSet<>());
		}
		follow.get(start).add(END_MARKER);
		int pass = 0;
		boolean followChanged;
		do {
			followChanged = false;
			pass++;
			for (Production production : grammar.getProductions()) {
				if (production.isEpsilonProduction()){
					continue;
				}
				Set<Symbol> trailer = new HashSet<>(follow.get(production.left));
				for (int i = production.right.size() - 1; i >= 0; i--){
					Symbol symbol = production.right.get(i);
					Set<Symbol> first = firstSets.of(symbol);
					if (symbol.isNonTerminal()){
						followChanged |= follow.get(symbol).addAll(trailer);
						if (!first.contains(EPSILON)){
							trailer.clear();
						}
						for (Symbol sym : first) {
							if (!sym.isEpsilon()){
								trailer.add(sym);
							}
						}
					} else {  // terminal
						trailer.clear();
						trailer.add(symbol);
					}
				}
			}
			if (LOG.isLoggable(Level.FINEST)){
				LOG.finest(String.format("follow sets after pass %d: %s", pass, follow));
			}
			listener.passCompleted(pass, FirstSetResolver.snapshot(follow), followChanged);
		} while (followChanged);
		LOG.fine(String.format("Calculated the follow sets of %d non terminals in %d passes", follow.size(), pass));
		return new FollowSets(start, follow, pass);
	}
}
