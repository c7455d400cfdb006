package lltool.transform;

import java.util.*;
import java.util.logging.Logger;

import lltool.Config;
import lltool.analysis.LeftReferenceGraph;
import lltool.grammar.Grammar;
import lltool.grammar.NonTerminal;
import lltool.grammar.Production;
import lltool.grammar.Symbol;

import static lltool.grammar.Epsilon.EPSILON;

/**
 * Eliminates immediate left recursion.
 *
 * The productions <pre>A → A α1 | … | A αn | β1 | … | βm</pre> are replaced by
 * <pre>
 *     A  → β1 A' | … | βm A'
 *     A' → α1 A' | … | αn A' | ε
 * </pre>
 * Non terminals without left recursive productions are copied. The order of the non terminals and productions
 * is kept, every new non terminal directly follows its origin. Indirect left recursion isn't eliminated,
 * it is reported in the warnings of the result.
 */
public class LeftRecursionEliminator {

	private static final Logger LOG = Logger.getLogger("Analysis");

	/**
	 * Appended to a non terminal name (possibly multiple times) to create the name of its tail non terminal
	 */
	private final String primeMarker;

	public LeftRecursionEliminator(String primeMarker) {
		if (primeMarker.isEmpty()){
			throw new IllegalArgumentException("The prime marker can't be empty");
		}
		this.primeMarker = primeMarker;
	}

	public LeftRecursionEliminator() {
		this(Config.getPrimeMarker());
	}

	/**
	 * Create a new grammar without immediate left recursion, the passed grammar isn't modified.
	 */
	public EliminationResult eliminate(Grammar grammar){
		Set<String> usedNames = new HashSet<>(grammar.symbolNames());
		Map<NonTerminal, List<Production>> productions = new LinkedHashMap<>();
		Map<NonTerminal, NonTerminal> introduced = new LinkedHashMap<>();
		List<EliminationWarning> warnings = new ArrayList<>();
		for (NonTerminal nonTerminal : grammar.allNonTerminals()) {
			List<List<Symbol>> recursive = new ArrayList<>();
			List<Production> nonRecursive = new ArrayList<>();
			boolean droppedTrivialCycle = false;
			for (Production production : grammar.productionsOf(nonTerminal)) {
				if (!production.isImmediatelyLeftRecursive()){
					nonRecursive.add(production);
				} else if (production.right.size() == 1){
					droppedTrivialCycle = true;
				} else {
					recursive.add(production.right.subList(1, production.right.size()));
				}
			}
			if (droppedTrivialCycle){
				LOG.warning(String.format("Removed the production %s -> %s", nonTerminal, nonTerminal));
				warnings.add(new EliminationWarning(EliminationWarning.Kind.TRIVIAL_CYCLE_REMOVED, nonTerminal));
			}
			if (recursive.isEmpty()){
				productions.put(nonTerminal, nonRecursive);
				if (nonRecursive.isEmpty() && droppedTrivialCycle){
					warnings.add(degenerate(nonTerminal));
				}
				continue;
			}
			NonTerminal tail = new NonTerminal(createTailName(nonTerminal, usedNames));
			introduced.put(nonTerminal, tail);
			LOG.info(String.format("Introduced %s to eliminate the left recursion of %s", tail, nonTerminal));
			List<Production> heads = new ArrayList<>();
			for (Production beta : nonRecursive) {
				List<Symbol> right = new ArrayList<>();
				if (!beta.isEpsilonProduction()){
					right.addAll(beta.right);
				}
				right.add(tail);
				heads.add(new Production(nonTerminal, right));
			}
			List<Production> tails = new ArrayList<>();
			for (List<Symbol> alpha : recursive) {
				List<Symbol> right = new ArrayList<>(alpha);
				right.add(tail);
				tails.add(new Production(tail, right));
			}
			tails.add(new Production(tail, EPSILON));
			productions.put(nonTerminal, heads);
			productions.put(tail, tails);
			if (heads.isEmpty()){
				warnings.add(degenerate(nonTerminal));
			}
		}
		Grammar result = new Grammar(grammar.startSymbol(), productions, grammar.getTerminals());
		LeftReferenceGraph graph = new LeftReferenceGraph(result);
		for (NonTerminal nonTerminal : graph.leftRecursiveNonTerminals()) {
			warnings.add(new EliminationWarning(EliminationWarning.Kind.INDIRECT_LEFT_RECURSION, nonTerminal,
					graph.cycleThrough(nonTerminal)));
		}
		return new EliminationResult(result, introduced, warnings);
	}

	private EliminationWarning degenerate(NonTerminal nonTerminal){
		LOG.warning(String.format("%s has no productions that aren't left recursive", nonTerminal));
		return new EliminationWarning(EliminationWarning.Kind.DEGENERATE_ELIMINATION, nonTerminal);
	}

	/**
	 * Appends the prime marker until the name isn't used by any symbol of the grammar or a previously
	 * introduced non terminal. The returned name is marked as used.
	 */
	private String createTailName(NonTerminal nonTerminal, Set<String> usedNames){
		String name = nonTerminal.name + primeMarker;
		while (usedNames.contains(name)){
			name += primeMarker;
		}
		usedNames.add(name);
		return name;
	}
}
