package lltool.transform;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import lltool.grammar.Grammar;
import lltool.grammar.NonTerminal;

/**
 * The grammar without immediate left recursion together with the introduced non terminals and the warnings.
 */
public class EliminationResult {

	public final Grammar grammar;

	/**
	 * Maps every non terminal that had immediate left recursion to its new tail non terminal
	 */
	public final Map<NonTerminal, NonTerminal> introducedNonTerminals;

	public final List<EliminationWarning> warnings;

	EliminationResult(Grammar grammar, Map<NonTerminal, NonTerminal> introducedNonTerminals,
	                  List<EliminationWarning> warnings) {
		this.grammar = grammar;
		this.introducedNonTerminals = Collections.unmodifiableMap(introducedNonTerminals);
		this.warnings = Collections.unmodifiableList(warnings);
	}

	public boolean hasWarnings(){
		return !warnings.isEmpty();
	}

	public List<EliminationWarning> warningsOfKind(EliminationWarning.Kind kind){
		return warnings.stream().filter(w -> w.kind == kind).collect(Collectors.toList());
	}

	/**
	 * Did the elimination change anything?
	 */
	public boolean isIdentity(){
		return introducedNonTerminals.isEmpty() && warningsOfKind(EliminationWarning.Kind.TRIVIAL_CYCLE_REMOVED).isEmpty();
	}
}
