package lltool.transform;

import java.util.Collections;
import java.util.List;

import lltool.grammar.NonTerminal;

import static lltool.util.Utils.join;

/**
 * A problem found while eliminating left recursion that doesn't prevent the creation of the new grammar.
 */
public class EliminationWarning {

	public enum Kind {
		/**
		 * Every production of the non terminal was left recursive, it has no productions left
		 */
		DEGENERATE_ELIMINATION,
		/**
		 * A production <pre>A → A</pre> was dropped
		 */
		TRIVIAL_CYCLE_REMOVED,
		/**
		 * The non terminal is still left recursive via other non terminals
		 */
		INDIRECT_LEFT_RECURSION
	}

	public final Kind kind;

	public final NonTerminal nonTerminal;

	/**
	 * Cycle of non terminals, only set for {@link Kind#INDIRECT_LEFT_RECURSION}
	 */
	public final List<NonTerminal> cycle;

	EliminationWarning(Kind kind, NonTerminal nonTerminal, List<NonTerminal> cycle) {
		this.kind = kind;
		this.nonTerminal = nonTerminal;
		this.cycle = Collections.unmodifiableList(cycle);
	}

	EliminationWarning(Kind kind, NonTerminal nonTerminal) {
		this(kind, nonTerminal, Collections.emptyList());
	}

	public String getMessage(){
		switch (kind){
			case DEGENERATE_ELIMINATION:
				return String.format("Every production of %s is left recursive, %s can't derive any word", nonTerminal, nonTerminal);
			case TRIVIAL_CYCLE_REMOVED:
				return String.format("Removed the production %s -> %s", nonTerminal, nonTerminal);
			default:
				return String.format("%s is still indirectly left recursive (%s), only immediate left recursion " +
						"is eliminated", nonTerminal, join(cycle, " -> "));
		}
	}

	@Override
	public String toString() {
		return kind + ": " + getMessage();
	}
}
