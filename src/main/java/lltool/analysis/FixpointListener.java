package lltool.analysis;

import java.util.Map;
import java.util.Set;

import lltool.grammar.NonTerminal;
import lltool.grammar.Symbol;

/**
 * Observes a fix point iteration over sets per non terminal.
 */
@FunctionalInterface
public interface FixpointListener {

	/**
	 * Called after every full pass over the productions
	 *
	 * @param pass number of the pass, starting at 1
	 * @param sets unmodifiable snapshot of the sets after the pass
	 * @param changed did a set change during the pass?
	 */
	void passCompleted(int pass, Map<NonTerminal, Set<Symbol>> sets, boolean changed);

	FixpointListener NONE = (pass, sets, changed) -> {};
}
