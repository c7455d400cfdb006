package lltool;

/**
 * Thrown when a grammar without any non terminal is constructed.
 */
public class EmptyGrammarException extends LLToolException {

	public EmptyGrammarException() {
		super("The grammar doesn't contain any non terminal");
	}
}
