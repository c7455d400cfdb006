package lltool;

/**
 * Base class of all errors raised while building or analysing a grammar.
 */
public class LLToolException extends RuntimeException {

	public LLToolException(String message) {
		super(message);
	}

	public LLToolException(String message, Throwable cause) {
		super(message, cause);
	}
}
