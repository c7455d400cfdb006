package lltool;

/**
 * A production violates the shape rules of a grammar, e.g. an epsilon that isn't the sole symbol
 * of the right hand side.
 */
public class MalformedProductionException extends LLToolException {

	public MalformedProductionException(String message) {
		super(message);
	}
}
