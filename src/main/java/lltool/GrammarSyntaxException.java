package lltool;

/**
 * An error in the textual description of a grammar.
 */
public class GrammarSyntaxException extends LLToolException {

	/**
	 * Line (starting at 1) of the grammar text that contains the error
	 */
	public final int line;

	public GrammarSyntaxException(int line, String message) {
		super(String.format("Error at line %d: %s", line, message));
		this.line = line;
	}
}
