package lltool;

/**
 * A production body, a start symbol or a lookup refers to a symbol that the grammar doesn't define.
 */
public class UndefinedSymbolException extends LLToolException {

	/**
	 * Name of the offending symbol
	 */
	public final String symbolName;

	public UndefinedSymbolException(String symbolName) {
		this(symbolName, String.format("Undefined symbol '%s'", symbolName));
	}

	public UndefinedSymbolException(String symbolName, String message) {
		super(message);
		this.symbolName = symbolName;
	}
}
