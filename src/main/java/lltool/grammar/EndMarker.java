package lltool.grammar;

/**
 * Marks the end of the input, it follows the start symbol. There is only one instance.
 */
public final class EndMarker extends Symbol {

	public static final EndMarker END_MARKER = new EndMarker();

	private EndMarker() {
		super(Kind.END_MARKER, "$");
	}

	private Object readResolve() {
		return END_MARKER;
	}
}
