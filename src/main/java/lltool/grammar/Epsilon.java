package lltool.grammar;

/**
 * The empty word. There is only one instance.
 */
public final class Epsilon extends Symbol {

	public static final Epsilon EPSILON = new Epsilon();

	private Epsilon() {
		super(Kind.EPSILON, "#");
	}

	private Object readResolve() {
		return EPSILON;
	}
}
