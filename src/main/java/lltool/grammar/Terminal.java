package lltool.grammar;

/**
 * A terminal symbol
 */
public class Terminal extends Symbol {

	public Terminal(String name) {
		super(Kind.TERMINAL, name);
	}
}
