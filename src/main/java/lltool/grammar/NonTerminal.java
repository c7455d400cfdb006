package lltool.grammar;

/**
 * A non terminal symbol. Its productions are stored in the {@link Grammar}.
 */
public class NonTerminal extends Symbol {

	/**
	 * @param name name of the non terminal, typically uppercase
	 */
	public NonTerminal(String name) {
		super(Kind.NON_TERMINAL, name);
	}
}
