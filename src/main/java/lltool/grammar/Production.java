package lltool.grammar;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import lltool.MalformedProductionException;

import static lltool.grammar.Epsilon.EPSILON;

/**
 * A grammar production with a left and a right hand side.
 *
 * Productions are values: two productions are equal if both of their sides are equal.
 */
public class Production implements Serializable {

	/**
	 * Left hand side of the production (the associated non terminal)
	 */
	public final NonTerminal left;

	/**
	 * Right hand side of the production, either terminals and non terminals or a single epsilon.
	 */
	public final List<Symbol> right;

	/**
	 * Non terminals used in the right hand side
	 */
	public final List<NonTerminal> nonTerminals;

	/**
	 * Terminals used in the right hand side
	 */
	public final List<Terminal> terminals;

	/**
	 * Creates a production, an empty right hand side is stored as <pre>[ε]</pre>.
	 *
	 * @throws MalformedProductionException if epsilon isn't the sole symbol or the end marker is used
	 */
	public Production(NonTerminal left, List<? extends Symbol> right) {
		this.left = left;
		List<Symbol> r = new ArrayList<>(right);
		if (r.isEmpty()){
			r.add(EPSILON);
		}
		List<NonTerminal> nonTerminals = new ArrayList<>();
		List<Terminal> terminals = new ArrayList<>();
		for (Symbol symbol : r) {
			switch (symbol.kind){
				case NON_TERMINAL:
					nonTerminals.add((NonTerminal)symbol);
					break;
				case TERMINAL:
					terminals.add((Terminal)symbol);
					break;
				case EPSILON:
					if (r.size() > 1){
						throw new MalformedProductionException(String.format("Epsilon has to be the only symbol " +
								"on the right hand side of %s -> %s", left, formatSymbols(r)));
					}
					break;
				case END_MARKER:
					throw new MalformedProductionException(String.format("The end marker can't be used " +
							"in the production %s -> %s", left, formatSymbols(r)));
			}
		}
		this.right = Collections.unmodifiableList(r);
		this.nonTerminals = Collections.unmodifiableList(nonTerminals);
		this.terminals = Collections.unmodifiableList(terminals);
	}

	public Production(NonTerminal left, Symbol... right) {
		this(left, List.of(right));
	}

	/**
	 * Is this the <pre>A → ε</pre> production?
	 */
	public boolean isEpsilonProduction(){
		return right.get(0).isEpsilon();
	}

	/**
	 * Does the right hand side start with the left hand side?
	 */
	public boolean isImmediatelyLeftRecursive(){
		return right.get(0).equals(left);
	}

	/**
	 * Size of the right hand side.
	 */
	public int rightSize(){
		return isEpsilonProduction() ? 0 : right.size();
	}

	public String formatRightSide(){
		return formatSymbols(right);
	}

	private static String formatSymbols(List<Symbol> symbols){
		StringBuilder builder = new StringBuilder();
		for (int i = 0; i < symbols.size(); i++) {
			builder.append(symbols.get(i));
			if (i < symbols.size() - 1) {
				builder.append(" ");
			}
		}
		return builder.toString();
	}

	@Override
	public String toString() {
		return left + " -> " + formatRightSide();
	}

	@Override
	public boolean equals(Object obj) {
		if (!(obj instanceof Production)){
			return false;
		}
		Production other = (Production)obj;
		return other.left.equals(left) && other.right.equals(right);
	}

	@Override
	public int hashCode() {
		return left.hashCode() * 31 + right.hashCode();
	}
}
