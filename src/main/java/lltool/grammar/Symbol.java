package lltool.grammar;

import java.io.Serializable;
import java.util.Objects;

/**
 * Base class for terminals, non terminals, epsilon and the end marker.
 *
 * Symbols are compared by their kind first and by their name second.
 */
public abstract class Symbol implements Serializable, Comparable<Symbol> {

	/**
	 * Kinds of symbols, declared in the order used for comparisons
	 */
	public enum Kind {
		TERMINAL, NON_TERMINAL, EPSILON, END_MARKER
	}

	public final Kind kind;

	/**
	 * Name of the symbol, the conventional spelling for epsilon and the end marker
	 */
	public final String name;

	protected Symbol(Kind kind, String name) {
		this.kind = kind;
		this.name = Objects.requireNonNull(name);
	}

	public boolean isTerminal(){
		return kind == Kind.TERMINAL;
	}

	public boolean isNonTerminal(){
		return kind == Kind.NON_TERMINAL;
	}

	public boolean isEpsilon(){
		return kind == Kind.EPSILON;
	}

	public boolean isEndMarker(){
		return kind == Kind.END_MARKER;
	}

	public boolean isEpsOrTerminal(){
		return isEpsilon() || isTerminal();
	}

	@Override
	public int hashCode() {
		return kind.hashCode() * 31 + name.hashCode();
	}

	@Override
	public boolean equals(Object obj) {
		if (!(obj instanceof Symbol)){
			return false;
		}
		Symbol other = (Symbol)obj;
		return other.kind == kind && other.name.equals(name);
	}

	@Override
	public int compareTo(Symbol o) {
		if (kind != o.kind){
			return kind.compareTo(o.kind);
		}
		return name.compareTo(o.name);
	}

	@Override
	public String toString() {
		return name;
	}
}
