package lltool.grammar;

import java.util.*;

import lltool.LLToolException;

import static lltool.grammar.Epsilon.EPSILON;

/**
 * Allows the simple creation of grammars.
 *
 * Productions are added with plain names, the passed {@link SymbolClassifier} decides
 * when the grammar is created which of the names are non terminals. The empty string and the epsilon
 * spelling stand for ε.
 */
public class GrammarBuilder {

	private final SymbolClassifier classifier;

	private final String epsilon;

	/**
	 * Heads in order of their first appearance
	 */
	private final Set<String> heads = new LinkedHashSet<>();

	private final List<String[]> productions = new ArrayList<>();

	private Set<String> declaredTerminals;

	public GrammarBuilder(SymbolClassifier classifier, String epsilon) {
		this.classifier = classifier;
		this.epsilon = epsilon;
	}

	public GrammarBuilder(SymbolClassifier classifier) {
		this(classifier, EPSILON.name);
	}

	/**
	 * Builder that treats every head as a non terminal
	 */
	public GrammarBuilder() {
		this(SymbolClassifier.HEADS);
	}

	/**
	 * Adds a new production.
	 *
	 * @param left name of the defining non terminal on the left hand side of the production
	 * @param right names on the right hand side, no names or a single epsilon for an ε production
	 */
	public GrammarBuilder add(String left, String... right){
		if (left == null || left.isEmpty() || left.equals(epsilon)){
			throw new LLToolException(String.format("Invalid left hand side \"%s\"", left));
		}
		heads.add(left);
		String[] prod = new String[right.length + 1];
		prod[0] = left;
		System.arraycopy(right, 0, prod, 1, right.length);
		productions.add(prod);
		return this;
	}

	/**
	 * Adds a production for every alternative.
	 */
	public GrammarBuilder addAlternatives(String left, String[]... alternatives){
		for (String[] alternative : alternatives) {
			add(left, alternative);
		}
		return this;
	}

	/**
	 * Declare the terminal alphabet, using other terminals is an error
	 */
	public GrammarBuilder terminals(String... names){
		declaredTerminals = new LinkedHashSet<>(Arrays.asList(names));
		return this;
	}

	public SymbolClassifier getClassifier(){
		return classifier;
	}

	private Symbol convert(String name){
		if (name.isEmpty() || name.equals(epsilon)){
			return EPSILON;
		}
		if (classifier.isNonTerminal(name, heads)){
			return new NonTerminal(name);
		}
		return new Terminal(name);
	}

	/**
	 * Create the grammar, the first added head is the start symbol.
	 *
	 * @throws lltool.EmptyGrammarException if no production has been added
	 */
	public Grammar toGrammar(){
		return toGrammar(heads.isEmpty() ? null : heads.iterator().next());
	}

	public Grammar toGrammar(String startNonTerminal){
		Map<NonTerminal, List<Production>> prods = new LinkedHashMap<>();
		for (String head : heads) {
			prods.put(new NonTerminal(head), new ArrayList<>());
		}
		for (String[] prod : productions) {
			NonTerminal left = new NonTerminal(prod[0]);
			List<Symbol> right = new ArrayList<>();
			for (int i = 1; i < prod.length; i++) {
				right.add(convert(prod[i]));
			}
			prods.get(left).add(new Production(left, right));
		}
		Set<Terminal> alphabet = null;
		if (declaredTerminals != null){
			alphabet = new LinkedHashSet<>();
			for (String name : declaredTerminals) {
				alphabet.add(new Terminal(name));
			}
		}
		return new Grammar(startNonTerminal == null ? null : new NonTerminal(startNonTerminal), prods, alphabet);
	}
}
