package lltool.grammar;

import java.util.*;

import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import lltool.EmptyGrammarException;
import lltool.MalformedProductionException;
import lltool.UndefinedSymbolException;

import static lltool.grammar.EndMarker.END_MARKER;
import static lltool.grammar.Epsilon.EPSILON;
import static org.junit.jupiter.api.Assertions.*;

public class GrammarTest {

	static Terminal t(String name){
		return new Terminal(name);
	}

	static NonTerminal nt(String name){
		return new NonTerminal(name);
	}

	@Nested
	public class TestProduction {

		@Test
		public void testEmptyRightSideIsEpsilon(){
			Production production = new Production(nt("A"), List.of());
			assertEquals(List.of(EPSILON), production.right);
			assertTrue(production.isEpsilonProduction());
			assertEquals(0, production.rightSize());
		}

		@Test
		public void testEpsilonHasToBeAlone(){
			assertThrows(MalformedProductionException.class, () -> new Production(nt("A"), t("a"), EPSILON));
		}

		@Test
		public void testEndMarkerIsNotAllowed(){
			assertThrows(MalformedProductionException.class, () -> new Production(nt("A"), t("a"), END_MARKER));
		}

		@Test
		public void testImmediateLeftRecursion(){
			assertTrue(new Production(nt("A"), nt("A"), t("b")).isImmediatelyLeftRecursive());
			assertFalse(new Production(nt("A"), t("A"), t("b")).isImmediatelyLeftRecursive());
			assertFalse(new Production(nt("A"), EPSILON).isImmediatelyLeftRecursive());
		}

		@Test
		public void testSymbolLists(){
			Production production = new Production(nt("A"), t("("), nt("E"), t(")"));
			assertEquals(List.of(nt("E")), production.nonTerminals);
			assertEquals(List.of(t("("), t(")")), production.terminals);
			assertEquals("A -> ( E )", production.toString());
		}
	}

	@Test
	public void testEmptyGrammar(){
		assertThrows(EmptyGrammarException.class, () -> new Grammar(nt("S"), new LinkedHashMap<>()));
		assertThrows(EmptyGrammarException.class, () -> new GrammarBuilder().toGrammar());
	}

	@Test
	public void testUndefinedNonTerminal(){
		UndefinedSymbolException ex = assertThrows(UndefinedSymbolException.class,
				() -> new GrammarBuilder(SymbolClassifier.CASING).add("S", "A", "b").toGrammar());
		assertEquals("A", ex.symbolName);
	}

	@Test
	public void testUndefinedStartSymbol(){
		UndefinedSymbolException ex = assertThrows(UndefinedSymbolException.class,
				() -> new GrammarBuilder().add("S", "a").toGrammar("X"));
		assertEquals("X", ex.symbolName);
	}

	@Test
	public void testUndeclaredTerminal(){
		UndefinedSymbolException ex = assertThrows(UndefinedSymbolException.class,
				() -> new GrammarBuilder().terminals("a").add("S", "a", "b").toGrammar());
		assertEquals("b", ex.symbolName);
	}

	@Test
	public void testProductionUnderWrongHead(){
		Map<NonTerminal, List<Production>> prods = new LinkedHashMap<>();
		prods.put(nt("S"), List.of(new Production(nt("T"), t("a"))));
		prods.put(nt("T"), List.of(new Production(nt("T"), t("a"))));
		assertThrows(MalformedProductionException.class, () -> new Grammar(nt("S"), prods));
	}

	@Test
	public void testProductionsOf(){
		Grammar grammar = new GrammarBuilder().add("S", "S", "a").add("S", "b").add("T", "").toGrammar();
		assertEquals(List.of(new Production(nt("S"), nt("S"), t("a")), new Production(nt("S"), t("b"))),
				grammar.productionsOf(nt("S")));
		assertEquals(List.of(new Production(nt("T"), EPSILON)), grammar.productionsOf(nt("T")));
		assertThrows(UndefinedSymbolException.class, () -> grammar.productionsOf(nt("X")));
		assertEquals(nt("S"), grammar.startSymbol());
		assertEquals(List.of(nt("S"), nt("T")), new ArrayList<>(grammar.allNonTerminals()));
		assertEquals(Set.of(t("a"), t("b")), grammar.getTerminals());
	}

	@Test
	public void testImmutable(){
		Grammar grammar = new GrammarBuilder().add("S", "a").toGrammar();
		assertThrows(UnsupportedOperationException.class, () -> grammar.productionsOf(nt("S")).clear());
		assertThrows(UnsupportedOperationException.class, () -> grammar.asMap().clear());
	}

	@Test
	public void testValueEquality(){
		Grammar first = new GrammarBuilder().add("S", "a", "S").add("S", "#").toGrammar();
		Grammar second = new GrammarBuilder().add("S", "a", "S").add("S", "").toGrammar();
		assertEquals(first, second);
		assertEquals(first.hashCode(), second.hashCode());
		assertNotEquals(first, new GrammarBuilder().add("S", "#").add("S", "a", "S").toGrammar());
	}

	@Test
	public void testToString(){
		Grammar grammar = new GrammarBuilder().add("E", "E", "+", "T").add("E", "T").add("T", "id").toGrammar();
		assertEquals("E -> E + T | T\nT -> id", grammar.toString());
	}

	@Test
	public void testCachedAnalysis(){
		Grammar grammar = new GrammarBuilder().add("S", "a").toGrammar();
		assertSame(grammar.firstSets(), grammar.firstSets());
		assertSame(grammar.followSets(), grammar.followSets());
	}

	@Test
	public void testClassifiers(){
		Set<String> heads = Set.of("S");
		assertTrue(SymbolClassifier.CASING.isNonTerminal("Expr", heads));
		assertFalse(SymbolClassifier.CASING.isNonTerminal("id", heads));
		assertTrue(SymbolClassifier.HEADS.isNonTerminal("S", heads));
		assertFalse(SymbolClassifier.HEADS.isNonTerminal("T", heads));
		assertTrue(SymbolClassifier.of(Set.of("expr")).isNonTerminal("expr", heads));
		assertThrows(IllegalArgumentException.class, () -> SymbolClassifier.forName("magic"));
	}
}
