package lltool.analysis;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import lltool.grammar.Grammar;

import static lltool.analysis.FirstSetResolverTest.*;
import static org.junit.jupiter.api.Assertions.*;

public class LeftReferenceGraphTest {

	@Test
	public void testImmediateLeftRecursion(){
		LeftReferenceGraph graph = new LeftReferenceGraph(parse(EXPRESSION_GRAMMAR));
		assertEquals(Set.of(nt("E"), nt("T")), graph.leftRecursiveNonTerminals());
		assertEquals(List.of(nt("E"), nt("E")), graph.cycleThrough(nt("E")));
		assertFalse(graph.isLeftRecursive(nt("F")));
		assertEquals(List.of(), graph.cycleThrough(nt("F")));
	}

	@Test
	public void testIndirectLeftRecursion(){
		LeftReferenceGraph graph = new LeftReferenceGraph(parse("S -> A a | b\nA -> S c | d"));
		assertEquals(List.of(nt("S"), nt("A"), nt("S")), graph.cycleThrough(nt("S")));
		assertEquals(List.of(nt("A"), nt("S"), nt("A")), graph.cycleThrough(nt("A")));
	}

	@Test
	public void testLeftRecursionBehindNullablePrefix(){
		LeftReferenceGraph graph = new LeftReferenceGraph(parse("S -> B S a | b\nB -> #"));
		assertTrue(graph.isLeftRecursive(nt("S")));
		assertFalse(graph.isLeftRecursive(nt("B")));
		LeftReferenceGraph.Edge edge = graph.edgesFrom(nt("S")).get(1);
		assertEquals(nt("S"), edge.to);
		assertTrue(edge.afterNullablePrefix);
	}

	@Test
	public void testNoLeftRecursion(){
		Grammar grammar = parse("E -> T E'\nE' -> + T E' | #\nT -> id");
		assertEquals(Set.of(), new LeftReferenceGraph(grammar).leftRecursiveNonTerminals());
		assertEquals("E -> T", new LeftReferenceGraph(grammar).toString());
	}

	@Test
	public void testDotFile(@TempDir Path dir) throws Exception {
		Path file = dir.resolve("left.dot");
		new LeftReferenceGraph(parse(EXPRESSION_GRAMMAR)).toFile(file);
		String content = new String(Files.readAllBytes(file), "UTF-8");
		assertTrue(content.contains("digraph"));
		assertTrue(content.contains("E"));
	}
}
