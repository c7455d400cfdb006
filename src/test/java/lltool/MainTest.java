package lltool;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.junit.jupiter.api.Assertions.*;

public class MainTest {

	@TempDir
	Path dir;

	private final ByteArrayOutputStream out = new ByteArrayOutputStream();
	private final ByteArrayOutputStream err = new ByteArrayOutputStream();

	@AfterEach
	public void resetConfig(){
		Config.reset();
	}

	private int run(String... args) throws Exception {
		return Main.run(args, new PrintStream(out, true, "UTF-8"), new PrintStream(err, true, "UTF-8"));
	}

	private Path grammarFile(String content) throws Exception {
		Path file = dir.resolve("grammar.txt");
		Files.write(file, content.getBytes("UTF-8"));
		return file;
	}

	private String out() throws Exception {
		return out.toString("UTF-8");
	}

	@Test
	public void testFirstFollow() throws Exception {
		Path file = grammarFile("E -> E + T | T\nT -> T * F | F\nF -> ( E ) | id\n");
		assertEquals(Main.EXIT_OK, run("first-follow", file.toString()));
		assertTrue(out().contains("Start Symbol:  E"));
		assertTrue(out().contains("FIRST(E) = [(, id]"));
		assertTrue(out().contains("FOLLOW(E) = [), +, $]"));
		assertTrue(out().contains("FOLLOW(F) = [), *, +, $]"));
	}

	@Test
	public void testLeftRecursion() throws Exception {
		Path file = grammarFile("E -> E + T | T\nT -> T * F | F\nF -> ( E ) | id\n");
		assertEquals(Main.EXIT_OK, run("left-recursion", file.toString()));
		assertTrue(out().contains("--- Original Grammar ---\nE -> E + T | T"));
		assertTrue(out().contains("E -> T E'\nE' -> + T E' | #\nT -> F T'\nT' -> * F T' | #\nF -> ( E ) | id"));
		assertFalse(out().contains("Warnings"));
	}

	@Test
	public void testAnalyze() throws Exception {
		Path file = grammarFile("E -> E + T | T\nT -> T * F | F\nF -> ( E ) | id\n");
		assertEquals(Main.EXIT_OK, run("analyze", file.toString()));
		assertTrue(out().contains("FIRST(E') = [+, #]"));
		assertTrue(out().contains("FOLLOW(T') = [), +, $]"));
	}

	@Test
	public void testWarningsArePrinted() throws Exception {
		Path file = grammarFile("S -> A a | b\nA -> S c | d\n");
		assertEquals(Main.EXIT_OK, run("left-recursion", file.toString()));
		assertTrue(out().contains("S is still indirectly left recursive (S -> A -> S)"));
	}

	@Test
	public void testHeadsClassifier() throws Exception {
		Path file = grammarFile("S -> A b\n");
		assertEquals(Main.EXIT_GRAMMAR_ERROR, run("first-follow", file.toString()));
		assertTrue(err.toString("UTF-8").contains("Undefined non terminal 'A'"));
		assertEquals(Main.EXIT_OK, run("first-follow", "--classifier", "heads", file.toString()));
		assertTrue(out().contains("FIRST(S) = [A]"));
	}

	@Test
	public void testDotOutput() throws Exception {
		Path file = grammarFile("E -> E + T | T\nT -> id\n");
		Path dot = dir.resolve("graph.dot");
		assertEquals(Main.EXIT_OK, run("first-follow", "--dot", dot.toString(), file.toString()));
		assertTrue(Files.size(dot) > 0);
	}

	@Test
	public void testConfigFile() throws Exception {
		Path config = dir.resolve("custom.ini");
		Files.write(config, "epsilon = eps\n".getBytes("UTF-8"));
		Path file = grammarFile("S -> a S | eps\n");
		assertEquals(Main.EXIT_OK, run("first-follow", "--config", config.toString(), file.toString()));
		assertTrue(out().contains("FIRST(S) = [a, #]"));
	}

	@Test
	public void testSyntaxError() throws Exception {
		Path file = grammarFile("S -> a\nS a\n");
		assertEquals(Main.EXIT_GRAMMAR_ERROR, run("first-follow", file.toString()));
		assertTrue(err.toString("UTF-8").contains("Error at line 2"));
	}

	@Test
	public void testMissingFile() throws Exception {
		assertEquals(Main.EXIT_IO_ERROR, run("first-follow", dir.resolve("missing.txt").toString()));
	}

	@Test
	public void testUsage() throws Exception {
		assertEquals(Main.EXIT_USAGE, run());
		assertEquals(Main.EXIT_USAGE, run("parse", "grammar.txt"));
		assertEquals(Main.EXIT_USAGE, run("first-follow"));
		assertEquals(Main.EXIT_USAGE, run("first-follow", "--dot"));
		assertEquals(Main.EXIT_USAGE, run("first-follow", "--classifier", "magic", "grammar.txt"));
		assertTrue(err.toString("UTF-8").contains("Usage: lltool"));
	}
}
