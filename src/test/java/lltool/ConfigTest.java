package lltool;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.logging.Level;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import lltool.grammar.SymbolClassifier;
import lltool.io.GrammarReader;
import lltool.transform.LeftRecursionEliminator;

import static org.junit.jupiter.api.Assertions.*;

public class ConfigTest {

	@AfterEach
	public void resetConfig(){
		Config.reset();
	}

	@Test
	public void testDefaults(){
		assertEquals("#", Config.getEpsilon());
		assertEquals("->", Config.getArrow());
		assertEquals("|", Config.getSeparator());
		assertEquals("'", Config.getPrimeMarker());
		assertEquals("casing", Config.getClassifier());
		assertEquals(Level.WARNING, Config.getLogLevel());
	}

	@Test
	public void testLoadConfig(@TempDir Path dir) throws Exception {
		Path file = dir.resolve(Config.configFile);
		Files.write(file, "primeMarker = _r\narrow = ::=\nunknown = 1\nno assignment\n".getBytes("UTF-8"));
		Config.loadConfig(file);
		assertEquals("_r", Config.getPrimeMarker());
		assertEquals("::=", Config.getArrow());
		assertNull(Config.get("unknown"));
		String eliminated = new LeftRecursionEliminator().eliminate(
				new GrammarReader(SymbolClassifier.CASING).read("A ::= A a | b")).grammar.toString();
		assertEquals("A -> b A_r\nA_r -> a A_r | #", eliminated);
	}
}
