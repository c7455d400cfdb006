package lltool.io;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.regex.Pattern;

import lltool.Config;
import lltool.GrammarSyntaxException;
import lltool.grammar.Grammar;
import lltool.grammar.GrammarBuilder;
import lltool.grammar.SymbolClassifier;

/**
 * Reads grammars written as
 * <pre>
 *     E -> E + T | T
 *     T -> id | #
 * </pre>
 * Symbols are separated by whitespace, <pre>#</pre> is ε and the head of the first line is the start symbol.
 * Lines with the same head add further alternatives.
 */
public class GrammarReader {

	private final SymbolClassifier classifier;
	private final String epsilon;
	private final String arrow;
	private final Pattern separator;

	public GrammarReader(SymbolClassifier classifier, String epsilon, String arrow, String separator) {
		this.classifier = classifier;
		this.epsilon = epsilon;
		this.arrow = arrow;
		this.separator = Pattern.compile(Pattern.quote(separator));
	}

	public GrammarReader(SymbolClassifier classifier) {
		this(classifier, Config.getEpsilon(), Config.getArrow(), Config.getSeparator());
	}

	/**
	 * Reader that uses the configured classifier and spellings
	 */
	public GrammarReader() {
		this(SymbolClassifier.forName(Config.getClassifier()));
	}

	public Grammar read(String text){
		try {
			return read(new StringReader(text));
		} catch (IOException e) {
			throw new UncheckedIOException(e);
		}
	}

	public Grammar read(Path file) throws IOException {
		try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
			return read(reader);
		}
	}

	/**
	 * @throws GrammarSyntaxException if a line isn't a valid production
	 * @throws lltool.EmptyGrammarException if there are no productions
	 * @throws lltool.UndefinedSymbolException if a non terminal is used but not defined
	 */
	public Grammar read(Reader reader) throws IOException {
		GrammarBuilder builder = new GrammarBuilder(classifier, epsilon);
		BufferedReader lines = new BufferedReader(reader);
		String line;
		int lineNumber = 0;
		while ((line = lines.readLine()) != null){
			lineNumber++;
			line = line.trim();
			if (line.isEmpty()){
				continue;
			}
			int arrowIndex = line.indexOf(arrow);
			if (arrowIndex == -1){
				throw new GrammarSyntaxException(lineNumber, String.format("Expected \"%s\" in \"%s\"", arrow, line));
			}
			String head = line.substring(0, arrowIndex).trim();
			if (head.isEmpty() || head.split("\\s+").length > 1){
				throw new GrammarSyntaxException(lineNumber, String.format("Expected a single non terminal before \"%s\"", arrow));
			}
			if (head.equals(epsilon)){
				throw new GrammarSyntaxException(lineNumber, String.format("%s can't be defined", epsilon));
			}
			String body = line.substring(arrowIndex + arrow.length());
			for (String alternative : separator.split(body, -1)) {
				alternative = alternative.trim();
				if (alternative.isEmpty()){
					throw new GrammarSyntaxException(lineNumber, String.format("Empty alternative for %s, use %s for ε", head, epsilon));
				}
				String[] symbols = alternative.split("\\s+");
				if (symbols.length > 1){
					for (String symbol : symbols) {
						if (symbol.equals(epsilon)){
							throw new GrammarSyntaxException(lineNumber, String.format("%s has to be the only symbol of an alternative", epsilon));
						}
					}
				}
				builder.add(head, symbols);
			}
		}
		return builder.toGrammar();
	}
}
