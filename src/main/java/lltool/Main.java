package lltool;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.Logger;

import lltool.analysis.FirstSetResolver;
import lltool.analysis.FirstSets;
import lltool.analysis.FollowSetResolver;
import lltool.analysis.FollowSets;
import lltool.analysis.LeftReferenceGraph;
import lltool.grammar.Grammar;
import lltool.grammar.SymbolClassifier;
import lltool.io.GrammarFormatter;
import lltool.io.GrammarReader;
import lltool.transform.EliminationResult;
import lltool.transform.LeftRecursionEliminator;

/**
 * Command line interface
 *
 * <pre>
 * lltool first-follow|left-recursion|analyze [--classifier casing|heads] [--dot FILE] [--config FILE] GRAMMAR_FILE
 * </pre>
 */
public class Main {

	public static final int EXIT_OK = 0;
	public static final int EXIT_GRAMMAR_ERROR = 1;
	public static final int EXIT_IO_ERROR = 2;
	public static final int EXIT_USAGE = 64;

	private static final String USAGE = "Usage: lltool first-follow|left-recursion|analyze " +
			"[--classifier casing|heads] [--dot FILE] [--config FILE] GRAMMAR_FILE";

	public static void main(String[] args) {
		System.exit(run(args, System.out, System.err));
	}

	/**
	 * Run the command line interface
	 *
	 * @return exit code
	 */
	public static int run(String[] args, PrintStream out, PrintStream err){
		String command = null;
		String classifierName = null;
		Path dotFile = null;
		Path configFile = null;
		List<String> positional = new ArrayList<>();
		for (int i = 0; i < args.length; i++) {
			String arg = args[i];
			if (arg.equals("--classifier") || arg.equals("--dot") || arg.equals("--config")){
				if (i + 1 >= args.length){
					err.println("Missing value for " + arg);
					err.println(USAGE);
					return EXIT_USAGE;
				}
				String value = args[++i];
				switch (arg){
					case "--classifier":
						classifierName = value;
						break;
					case "--dot":
						dotFile = Paths.get(value);
						break;
					default:
						configFile = Paths.get(value);
				}
			} else if (command == null){
				command = arg;
			} else {
				positional.add(arg);
			}
		}
		if (command == null || positional.size() != 1
				|| !(command.equals("first-follow") || command.equals("left-recursion") || command.equals("analyze"))){
			err.println(USAGE);
			return EXIT_USAGE;
		}
		try {
			if (configFile != null){
				Config.loadConfig(configFile);
			}
			configureLogging(Config.getLogLevel());
			SymbolClassifier classifier = SymbolClassifier.forName(classifierName == null ? Config.getClassifier() : classifierName);
			Grammar grammar = new GrammarReader(classifier).read(Paths.get(positional.get(0)));
			switch (command){
				case "first-follow":
					printFirstFollow(grammar, out);
					break;
				case "left-recursion":
					eliminate(grammar, out);
					break;
				default:
					printFirstFollow(eliminate(grammar, out), out);
			}
			if (dotFile != null){
				new LeftReferenceGraph(grammar).toFile(dotFile);
			}
			return EXIT_OK;
		} catch (IllegalArgumentException e) {
			err.println("Error: " + e.getMessage());
			err.println(USAGE);
			return EXIT_USAGE;
		} catch (LLToolException e) {
			err.println("Error: " + e.getMessage());
			return EXIT_GRAMMAR_ERROR;
		} catch (IOException e) {
			err.println("Error: Can't access " + e.getMessage());
			return EXIT_IO_ERROR;
		}
	}

	private static void printFirstFollow(Grammar grammar, PrintStream out){
		FirstSets firstSets = new FirstSetResolver().resolve(grammar);
		FollowSets followSets = new FollowSetResolver().resolve(grammar, firstSets);
		out.println(GrammarFormatter.details(grammar));
		out.println();
		out.println(GrammarFormatter.firstSets(firstSets));
		out.println();
		out.println(GrammarFormatter.followSets(followSets));
	}

	private static Grammar eliminate(Grammar grammar, PrintStream out){
		EliminationResult result = new LeftRecursionEliminator().eliminate(grammar);
		out.println(GrammarFormatter.grammar("Original Grammar", grammar));
		out.println();
		out.println(GrammarFormatter.grammar("Grammar After Eliminating Left Recursion", result.grammar));
		if (result.hasWarnings()){
			out.println();
			out.println(GrammarFormatter.warnings(result.warnings));
		}
		out.println();
		return result.grammar;
	}

	private static void configureLogging(Level level){
		Logger root = Logger.getLogger("");
		root.setLevel(level);
		for (Handler handler : root.getHandlers()) {
			handler.setLevel(level);
		}
	}
}
