package lltool;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.*;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Global settings with defaults, overridden by the <pre>key = value</pre> lines of the file
 * {@value #configFile} in the working directory.
 */
public class Config {

	public static final String configFile = "lltool.ini";

	private static final Logger LOG = Logger.getLogger("Analysis");

	private static final Map<String, String> defaults = new LinkedHashMap<String, String>(){{
		put("epsilon", "#");
		put("arrow", "->");
		put("separator", "|");
		put("primeMarker", "'");
		put("classifier", "casing");
		put("logLevel", "WARNING");
	}};

	private static final Map<String, String> config = new LinkedHashMap<>(defaults);

	/** Spelling of ε in grammar files */
	public static String getEpsilon(){
		return config.get("epsilon");
	}

	/** Separates the head of a production from its alternatives */
	public static String getArrow(){
		return config.get("arrow");
	}

	/** Separates alternatives */
	public static String getSeparator(){
		return config.get("separator");
	}

	/** Appended to create the names of new non terminals */
	public static String getPrimeMarker(){
		return config.get("primeMarker");
	}

	/** "casing" or "heads", see {@link lltool.grammar.SymbolClassifier#forName(String)} */
	public static String getClassifier(){
		return config.get("classifier");
	}

	public static Level getLogLevel(){
		return Level.parse(config.get("logLevel"));
	}

	public static String get(String key){
		return config.get(key);
	}

	/**
	 * Reset all settings to their defaults
	 */
	public static void reset(){
		config.clear();
		config.putAll(defaults);
	}

	/**
	 * Load the settings of the passed file, unknown keys are ignored.
	 *
	 * @throws IOException if the file can't be read
	 */
	public static void loadConfig(Path file) throws IOException {
		try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
			String line;
			while ((line = reader.readLine()) != null){
				if (line.contains(" = ")){
					String[] parts = line.split(" = ", 2);
					String key = parts[0].trim();
					if (config.containsKey(key)){
						config.put(key, parts[1].trim());
					} else {
						LOG.warning(String.format("Unknown config key \"%s\" in %s", key, file));
					}
				}
			}
		}
	}

	static {
		Path file = Paths.get(configFile);
		if (Files.exists(file)){
			try {
				loadConfig(file);
			} catch (IOException e) {
				LOG.log(Level.WARNING, "Can't read " + file + ", using the default settings", e);
			}
		}
	}
}
