package com.example.navireader.morph.cli;

import com.example.navireader.morph.MorphologyException;
import com.example.navireader.morph.NaviMorphology;
import com.example.navireader.morph.config.ParserConfig;
import com.example.navireader.morph.dictionary.LexicalRecord;
import com.example.navireader.morph.dictionary.Lexicon;
import com.example.navireader.morph.dictionary.LexiconSource;
import com.example.navireader.morph.dictionary.SqliteLexiconStore;
import com.example.navireader.morph.morphology.JsonExceptionSource;
import com.example.navireader.morph.morphology.MorphologyTrace;
import com.example.navireader.morph.morphology.Slf4jMorphologyTrace;
import com.example.navireader.morph.parser.ParseResultExporter;
import com.example.navireader.morph.parser.SentenceParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Command line front end. Without a mode it parses a sentence against the configured
 * dictionary, prints one row per token and saves the rows as {@code results.tsv}.
 *
 * <pre>
 *   [--config file] [--parse] [sentence...]
 *   [--config file] --lemmatize word...
 *   --generate category lemma [key=value...]
 *   [--config file] --import-sqlite database
 * </pre>
 */
public final class NaviConsoleApplication {

    private static final Logger logger = LoggerFactory.getLogger(NaviConsoleApplication.class);

    static final String DEFAULT_SENTENCE = "Oel ngati kameie, ma tsmukan!";
    static final String RESULTS_FILE = "results.tsv";

    private final PrintStream out;
    private final PrintStream err;

    public NaviConsoleApplication(PrintStream out, PrintStream err) {
        this.out = Objects.requireNonNull(out, "out");
        this.err = Objects.requireNonNull(err, "err");
    }

    public static void main(String[] args) {
        int exitCode = new NaviConsoleApplication(System.out, System.err).run(args);
        if (exitCode != 0) {
            System.exit(exitCode);
        }
    }

    public int run(String[] args) {
        List<String> arguments = new ArrayList<>(args == null ? List.of() : Arrays.asList(args));
        Path configPath = null;
        int configIndex = arguments.indexOf("--config");
        if (configIndex >= 0) {
            if (configIndex + 1 >= arguments.size()) {
                err.println("Option --config requires a path.");
                return 1;
            }
            configPath = Path.of(arguments.get(configIndex + 1));
            arguments.subList(configIndex, configIndex + 2).clear();
        }

        String mode = arguments.isEmpty() ? "--parse" : arguments.get(0);
        List<String> rest = arguments.isEmpty() || !mode.startsWith("--")
                ? arguments
                : arguments.subList(1, arguments.size());
        try {
            switch (mode) {
                case "--lemmatize":
                    return lemmatize(loadConfig(configPath), rest);
                case "--generate":
                    return generate(rest);
                case "--import-sqlite":
                    return importSqlite(loadConfig(configPath), rest);
                case "--parse":
                    return parse(loadConfig(configPath), rest);
                default:
                    if (mode.startsWith("--")) {
                        err.println("Unknown option: " + mode);
                        printUsage();
                        return 1;
                    }
                    return parse(loadConfig(configPath), rest);
            }
        } catch (MorphologyException ex) {
            err.println("Morphology failed: " + ex.getMessage());
            logger.debug("Command failed", ex);
            return 2;
        }
    }

    private int parse(ParserConfig config, List<String> words) {
        String sentence = words.isEmpty() ? DEFAULT_SENTENCE : String.join(" ", words);
        MorphologyTrace trace = new Slf4jMorphologyTrace();
        NaviMorphology morphology = NaviMorphology.load(new JsonExceptionSource(config.exceptionsFile()), trace);
        Lexicon lexicon = Lexicon.load(config.createLexiconSource());
        logger.info("Using provider: {}", config.providerType());

        out.println("Parsing sentence: " + sentence);
        SentenceParser parser = new SentenceParser(morphology, lexicon, trace);
        List<LexicalRecord> rows = parser.parseSentence(sentence);
        for (LexicalRecord row : rows) {
            out.println(String.join("\t", row.surfaceForm(), row.syllabicForm(), row.acousticForm(),
                    row.partOfSpeech(), String.join(", ", row.translations())));
        }

        ParseResultExporter exporter = new ParseResultExporter();
        exporter.writeTsv(rows, config.outputDirectoryPath(), RESULTS_FILE)
                .ifPresent(file -> out.println("Saved " + file));
        exporter.writePosDistribution(rows, config.outputDirectoryPath());
        return 0;
    }

    private int lemmatize(ParserConfig config, List<String> words) {
        if (words.isEmpty()) {
            err.println("Option --lemmatize requires at least one word.");
            return 1;
        }
        NaviMorphology morphology = NaviMorphology.load(new JsonExceptionSource(config.exceptionsFile()),
                new Slf4jMorphologyTrace());
        for (String word : words) {
            out.println(word + "\t" + morphology.lemmatize(word));
        }
        return 0;
    }

    private int generate(List<String> args) {
        if (args.size() < 2) {
            err.println("Option --generate requires a category and a lemma.");
            return 1;
        }
        Map<String, String> features = new LinkedHashMap<>();
        for (String pair : args.subList(2, args.size())) {
            int separator = pair.indexOf('=');
            if (separator <= 0) {
                err.println("Feature must be written as key=value: " + pair);
                return 1;
            }
            features.put(pair.substring(0, separator), pair.substring(separator + 1));
        }
        NaviMorphology morphology = new NaviMorphology();
        for (String form : morphology.generate(args.get(0), args.get(1), features)) {
            out.println(form);
        }
        return 0;
    }

    private int importSqlite(ParserConfig config, List<String> args) {
        if (args.size() != 1) {
            err.println("Option --import-sqlite requires the database path.");
            return 1;
        }
        Path database = Path.of(args.get(0));
        LexiconSource source = config.createLexiconSource();
        int count = new SqliteLexiconStore(database).importRecords(source.load());
        out.printf("Imported %d dictionary entries into %s%n", count, database.toAbsolutePath());
        return 0;
    }

    private static ParserConfig loadConfig(Path configPath) {
        return configPath == null ? ParserConfig.loadDefault() : ParserConfig.load(configPath);
    }

    private void printUsage() {
        err.println("Usage: [--config file] [--parse] [sentence...]");
        err.println("       [--config file] --lemmatize word...");
        err.println("       --generate category lemma [key=value...]");
        err.println("       [--config file] --import-sqlite database");
    }
}
