package com.example.navireader.morph.config;

import com.example.navireader.morph.MorphologyException;
import com.example.navireader.morph.dictionary.LexiconSource;
import com.example.navireader.morph.dictionary.RemoteLexiconSource;
import com.example.navireader.morph.dictionary.SqliteLexiconStore;
import com.example.navireader.morph.dictionary.TsvLexiconSource;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.google.gson.stream.JsonReader;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Locale;

/**
 * Settings of the sentence pipeline, read from JSON:
 * <pre>
 * {
 *   "provider": {"type": "tsv", "tsvPath": "words.tsv", "apiUrl": "...", "sqlitePath": "...",
 *                "timeoutSeconds": 10, "retryAttempts": 3},
 *   "exceptionsPath": "exceptions.json",
 *   "outputDirectory": "tsv files output"
 * }
 * </pre>
 * The file is looked up via the {@code navi.config.path} system property, the {@code NAVI_CONFIG}
 * environment variable, {@code navi-config.json} in the working directory and finally the
 * bundled classpath resource.
 */
public final class ParserConfig {

    public static final String CONFIG_PROPERTY = "navi.config.path";
    public static final String CONFIG_ENV = "NAVI_CONFIG";
    public static final String DEFAULT_FILE_NAME = "navi-config.json";

    private static final Gson GSON = new GsonBuilder().create();

    /** Dictionary provider section. */
    public static final class Provider {
        public String type;
        public String tsvPath;
        public String apiUrl;
        public String sqlitePath;
        public Integer timeoutSeconds;
        public Integer retryAttempts;
    }

    public Provider provider = new Provider();
    public String exceptionsPath = "exceptions.json";
    public String outputDirectory = "tsv files output";

    public static ParserConfig loadDefault() {
        String systemProperty = System.getProperty(CONFIG_PROPERTY);
        if (systemProperty != null && !systemProperty.isBlank()) {
            return load(Path.of(systemProperty));
        }
        String envPath = System.getenv(CONFIG_ENV);
        if (envPath != null && !envPath.isBlank()) {
            return load(Path.of(envPath));
        }
        Path local = Path.of(DEFAULT_FILE_NAME);
        if (Files.isRegularFile(local)) {
            return load(local);
        }
        try (InputStream stream = ParserConfig.class.getResourceAsStream("/" + DEFAULT_FILE_NAME)) {
            if (stream == null) {
                throw new MorphologyException("Missing configuration. Provide path via system property '"
                        + CONFIG_PROPERTY + "' or environment variable '" + CONFIG_ENV + "'.");
            }
            return fromJson(new InputStreamReader(stream, StandardCharsets.UTF_8));
        } catch (IOException ex) {
            throw new MorphologyException("Failed to read bundled configuration", ex);
        }
    }

    public static ParserConfig load(Path path) {
        if (!Files.isRegularFile(path)) {
            throw new MorphologyException("Configuration file not found: " + path.toAbsolutePath());
        }
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return fromJson(reader);
        } catch (IOException ex) {
            throw new MorphologyException("Failed to read configuration " + path.toAbsolutePath(), ex);
        }
    }

    public static ParserConfig fromJson(Reader reader) {
        ParserConfig config;
        try {
            config = GSON.fromJson(new JsonReader(reader), ParserConfig.class);
        } catch (JsonParseException ex) {
            throw new MorphologyException("Configuration is not valid JSON", ex);
        }
        if (config == null) {
            throw new MorphologyException("Configuration is empty");
        }
        if (config.provider == null) {
            config.provider = new Provider();
        }
        return config;
    }

    public String providerType() {
        return provider.type == null ? "" : provider.type.strip().toLowerCase(Locale.ROOT);
    }

    public Duration timeout() {
        return Duration.ofSeconds(provider.timeoutSeconds == null ? 10 : provider.timeoutSeconds);
    }

    public int retryAttempts() {
        return provider.retryAttempts == null ? 3 : provider.retryAttempts;
    }

    public Path exceptionsFile() {
        return Path.of(exceptionsPath == null ? "exceptions.json" : exceptionsPath);
    }

    public Path outputDirectoryPath() {
        return Path.of(outputDirectory == null ? "tsv files output" : outputDirectory);
    }

    /**
     * Creates the dictionary source named by {@code provider.type}.
     *
     * @throws MorphologyException for an unknown type, a missing required field or a value the
     *                             source rejects (relative URL, non-positive retries or timeout)
     */
    public LexiconSource createLexiconSource() {
        String type = providerType();
        try {
            switch (type) {
                case "tsv":
                    return new TsvLexiconSource(Path.of(require(provider.tsvPath, "provider.tsvPath")));
                case "api":
                    return new RemoteLexiconSource(URI.create(require(provider.apiUrl, "provider.apiUrl")),
                            timeout(), retryAttempts());
                case "sqlite":
                    return new SqliteLexiconStore(Path.of(require(provider.sqlitePath, "provider.sqlitePath")));
                default:
                    throw new MorphologyException("Unknown provider type: " + type);
            }
        } catch (IllegalArgumentException ex) {
            throw new MorphologyException("Invalid '" + type + "' provider configuration: " + ex.getMessage(), ex);
        }
    }

    private static String require(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new MorphologyException(name + " must be specified in the configuration");
        }
        return value;
    }
}
