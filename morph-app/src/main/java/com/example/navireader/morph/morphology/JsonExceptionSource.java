package com.example.navireader.morph.morphology;

import com.example.navireader.morph.MalformedExceptionDataException;
import com.example.navireader.morph.MorphologyException;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Reads lemma exceptions from a JSON document shaped as {@code {"lemma": ["form", ...], ...}}.
 * Entries that do not have that shape are skipped one by one; a document that is not JSON
 * at all is reported as {@link MalformedExceptionDataException}.
 */
public final class JsonExceptionSource implements ExceptionSource {

    private static final Logger logger = LoggerFactory.getLogger(JsonExceptionSource.class);

    private final Path path;

    public JsonExceptionSource(Path path) {
        this.path = Objects.requireNonNull(path, "path");
    }

    @Override
    public List<ExceptionEntry> load() {
        if (!Files.isRegularFile(path)) {
            logger.info("No exceptions file found at {}", path.toAbsolutePath());
            return Collections.emptyList();
        }
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return parse(reader, path.toString());
        } catch (IOException ex) {
            throw new MorphologyException("Failed to read exceptions file " + path.toAbsolutePath(), ex);
        }
    }

    /**
     * Parses an exception document from an arbitrary reader.
     *
     * @param origin description of the document used in log and error messages
     */
    public static List<ExceptionEntry> parse(Reader reader, String origin) {
        JsonElement root;
        try {
            root = JsonParser.parseReader(reader);
        } catch (JsonParseException ex) {
            throw new MalformedExceptionDataException("File is not valid JSON: " + origin, ex);
        }
        if (root == null || root.isJsonNull()) {
            throw new MalformedExceptionDataException("File is empty: " + origin);
        }
        if (!root.isJsonObject()) {
            throw new MalformedExceptionDataException("Expected a JSON object of lemma to forms in " + origin);
        }

        JsonObject object = root.getAsJsonObject();
        List<ExceptionEntry> entries = new ArrayList<>(object.size());
        for (Map.Entry<String, JsonElement> member : object.entrySet()) {
            ExceptionEntry entry = toEntry(member.getKey(), member.getValue());
            if (entry == null) {
                logger.warn("Skipping malformed exception entry '{}' in {}", member.getKey(), origin);
                continue;
            }
            entries.add(entry);
        }
        return Collections.unmodifiableList(entries);
    }

    private static ExceptionEntry toEntry(String lemma, JsonElement value) {
        if (lemma == null || lemma.isBlank() || value == null || !value.isJsonArray()) {
            return null;
        }
        JsonArray array = value.getAsJsonArray();
        Set<String> forms = new LinkedHashSet<>();
        for (JsonElement element : array) {
            if (!element.isJsonPrimitive() || !element.getAsJsonPrimitive().isString()) {
                return null;
            }
            String form = element.getAsString();
            if (form.isBlank()) {
                return null;
            }
            forms.add(form);
        }
        return new ExceptionEntry(lemma.strip(), forms);
    }
}
