package com.example.navireader.morph.dictionary;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Downloads the word list of an online dictionary. The service answers a GET with a JSON array
 * of objects carrying {@code navi}, {@code syllabic}, {@code acoustic}, {@code wordclass} and
 * {@code translations}.
 */
public class RemoteLexiconSource implements LexiconSource {

    private static final Logger logger = LoggerFactory.getLogger(RemoteLexiconSource.class);

    private final HttpClient httpClient;
    private final URI endpoint;
    private final Duration timeout;
    private final int retries;

    public RemoteLexiconSource(URI endpoint, Duration timeout, int retries) {
        this(HttpClient.newBuilder()
                        .version(HttpClient.Version.HTTP_1_1)
                        .connectTimeout(timeout)
                        .followRedirects(HttpClient.Redirect.NORMAL)
                        .build(),
                endpoint, timeout, retries);
    }

    public RemoteLexiconSource(HttpClient httpClient, URI endpoint, Duration timeout, int retries) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
        this.timeout = Objects.requireNonNull(timeout, "timeout");
        if (!endpoint.isAbsolute()) {
            throw new IllegalArgumentException("Endpoint URI must be absolute: " + endpoint);
        }
        if (retries <= 0) {
            throw new IllegalArgumentException("Retry attempts must be positive");
        }
        this.retries = retries;
    }

    @Override
    public List<LexicalRecord> load() {
        for (int attempt = 1; attempt <= retries; attempt++) {
            try {
                logger.info("Loading dictionary from {} (attempt {})", endpoint, attempt);
                String body = fetch();
                JsonElement root = JsonParser.parseString(body);
                if (!root.isJsonArray()) {
                    logger.warn("Dictionary service returned a non-list response; expected list");
                    return Collections.emptyList();
                }
                return toRecords(root.getAsJsonArray());
            } catch (IOException | JsonParseException ex) {
                logger.warn("Dictionary load failed: {}", ex.getMessage());
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                logger.warn("Dictionary load interrupted");
                return Collections.emptyList();
            }
        }
        logger.error("Dictionary service {} unreachable", endpoint);
        return Collections.emptyList();
    }

    private String fetch() throws IOException, InterruptedException {
        HttpRequest request = HttpRequest.newBuilder(endpoint)
                .GET()
                .header("Accept", "application/json")
                .timeout(timeout)
                .build();
        HttpResponse<String> response = httpClient.send(request,
                HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            throw new IOException("HTTP " + status + " from " + endpoint);
        }
        return response.body();
    }

    static List<LexicalRecord> toRecords(JsonArray items) {
        List<LexicalRecord> records = new ArrayList<>(items.size());
        for (JsonElement item : items) {
            LexicalRecord record = toRecord(item);
            if (record == null) {
                logger.warn("Skipping malformed dictionary item {}", item);
                continue;
            }
            records.add(record);
        }
        return records;
    }

    private static LexicalRecord toRecord(JsonElement item) {
        if (item == null || !item.isJsonObject()) {
            return null;
        }
        JsonObject object = item.getAsJsonObject();
        String navi = string(object, "navi");
        if (navi.isBlank()) {
            return null;
        }
        return new LexicalRecord(navi, string(object, "syllabic"), string(object, "acoustic"),
                string(object, "wordclass"), translations(object.get("translations")));
    }

    private static String string(JsonObject object, String member) {
        JsonElement value = object.get(member);
        if (value == null || !value.isJsonPrimitive()) {
            return "";
        }
        return value.getAsString().strip();
    }

    // Translations come either as plain strings or as objects keyed by language.
    private static List<String> translations(JsonElement value) {
        if (value == null || !value.isJsonArray()) {
            return List.of();
        }
        List<String> translations = new ArrayList<>();
        for (JsonElement element : value.getAsJsonArray()) {
            JsonElement text = element.isJsonObject() ? element.getAsJsonObject().get("en") : element;
            if (text == null || !text.isJsonPrimitive()) {
                logger.warn("Skipping malformed translation {}", element);
                continue;
            }
            translations.add(text.getAsString());
        }
        return translations;
    }
}
