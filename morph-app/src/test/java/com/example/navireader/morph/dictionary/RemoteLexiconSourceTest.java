package com.example.navireader.morph.dictionary;

import com.google.gson.JsonArray;
import com.google.gson.JsonParser;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

class RemoteLexiconSourceTest {

    private static final String WORDS = "[{\"navi\": \"tsmukan\", \"syllabic\": \"tsmu-kan\", "
            + "\"acoustic\": \"tsmuKAN\", \"wordclass\": \"n.\", \"translations\": [{\"en\": \"brother\"}]},"
            + "{\"navi\": \"kame\", \"wordclass\": \"vtr.\", \"translations\": [\"to see\"]},"
            + "{\"syllabic\": \"no-word\"}]";

    private HttpServer server;
    private URI endpoint;

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress("localhost", 0), 0);
        endpoint = URI.create("http://localhost:" + server.getAddress().getPort() + "/api/list");
    }

    @AfterEach
    void tearDown() {
        if (server != null) {
            server.stop(0);
        }
    }

    @Test
    void loadsRecordsFromJsonList() {
        server.createContext("/api/list", exchange -> respond(exchange, 200, WORDS));
        server.start();

        List<LexicalRecord> records = new RemoteLexiconSource(endpoint, Duration.ofSeconds(5), 1).load();

        Assertions.assertEquals(2, records.size());
        Assertions.assertEquals(new LexicalRecord("tsmukan", "tsmu-kan", "tsmuKAN", "n.", List.of("brother")),
                records.get(0));
        Assertions.assertEquals(List.of("to see"), records.get(1).translations());
    }

    @Test
    void retriesFailedRequests() {
        AtomicInteger calls = new AtomicInteger();
        server.createContext("/api/list", exchange -> {
            if (calls.incrementAndGet() < 3) {
                respond(exchange, 503, "busy");
            } else {
                respond(exchange, 200, WORDS);
            }
        });
        server.start();

        List<LexicalRecord> records = new RemoteLexiconSource(endpoint, Duration.ofSeconds(5), 3).load();

        Assertions.assertEquals(3, calls.get());
        Assertions.assertEquals(2, records.size());
    }

    @Test
    void givesUpAfterLastAttempt() {
        AtomicInteger calls = new AtomicInteger();
        server.createContext("/api/list", exchange -> {
            calls.incrementAndGet();
            respond(exchange, 500, "down");
        });
        server.start();

        Assertions.assertTrue(new RemoteLexiconSource(endpoint, Duration.ofSeconds(5), 2).load().isEmpty());
        Assertions.assertEquals(2, calls.get());
    }

    @Test
    void nonListResponseIsEmpty() {
        server.createContext("/api/list", exchange -> respond(exchange, 200, "{\"navi\": \"tsmukan\"}"));
        server.start();

        Assertions.assertTrue(new RemoteLexiconSource(endpoint, Duration.ofSeconds(5), 3).load().isEmpty());
    }

    @Test
    void rejectsInvalidSettings() {
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> new RemoteLexiconSource(URI.create("/relative"), Duration.ofSeconds(1), 1));
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> new RemoteLexiconSource(endpoint, Duration.ofSeconds(1), 0));
    }

    @Test
    void convertsJsonItemsWithoutNetwork() {
        JsonArray items = JsonParser.parseString("[\"tute\", {\"navi\": \" tute \"}]").getAsJsonArray();

        List<LexicalRecord> records = RemoteLexiconSource.toRecords(items);

        Assertions.assertEquals(1, records.size());
        Assertions.assertEquals("tute", records.get(0).surfaceForm());
        Assertions.assertEquals(LexicalRecord.UNKNOWN_POS, records.get(0).partOfSpeech());
    }

    @Test
    void skipsTranslationsThatAreNotText() {
        JsonArray items = JsonParser.parseString("[{\"navi\": \"tute\", \"translations\": "
                + "[{\"en\": null}, {\"de\": \"Person\"}, [\"x\"], \"person\"]}, {\"navi\": \"kame\"}]")
                .getAsJsonArray();

        List<LexicalRecord> records = RemoteLexiconSource.toRecords(items);

        Assertions.assertEquals(2, records.size());
        Assertions.assertEquals(List.of("person"), records.get(0).translations());
        Assertions.assertTrue(records.get(1).translations().isEmpty());
    }

    private static void respond(HttpExchange exchange, int status, String body) throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().add("Content-Type", "application/json; charset=utf-8");
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream output = exchange.getResponseBody()) {
            output.write(bytes);
        }
    }
}
