package com.example.navireader.morph.parser;

import com.example.navireader.morph.MorphologyException;
import com.example.navireader.morph.dictionary.LexicalRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Writes parse results as tab-separated tables.
 */
public final class ParseResultExporter {

    private static final Logger logger = LoggerFactory.getLogger(ParseResultExporter.class);

    static final String HEADER = "navi\tsyllabic\tacoustic\tpos\ttranslations";
    static final String DISTRIBUTION_FILE = "pos_distribution.tsv";

    /**
     * Writes {@code results} to {@code directory/filename}, creating the directory if needed.
     *
     * @return the written file, empty when there was nothing to write
     */
    public Optional<Path> writeTsv(List<LexicalRecord> results, Path directory, String filename) {
        Objects.requireNonNull(directory, "directory");
        Objects.requireNonNull(filename, "filename");
        if (results == null || results.isEmpty()) {
            logger.info("No results to save.");
            return Optional.empty();
        }
        Path file = directory.resolve(filename);
        try {
            Files.createDirectories(directory);
            try (BufferedWriter writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
                writer.write(HEADER);
                for (LexicalRecord record : results) {
                    writer.newLine();
                    writer.write(String.join("\t",
                            clean(record.surfaceForm()),
                            clean(record.syllabicForm()),
                            clean(record.acousticForm()),
                            clean(record.partOfSpeech()),
                            clean(String.join(", ", record.translations()))));
                }
                writer.newLine();
            }
        } catch (IOException ex) {
            throw new MorphologyException("Failed to write results to " + file.toAbsolutePath(), ex);
        }
        logger.info("Results saved to {}", file);
        return Optional.of(file);
    }

    /**
     * Counts rows per part of speech, most frequent first. Equal counts keep first-seen order.
     */
    public Map<String, Long> posDistribution(List<LexicalRecord> results) {
        Map<String, Long> counts = new LinkedHashMap<>();
        if (results != null) {
            for (LexicalRecord record : results) {
                counts.merge(record.partOfSpeech(), 1L, Long::sum);
            }
        }
        List<Map.Entry<String, Long>> entries = new ArrayList<>(counts.entrySet());
        entries.sort(Map.Entry.<String, Long>comparingByValue().reversed());
        Map<String, Long> sorted = new LinkedHashMap<>();
        for (Map.Entry<String, Long> entry : entries) {
            sorted.put(entry.getKey(), entry.getValue());
        }
        return sorted;
    }

    /**
     * Writes {@link #posDistribution(List)} as a two-column table.
     */
    public Optional<Path> writePosDistribution(List<LexicalRecord> results, Path directory) {
        if (results == null || results.isEmpty()) {
            logger.info("There's no data for the POS distribution.");
            return Optional.empty();
        }
        Path file = directory.resolve(DISTRIBUTION_FILE);
        try {
            Files.createDirectories(directory);
            try (BufferedWriter writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
                writer.write("pos\tquantity");
                for (Map.Entry<String, Long> entry : posDistribution(results).entrySet()) {
                    writer.newLine();
                    writer.write(clean(entry.getKey()) + "\t" + entry.getValue());
                }
                writer.newLine();
            }
        } catch (IOException ex) {
            throw new MorphologyException("Failed to write POS distribution to " + file.toAbsolutePath(), ex);
        }
        logger.info("POS distribution saved to {}", file);
        return Optional.of(file);
    }

    private static String clean(String value) {
        return value == null ? "" : value.replace('\t', ' ').replace('\n', ' ').replace('\r', ' ');
    }
}
