package com.example.navireader.morph.dictionary;

import com.example.navireader.morph.MorphologyException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Reads dictionary records from a tab-separated word list with the columns
 * {@value #WORD_COLUMN}, {@value #POS_COLUMN} and {@value #TRANSLATION_COLUMN}.
 */
public final class TsvLexiconSource implements LexiconSource {

    private static final Logger logger = LoggerFactory.getLogger(TsvLexiconSource.class);

    public static final String WORD_COLUMN = "Word (Na'vi)";
    public static final String POS_COLUMN = "POS";
    public static final String TRANSLATION_COLUMN = "Translation (en)";

    private final Path path;

    public TsvLexiconSource(Path path) {
        this.path = Objects.requireNonNull(path, "path");
        if (!Files.isRegularFile(path)) {
            throw new MorphologyException("TSV file not found: " + path.toAbsolutePath());
        }
    }

    @Override
    public List<LexicalRecord> load() {
        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            String headerLine = reader.readLine();
            if (headerLine == null) {
                logger.warn("TSV file {} is empty", path);
                return Collections.emptyList();
            }
            List<String> header = Arrays.asList(stripBom(headerLine).split("\t", -1));
            int wordIndex = header.indexOf(WORD_COLUMN);
            int posIndex = header.indexOf(POS_COLUMN);
            int translationIndex = header.indexOf(TRANSLATION_COLUMN);
            if (wordIndex < 0 || posIndex < 0 || translationIndex < 0) {
                logger.warn("TSV file {} missing expected columns, found {}", path, header);
                return Collections.emptyList();
            }

            List<LexicalRecord> records = new ArrayList<>();
            String line;
            int lineNumber = 1;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                if (line.isBlank()) {
                    continue;
                }
                String[] cells = line.split("\t", -1);
                String word = cell(cells, wordIndex).toLowerCase(Locale.ROOT);
                if (word.isEmpty()) {
                    logger.warn("Skipping line {} of {}: no word", lineNumber, path);
                    continue;
                }
                String translation = cell(cells, translationIndex);
                records.add(new LexicalRecord(word, "", "", cell(cells, posIndex),
                        translation.isEmpty() ? List.of() : List.of(translation)));
            }
            logger.info("Loaded {} dictionary records from {}", records.size(), path);
            return records;
        } catch (IOException ex) {
            logger.error("Failed to read TSV file {}", path, ex);
            return Collections.emptyList();
        }
    }

    private static String cell(String[] cells, int index) {
        return index < cells.length ? cells[index].strip() : "";
    }

    private static String stripBom(String line) {
        return line.startsWith("\ufeff") ? line.substring(1) : line;
    }
}
