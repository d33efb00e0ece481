package com.example.navireader.morph.morphology;

import com.example.navireader.morph.MalformedExceptionDataException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.text.Normalizer;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable lookup from irregular surface forms to their lemma. Entries are scanned in load
 * order, so when two lemmas claim the same form the one loaded first wins.
 */
public final class ExceptionIndex {

    private static final Logger logger = LoggerFactory.getLogger(ExceptionIndex.class);

    private static final ExceptionIndex EMPTY = new ExceptionIndex(Collections.emptyList());

    private final List<ExceptionEntry> entries;

    public ExceptionIndex(List<ExceptionEntry> entries) {
        this.entries = List.copyOf(Objects.requireNonNull(entries, "entries"));
    }

    public static ExceptionIndex empty() {
        return EMPTY;
    }

    /**
     * Loads the index from {@code source}. A malformed document yields an empty index so that
     * lemmatization falls back to the regular rules.
     */
    public static ExceptionIndex load(ExceptionSource source) {
        Objects.requireNonNull(source, "source");
        try {
            List<ExceptionEntry> entries = source.load();
            logger.info("Loaded {} lemma exceptions", entries.size());
            return new ExceptionIndex(entries);
        } catch (MalformedExceptionDataException ex) {
            logger.warn("Ignoring lemma exceptions: {}", ex.getMessage());
            return EMPTY;
        }
    }

    /**
     * @param word surface word, compared case-insensitively after NFC normalisation
     * @return the lemma of the first entry listing {@code word}
     */
    public Optional<String> lemmaOf(String word) {
        String normalised = Normalizer.normalize(word, Normalizer.Form.NFC).toLowerCase(Locale.ROOT);
        for (ExceptionEntry entry : entries) {
            if (entry.matches(normalised)) {
                return Optional.of(entry.lemma());
            }
        }
        return Optional.empty();
    }

    public List<ExceptionEntry> entries() {
        return entries;
    }

    public int size() {
        return entries.size();
    }
}
