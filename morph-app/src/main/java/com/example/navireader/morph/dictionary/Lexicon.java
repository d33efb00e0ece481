package com.example.navireader.morph.dictionary;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * In-memory dictionary keyed by lower-cased surface form. When several records share a
 * surface form the first one loaded is returned.
 */
public final class Lexicon implements LexiconLookup {

    private final List<LexicalRecord> records;
    private final Map<String, LexicalRecord> bySurfaceForm;

    public Lexicon(List<LexicalRecord> records) {
        this.records = List.copyOf(Objects.requireNonNull(records, "records"));
        Map<String, LexicalRecord> index = new LinkedHashMap<>();
        for (LexicalRecord record : this.records) {
            index.putIfAbsent(record.surfaceForm().toLowerCase(Locale.ROOT), record);
        }
        this.bySurfaceForm = Collections.unmodifiableMap(index);
    }

    public static Lexicon load(LexiconSource source) {
        return new Lexicon(Objects.requireNonNull(source, "source").load());
    }

    @Override
    public Optional<LexicalRecord> lookup(String lemma) {
        if (lemma == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(bySurfaceForm.get(lemma.toLowerCase(Locale.ROOT)));
    }

    public List<LexicalRecord> records() {
        return records;
    }

    public int size() {
        return records.size();
    }
}
