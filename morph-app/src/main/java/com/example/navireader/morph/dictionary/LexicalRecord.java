package com.example.navireader.morph.dictionary;

import java.util.List;
import java.util.Objects;

/**
 * Dictionary entry for one lemma.
 *
 * @param surfaceForm  lemma as written, required
 * @param syllabicForm syllable breakdown, empty when unknown
 * @param acousticForm stressed pronunciation, empty when unknown
 * @param partOfSpeech word class, {@value #UNKNOWN_POS} when missing
 * @param translations glosses in source order
 */
public record LexicalRecord(String surfaceForm,
                            String syllabicForm,
                            String acousticForm,
                            String partOfSpeech,
                            List<String> translations) {

    public static final String UNKNOWN_POS = "unknown";

    public LexicalRecord {
        Objects.requireNonNull(surfaceForm, "surfaceForm");
        if (surfaceForm.isBlank()) {
            throw new IllegalArgumentException("Lexical record must have a surface form");
        }
        syllabicForm = syllabicForm == null ? "" : syllabicForm;
        acousticForm = acousticForm == null ? "" : acousticForm;
        partOfSpeech = partOfSpeech == null || partOfSpeech.isBlank() ? UNKNOWN_POS : partOfSpeech;
        translations = translations == null ? List.of() : List.copyOf(translations);
    }

    /**
     * Placeholder row for a token that is not in the dictionary.
     */
    public static LexicalRecord unknown(String token) {
        return new LexicalRecord(token, "", "", UNKNOWN_POS, List.of());
    }
}
