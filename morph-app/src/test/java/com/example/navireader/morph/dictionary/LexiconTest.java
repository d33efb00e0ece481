package com.example.navireader.morph.dictionary;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.Test;

class LexiconTest {

    @Test
    void firstRecordWinsForDuplicateSurfaceForms() {
        LexicalRecord first = new LexicalRecord("Tute", "", "", "n.", List.of("person"));
        LexicalRecord second = new LexicalRecord("tute", "", "", "n.", List.of("people"));
        Lexicon lexicon = Lexicon.load(() -> List.of(first, second));

        assertEquals(Optional.of(first), lexicon.lookup("TUTE"));
        assertEquals(2, lexicon.size());
        assertTrue(lexicon.lookup("kelku").isEmpty());
        assertTrue(lexicon.lookup(null).isEmpty());
    }

    @Test
    void recordsValidateSurfaceForm() {
        assertThrows(IllegalArgumentException.class, () -> new LexicalRecord(" ", "", "", "n.", List.of()));
        LexicalRecord unknown = LexicalRecord.unknown("Kaltxì");
        assertEquals("Kaltxì", unknown.surfaceForm());
        assertEquals(LexicalRecord.UNKNOWN_POS, unknown.partOfSpeech());
        assertEquals(new LexicalRecord("oe", null, null, null, null), new LexicalRecord("oe", "", "", "unknown", List.of()));
    }
}
