package com.example.navireader.morph.morphology;

/**
 * Ending classes of a surface string that drive suffix selection.
 */
public record PhonologicalProfile(boolean endsWithVowel,
                                  boolean endsWithDiphthong,
                                  boolean endsWithPseudovowel) {

    public static PhonologicalProfile of(String word) {
        return new PhonologicalProfile(
                Phonology.endsWithVowel(word),
                Phonology.endsWithDiphthong(word),
                Phonology.endsWithPseudovowel(word));
    }

    /** Vowel-like for patientive and dative selection. */
    public boolean vowelOrDiphthong() {
        return endsWithVowel || endsWithDiphthong;
    }
}
