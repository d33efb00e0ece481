package com.example.navireader.morph.morphology.words;

/**
 * Lexical categories that have a generator.
 */
public enum WordCategory {
    NOUN,
    PRONOUN,
    VERB,
    ADJECTIVE,
    NUMBER,
    PARTICLE,
    PRENOUN;

    public static WordCategory fromName(String name) {
        return FeatureValues.parse(values(), "category", name);
    }
}
