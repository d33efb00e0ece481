package com.example.navireader.morph.morphology.words;

/**
 * Grammatical features requested from a generator. Each category has its own record type.
 */
public interface WordFeatures {

    WordCategory category();
}
