package com.example.navireader.morph.morphology.words;

/**
 * Side of the noun an attributive adjective stands on.
 */
public enum NounPosition {
    BEFORE,
    AFTER;

    public static NounPosition fromName(String name) {
        return FeatureValues.parse(values(), "position", name);
    }
}
