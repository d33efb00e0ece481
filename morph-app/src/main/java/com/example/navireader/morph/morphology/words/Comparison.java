package com.example.navireader.morph.morphology.words;

public enum Comparison {
    STANDARD,
    SUPERLATIVE,
    EQUALITY;

    public static Comparison fromName(String name) {
        return FeatureValues.parse(values(), "comparison", name);
    }
}
