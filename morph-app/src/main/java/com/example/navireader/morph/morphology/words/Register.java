package com.example.navireader.morph.morphology.words;

public enum Register {
    FULL,
    SHORT;

    public static Register fromName(String name) {
        return FeatureValues.parse(values(), "register", name);
    }
}
