package com.example.navireader.morph.morphology.words;

public enum Person {
    FIRST,
    SECOND,
    THIRD;

    public static Person fromName(String name) {
        return FeatureValues.parse(values(), "person", name);
    }
}
