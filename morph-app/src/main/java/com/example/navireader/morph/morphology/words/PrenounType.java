package com.example.navireader.morph.morphology.words;

public enum PrenounType {
    DEICTIC,
    QUESTION,
    UNIVERSAL;

    public static PrenounType fromName(String name) {
        return FeatureValues.parse(values(), "prenoun type", name);
    }
}
