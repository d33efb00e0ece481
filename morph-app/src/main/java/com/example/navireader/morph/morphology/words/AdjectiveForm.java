package com.example.navireader.morph.morphology.words;

public enum AdjectiveForm {
    ATTRIBUTIVE,
    ADVERB,
    COMPARATIVE,
    COLOR_NOUN;

    public static AdjectiveForm fromName(String name) {
        return FeatureValues.parse(values(), "adjective form", name);
    }
}
