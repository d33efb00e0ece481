package com.example.navireader.morph.morphology.words;

public enum Animacy {
    ANIMATE,
    INANIMATE;

    public static Animacy fromName(String name) {
        return FeatureValues.parse(values(), "animacy", name);
    }
}
