package com.example.navireader.morph.morphology.words;

public enum ParticleType {
    QUESTION,
    VOCATIVE,
    NEGATIVE,
    GENERAL;

    public static ParticleType fromName(String name) {
        return FeatureValues.parse(values(), "particle type", name);
    }
}
