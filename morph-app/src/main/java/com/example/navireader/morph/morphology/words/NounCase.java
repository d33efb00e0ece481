package com.example.navireader.morph.morphology.words;

public enum NounCase {
    SUBJECTIVE,
    AGENTIVE,
    PATIENTIVE,
    DATIVE,
    GENITIVE,
    TOPICAL;

    public static NounCase fromName(String name) {
        return FeatureValues.parse(values(), "case", name);
    }
}
