package com.example.navireader.morph.morphology.words;

/**
 * Whether a first-person non-singular pronoun includes the addressee.
 */
public enum Inclusivity {
    EXCLUSIVE,
    INCLUSIVE;

    public static Inclusivity fromName(String name) {
        return FeatureValues.parse(values(), "inclusivity", name);
    }
}
