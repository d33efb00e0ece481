package com.example.navireader.morph.morphology.words;

/**
 * Number with the prefix that marks it on nouns.
 */
public enum GrammaticalNumber {
    SINGULAR(""),
    DUAL("me"),
    TRIAL("pxe"),
    PLURAL("ay");

    private final String prefix;

    GrammaticalNumber(String prefix) {
        this.prefix = prefix;
    }

    public String prefix() {
        return prefix;
    }

    public static GrammaticalNumber fromName(String name) {
        return FeatureValues.parse(values(), "number", name);
    }
}
