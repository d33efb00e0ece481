package com.example.navireader.morph.morphology.words;

public enum NumeralForm {
    CARDINAL,
    ORDINAL,
    FRACTION,
    /** How many times: once, twice, ... */
    ADVERBIAL;

    public static NumeralForm fromName(String name) {
        return FeatureValues.parse(values(), "numeral form", name);
    }
}
