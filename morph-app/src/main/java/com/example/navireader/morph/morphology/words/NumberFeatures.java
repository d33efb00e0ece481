package com.example.navireader.morph.morphology.words;

import java.util.Objects;

/**
 * @param value number in the range 1 to 8
 */
public record NumberFeatures(NumeralForm form, int value) implements WordFeatures {

    public NumberFeatures {
        Objects.requireNonNull(form, "form");
    }

    @Override
    public WordCategory category() {
        return WordCategory.NUMBER;
    }
}
