package com.example.navireader.morph.morphology.words;

import java.util.Objects;

/**
 * @param indefinite whether the indefinite {@code -o} is attached before number and case
 */
public record NounFeatures(NounCase nounCase, GrammaticalNumber number, boolean indefinite)
        implements WordFeatures {

    public NounFeatures {
        Objects.requireNonNull(nounCase, "nounCase");
        Objects.requireNonNull(number, "number");
    }

    public static NounFeatures of(NounCase nounCase, GrammaticalNumber number) {
        return new NounFeatures(nounCase, number, false);
    }

    @Override
    public WordCategory category() {
        return WordCategory.NOUN;
    }
}
