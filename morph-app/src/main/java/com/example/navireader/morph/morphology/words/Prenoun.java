package com.example.navireader.morph.morphology.words;

import java.util.List;

/**
 * Prenouns such as {@code tsa-}, {@code fì-} and {@code pe-} prefixed to a noun.
 */
public final class Prenoun implements WordForm<PrenounFeatures> {

    private static final List<String> LENITING_PRENOUNS = List.of("pe");

    @Override
    public WordCategory category() {
        return WordCategory.PRENOUN;
    }

    @Override
    public Class<PrenounFeatures> featureType() {
        return PrenounFeatures.class;
    }

    @Override
    public List<String> inflect(String lemma, PrenounFeatures features) {
        return List.of(combineWithNoun(lemma, features.noun()));
    }

    /**
     * Joins prenoun and noun, contracting a final {@code a} against an initial {@code a}
     * ({@code tsa} + {@code atan} gives {@code tsatan}).
     */
    public String combineWithNoun(String prenoun, String noun) {
        if (prenoun.endsWith("a") && noun.startsWith("a")) {
            return prenoun.substring(0, prenoun.length() - 1) + noun;
        }
        return prenoun + noun;
    }

    public boolean causesLenition(String prenoun) {
        for (String leniting : LENITING_PRENOUNS) {
            if (prenoun.startsWith(leniting)) {
                return true;
            }
        }
        return false;
    }
}
