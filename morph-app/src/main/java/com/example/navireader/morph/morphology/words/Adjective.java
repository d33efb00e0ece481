package com.example.navireader.morph.morphology.words;

import com.example.navireader.morph.UnknownFeatureException;

import java.util.List;

/**
 * Attribution, adverb formation, comparison and color nouns.
 */
public final class Adjective implements WordForm<AdjectiveFeatures> {

    public static final String ATTRIBUTIVE_MARKER = "a";
    public static final String SUPERLATIVE = "frato";

    @Override
    public WordCategory category() {
        return WordCategory.ADJECTIVE;
    }

    @Override
    public Class<AdjectiveFeatures> featureType() {
        return AdjectiveFeatures.class;
    }

    @Override
    public List<String> inflect(String lemma, AdjectiveFeatures features) {
        switch (features.form()) {
            case ATTRIBUTIVE:
                return List.of(makeAttributive(lemma, features.position(), features.derivedWithLe()));
            case ADVERB:
                return List.of(makeAdverb(lemma));
            case COMPARATIVE:
                return List.of(makeComparative(lemma, features.comparison(), features.comparedTo()));
            case COLOR_NOUN:
                return List.of(makeColorNoun(lemma, features.color()));
            default:
                throw new UnknownFeatureException("adjective form", features.form().name());
        }
    }

    /**
     * Adds the attributive {@code -a-}. Adjectives already ending in {@code a} are left as they
     * are ("apxa tute", not "apxaa tute"); {@code le-} adjectives after their noun stay unmarked.
     */
    public String makeAttributive(String lemma, NounPosition position, boolean derivedWithLe) {
        if (derivedWithLe && position == NounPosition.AFTER) {
            return lemma;
        }
        if (lemma.endsWith(ATTRIBUTIVE_MARKER)) {
            return lemma;
        }
        return lemma + ATTRIBUTIVE_MARKER;
    }

    public String makeAdverb(String lemma) {
        return "ni" + lemma;
    }

    public String makeComparative(String lemma, Comparison comparison, String comparedTo) {
        switch (comparison) {
            case STANDARD:
                return comparedTo == null || comparedTo.isBlank() ? "to" : "to " + comparedTo;
            case SUPERLATIVE:
                return SUPERLATIVE;
            case EQUALITY:
                String equality = "niftxan " + lemma + " na";
                return comparedTo == null || comparedTo.isBlank() ? equality : equality + " " + comparedTo;
            default:
                throw new UnknownFeatureException("comparison", comparison.name());
        }
    }

    /**
     * Color noun with nasal assimilation: a final {@code n} becomes {@code m} before {@code -pin}.
     * Adjectives that do not name a color are returned unchanged.
     */
    public String makeColorNoun(String lemma, boolean color) {
        if (!color) {
            return lemma;
        }
        if (lemma.endsWith("n")) {
            return lemma.substring(0, lemma.length() - 1) + "mpin";
        }
        return lemma + "pin";
    }
}
