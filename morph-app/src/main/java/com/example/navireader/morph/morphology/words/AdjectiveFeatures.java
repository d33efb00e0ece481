package com.example.navireader.morph.morphology.words;

import java.util.Objects;

/**
 * @param derivedWithLe adjective built with the {@code le-} prefix, unmarked after its noun
 * @param color         adjective naming a color, which has a color noun
 * @param comparedTo    standard of comparison, may be {@code null}
 */
public record AdjectiveFeatures(AdjectiveForm form,
                                NounPosition position,
                                boolean derivedWithLe,
                                boolean color,
                                Comparison comparison,
                                String comparedTo) implements WordFeatures {

    public AdjectiveFeatures {
        Objects.requireNonNull(form, "form");
        Objects.requireNonNull(position, "position");
        Objects.requireNonNull(comparison, "comparison");
    }

    public static AdjectiveFeatures attributive(NounPosition position, boolean derivedWithLe) {
        return new AdjectiveFeatures(AdjectiveForm.ATTRIBUTIVE, position, derivedWithLe, false,
                Comparison.STANDARD, null);
    }

    public static AdjectiveFeatures adverb() {
        return new AdjectiveFeatures(AdjectiveForm.ADVERB, NounPosition.BEFORE, false, false,
                Comparison.STANDARD, null);
    }

    public static AdjectiveFeatures comparative(Comparison comparison, String comparedTo) {
        return new AdjectiveFeatures(AdjectiveForm.COMPARATIVE, NounPosition.BEFORE, false, false,
                comparison, comparedTo);
    }

    public static AdjectiveFeatures colorNoun(boolean color) {
        return new AdjectiveFeatures(AdjectiveForm.COLOR_NOUN, NounPosition.BEFORE, false, color,
                Comparison.STANDARD, null);
    }

    @Override
    public WordCategory category() {
        return WordCategory.ADJECTIVE;
    }
}
