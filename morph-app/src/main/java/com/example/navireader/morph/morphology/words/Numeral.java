package com.example.navireader.morph.morphology.words;

import com.example.navireader.morph.UnknownFeatureException;

import java.util.List;
import java.util.Map;

/**
 * Numerals of the octal counting system for the values 1 to 8 ({@code vol}, eight, is the base).
 */
public final class Numeral implements WordForm<NumberFeatures> {

    public static final int MIN_VALUE = 1;
    public static final int MAX_VALUE = 8;

    private static final Map<Integer, String> CARDINALS = Map.of(
            1, "'aw",
            2, "mune",
            3, "pxey",
            4, "tsing",
            5, "mrr",
            6, "pukap",
            7, "kinä",
            8, "vol");

    private static final Map<String, String> ORDINAL_STEMS = Map.of(
            "mune", "mu",
            "tsing", "tsi",
            "pukap", "pu",
            "kinä", "ki");

    private static final String ORDINAL_SUFFIX = "ve";

    @Override
    public WordCategory category() {
        return WordCategory.NUMBER;
    }

    @Override
    public Class<NumberFeatures> featureType() {
        return NumberFeatures.class;
    }

    /**
     * The lemma is not consulted: numerals are generated from the value alone.
     */
    @Override
    public List<String> inflect(String lemma, NumberFeatures features) {
        int value = features.value();
        switch (features.form()) {
            case CARDINAL:
                return List.of(getCardinal(value));
            case ORDINAL:
                return List.of(getOrdinal(value));
            case FRACTION:
                return List.of(getFraction(value));
            case ADVERBIAL:
                return List.of(makeAdverbial(value));
            default:
                throw new UnknownFeatureException("numeral form", features.form().name());
        }
    }

    public String getCardinal(int value) {
        String cardinal = CARDINALS.get(value);
        if (cardinal == null) {
            throw new UnknownFeatureException("number", Integer.toString(value),
                    "Number " + value + " is outside " + MIN_VALUE + ".." + MAX_VALUE);
        }
        return cardinal;
    }

    public String getOrdinal(int value) {
        String cardinal = getCardinal(value);
        return ORDINAL_STEMS.getOrDefault(cardinal, cardinal) + ORDINAL_SUFFIX;
    }

    public String getFraction(int value) {
        if (value == 2) {
            return "mawl";
        }
        if (value == 3) {
            return "pan";
        }
        String ordinal = getOrdinal(value);
        return ordinal.substring(0, ordinal.length() - ORDINAL_SUFFIX.length()) + "pxi";
    }

    public String makeAdverbial(int value) {
        switch (value) {
            case 1:
                return "'awlo";
            case 2:
                return "melo";
            case 3:
                return "pxelo";
            default:
                return "alo a" + getCardinal(value);
        }
    }
}
