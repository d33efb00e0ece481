package com.example.navireader.morph.morphology.words;

import com.example.navireader.morph.UnknownFeatureException;

import java.util.Locale;

/**
 * Parsing of closed feature enumerations from their lower-case names.
 */
final class FeatureValues {

    private FeatureValues() {
    }

    static <E extends Enum<E>> E parse(E[] values, String feature, String raw) {
        if (raw == null) {
            throw new UnknownFeatureException(feature, "null");
        }
        String key = raw.strip().toUpperCase(Locale.ROOT).replace('-', '_');
        for (E value : values) {
            if (value.name().equals(key)) {
                return value;
            }
        }
        throw new UnknownFeatureException(feature, raw);
    }

    static String displayName(Enum<?> value) {
        return value.name().toLowerCase(Locale.ROOT);
    }
}
