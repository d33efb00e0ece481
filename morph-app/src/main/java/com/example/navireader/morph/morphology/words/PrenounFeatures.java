package com.example.navireader.morph.morphology.words;

import java.util.Objects;

/**
 * @param type informational only, every prenoun type combines the same way
 * @param noun the noun the prenoun is prefixed to
 */
public record PrenounFeatures(PrenounType type, String noun) implements WordFeatures {

    public PrenounFeatures {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(noun, "noun");
    }

    @Override
    public WordCategory category() {
        return WordCategory.PRENOUN;
    }
}
