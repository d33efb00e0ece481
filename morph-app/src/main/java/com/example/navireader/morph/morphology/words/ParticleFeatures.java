package com.example.navireader.morph.morphology.words;

import java.util.Objects;

/**
 * @param context the phrase the particle is placed around
 */
public record ParticleFeatures(ParticleType type, String context) implements WordFeatures {

    public ParticleFeatures {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(context, "context");
    }

    @Override
    public WordCategory category() {
        return WordCategory.PARTICLE;
    }
}
