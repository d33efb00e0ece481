package com.example.navireader.morph.morphology.words;

import com.example.navireader.morph.UnknownFeatureException;

import java.util.List;

/**
 * Placement of particles relative to the phrase they attach to.
 */
public final class Particle implements WordForm<ParticleFeatures> {

    public static final String VOCATIVE_MARKER = "ma";

    @Override
    public WordCategory category() {
        return WordCategory.PARTICLE;
    }

    @Override
    public Class<ParticleFeatures> featureType() {
        return ParticleFeatures.class;
    }

    @Override
    public List<String> inflect(String lemma, ParticleFeatures features) {
        return List.of(useInContext(lemma, features.type(), features.context()));
    }

    /**
     * Question particles lead the phrase, the vocative is always {@code ma} before it, and
     * negative and general particles follow it.
     */
    public String useInContext(String particle, ParticleType type, String context) {
        switch (type) {
            case QUESTION:
                return particle + " " + context;
            case VOCATIVE:
                return VOCATIVE_MARKER + " " + context;
            case NEGATIVE:
            case GENERAL:
                return context + " " + particle;
            default:
                throw new UnknownFeatureException("particle type", type.name());
        }
    }
}
