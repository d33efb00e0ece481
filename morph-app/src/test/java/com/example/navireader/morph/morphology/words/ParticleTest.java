package com.example.navireader.morph.morphology.words;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.util.List;

import org.junit.jupiter.api.Test;

class ParticleTest {

    private final Particle particle = new Particle();

    @Test
    void placementDependsOnType() {
        assertEquals("srak nga kame", particle.useInContext("srak", ParticleType.QUESTION, "nga kame"));
        assertEquals("ma tsmukan", particle.useInContext("ma", ParticleType.VOCATIVE, "tsmukan"));
        assertEquals("ma tsmukan", particle.useInContext("fpi", ParticleType.VOCATIVE, "tsmukan"));
        assertEquals("kame ke", particle.useInContext("ke", ParticleType.NEGATIVE, "kame"));
        assertEquals("kame nì'aw", particle.useInContext("nì'aw", ParticleType.GENERAL, "kame"));
    }

    @Test
    void inflectPassesContextThrough() {
        assertEquals(List.of("srak oel"),
                particle.inflect("srak", new ParticleFeatures(ParticleType.QUESTION, "oel")));
    }
}
