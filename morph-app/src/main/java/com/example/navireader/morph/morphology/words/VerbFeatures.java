package com.example.navireader.morph.morphology.words;

/**
 * Infixes for the three verb slots; {@code null} leaves a slot empty.
 *
 * @param transitive informational only, infix placement does not depend on it
 */
public record VerbFeatures(String preFirstInfix, String firstInfix, String secondInfix, boolean transitive)
        implements WordFeatures {

    public static VerbFeatures infixes(String preFirstInfix, String firstInfix, String secondInfix) {
        return new VerbFeatures(preFirstInfix, firstInfix, secondInfix, true);
    }

    public static VerbFeatures activeParticiple() {
        return infixes(null, Verb.ACTIVE_PARTICIPLE, null);
    }

    public static VerbFeatures passiveParticiple() {
        return infixes(null, Verb.PASSIVE_PARTICIPLE, null);
    }

    public static VerbFeatures causative() {
        return infixes(Verb.CAUSATIVE, null, null);
    }

    public static VerbFeatures reflexive() {
        return infixes(Verb.REFLEXIVE, null, null);
    }

    @Override
    public WordCategory category() {
        return WordCategory.VERB;
    }
}
