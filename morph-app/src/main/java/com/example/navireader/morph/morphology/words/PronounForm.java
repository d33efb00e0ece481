package com.example.navireader.morph.morphology.words;

/**
 * What a pronoun generator call produces.
 */
public enum PronounForm {
    /** Case form of the (gendered or honorific) pronoun. */
    INFLECTED,
    /** Long and short question word for a gender and number. */
    QUESTION,
    SHORT_PLURAL,
    /** Contracted variant of a plural pronoun. */
    SHORT,
    /** Paradigm of "lahe" (other) for a register and case. */
    LAHE,
    /** Personal pronoun for a person, inclusivity, animacy and number. */
    BASIC,
    /** Case form of the reflexive "sno"; the lemma is ignored. */
    REFLEXIVE,
    /** Case form of the indeterminate "fko" (one, they); the lemma is ignored. */
    INDETERMINATE;

    public static PronounForm fromName(String name) {
        return FeatureValues.parse(values(), "pronoun form", name);
    }
}
