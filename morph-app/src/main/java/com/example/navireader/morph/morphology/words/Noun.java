package com.example.navireader.morph.morphology.words;

import com.example.navireader.morph.morphology.PhonologicalProfile;
import com.example.navireader.morph.morphology.Phonology;

import java.util.List;

/**
 * Case and number inflection of nouns.
 */
public final class Noun implements WordForm<NounFeatures> {

    @Override
    public WordCategory category() {
        return WordCategory.NOUN;
    }

    @Override
    public Class<NounFeatures> featureType() {
        return NounFeatures.class;
    }

    @Override
    public List<String> inflect(String lemma, NounFeatures features) {
        String base = features.indefinite() ? makeIndefinite(lemma) : lemma;
        return List.of(getNumberWithCase(base, features.number(), features.nounCase()));
    }

    public String getCase(String lemma, NounCase nounCase) {
        return getCase(lemma, PhonologicalProfile.of(lemma), nounCase);
    }

    /**
     * Appends the case ending selected by the ending class in {@code profile}.
     */
    public String getCase(String lemma, PhonologicalProfile profile, NounCase nounCase) {
        return lemma + caseEnding(lemma, profile, nounCase);
    }

    static String caseEnding(String lemma, PhonologicalProfile profile, NounCase nounCase) {
        switch (nounCase) {
            case SUBJECTIVE:
                return "";
            case AGENTIVE:
                return profile.endsWithVowel() ? "l" : "il";
            case PATIENTIVE:
                return profile.vowelOrDiphthong() ? "ti" : "it";
            case DATIVE:
                return profile.vowelOrDiphthong() ? "ru" : "ur";
            case GENITIVE:
                return genitiveEnding(lemma, profile);
            case TOPICAL:
                return profile.endsWithVowel() ? "ri" : "iri";
            default:
                throw new IllegalStateException("Unhandled case " + nounCase);
        }
    }

    private static String genitiveEnding(String lemma, PhonologicalProfile profile) {
        if (!profile.endsWithVowel()) {
            return "ä";
        }
        if (lemma.endsWith("o") || lemma.endsWith("u")) {
            return "ä";
        }
        return "yä";
    }

    /**
     * Singular is the bare lemma; other numbers prefix the lenited stem.
     */
    public String getNumber(String lemma, GrammaticalNumber number) {
        if (number == GrammaticalNumber.SINGULAR) {
            return lemma;
        }
        return number.prefix() + Phonology.lenite(lemma);
    }

    /**
     * Marks number first and then selects the case ending from the ending of the numbered form.
     */
    public String getNumberWithCase(String lemma, GrammaticalNumber number, NounCase nounCase) {
        String numbered = getNumber(lemma, number);
        return getCase(numbered, PhonologicalProfile.of(numbered), nounCase);
    }

    public String makeIndefinite(String lemma) {
        return lemma + "o";
    }
}
