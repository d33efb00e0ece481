package com.example.navireader.morph.morphology.words;

import com.example.navireader.morph.UnknownFeatureException;
import com.example.navireader.morph.morphology.Phonology;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Verb inflection by infixation. Infixes go before the vowel of a target syllable:
 * the pre-first and first slots target the penultimate syllable, the second slot the last one.
 */
public final class Verb implements WordForm<VerbFeatures> {

    public static final String ACTIVE_PARTICIPLE = "us";
    public static final String PASSIVE_PARTICIPLE = "awn";
    public static final String CAUSATIVE = "eyk";
    public static final String REFLEXIVE = "äp";

    public static final Set<String> PRE_FIRST_INFIXES = Set.of("äp", "eyk", "äpeyk");
    public static final Set<String> FIRST_INFIXES = Set.of("am", "ìm", "ìy", "ay", "er", "ol", "iv", "us", "awn");
    public static final Set<String> SECOND_INFIXES = Set.of("ei", "äng", "ats", "uy");

    private static final int PENULTIMATE = -2;
    private static final int LAST = -1;

    @Override
    public WordCategory category() {
        return WordCategory.VERB;
    }

    @Override
    public Class<VerbFeatures> featureType() {
        return VerbFeatures.class;
    }

    @Override
    public List<String> inflect(String lemma, VerbFeatures features) {
        return List.of(addInfix(lemma, features.preFirstInfix(), features.firstInfix(), features.secondInfix()));
    }

    /**
     * Inserts up to three infixes into {@code verb}. Each insertion works on the result of the
     * previous one; the pre-first slot is skipped for monosyllabic verbs.
     */
    public String addInfix(String verb, String preFirst, String first, String second) {
        requireKnown("pre-first infix", preFirst, PRE_FIRST_INFIXES);
        requireKnown("first infix", first, FIRST_INFIXES);
        requireKnown("second infix", second, SECOND_INFIXES);

        String result = verb;
        int syllableCount = Phonology.syllables(verb).size();
        if (preFirst != null && syllableCount >= 2) {
            result = insertInfix(result, preFirst, PENULTIMATE);
        }
        if (first != null) {
            result = insertInfix(result, first, PENULTIMATE);
        }
        if (second != null) {
            result = insertInfix(result, second, LAST);
        }
        return result;
    }

    /**
     * Inserts {@code infix} before the first vowel of the syllable at {@code syllableIndex}.
     * Negative indexes count from the end; an index past either end falls back to the last
     * syllable (negative) or the first syllable (non-negative).
     */
    static String insertInfix(String word, String infix, int syllableIndex) {
        List<String> syllables = new ArrayList<>(Phonology.syllables(word));
        if (syllables.isEmpty()) {
            return word;
        }
        int size = syllables.size();
        int index;
        if (Math.abs(syllableIndex) > size) {
            index = syllableIndex < 0 ? size - 1 : 0;
        } else {
            index = syllableIndex < 0 ? size + syllableIndex : syllableIndex;
        }
        if (index >= size) {
            index = 0;
        }

        String target = syllables.get(index);
        for (int i = 0; i < target.length(); i++) {
            if (Phonology.isVowel(target.charAt(i))) {
                syllables.set(index, target.substring(0, i) + infix + target.substring(i));
                break;
            }
        }
        return String.join("", syllables);
    }

    public String makeParticiple(String verb, boolean active) {
        return addInfix(verb, null, active ? ACTIVE_PARTICIPLE : PASSIVE_PARTICIPLE, null);
    }

    public String makeCausative(String verb) {
        return addInfix(verb, CAUSATIVE, null, null);
    }

    public String makeReflexive(String verb) {
        return addInfix(verb, REFLEXIVE, null, null);
    }

    private static void requireKnown(String slot, String infix, Set<String> known) {
        if (infix != null && !known.contains(infix)) {
            throw new UnknownFeatureException(slot, infix);
        }
    }
}
