package com.example.navireader.morph.morphology;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Phonological predicates shared by the lemmatizer and the word-form generators.
 */
public final class Phonology {

    /** Vowel letters of the orthography, including the accented {@code ì} and {@code ä}. */
    public static final String VOWELS = "aeiìouä";

    private static final List<String> DIPHTHONGS = List.of("aw", "ay", "ew", "ey");
    private static final List<String> PSEUDOVOWELS = List.of("ll", "rr");

    // Clusters come before their single-letter prefixes: "px" must never be read as "p".
    private static final List<Map.Entry<String, String>> LENITION = List.of(
            Map.entry("px", "p"),
            Map.entry("tx", "t"),
            Map.entry("kx", "k"),
            Map.entry("ts", "s"),
            Map.entry("p", "p"),
            Map.entry("t", "t"),
            Map.entry("k", "k"));

    private Phonology() {
    }

    public static boolean isVowel(char ch) {
        return VOWELS.indexOf(ch) >= 0;
    }

    public static boolean endsWithVowel(String word) {
        return word != null && !word.isEmpty() && isVowel(word.charAt(word.length() - 1));
    }

    public static boolean endsWithDiphthong(String word) {
        return endsWithAny(word, DIPHTHONGS);
    }

    public static boolean endsWithPseudovowel(String word) {
        return endsWithAny(word, PSEUDOVOWELS);
    }

    /**
     * Applies the first matching entry of the lenition table to the start of {@code word}.
     */
    public static String lenite(String word) {
        for (Map.Entry<String, String> rule : LENITION) {
            if (word.startsWith(rule.getKey())) {
                return rule.getValue() + word.substring(rule.getKey().length());
            }
        }
        return word;
    }

    /**
     * Splits a word into syllables. Each syllable runs up to and including the next vowel;
     * consonants after the last vowel are attached to the final syllable. A word without
     * vowels forms a single syllable and the empty word has none.
     */
    public static List<String> syllables(String word) {
        List<String> syllables = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        for (int i = 0; i < word.length(); i++) {
            char ch = word.charAt(i);
            current.append(ch);
            if (isVowel(ch)) {
                syllables.add(current.toString());
                current.setLength(0);
            }
        }
        if (current.length() > 0) {
            if (syllables.isEmpty()) {
                syllables.add(current.toString());
            } else {
                int last = syllables.size() - 1;
                syllables.set(last, syllables.get(last) + current);
            }
        }
        return Collections.unmodifiableList(syllables);
    }

    private static boolean endsWithAny(String word, List<String> endings) {
        if (word == null) {
            return false;
        }
        for (String ending : endings) {
            if (word.endsWith(ending)) {
                return true;
            }
        }
        return false;
    }
}
