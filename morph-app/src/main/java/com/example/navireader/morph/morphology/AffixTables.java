package com.example.navireader.morph.morphology;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Ordered affix lists consulted by the {@link Lemmatizer}. The lists keep insertion order;
 * callers that need longest-first matching ask for {@link #longestFirst(List)} at match time.
 */
public final class AffixTables {

    private final List<String> numberPrefixes;
    private final List<String> caseSuffixes;
    private final List<String> verbSuffixes;

    public AffixTables(List<String> numberPrefixes, List<String> caseSuffixes, List<String> verbSuffixes) {
        this.numberPrefixes = List.copyOf(Objects.requireNonNull(numberPrefixes, "numberPrefixes"));
        this.caseSuffixes = List.copyOf(Objects.requireNonNull(caseSuffixes, "caseSuffixes"));
        this.verbSuffixes = List.copyOf(Objects.requireNonNull(verbSuffixes, "verbSuffixes"));
    }

    /**
     * Built-in tables: dual/trial/plural prefixes, the case endings in both their vowel and
     * consonant variants, and the verbal endings.
     */
    public static AffixTables defaultNavi() {
        return new AffixTables(
                List.of("ay", "me", "pxe"),
                List.of("l", "ìl", "ti", "it", "ru", "ìri", "yä", "ri", "ä"),
                List.of("ie", "i", "u", "ìm"));
    }

    public List<String> numberPrefixes() {
        return numberPrefixes;
    }

    public List<String> caseSuffixes() {
        return caseSuffixes;
    }

    public List<String> verbSuffixes() {
        return verbSuffixes;
    }

    /**
     * Copy of {@code affixes} sorted by descending length. The sort is stable, so affixes of
     * equal length stay in table order.
     */
    public static List<String> longestFirst(List<String> affixes) {
        List<String> sorted = new ArrayList<>(affixes);
        sorted.sort(Comparator.comparingInt(String::length).reversed());
        return sorted;
    }
}
