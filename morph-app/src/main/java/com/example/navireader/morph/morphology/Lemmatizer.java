package com.example.navireader.morph.morphology;

import com.example.navireader.morph.InvalidInputException;

import java.text.Normalizer;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Reduces an inflected surface word to its lemma. Known irregular forms are resolved through
 * the {@link ExceptionIndex}; everything else goes through a single pass of affix stripping:
 * at most one number prefix, then at most one case suffix, then at most one verb suffix.
 */
public final class Lemmatizer {

    private final AffixTables affixes;
    private final ExceptionIndex exceptions;

    public Lemmatizer() {
        this(AffixTables.defaultNavi(), ExceptionIndex.empty());
    }

    public Lemmatizer(AffixTables affixes, ExceptionIndex exceptions) {
        this.affixes = Objects.requireNonNull(affixes, "affixes");
        this.exceptions = Objects.requireNonNull(exceptions, "exceptions");
    }

    public String lemmatize(String word) {
        if (word == null) {
            throw new InvalidInputException("lemmatize", "word must be a string, got null");
        }
        String normalised = normalise(word);
        if (normalised.isEmpty()) {
            return normalised;
        }

        Optional<String> irregular = exceptions.lemmaOf(normalised);
        if (irregular.isPresent()) {
            return irregular.get();
        }

        String stem = stripNumberPrefix(normalised);
        stem = stripCaseSuffix(stem);
        return stripVerbSuffix(stem);
    }

    private String stripNumberPrefix(String word) {
        for (String prefix : affixes.numberPrefixes()) {
            if (word.startsWith(prefix) && leavesEnough(word, prefix)) {
                return word.substring(prefix.length());
            }
        }
        return word;
    }

    private String stripCaseSuffix(String word) {
        for (String suffix : AffixTables.longestFirst(affixes.caseSuffixes())) {
            if (word.endsWith(suffix) && leavesEnough(word, suffix)) {
                return word.substring(0, word.length() - suffix.length());
            }
        }
        return word;
    }

    // No remainder guard for verb endings: "kame" must come out of "kameie".
    private String stripVerbSuffix(String word) {
        for (String suffix : AffixTables.longestFirst(affixes.verbSuffixes())) {
            if (word.endsWith(suffix)) {
                return word.substring(0, word.length() - suffix.length());
            }
        }
        return word;
    }

    private static boolean leavesEnough(String word, String affix) {
        return word.length() - affix.length() > affix.length() + 1;
    }

    private static String normalise(String word) {
        return Normalizer.normalize(word, Normalizer.Form.NFC).toLowerCase(Locale.ROOT);
    }

    public ExceptionIndex exceptions() {
        return exceptions;
    }
}
