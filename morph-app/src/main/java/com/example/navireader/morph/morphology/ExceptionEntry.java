package com.example.navireader.morph.morphology;

import java.text.Normalizer;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * An irregular lemma together with the surface forms that reduce to it. Lemma and forms are
 * stored in NFC, forms also lower-cased; the lemma itself always matches even when it is not
 * listed among the forms.
 */
public record ExceptionEntry(String lemma, Set<String> forms) {

    public ExceptionEntry {
        Objects.requireNonNull(lemma, "lemma");
        if (lemma.isBlank()) {
            throw new IllegalArgumentException("Exception lemma must not be blank");
        }
        lemma = nfc(lemma.strip());
        Objects.requireNonNull(forms, "forms");
        Set<String> normalised = new LinkedHashSet<>();
        for (String form : forms) {
            if (form == null || form.isBlank()) {
                throw new IllegalArgumentException("Exception form for '" + lemma + "' must not be blank");
            }
            normalised.add(nfc(form.strip()).toLowerCase(Locale.ROOT));
        }
        forms = Collections.unmodifiableSet(normalised);
    }

    /**
     * @param normalisedWord NFC, lower-cased surface word
     */
    public boolean matches(String normalisedWord) {
        return forms.contains(normalisedWord) || lemma.toLowerCase(Locale.ROOT).equals(normalisedWord);
    }

    private static String nfc(String text) {
        return Normalizer.normalize(text, Normalizer.Form.NFC);
    }
}
