package com.example.navireader.morph.morphology.words;

import java.util.List;

/**
 * Generator of surface forms for one lexical category.
 *
 * @param <F> feature record accepted by the generator
 */
public interface WordForm<F extends WordFeatures> {

    WordCategory category();

    Class<F> featureType();

    /**
     * @return the surface forms, most generators return exactly one
     */
    List<String> inflect(String lemma, F features);
}
