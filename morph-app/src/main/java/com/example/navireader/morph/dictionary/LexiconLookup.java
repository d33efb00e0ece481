package com.example.navireader.morph.dictionary;

import java.util.Optional;

/**
 * Finds the dictionary record of a lemma. An empty result means the word is unknown.
 */
public interface LexiconLookup {

    Optional<LexicalRecord> lookup(String lemma);
}
