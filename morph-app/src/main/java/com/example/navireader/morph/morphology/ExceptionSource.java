package com.example.navireader.morph.morphology;

import com.example.navireader.morph.MalformedExceptionDataException;

import java.util.List;

/**
 * Supplies the irregular lemma table consumed by {@link ExceptionIndex}.
 */
public interface ExceptionSource {

    /**
     * @return the entries in source order
     * @throws MalformedExceptionDataException when the underlying document cannot be parsed
     */
    List<ExceptionEntry> load();
}
