package com.example.navireader.morph;

/**
 * Raised when the lemma exception document cannot be parsed at all.
 */
public class MalformedExceptionDataException extends MorphologyException {
    public MalformedExceptionDataException(String message) {
        super(message);
    }

    public MalformedExceptionDataException(String message, Throwable cause) {
        super(message, cause);
    }
}
