package com.example.navireader.morph;

/**
 * Exception thrown when a morphological operation cannot produce a result.
 */
public class MorphologyException extends RuntimeException {
    public MorphologyException(String message) {
        super(message);
    }

    public MorphologyException(String message, Throwable cause) {
        super(message, cause);
    }
}
