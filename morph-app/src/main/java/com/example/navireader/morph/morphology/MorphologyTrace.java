package com.example.navireader.morph.morphology;

/**
 * Observer notified around every public morphology call. Implementations must not throw;
 * the morphology code never depends on what a trace does.
 */
public interface MorphologyTrace {

    MorphologyTrace NOOP = new MorphologyTrace() {
    };

    default void started(String operation, Object input) {
    }

    default void finished(String operation, Object result) {
    }

    default void failed(String operation, RuntimeException error) {
    }
}
