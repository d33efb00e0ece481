package com.example.navireader.morph.morphology;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reports morphology calls to the {@code pipeline} logger.
 */
public final class Slf4jMorphologyTrace implements MorphologyTrace {

    private static final Logger logger = LoggerFactory.getLogger("pipeline");

    @Override
    public void started(String operation, Object input) {
        logger.info("Calling {}", operation);
        logger.debug("{} input: {}", operation, input);
    }

    @Override
    public void finished(String operation, Object result) {
        logger.info("{} finished successfully", operation);
        logger.debug("{} result: {}", operation, result);
    }

    @Override
    public void failed(String operation, RuntimeException error) {
        logger.error("{} failed: {}", operation, error.getMessage(), error);
    }
}
