package com.novelsource.test;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.TestInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Base class for all unit tests.
 * Logs the start and end of every test so failures are easy to find in the output.
 */
public abstract class TestBase {
    protected static final Logger logger = LoggerFactory.getLogger(TestBase.class);

    @BeforeEach
    void setUp(TestInfo testInfo) {
        logger.info("🧪 Starting test: {}", testInfo.getDisplayName());
    }

    @AfterEach
    void tearDown(TestInfo testInfo) {
        logger.info("✅ Finished test: {}", testInfo.getDisplayName());
    }
}
