package com.novelsource.core.config;

import com.novelsource.core.parser.FuzzyMatchPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Validates the application configuration on startup.
 */
public class ConfigValidator {
    private static final Logger logger = LoggerFactory.getLogger(ConfigValidator.class);

    private final File homeDir;

    public ConfigValidator(File homeDir) {
        this.homeDir = homeDir;
    }

    public List<ValidationError> validate(Configuration config) {
        List<ValidationError> errors = new ArrayList<>();

        // 1. Directories
        validateDirectories(config, errors);

        // 2. Limits
        validateLimits(config, errors);

        // 3. Matching policy
        validatePolicy(config, errors);

        return errors;
    }

    private void validateDirectories(Configuration config, List<ValidationError> errors) {
        ensureDir("sourcesDir", config.sourcesDir, errors);

        if (config.databasePath == null || config.databasePath.isEmpty()) {
            errors.add(ValidationError.error("databasePath is not set"));
        } else {
            File parent = new File(homeDir, config.databasePath).getParentFile();
            if (parent != null && !parent.exists() && !parent.mkdirs()) {
                errors.add(ValidationError.error("Cannot create database directory: " + parent));
            }
        }

        if (config.pluginsDir != null && !config.pluginsDir.isEmpty()
                && !new File(homeDir, config.pluginsDir).isDirectory()) {
            errors.add(ValidationError.warning("Plugin directory not found: " + config.pluginsDir
                    + " - only built-in parsers will be available"));
        }
    }

    private void ensureDir(String key, String path, List<ValidationError> errors) {
        if (path == null || path.isEmpty()) {
            errors.add(ValidationError.error(key + " is not set"));
            return;
        }
        File dir = new File(homeDir, path);
        if (!dir.exists()) {
            if (!dir.mkdirs()) {
                errors.add(ValidationError.error("Cannot create directory: " + dir));
            } else {
                logger.info("✅ Created directory: {}", dir);
            }
        }
    }

    private void validateLimits(Configuration config, List<ValidationError> errors) {
        if (config.fetchTimeoutMillis <= 0) {
            errors.add(ValidationError.error("fetchTimeoutMillis must be positive"));
        } else if (config.fetchTimeoutMillis < 3000) {
            errors.add(ValidationError.warning("fetchTimeoutMillis below 3s - slow sources will time out"));
        }
        if (config.maxPages <= 0) {
            errors.add(ValidationError.error("maxPages must be positive"));
        }
        if (config.batchDelayMillis < 0) {
            errors.add(ValidationError.error("batchDelayMillis must not be negative"));
        } else if (config.batchDelayMillis < 500) {
            errors.add(ValidationError.warning("batchDelayMillis below 500ms - sources may block the client"));
        }
    }

    private void validatePolicy(Configuration config, List<ValidationError> errors) {
        try {
            config.fuzzyPolicy();
        } catch (IllegalArgumentException e) {
            errors.add(ValidationError.error("Unknown fuzzyMatchPolicy '" + config.fuzzyMatchPolicy
                    + "', expected one of " + Arrays.toString(FuzzyMatchPolicy.values())));
        }
    }

    /**
     * Validate and report to the log. Throws if errors were found.
     */
    public void validateAndReport(Configuration config) {
        List<ValidationError> errors = validate(config);

        int errorCount = 0;
        int warningCount = 0;

        for (ValidationError error : errors) {
            if (error.isError()) {
                logger.error("❌ Config Error: {}", error.message());
                errorCount++;
            } else {
                logger.warn("⚠️ Config Warning: {}", error.message());
                warningCount++;
            }
        }

        if (errorCount > 0 || warningCount > 0) {
            logger.warn("📋 Configuration validation: {} errors, {} warnings", errorCount, warningCount);
        } else {
            logger.info("✅ Configuration validation passed");
        }

        if (errorCount > 0) {
            throw new IllegalStateException(
                    String.format("Configuration validation failed with %d error(s). Fix config and restart.",
                            errorCount));
        }
    }
}
