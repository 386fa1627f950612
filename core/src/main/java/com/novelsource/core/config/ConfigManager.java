package com.novelsource.core.config;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;

public class ConfigManager {
    private static final Logger logger = LoggerFactory.getLogger(ConfigManager.class);

    private final File configFile;
    private final Gson gson;
    private Configuration configuration;

    public ConfigManager(File configFile) {
        this.configFile = configFile;
        this.gson = new GsonBuilder().setPrettyPrinting().create();
        load();
    }

    public Configuration getConfig() {
        return configuration;
    }

    public File getConfigFile() {
        return configFile;
    }

    public synchronized void save() {
        File parent = configFile.getAbsoluteFile().getParentFile();
        if (parent != null && !parent.exists() && !parent.mkdirs()) {
            logger.error("Cannot create config directory: {}", parent);
            return;
        }
        try (Writer writer = Files.newBufferedWriter(configFile.toPath(), StandardCharsets.UTF_8)) {
            gson.toJson(configuration, writer);
            logger.info("Configuration saved to disk.");
        } catch (IOException e) {
            logger.error("Failed to save configuration", e);
        }
    }

    public synchronized void updateConfig(Configuration newConfig) {
        this.configuration = newConfig;
        save();
    }

    private void load() {
        if (!configFile.exists()) {
            configuration = new Configuration();
            logger.info("No config file found. Created default configuration.");
            save(); // write defaults
            return;
        }

        try (Reader reader = Files.newBufferedReader(configFile.toPath(), StandardCharsets.UTF_8)) {
            configuration = gson.fromJson(reader, Configuration.class);
            if (configuration == null) configuration = new Configuration();
            logger.info("Configuration loaded.");
        } catch (IOException | JsonParseException e) {
            logger.error("Failed to load configuration, using defaults", e);
            configuration = new Configuration();
        }
    }
}
