package com.novelsource.core.config;

import com.novelsource.core.parser.FuzzyMatchPolicy;
import com.novelsource.test.TestBase;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ConfigManager
 */
class ConfigManagerTest extends TestBase {

    @TempDir
    File home;

    @Test
    void testDefaultsWrittenOnFirstLoad() {
        File file = new File(home, "config.json");
        ConfigManager manager = new ConfigManager(file);

        assertTrue(file.exists(), "Defaults should be written to disk");
        Configuration config = manager.getConfig();
        assertEquals("sources", config.sourcesDir);
        assertEquals(100, config.maxPages);
        assertEquals(FuzzyMatchPolicy.DOMAIN_LABEL, config.fuzzyPolicy());
        assertTrue(config.isPluginEnabled("SiteParsers"));
    }

    @Test
    void testSaveAndReload() {
        File file = new File(home, "config.json");
        ConfigManager manager = new ConfigManager(file);
        manager.getConfig().maxPages = 7;
        manager.getConfig().plugins.put("SiteParsers", false);
        manager.save();

        Configuration reloaded = new ConfigManager(file).getConfig();
        assertEquals(7, reloaded.maxPages);
        assertFalse(reloaded.isPluginEnabled("SiteParsers"), "Disabled plugin should stay disabled");
        assertTrue(reloaded.isPluginEnabled("Unlisted"), "Unlisted plugins are enabled");
    }

    @Test
    void testBrokenFileFallsBackToDefaults() throws IOException {
        File file = new File(home, "config.json");
        Files.writeString(file.toPath(), "{ this is not json", StandardCharsets.UTF_8);

        Configuration config = new ConfigManager(file).getConfig();
        assertNotNull(config);
        assertEquals(30000, config.fetchTimeoutMillis);
    }

    @Test
    void testUpdateConfig() {
        File file = new File(home, "nested/config.json");
        ConfigManager manager = new ConfigManager(file);

        Configuration replacement = new Configuration();
        replacement.fuzzyMatchPolicy = "host_suffix";
        manager.updateConfig(replacement);

        assertEquals(FuzzyMatchPolicy.HOST_SUFFIX, new ConfigManager(file).getConfig().fuzzyPolicy());
    }
}
