package com.novelsource;

import com.novelsource.common.error.ConfigException;
import com.novelsource.core.config.ConfigManager;
import com.novelsource.core.config.ConfigValidator;
import com.novelsource.core.config.Configuration;
import com.novelsource.core.config.SourceCatalog;
import com.novelsource.core.net.JsoupTransport;
import com.novelsource.core.parser.ParserContext;
import com.novelsource.core.parser.ParserRegistry;
import com.novelsource.core.plugin.PluginLoader;
import com.novelsource.core.selector.SelectorEngine;
import com.novelsource.services.detect.SourceDetector;
import com.novelsource.services.importing.ImportService;
import com.novelsource.services.library.BookDatabase;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Wires configuration, source catalog, parser registry and services under one home directory.
 */
public class Kernel {
    private static final Logger logger = LoggerFactory.getLogger(Kernel.class);

    private final File homeDir;
    private final ConfigManager configManager;
    private final SourceCatalog catalog;
    private final PluginLoader pluginLoader;
    private final AtomicBoolean running = new AtomicBoolean(false);

    private ParserRegistry registry;
    private SourceDetector detector;
    private BookDatabase bookDatabase;
    private ImportService importService;

    public Kernel(File homeDir) {
        this.homeDir = homeDir;
        if (!homeDir.exists()) homeDir.mkdirs();

        this.configManager = new ConfigManager(new File(homeDir, "config.json"));
        Configuration config = configManager.getConfig();

        ParserContext context = new ParserContext(
                new JsoupTransport(config.userAgent, config.fetchTimeoutMillis),
                new SelectorEngine(),
                config.maxPages);
        this.catalog = new SourceCatalog(new File(homeDir, config.sourcesDir));
        this.pluginLoader = new PluginLoader(config, context, new File(homeDir, config.pluginsDir));
    }

    /**
     * Validates the configuration, loads sources and plugins, opens the library.
     *
     * @throws ConfigException if two plugins register the same parser
     */
    public synchronized void start() throws ConfigException {
        if (running.getAndSet(true)) return;
        logger.info("⚛️ Kernel booting in {}", homeDir.getAbsolutePath());

        Configuration config = configManager.getConfig();
        new ConfigValidator(homeDir).validateAndReport(config);

        catalog.load();
        registry = pluginLoader.load();
        configManager.save(); // persist newly discovered plugins

        detector = new SourceDetector(catalog, config.fuzzyPolicy());
        bookDatabase = BookDatabase.open(new File(homeDir, config.databasePath));
        importService = new ImportService(catalog, registry, bookDatabase, detector,
                Duration.ofMillis(config.batchDelayMillis));

        logger.info("✅ Kernel active: {} source(s), {} specialized parser(s).", catalog.size(), registry.size());
    }

    public void stop() {
        if (!running.getAndSet(false)) return;
        pluginLoader.close();
        if (bookDatabase != null) bookDatabase.shutdown();
        logger.info("Kernel stopped.");
    }

    public File getHomeDir() {
        return homeDir;
    }

    public ConfigManager getConfigManager() {
        return configManager;
    }

    public SourceCatalog getCatalog() {
        return catalog;
    }

    public PluginLoader getPluginLoader() {
        return pluginLoader;
    }

    public ParserRegistry getRegistry() {
        return registry;
    }

    public SourceDetector getDetector() {
        return detector;
    }

    public BookDatabase getBookDatabase() {
        return bookDatabase;
    }

    public ImportService getImportService() {
        return importService;
    }
}
