package com.novelsource.core.plugin;

import com.novelsource.api.ParserPlugin;
import com.novelsource.common.error.ConfigException;
import com.novelsource.core.config.Configuration;
import com.novelsource.core.parser.ParserContext;
import com.novelsource.core.parser.ParserRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.net.MalformedURLException;
import java.net.URL;
import java.net.URLClassLoader;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.ServiceConfigurationError;
import java.util.ServiceLoader;

/**
 * Discovers {@link ParserPlugin}s and builds the {@link ParserRegistry} from them.
 * <p>
 * Sources, in order: plugins added with {@link #addPlugin}, plugins on the classpath, plugin jars
 * in the configured plugins directory. A plugin disabled in {@link Configuration#plugins} is skipped.
 * {@link #load()} runs once; later calls return the same registry.
 */
public class PluginLoader {
    private static final Logger logger = LoggerFactory.getLogger(PluginLoader.class);

    private final Configuration config;
    private final ParserContext context;
    private final File pluginDir;
    private final List<ParserPlugin> builtIn = new ArrayList<>();
    private final Map<String, ParserPlugin> activePlugins = new LinkedHashMap<>();
    private final List<URLClassLoader> classLoaders = new ArrayList<>();
    private boolean scanClasspath = true;
    private ParserRegistry registry;

    public PluginLoader(Configuration config, ParserContext context, File pluginDir) {
        this.config = config;
        this.context = context;
        this.pluginDir = pluginDir;
    }

    public synchronized PluginLoader addPlugin(ParserPlugin plugin) {
        if (registry != null) throw new IllegalStateException("Plugins already loaded");
        builtIn.add(plugin);
        return this;
    }

    /**
     * Turns off classpath discovery, leaving only added plugins and plugin jars.
     */
    public synchronized PluginLoader withoutClasspathScan() {
        this.scanClasspath = false;
        return this;
    }

    /**
     * @throws ConfigException if two plugins register the same parser name
     */
    public synchronized ParserRegistry load() throws ConfigException {
        if (registry != null) return registry;

        ParserRegistry.Builder builder = ParserRegistry.builder(context).policy(config.fuzzyPolicy());

        // 1. Added plugins
        for (ParserPlugin plugin : builtIn) {
            loadPluginSafe(plugin, builder);
        }

        // 2. Classpath
        if (scanClasspath) {
            loadFrom(ServiceLoader.load(ParserPlugin.class, getClass().getClassLoader()), builder);
        }

        // 3. Plugin jars
        for (File jar : listJars()) {
            try {
                URLClassLoader ucl = new URLClassLoader(new URL[] { jar.toURI().toURL() }, getClass().getClassLoader());
                classLoaders.add(ucl);
                loadFrom(ServiceLoader.load(ParserPlugin.class, ucl), builder);
            } catch (MalformedURLException e) {
                logger.error("Failed to load plugin jar: {}", jar.getName(), e);
            }
        }

        registry = builder.build();
        logger.info("🔌 {} plugin(s) active, {} specialized parser(s) registered",
                activePlugins.size(), registry.size());
        return registry;
    }

    private void loadFrom(ServiceLoader<ParserPlugin> loader, ParserRegistry.Builder builder) throws ConfigException {
        try {
            for (ParserPlugin plugin : loader) {
                loadPluginSafe(plugin, builder);
            }
        } catch (ServiceConfigurationError e) {
            logger.error("Broken plugin service registration", e);
        }
    }

    private void loadPluginSafe(ParserPlugin plugin, ParserRegistry.Builder builder) throws ConfigException {
        String name = plugin.getName();
        if (activePlugins.containsKey(name)) {
            logger.debug("Plugin {} is already loaded. Skipping duplicate.", name);
            return;
        }

        if (config.plugins != null && !config.plugins.containsKey(name)) {
            logger.info("✨ New Plugin discovered: {}", name);
            config.plugins.put(name, true);
        }

        if (!config.isPluginEnabled(name)) {
            logger.info("Plugin {} is disabled in config.", name);
            return;
        }

        int checkpoint = builder.checkpoint();
        try {
            logger.info("Loading Plugin: {} v{}", name, plugin.getVersion());
            plugin.registerParsers(builder);
            activePlugins.put(name, plugin);
        } catch (RuntimeException e) {
            // a disabled plugin keeps none of its parsers
            builder.rollbackTo(checkpoint);
            logger.error("Failed to enable plugin: {}", name, e);
        }
    }

    private List<File> listJars() {
        if (pluginDir == null || !pluginDir.isDirectory()) return List.of();
        File[] jars = pluginDir.listFiles((dir, n) -> n.endsWith(".jar"));
        if (jars == null) return List.of();
        Arrays.sort(jars, Comparator.comparing(File::getName));
        return Arrays.asList(jars);
    }

    public synchronized Collection<ParserPlugin> getPlugins() {
        return new ArrayList<>(activePlugins.values());
    }

    public synchronized void close() {
        for (URLClassLoader ucl : classLoaders) {
            try {
                ucl.close();
            } catch (IOException e) {
                logger.warn("Failed to close plugin class loader", e);
            }
        }
        classLoaders.clear();
    }
}
