package com.novelsource.api;

import com.novelsource.common.error.ConfigException;
import com.novelsource.core.parser.ParserRegistry;

/**
 * Entry point of a parser plugin jar, found through {@link java.util.ServiceLoader}.
 */
public interface ParserPlugin {
    // Plugin name, also the key in Configuration.plugins
    String getName();

    String getVersion();

    // Called once while the registry is built. Register every specialized parser here.
    void registerParsers(ParserRegistry.Builder registry) throws ConfigException;
}
