package com.novelsource.plugins.sites;

import com.novelsource.api.ParserPlugin;
import com.novelsource.common.error.ConfigException;
import com.novelsource.core.parser.ParserDescriptor;
import com.novelsource.core.parser.ParserRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parsers for sites the generic config-driven parser cannot fully handle.
 */
public class SiteParsersPlugin implements ParserPlugin {
    private static final Logger logger = LoggerFactory.getLogger(SiteParsersPlugin.class);

    @Override
    public String getName() {
        return "SiteParsers";
    }

    @Override
    public String getVersion() {
        return "1.0.0";
    }

    @Override
    public void registerParsers(ParserRegistry.Builder registry) throws ConfigException {
        registry.register(ParserDescriptor.builder("ddyueshu")
                .displayName("顶点小说 (ddyueshu)")
                .domain("www.ddyueshu.cc", "m.ddyueshu.cc", "ddyueshu.cc")
                .factory(DdyueshuParser::new)
                .build());

        registry.register(ParserDescriptor.builder("crxs")
                .displayName("crxs.me")
                .domain("crxs.me", "www.crxs.me")
                .urlPattern("^https?://([a-z0-9-]+\\.)?crxs\\.me/fiction/")
                .factory(CrxsParser::new)
                .build());

        logger.info("📖 Site parsers registered: ddyueshu, crxs");
    }
}
