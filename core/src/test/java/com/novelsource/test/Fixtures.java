package com.novelsource.test;

import com.novelsource.common.error.ConfigException;
import com.novelsource.core.config.SourceConfig;
import com.novelsource.core.config.SourceConfigs;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

/**
 * Loads files from {@code src/test/resources/fixtures}.
 */
public final class Fixtures {

    private Fixtures() {
    }

    public static String read(String name) {
        try (InputStream in = Fixtures.class.getResourceAsStream("/fixtures/" + name)) {
            if (in == null) throw new IllegalArgumentException("Missing fixture: " + name);
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static SourceConfig source(String name) throws ConfigException {
        return SourceConfigs.parse(read("sources/" + name + ".json"), name);
    }
}
