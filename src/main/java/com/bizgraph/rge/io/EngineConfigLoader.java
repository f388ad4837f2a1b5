package com.bizgraph.rge.io;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

/** Reads {@link EngineConfig} from a file or the classpath. */
public final class EngineConfigLoader {
    private static final Logger log = LogManager.getLogger(EngineConfigLoader.class);

    public static final String DEFAULT_RESOURCE = "bizgraph.json";

    private EngineConfigLoader() {
    }

    public static EngineConfig parse(String json) {
        try {
            return JsonSupport.mapper().readValue(json, EngineConfig.class).validate();
        } catch (IOException e) {
            throw new IllegalArgumentException("Malformed engine configuration: " + e.getMessage(), e);
        }
    }

    public static EngineConfig load(Path path) {
        try {
            return parse(Files.readString(path));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read engine configuration from " + path, e);
        }
    }

    /**
     * Loads {@code resource} from the classpath, or returns defaults when it is
     * absent.
     */
    public static EngineConfig loadResource(String resource) {
        try (InputStream in = EngineConfigLoader.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                log.info("No {} on classpath, using default engine configuration", resource);
                return new EngineConfig().validate();
            }
            EngineConfig config = JsonSupport.mapper().readValue(in, EngineConfig.class).validate();
            log.info("Loaded engine configuration from classpath:{}", resource);
            return config;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read engine configuration " + resource, e);
        }
    }

    public static EngineConfig loadDefault() {
        return loadResource(DEFAULT_RESOURCE);
    }
}
