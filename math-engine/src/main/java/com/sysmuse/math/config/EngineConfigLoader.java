package com.sysmuse.math.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.sysmuse.util.LoggingUtil;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;

/**
 * Loads and saves {@link EngineConfig} as JSON using Jackson.
 */
public class EngineConfigLoader {

    public static final String DEFAULT_RESOURCE = "math-engine.json";

    private final ObjectMapper objectMapper;

    public EngineConfigLoader() {
        this.objectMapper = new ObjectMapper();
        this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
    }

    /**
     * Load configuration from a JSON file.
     *
     * @throws IOException if the file is missing or cannot be parsed
     */
    public EngineConfig loadFromFile(String filename) throws IOException {
        File file = new File(filename);
        if (!file.exists()) {
            throw new IOException("Engine configuration file not found: " + filename);
        }
        EngineConfig config = objectMapper.readValue(file, EngineConfig.class);
        LoggingUtil.debug("Loaded engine configuration from " + filename + ": " + config);
        return config;
    }

    /**
     * Load the classpath default. A missing resource yields built-in defaults.
     *
     * @throws IOException if the resource exists but cannot be parsed
     */
    public EngineConfig loadDefault() throws IOException {
        return loadFromResource(DEFAULT_RESOURCE);
    }

    public EngineConfig loadFromResource(String resourceName) throws IOException {
        try (InputStream in = EngineConfigLoader.class.getClassLoader().getResourceAsStream(resourceName)) {
            if (in == null) {
                LoggingUtil.debug("No " + resourceName + " on classpath, using defaults");
                return new EngineConfig();
            }
            return objectMapper.readValue(in, EngineConfig.class);
        }
    }

    public void saveToFile(EngineConfig config, String filename) throws IOException {
        File file = new File(filename);
        File parent = file.getAbsoluteFile().getParentFile();
        if (parent != null) {
            parent.mkdirs();
        }
        objectMapper.writeValue(file, config);
    }
}
