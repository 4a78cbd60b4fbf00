package com.raditha.codetwin.config;

import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.util.HashMap;
import java.util.Map;

/**
 * Process-wide configuration map read from {@code codetwin.yml}.
 * Values set programmatically (for example from command-line options)
 * override what the file provided.
 */
public final class Settings {

    public static final String DEFAULT_CONFIG = "codetwin.yml";
    public static final String OUTPUT_PATH = "output_path";

    private static final Map<String, Object> props = new HashMap<>();

    private Settings() {
    }

    /**
     * Load the default configuration from the classpath. A missing file
     * leaves the map empty so that built-in defaults apply.
     */
    public static synchronized void loadConfigMap() throws IOException {
        props.clear();
        try (InputStream in = Settings.class.getClassLoader().getResourceAsStream(DEFAULT_CONFIG)) {
            if (in != null) {
                props.putAll(parse(in, DEFAULT_CONFIG));
            }
        }
    }

    /**
     * Load configuration from an explicit file, replacing anything loaded
     * before.
     */
    public static synchronized void loadConfigMap(File configFile) throws IOException {
        props.clear();
        try (InputStream in = Files.newInputStream(configFile.toPath())) {
            props.putAll(parse(in, configFile.getPath()));
        }
    }

    public static synchronized Object getProperty(String key) {
        return props.get(key);
    }

    /**
     * Set or, when {@code value} is null, remove a property.
     */
    public static synchronized void setProperty(String key, Object value) {
        if (value == null) {
            props.remove(key);
        } else {
            props.put(key, value);
        }
    }

    public static synchronized void clear() {
        props.clear();
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> parse(InputStream in, String source) {
        Yaml yaml = new Yaml(new SafeConstructor(new LoaderOptions()));
        Object loaded;
        try {
            loaded = yaml.load(in);
        } catch (YAMLException e) {
            throw new IllegalArgumentException("Invalid configuration file " + source + ": " + e.getMessage(), e);
        }
        if (loaded == null) {
            return Map.of();
        }
        if (!(loaded instanceof Map)) {
            throw new IllegalArgumentException("Configuration file " + source + " must contain a mapping");
        }
        return (Map<String, Object>) loaded;
    }
}
