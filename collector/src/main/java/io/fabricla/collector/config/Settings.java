package io.fabricla.collector.config;

import io.fabricla.collector.error.ConfigException;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Properties;

/**
 * Layered key lookup: JVM system property, then environment variable {@code FABRICLA_<KEY>} (dots as
 * underscores, upper case), then the properties file.
 */
public final class Settings {
    static final String ENV_PREFIX = "FABRICLA_";

    private final Properties file;
    private final Properties system;
    private final Map<String, String> env;

    public Settings(Properties file, Properties system, Map<String, String> env) {
        this.file = file;
        this.system = system;
        this.env = Map.copyOf(env);
    }

    public static Settings of(Properties file) {
        return new Settings(file, System.getProperties(), System.getenv());
    }

    public static Settings load(Path path) throws ConfigException {
        Properties p = new Properties();
        if (path != null) {
            try (Reader r = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
                p.load(r);
            } catch (IOException e) {
                throw new ConfigException("Cannot read configuration " + path + ": " + e.getMessage(), e);
            }
        }
        return of(p);
    }

    public static String envName(String key) {
        return ENV_PREFIX + key.replace('.', '_').replace('-', '_').toUpperCase(Locale.ROOT);
    }

    public Optional<String> get(String key) {
        String v = system.getProperty(key);
        if (blank(v)) v = env.get(envName(key));
        if (blank(v)) v = file.getProperty(key);
        return blank(v) ? Optional.empty() : Optional.of(v.trim());
    }

    public String get(String key, String def) { return get(key).orElse(def); }

    /** Raw environment variable, for names outside the key scheme. */
    public Optional<String> env(String name) {
        String v = env.get(name);
        return blank(v) ? Optional.empty() : Optional.of(v.trim());
    }

    public int getInt(String key, int def) throws ConfigException {
        Optional<String> v = get(key);
        if (v.isEmpty()) return def;
        try {
            return Integer.parseInt(v.get());
        } catch (NumberFormatException e) {
            throw new ConfigException(key + " must be an integer, got '" + v.get() + "'", e);
        }
    }

    public long getLong(String key, long def) throws ConfigException {
        Optional<String> v = get(key);
        if (v.isEmpty()) return def;
        try {
            return Long.parseLong(v.get());
        } catch (NumberFormatException e) {
            throw new ConfigException(key + " must be an integer, got '" + v.get() + "'", e);
        }
    }

    public double getDouble(String key, double def) throws ConfigException {
        Optional<String> v = get(key);
        if (v.isEmpty()) return def;
        try {
            return Double.parseDouble(v.get());
        } catch (NumberFormatException e) {
            throw new ConfigException(key + " must be a number, got '" + v.get() + "'", e);
        }
    }

    private static boolean blank(String s) { return s == null || s.isBlank(); }
}
