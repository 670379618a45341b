package com.fusestorage.config;

import lombok.extern.slf4j.Slf4j;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Properties;
import java.util.function.UnaryOperator;

/**
 * Loads {@link DatabaseSettings} from YAML, then applies overrides.
 *
 * <p>Precedence, highest first: system property {@code fusestorage.<key>}, environment variable
 * {@code FUSESTORAGE_<KEY>} (camel case split on humps, e.g. {@code FUSESTORAGE_JDBC_URL}), the YAML file,
 * built-in defaults.
 */
@Slf4j
public final class DatabaseSettingsLoader {
    public static final String DEFAULT_RESOURCE = "fusestorage.yml";
    static final String PROPERTY_PREFIX = "fusestorage.";
    static final String ENV_PREFIX = "FUSESTORAGE_";

    private DatabaseSettingsLoader() {
    }

    /**
     * Load {@value #DEFAULT_RESOURCE} from the classpath if present, then apply overrides.
     *
     * @return settings
     */
    public static DatabaseSettings load() {
        ClassLoader cl = Thread.currentThread().getContextClassLoader();
        if (cl == null) {
            cl = DatabaseSettingsLoader.class.getClassLoader();
        }
        DatabaseSettings settings;
        try (InputStream in = cl.getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null) {
                log.debug("No {} on the classpath, using defaults", DEFAULT_RESOURCE);
                settings = new DatabaseSettings();
            } else {
                settings = parse(in, DEFAULT_RESOURCE);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + DEFAULT_RESOURCE, e);
        }
        return applyOverrides(settings, System.getProperties(), System::getenv);
    }

    /**
     * Load settings from a YAML file, then apply overrides.
     *
     * @param file YAML file
     * @return settings
     */
    public static DatabaseSettings load(Path file) {
        try (InputStream in = Files.newInputStream(file)) {
            return applyOverrides(parse(in, file.toString()), System.getProperties(), System::getenv);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read database settings: " + file, e);
        }
    }

    static DatabaseSettings parse(InputStream in, String source) {
        try {
            DatabaseSettings loaded = new Yaml().loadAs(in, DatabaseSettings.class);
            if (loaded == null) {
                log.debug("Database settings {} are empty, using defaults", source);
                return new DatabaseSettings();
            }
            log.debug("Loaded database settings from {}", source);
            return loaded;
        } catch (YAMLException e) {
            throw new IllegalArgumentException("Invalid database settings in " + source + ": " + e.getMessage(), e);
        }
    }

    static DatabaseSettings applyOverrides(DatabaseSettings settings, Properties systemProperties,
                                           UnaryOperator<String> environment) {
        DatabaseSettings out = settings.toBuilder().build();
        String v;
        if ((v = lookup("name", systemProperties, environment)) != null) {
            out.setName(v);
        }
        if ((v = lookup("jdbcUrl", systemProperties, environment)) != null) {
            out.setJdbcUrl(v);
        }
        if ((v = lookup("username", systemProperties, environment)) != null) {
            out.setUsername(v);
        }
        if ((v = lookup("password", systemProperties, environment)) != null) {
            out.setPassword(v);
        }
        if ((v = lookup("driverClassName", systemProperties, environment)) != null) {
            out.setDriverClassName(v);
        }
        if ((v = lookup("maximumPoolSize", systemProperties, environment)) != null) {
            out.setMaximumPoolSize(parseInt("maximumPoolSize", v));
        }
        if ((v = lookup("minimumIdle", systemProperties, environment)) != null) {
            out.setMinimumIdle(parseInt("minimumIdle", v));
        }
        if ((v = lookup("connectionTimeoutMs", systemProperties, environment)) != null) {
            out.setConnectionTimeoutMs(parseLong("connectionTimeoutMs", v));
        }
        if ((v = lookup("validationTimeoutSeconds", systemProperties, environment)) != null) {
            out.setValidationTimeoutSeconds(parseInt("validationTimeoutSeconds", v));
        }
        if (out.getDataSourceProperties() == null) {
            out.setDataSourceProperties(new LinkedHashMap<>());
        }
        return out;
    }

    static String envName(String key) {
        return ENV_PREFIX + key.replaceAll("([a-z0-9])([A-Z])", "$1_$2").toUpperCase(Locale.ROOT);
    }

    private static String lookup(String key, Properties systemProperties, UnaryOperator<String> environment) {
        String v = trimToNull(systemProperties.getProperty(PROPERTY_PREFIX + key));
        if (v == null) {
            v = trimToNull(environment.apply(envName(key)));
        }
        return v;
    }

    private static String trimToNull(String v) {
        if (v == null) {
            return null;
        }
        String t = v.trim();
        return t.isEmpty() ? null : t;
    }

    private static int parseInt(String key, String v) {
        try {
            return Integer.parseInt(v);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid integer for " + key + ": " + v, e);
        }
    }

    private static long parseLong(String key, String v) {
        try {
            return Long.parseLong(v);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid integer for " + key + ": " + v, e);
        }
    }
}
