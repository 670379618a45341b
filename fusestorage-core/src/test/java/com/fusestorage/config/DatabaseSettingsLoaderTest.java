package com.fusestorage.config;

import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Properties;
import java.util.function.UnaryOperator;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

class DatabaseSettingsLoaderTest {
    private static final UnaryOperator<String> NO_ENV = key -> null;

    private static InputStream yaml(String text) {
        return new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    void parse_readsEveryKey() {
        DatabaseSettings settings = DatabaseSettingsLoader.parse(yaml(String.join("\n",
                "name: orders",
                "jdbcUrl: jdbc:sqlite:orders.sqlite",
                "username: app",
                "password: secret",
                "maximumPoolSize: 8",
                "minimumIdle: 2",
                "connectionTimeoutMs: 1000",
                "validationTimeoutSeconds: 3",
                "dataSourceProperties:",
                "  foreign_keys: true",
                "")), "test");

        assertEquals("orders", settings.getName());
        assertEquals("jdbc:sqlite:orders.sqlite", settings.getJdbcUrl());
        assertEquals("app", settings.getUsername());
        assertEquals("secret", settings.getPassword());
        assertEquals(8, settings.getMaximumPoolSize());
        assertEquals(2, settings.getMinimumIdle());
        assertEquals(1000L, settings.getConnectionTimeoutMs());
        assertEquals(3, settings.getValidationTimeoutSeconds());
        assertEquals(Map.of("foreign_keys", true), settings.getDataSourceProperties());
    }

    @Test
    void parse_missingKeysKeepDefaults() {
        DatabaseSettings settings = DatabaseSettingsLoader.parse(yaml("name: partial\n"), "test");
        assertEquals("partial", settings.getName());
        assertEquals(DatabaseSettings.DEFAULT_JDBC_URL, settings.getJdbcUrl());
        assertEquals(4, settings.getMaximumPoolSize());
    }

    @Test
    void parse_emptyDocumentIsDefaults() {
        DatabaseSettings settings = DatabaseSettingsLoader.parse(yaml(""), "test");
        assertEquals(new DatabaseSettings(), settings);
    }

    @Test
    void parse_invalidYamlIsRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> DatabaseSettingsLoader.parse(yaml("maximumPoolSize: [not, a, number]\n"), "test"));
    }

    @Test
    void applyOverrides_systemPropertyBeatsEnvironment() {
        Properties props = new Properties();
        props.setProperty("fusestorage.jdbcUrl", "jdbc:sqlite:from-property.sqlite");
        Map<String, String> env = Map.of(
                "FUSESTORAGE_JDBC_URL", "jdbc:sqlite:from-env.sqlite",
                "FUSESTORAGE_MAXIMUM_POOL_SIZE", "16");

        DatabaseSettings settings = DatabaseSettingsLoader.applyOverrides(new DatabaseSettings(), props, env::get);

        assertEquals("jdbc:sqlite:from-property.sqlite", settings.getJdbcUrl());
        assertEquals(16, settings.getMaximumPoolSize());
    }

    @Test
    void applyOverrides_leavesInputUntouched() {
        DatabaseSettings original = new DatabaseSettings();
        Properties props = new Properties();
        props.setProperty("fusestorage.name", "other");

        DatabaseSettings settings = DatabaseSettingsLoader.applyOverrides(original, props, NO_ENV);

        assertEquals("other", settings.getName());
        assertEquals(DatabaseSettings.DEFAULT_NAME, original.getName());
    }

    @Test
    void applyOverrides_blankValuesAreIgnored() {
        Properties props = new Properties();
        props.setProperty("fusestorage.username", "  ");
        DatabaseSettings settings = DatabaseSettingsLoader.applyOverrides(new DatabaseSettings(), props, NO_ENV);
        assertNull(settings.getUsername());
        assertNotNull(settings.getDataSourceProperties());
    }

    @Test
    void applyOverrides_rejectsBadNumbers() {
        Properties props = new Properties();
        props.setProperty("fusestorage.minimumIdle", "many");
        assertThrows(IllegalArgumentException.class,
                () -> DatabaseSettingsLoader.applyOverrides(new DatabaseSettings(), props, NO_ENV));
    }

    @Test
    void envName_splitsCamelCase() {
        assertEquals("FUSESTORAGE_JDBC_URL", DatabaseSettingsLoader.envName("jdbcUrl"));
        assertEquals("FUSESTORAGE_CONNECTION_TIMEOUT_MS", DatabaseSettingsLoader.envName("connectionTimeoutMs"));
        assertEquals("FUSESTORAGE_NAME", DatabaseSettingsLoader.envName("name"));
    }

    @Test
    void load_readsClasspathResource() {
        DatabaseSettings settings = DatabaseSettingsLoader.load();
        assertEquals("fusestorage-test", settings.getName());
        assertEquals(2, settings.getMaximumPoolSize());
    }
}
