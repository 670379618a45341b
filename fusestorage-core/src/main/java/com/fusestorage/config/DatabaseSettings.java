package com.fusestorage.config;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Connection and pool settings for one database.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class DatabaseSettings {
    public static final String DEFAULT_NAME = "fusestorage";
    public static final String DEFAULT_JDBC_URL = "jdbc:sqlite:fuse.sqlite";

    @Builder.Default
    private String name = DEFAULT_NAME;
    @Builder.Default
    private String jdbcUrl = DEFAULT_JDBC_URL;
    private String username;
    @ToString.Exclude
    private String password;
    /**
     * Driver class to load; left unset, the driver is resolved through {@link java.sql.DriverManager}.
     */
    private String driverClassName;
    @Builder.Default
    private int maximumPoolSize = 4;
    @Builder.Default
    private int minimumIdle = 1;
    @Builder.Default
    private long connectionTimeoutMs = 30_000L;
    @Builder.Default
    private int validationTimeoutSeconds = 5;
    /**
     * Extra properties handed to the driver, e.g. {@code foreign_keys: true} for SQLite.
     */
    @Builder.Default
    private Map<String, Object> dataSourceProperties = new LinkedHashMap<>();
}
