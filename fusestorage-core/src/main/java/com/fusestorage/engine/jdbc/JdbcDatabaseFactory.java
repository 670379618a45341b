package com.fusestorage.engine.jdbc;

import com.fusestorage.config.DatabaseSettings;
import com.fusestorage.engine.DatabaseFactory;
import com.fusestorage.engine.DatabaseQueue;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import com.zaxxer.hikari.pool.HikariPool;
import lombok.extern.slf4j.Slf4j;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.Map;

/**
 * Creates {@link JdbcDatabaseQueue}s backed by a HikariCP pool.
 */
@Slf4j
public class JdbcDatabaseFactory implements DatabaseFactory {

    @Override
    public DatabaseQueue createDatabaseQueue(DatabaseSettings settings) throws SQLException {
        HikariConfig config = buildHikariConfig(settings);
        HikariDataSource ds;
        try {
            ds = new HikariDataSource(config);
        } catch (HikariPool.PoolInitializationException e) {
            if (e.getCause() instanceof SQLException sqlException) {
                throw sqlException;
            }
            throw new SQLException("Failed to initialize pool " + config.getPoolName(), e);
        }

        try {
            try (Connection conn = ds.getConnection()) {
                if (!conn.isValid(settings.getValidationTimeoutSeconds())) {
                    throw new SQLException("Connection is not valid");
                }
            }
        } catch (SQLException e) {
            ds.close();
            throw e;
        }

        log.info("Opened database pool {} for {}", config.getPoolName(), maskUrl(settings.getJdbcUrl()));
        return new JdbcDatabaseQueue(ds);
    }

    HikariConfig buildHikariConfig(DatabaseSettings settings) {
        if (settings.getJdbcUrl() == null || settings.getJdbcUrl().isBlank()) {
            throw new IllegalArgumentException("jdbcUrl is required");
        }
        HikariConfig config = new HikariConfig();
        config.setPoolName(settings.getName() != null ? settings.getName() : DatabaseSettings.DEFAULT_NAME);
        config.setExceptionOverrideClassName(HikariSqlExceptionOverride.class.getName());
        config.setJdbcUrl(settings.getJdbcUrl());
        config.setUsername(settings.getUsername());
        config.setPassword(settings.getPassword());
        if (settings.getDriverClassName() != null && !settings.getDriverClassName().isBlank()) {
            config.setDriverClassName(settings.getDriverClassName());
        }
        if (settings.getDataSourceProperties() != null) {
            for (Map.Entry<String, Object> entry : settings.getDataSourceProperties().entrySet()) {
                config.addDataSourceProperty(entry.getKey(), String.valueOf(entry.getValue()));
            }
        }

        config.setConnectionTimeout(settings.getConnectionTimeoutMs());
        config.setMaximumPoolSize(settings.getMaximumPoolSize());
        config.setMinimumIdle(settings.getMinimumIdle());
        return config;
    }

    private static String maskUrl(String url) {
        if (url == null) {
            return null;
        }
        return url.replaceAll(":[^@:/]+@", ":****@").replaceAll("(?i)(password=)[^&;]*", "$1****");
    }
}
