package com.fusestorage.util;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.Reader;
import java.sql.Blob;
import java.sql.Clob;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.SQLFeatureNotSupportedException;
import java.sql.SQLXML;
import java.sql.Struct;
import java.sql.Time;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Normalizes JDBC driver values into the plain Java values the converter understands.
 *
 * <p>Driver-specific objects never leak out of the engine adapter: LOBs become {@code String} or
 * {@code byte[]}, SQL arrays and structs become lists, timestamps become {@link Instant}.
 */
@Slf4j
public final class JdbcValues {
    private static final int MAX_NESTED_DEPTH = 3;
    private static final int READ_BUFFER_CHARS = 8192;

    private JdbcValues() {
    }

    /**
     * Reads a column and normalizes its value.
     *
     * @param rs result set positioned on a row
     * @param columnIndex 1-based column index
     * @return normalized value, {@code null} for SQL NULL
     * @throws SQLException on JDBC errors
     */
    public static Object readValue(ResultSet rs, int columnIndex) throws SQLException {
        return normalize(rs.getObject(columnIndex));
    }

    /**
     * Normalizes an arbitrary driver value.
     *
     * @param v value to convert
     * @return normalized value
     * @throws SQLException on JDBC errors while reading LOBs, arrays or structs
     */
    public static Object normalize(Object v) throws SQLException {
        return normalize(v, 0);
    }

    private static Object normalize(Object v, int depth) throws SQLException {
        if (v == null) {
            return null;
        }
        if (depth > MAX_NESTED_DEPTH) {
            return String.valueOf(v);
        }

        Object driverValue = tryReadDriverSpecificValue(v);
        if (driverValue != null) {
            return driverValue;
        }

        if (v instanceof Number || v instanceof Boolean || v instanceof String || v instanceof byte[]) {
            return v;
        }
        if (v instanceof Clob clob) {
            return readClob(clob);
        }
        if (v instanceof Blob blob) {
            return readBlob(blob);
        }
        if (v instanceof SQLXML xml) {
            return xml.getString();
        }
        if (v instanceof Timestamp ts) {
            return ts.toInstant();
        }
        if (v instanceof java.sql.Date date) {
            return Instant.ofEpochMilli(date.getTime());
        }
        if (v instanceof Time time) {
            return time.toLocalTime().toString();
        }

        if (v instanceof Struct struct) {
            Object[] attrs = struct.getAttributes();
            Object[] safe = attrs != null ? attrs : new Object[0];
            List<Object> out = new ArrayList<>(safe.length);
            for (Object attr : safe) {
                out.add(normalize(attr, depth + 1));
            }
            return out;
        }

        if (v instanceof java.sql.Array arr) {
            try {
                Object arrayValue = arr.getArray();
                if (arrayValue instanceof Object[] objectArray) {
                    List<Object> out = new ArrayList<>(objectArray.length);
                    for (Object elem : objectArray) {
                        out.add(normalize(elem, depth + 1));
                    }
                    return out;
                }
                return arrayValue;
            } finally {
                release(arr::free);
            }
        }

        return v;
    }

    private interface Release {
        void free() throws SQLException;
    }

    private static void release(Release release) throws SQLException {
        try {
            release.free();
        } catch (SQLFeatureNotSupportedException e) {
            log.debug("Driver does not support freeing LOB handles: {}", e.getMessage());
        }
    }

    private static Object tryReadDriverSpecificValue(Object v) {
        String className = v.getClass().getName();

        // PostgreSQL: json/jsonb and custom types come back as org.postgresql.util.PGobject
        if ("org.postgresql.util.PGobject".equals(className)) {
            return invokeAccessor(v, "getValue");
        }

        // Oracle: oracle.sql.TIMESTAMP is not a java.sql.Timestamp
        if (className.startsWith("oracle.sql.TIMESTAMP")) {
            Object ts = invokeAccessor(v, "timestampValue");
            return ts instanceof Timestamp t ? t.toInstant() : ts;
        }

        return null;
    }

    private static Object invokeAccessor(Object v, String method) {
        try {
            var m = v.getClass().getMethod(method);
            return m.invoke(v);
        } catch (ReflectiveOperationException | RuntimeException e) {
            log.debug("Driver accessor {}.{} failed: {}", v.getClass().getName(), method, e.getMessage());
            return null;
        }
    }

    private static String readClob(Clob clob) throws SQLException {
        try {
            long length = clob.length();
            if (length <= 0) {
                return "";
            }
            if (length <= Integer.MAX_VALUE) {
                return clob.getSubString(1, (int) length);
            }
            try (Reader reader = clob.getCharacterStream()) {
                StringBuilder sb = new StringBuilder();
                char[] buf = new char[READ_BUFFER_CHARS];
                int n;
                while ((n = reader.read(buf)) > 0) {
                    sb.append(buf, 0, n);
                }
                return sb.toString();
            } catch (IOException e) {
                throw new SQLException("Failed to read CLOB", e);
            }
        } finally {
            release(clob::free);
        }
    }

    private static byte[] readBlob(Blob blob) throws SQLException {
        try {
            long length = blob.length();
            if (length <= 0) {
                return new byte[0];
            }
            if (length > Integer.MAX_VALUE) {
                throw new SQLException("BLOB too large to read into memory: " + length + " bytes");
            }
            return blob.getBytes(1, (int) length);
        } finally {
            release(blob::free);
        }
    }
}
