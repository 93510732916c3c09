package com.fedsearch.util;

import java.io.Reader;
import java.sql.Blob;
import java.sql.Clob;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.SQLXML;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;

/**
 * Converts JDBC driver values into JSON-safe values so that cached pages serialize the same way
 * regardless of the backend they came from.
 */
public final class JdbcValues {
    private static final int MAX_LOB_CHARS = 100_000;
    private static final int MAX_BLOB_BYTES = 100_000;
    private static final int MAX_STRING_CHARS = 100_000;
    private static final int MAX_NESTED_DEPTH = 3;
    static final String UNSUPPORTED_PLACEHOLDER = "[unsupported]";

    private JdbcValues() {
    }

    /**
     * Reads a column value and returns a JSON-safe equivalent. Values the driver cannot
     * hand out are replaced by a placeholder rather than failing the whole row.
     *
     * @param rs result set
     * @param columnIndex 1-based column index
     * @return json-safe value
     */
    public static Object read(ResultSet rs, int columnIndex) {
        try {
            return toJsonSafe(rs.getObject(columnIndex), 0);
        } catch (SQLException | RuntimeException e) {
            return UNSUPPORTED_PLACEHOLDER;
        }
    }

    static Object toJsonSafe(Object v, int depth) throws SQLException {
        if (v == null) {
            return null;
        }
        if (depth > MAX_NESTED_DEPTH) {
            return UNSUPPORTED_PLACEHOLDER;
        }

        // PostgreSQL json/jsonb/custom types
        if ("org.postgresql.util.PGobject".equals(v.getClass().getName())) {
            return truncate(v.toString());
        }

        if (v instanceof Number || v instanceof Boolean) {
            return v;
        }
        if (v instanceof String s) {
            return truncate(s);
        }
        if (v instanceof Clob clob) {
            return readClob(clob);
        }
        if (v instanceof Blob blob) {
            int toRead = (int) Math.min(blob.length(), MAX_BLOB_BYTES);
            return toRead <= 0 ? "" : Base64.getEncoder().encodeToString(blob.getBytes(1, toRead));
        }
        if (v instanceof SQLXML xml) {
            return truncate(xml.getString());
        }
        if (v instanceof byte[] bytes) {
            return Base64.getEncoder().encodeToString(bytes);
        }
        if (v instanceof java.sql.Array arr) {
            Object arrayValue = arr.getArray();
            if (arrayValue instanceof Object[] objectArray) {
                List<Object> out = new ArrayList<>(objectArray.length);
                for (Object elem : objectArray) {
                    out.add(toJsonSafe(elem, depth + 1));
                }
                return out;
            }
            return truncate(String.valueOf(arrayValue));
        }
        // dates, times, timestamps, UUIDs and anything else
        return truncate(String.valueOf(v));
    }

    private static String truncate(String s) {
        if (s == null || s.length() <= MAX_STRING_CHARS) {
            return s;
        }
        return s.substring(0, MAX_STRING_CHARS);
    }

    private static String readClob(Clob clob) throws SQLException {
        try (Reader reader = clob.getCharacterStream()) {
            if (reader == null) {
                return "";
            }
            char[] buf = new char[8192];
            StringBuilder sb = new StringBuilder();
            int n;
            while (sb.length() < MAX_LOB_CHARS
                    && (n = reader.read(buf, 0, Math.min(buf.length, MAX_LOB_CHARS - sb.length()))) > 0) {
                sb.append(buf, 0, n);
            }
            return sb.toString();
        } catch (java.io.IOException e) {
            throw new SQLException("Failed to read CLOB value", e);
        }
    }
}
