package com.fedsearch.cache;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.List;

/**
 * Cache keys of the form {@code <connectionId>:<16 hex chars>}. The hash covers the connection,
 * the SQL with whitespace collapsed and any trailing semicolon removed, and the positional
 * parameters, so cosmetic differences in generated SQL share one entry.
 */
public final class CacheKeys {

    private static final int HASH_CHARS = 16;

    private CacheKeys() {
    }

    public static String forQuery(String connectionId, String sql, List<Object> params) {
        StringBuilder material = new StringBuilder();
        material.append(connectionId).append('\n').append(normalizeSql(sql)).append('\n');
        if (params != null) {
            for (Object param : params) {
                material.append(param == null ? "\u0000" : param.getClass().getSimpleName() + "=" + param).append('\u0001');
            }
        }
        return connectionId + ":" + sha256(material.toString()).substring(0, HASH_CHARS);
    }

    static String normalizeSql(String sql) {
        if (sql == null) {
            return "";
        }
        String s = sql.trim().replaceAll("\\s+", " ");
        while (s.endsWith(";")) {
            s = s.substring(0, s.length() - 1).trim();
        }
        return s;
    }

    private static String sha256(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(value.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
