package com.entity.pipeline.store;

import java.time.Instant;
import java.util.Map;

/**
 * Typed accessors for rows returned by {@link StoreConnection#query}.
 * SQLite returns INTEGER columns as Integer or Long depending on magnitude.
 */
final class Rows {

    private Rows() {
    }

    static long getLong(Map<String, Object> row, String column) {
        Object value = row.get(column);
        if (value == null) {
            throw new StoreException("Column '" + column + "' is null");
        }
        return ((Number) value).longValue();
    }

    static Long getNullableLong(Map<String, Object> row, String column) {
        Object value = row.get(column);
        return value == null ? null : ((Number) value).longValue();
    }

    static int getInt(Map<String, Object> row, String column, int defaultValue) {
        Object value = row.get(column);
        return value == null ? defaultValue : ((Number) value).intValue();
    }

    static double getDouble(Map<String, Object> row, String column) {
        Object value = row.get(column);
        return value == null ? 0.0 : ((Number) value).doubleValue();
    }

    static boolean getBoolean(Map<String, Object> row, String column) {
        Object value = row.get(column);
        return value != null && ((Number) value).intValue() != 0;
    }

    static String getString(Map<String, Object> row, String column) {
        Object value = row.get(column);
        return value == null ? null : value.toString();
    }

    static Instant getInstant(Map<String, Object> row, String column) {
        String value = getString(row, column);
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Instant.parse(value);
        } catch (RuntimeException e) {
            // rows written by other tools may carry SQLite's CURRENT_TIMESTAMP format
            return Instant.parse(value.replace(' ', 'T') + (value.endsWith("Z") ? "" : "Z"));
        }
    }
}
