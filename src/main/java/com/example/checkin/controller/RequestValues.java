package com.example.checkin.controller;

/**
 * Coercion of loosely typed JSON body values. Numbers may arrive as JSON numbers or as strings;
 * anything unparseable surfaces as a 400 through {@link NumberFormatException}.
 */
final class RequestValues {

    private RequestValues() {
    }

    static Long asLong(Object value) {
        if (value == null) return null;
        if (value instanceof Number) return ((Number) value).longValue();
        return Long.valueOf(value.toString().trim());
    }

    static Double asDouble(Object value) {
        if (value == null) return null;
        if (value instanceof Number) return ((Number) value).doubleValue();
        return Double.valueOf(value.toString().trim());
    }
}
