package com.ashscreener.model;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public final class TableRow {
    private final Map<String, Object> values;

    public TableRow(Map<String, ?> raw) {
        Map<String, Object> copy = new LinkedHashMap<>();
        if (raw != null) {
            for (Map.Entry<String, ?> e : raw.entrySet()) {
                if (e.getKey() != null && e.getValue() != null) {
                    copy.put(e.getKey(), e.getValue());
                }
            }
        }
        this.values = Collections.unmodifiableMap(copy);
    }

    public String getString(String field) {
        Object value = values.get(field);
        return value == null ? "" : String.valueOf(value).trim();
    }

    /**
     * Numeric value of the field, or null when missing or unparseable.
     */
    public Double getDouble(String field) {
        Object value = values.get(field);
        if (value instanceof Number number) {
            double d = number.doubleValue();
            return Double.isFinite(d) ? d : null;
        }
        String text = value == null ? "" : String.valueOf(value).trim();
        if (text.isEmpty() || "-".equals(text) || "null".equalsIgnoreCase(text)) {
            return null;
        }
        try {
            double d = Double.parseDouble(text.replace(",", ""));
            return Double.isFinite(d) ? d : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }

    public double doubleOr(String field, double fallback) {
        Double value = getDouble(field);
        return value == null ? fallback : value;
    }

    /**
     * Accepts {@code yyyy-MM-dd}, {@code yyyyMMdd} and timestamps starting with an ISO date.
     */
    public LocalDate getDate(String field) {
        String text = getString(field);
        if (text.length() >= 10 && text.charAt(4) == '-') {
            try {
                return LocalDate.parse(text.substring(0, 10));
            } catch (DateTimeParseException e) {
                return null;
            }
        }
        if (text.length() >= 8 && text.substring(0, 8).chars().allMatch(Character::isDigit)) {
            try {
                return LocalDate.of(
                        Integer.parseInt(text.substring(0, 4)),
                        Integer.parseInt(text.substring(4, 6)),
                        Integer.parseInt(text.substring(6, 8))
                );
            } catch (RuntimeException e) {
                return null;
            }
        }
        return null;
    }

    public Map<String, Object> toMap() {
        return values;
    }
}
