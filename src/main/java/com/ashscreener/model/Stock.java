package com.ashscreener.model;

import java.util.Locale;

public final class Stock {
    public final String code;
    public final String name;
    public final Board board;

    public Stock(String code, String name) {
        this.code = normalizeCode(code);
        this.name = name == null ? "" : name.trim();
        this.board = Board.fromCode(this.code);
    }

    /**
     * Strips exchange prefixes/suffixes ({@code sh600000}, {@code 600000.SH}) and left-pads to 6 digits.
     */
    public static String normalizeCode(String raw) {
        String token = raw == null ? "" : raw.trim().toLowerCase(Locale.ROOT);
        if (token.startsWith("sh") || token.startsWith("sz") || token.startsWith("bj")) {
            token = token.substring(2);
        }
        int dot = token.indexOf('.');
        if (dot >= 0) {
            token = token.substring(0, dot);
        }
        token = token.replaceAll("[^0-9]", "");
        if (token.isEmpty()) {
            return "";
        }
        if (token.length() > 6) {
            return token.substring(0, 6);
        }
        return "0".repeat(6 - token.length()) + token;
    }

    /**
     * Special-treatment and delisting names are never screened.
     */
    public boolean excludedByName() {
        return name.contains("ST") || name.contains("退");
    }
}
