package com.ashscreener.model;

/**
 * Exchange board, derived from the leading digits of the 6-character code.
 */
public enum Board {
    MAIN,
    CHINEXT,
    STAR,
    BEIJING,
    UNKNOWN;

    public static Board fromCode(String code) {
        String c = code == null ? "" : code.trim();
        if (c.startsWith("60") || c.startsWith("00")) {
            return MAIN;
        }
        if (c.startsWith("30")) {
            return CHINEXT;
        }
        if (c.startsWith("68")) {
            return STAR;
        }
        if (c.startsWith("8") || c.startsWith("4") || c.startsWith("92")) {
            return BEIJING;
        }
        return UNKNOWN;
    }

    public boolean screenable() {
        return this == MAIN || this == CHINEXT || this == STAR;
    }
}
