package com.familygraph.model;

import java.util.Locale;

public enum Gender {
    MALE("M"),
    FEMALE("F"),
    UNKNOWN("U");

    private final String code;

    Gender(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    /**
     * Lenient parse used for stored rows: "M", "F", "MALE", "FEMALE" in any case.
     * Anything else, including null, is UNKNOWN.
     */
    public static Gender fromCode(String value) {
        if (value == null || value.isBlank()) {
            return UNKNOWN;
        }
        return switch (value.trim().toUpperCase(Locale.ROOT)) {
            case "M", "MALE" -> MALE;
            case "F", "FEMALE" -> FEMALE;
            default -> UNKNOWN;
        };
    }
}
