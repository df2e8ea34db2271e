package com.familygraph.graph;

import java.util.Locale;

/**
 * UP_TO keeps everyone reached within N hops; ONLY_AT keeps only those exactly N hops away.
 */
public enum DepthMode {
    UP_TO("up_to"),
    ONLY_AT("only_at");

    private final String value;

    DepthMode(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public boolean accepts(int depth, int maxDepth) {
        return switch (this) {
            case UP_TO -> depth > 0 && depth <= maxDepth;
            case ONLY_AT -> depth == maxDepth;
        };
    }

    public static DepthMode fromValue(String value) {
        if (value != null) {
            String normalized = value.trim().toLowerCase(Locale.ROOT);
            for (DepthMode mode : values()) {
                if (mode.value.equals(normalized)) {
                    return mode;
                }
            }
        }
        throw new InvalidDepthModeException(value);
    }
}
