package com.iimsoft.planner.domain;

import java.util.Locale;

public enum ResourceType {
    HUMAN,
    MATERIAL,
    TECHNOLOGICAL,
    SPATIAL,
    FINANCIAL;

    /**
     * Boundary conversion for raw labels; unknown labels map to MATERIAL.
     */
    public static ResourceType fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return MATERIAL;
        }
        String key = raw.trim().toUpperCase(Locale.ROOT);
        for (ResourceType t : values()) {
            if (t.name().equals(key)) {
                return t;
            }
        }
        return MATERIAL;
    }
}
