package com.iimsoft.planner.domain;

import java.util.Locale;

/**
 * 优先级：数值同时用于排序与打分偏置
 */
public enum Priority {
    LOW(1),
    MEDIUM(5),
    HIGH(8),
    CRITICAL(10);

    private final int value;

    Priority(int value) {
        this.value = value;
    }

    public int getValue() {
        return value;
    }

    /**
     * Maps a raw label (English name or numeric value) to a priority. Unknown labels map to MEDIUM.
     */
    public static Priority fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return MEDIUM;
        }
        String key = raw.trim().toUpperCase(Locale.ROOT);
        for (Priority p : values()) {
            if (p.name().equals(key) || String.valueOf(p.value).equals(key)) {
                return p;
            }
        }
        return MEDIUM;
    }
}
