package com.playpulse.analytics.model;

public enum Severity {
    INFO,
    WARNING,
    CRITICAL;

    public boolean outranks(Severity other) {
        return other == null || ordinal() > other.ordinal();
    }

    public String wireName() {
        return name().toLowerCase(java.util.Locale.ROOT);
    }

    public static Severity fromWire(String value) {
        if (value != null) {
            String normalized = value.trim();
            for (Severity severity : values()) {
                if (severity.name().equalsIgnoreCase(normalized)) {
                    return severity;
                }
            }
        }
        throw new IllegalArgumentException("Unknown severity: " + value);
    }
}
