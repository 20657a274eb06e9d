package com.playpulse.analytics.parse;

/**
 * A value was present but unacceptable (out of range, inverted bounds, unknown enum). Carries the
 * JSON path of the offending field so the rejection can name it.
 */
public class TelemetryValidationException extends Exception {
    private static final long serialVersionUID = 1L;

    private final String field;

    public TelemetryValidationException(String field, String message) {
        super(field + ": " + message);
        this.field = field;
    }

    public String field() {
        return field;
    }
}
