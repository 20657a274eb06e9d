package com.playpulse.analytics.model;

import java.io.Serializable;

/**
 * A typed payload together with the event it was parsed from.
 */
public class ParsedTelemetry<T> implements Serializable {
    private static final long serialVersionUID = 1L;

    public TelemetryEvent event;
    public T payload;

    public ParsedTelemetry() {}

    public ParsedTelemetry(TelemetryEvent event, T payload) {
        this.event = event;
        this.payload = payload;
    }
}
