package com.playpulse.analytics.model;

import java.io.Serializable;

/**
 * DLQ/quarantine envelope: where the record came from, why it was rejected, and the original payload.
 */
public class RejectedEventEnvelope implements Serializable {
    private static final long serialVersionUID = 1L;

    public String schemaVersion;
    public SourcePointer source;
    public FailureDetails failure;
    public Identity identity;
    public Payload payload;
    public String dedupKey;
    public String dedupStrategy;
    public boolean replay;
    public long ingestionTimestamp;
    public Long eventTimestamp;

    public RejectedEventEnvelope() {}

    public static class SourcePointer implements Serializable {
        private static final long serialVersionUID = 1L;

        public String topic;
        public int partition;
        public long offset;
        public long recordTimestamp;

        public SourcePointer() {}
    }

    public static class FailureDetails implements Serializable {
        private static final long serialVersionUID = 1L;

        public String stage;
        public String failureClass;
        public String reason;
        // JSON path of the offending value, when validation can name one.
        public String field;
        public String details;

        public FailureDetails() {}
    }

    public static class Identity implements Serializable {
        private static final long serialVersionUID = 1L;

        public String eventId;
        public String eventType;
        public String eventVersion;
        public String sessionId;
        public String projectId;

        public Identity() {}
    }

    public static class Payload implements Serializable {
        private static final long serialVersionUID = 1L;

        public String encoding;
        public String body;
        public String canonicalJson;

        public Payload() {}
    }
}
