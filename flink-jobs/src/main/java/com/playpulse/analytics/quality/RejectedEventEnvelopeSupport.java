package com.playpulse.analytics.quality;

import com.fasterxml.jackson.databind.JsonNode;

import com.playpulse.analytics.model.InboundRecord;
import com.playpulse.analytics.model.RejectedEventEnvelope;
import com.playpulse.analytics.parse.JsonNodeUtils;

/**
 * Shared extraction helpers for envelope construction and schema checks.
 */
public final class RejectedEventEnvelopeSupport {
    private RejectedEventEnvelopeSupport() {}

    public static RejectedEventEnvelope.SourcePointer buildSourcePointer(InboundRecord record) {
        RejectedEventEnvelope.SourcePointer source = new RejectedEventEnvelope.SourcePointer();
        if (record != null) {
            source.topic = record.topic;
            source.partition = record.partition;
            source.offset = record.offset;
            source.recordTimestamp = record.recordTimestamp;
        }
        return source;
    }

    public static RejectedEventEnvelope.Identity extractIdentity(JsonNode root) {
        RejectedEventEnvelope.Identity identity = new RejectedEventEnvelope.Identity();
        if (root == null) {
            return identity;
        }
        identity.eventId = root.path("id").asText("");
        identity.eventType = root.path("type").asText("");
        identity.eventVersion = extractVersion(root);
        identity.sessionId = JsonNodeUtils.asNullableText(root.path("session_id"));
        identity.projectId = JsonNodeUtils.asNullableText(root.path("project_id"));
        return identity;
    }

    /**
     * Version from the envelope, falling back to {@code data.version}; null when absent.
     */
    public static String extractVersion(JsonNode root) {
        if (root == null) {
            return null;
        }
        JsonNode versionNode = root.get("version");
        if (versionNode == null || versionNode.isMissingNode() || versionNode.isNull()) {
            versionNode = root.path("data").get("version");
        }
        if (versionNode == null || versionNode.isMissingNode() || versionNode.isNull()) {
            return null;
        }
        if (versionNode.isNumber()) {
            return String.valueOf(versionNode.asInt());
        }
        return versionNode.asText(null);
    }
}
