package com.playpulse.analytics.quality;

import java.time.Duration;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Centralized configuration for the telemetry fusion job, sourced from environment variables.
 */
public class FusionJobConfig implements java.io.Serializable {
    private static final long serialVersionUID = 1L;

    public final String kafkaBootstrap;
    public final String inputTopic;
    public final String dlqTopic;
    public final String quarantineTopic;
    public final String kafkaGroupId;

    public final String fusedRowsTopic;
    public final String verdictsTopic;
    public final String sessionScoresTopic;
    public final String sessionEventsTopic;
    public final String readingAuditTopic;
    public final String chunkAuditTopic;
    public final String segmentRollupsTopic;

    public final int dedupTtlMinutes;
    public final int sessionStateTtlMinutes;
    public final int maxSessionDurationSec;
    public final Set<String> supportedVersions;

    public final Set<String> affectDimensions;
    public final Set<String> physioDimensions;
    public final Set<String> baselineDimensions;

    public final String chunkAnalysisUrl;
    public final int chunkAnalysisMaxAttempts;
    public final long chunkAnalysisInitialBackoffMs;
    public final long chunkAnalysisMaxBackoffMs;
    public final long chunkAnalysisTimeoutMs;
    public final int chunkAnalysisCapacity;

    public final int maxRecordSizeBytes;
    public final long checkpointIntervalMs;
    public final Duration metricsRateWindow;

    private FusionJobConfig(Builder b) {
        this.kafkaBootstrap = b.kafkaBootstrap;
        this.inputTopic = b.inputTopic;
        this.dlqTopic = b.dlqTopic;
        this.quarantineTopic = b.quarantineTopic;
        this.kafkaGroupId = b.kafkaGroupId;
        this.fusedRowsTopic = b.fusedRowsTopic;
        this.verdictsTopic = b.verdictsTopic;
        this.sessionScoresTopic = b.sessionScoresTopic;
        this.sessionEventsTopic = b.sessionEventsTopic;
        this.readingAuditTopic = b.readingAuditTopic;
        this.chunkAuditTopic = b.chunkAuditTopic;
        this.segmentRollupsTopic = b.segmentRollupsTopic;
        this.dedupTtlMinutes = b.dedupTtlMinutes;
        this.sessionStateTtlMinutes = b.sessionStateTtlMinutes;
        this.maxSessionDurationSec = b.maxSessionDurationSec;
        this.supportedVersions = Collections.unmodifiableSet(b.supportedVersions);
        this.affectDimensions = Collections.unmodifiableSet(b.affectDimensions);
        this.physioDimensions = Collections.unmodifiableSet(b.physioDimensions);
        this.baselineDimensions = Collections.unmodifiableSet(b.baselineDimensions);
        this.chunkAnalysisUrl = b.chunkAnalysisUrl;
        this.chunkAnalysisMaxAttempts = b.chunkAnalysisMaxAttempts;
        this.chunkAnalysisInitialBackoffMs = b.chunkAnalysisInitialBackoffMs;
        this.chunkAnalysisMaxBackoffMs = b.chunkAnalysisMaxBackoffMs;
        this.chunkAnalysisTimeoutMs = b.chunkAnalysisTimeoutMs;
        this.chunkAnalysisCapacity = b.chunkAnalysisCapacity;
        this.maxRecordSizeBytes = b.maxRecordSizeBytes;
        this.checkpointIntervalMs = b.checkpointIntervalMs;
        this.metricsRateWindow = b.metricsRateWindow;
    }

    public static FusionJobConfig fromEnv() {
        Builder b = new Builder();
        b.kafkaBootstrap = env("PLAYPULSE_KAFKA_BOOTSTRAP", "kafka:9092");
        b.inputTopic = env("PLAYPULSE_INPUT_TOPIC", "playtest.telemetry.v1");
        b.dlqTopic = env("PLAYPULSE_DLQ_TOPIC", "playtest.dlq.telemetry.v1");
        b.quarantineTopic = env("PLAYPULSE_QUARANTINE_TOPIC", "playtest.quarantine.telemetry.v1");
        b.kafkaGroupId = env("PLAYPULSE_GROUP_ID", "flink-playtest-fusion-v1");

        b.fusedRowsTopic = env("PLAYPULSE_FUSED_ROWS_TOPIC", "playtest.fused_rows.v1");
        b.verdictsTopic = env("PLAYPULSE_VERDICTS_TOPIC", "playtest.segment_verdicts.v1");
        b.sessionScoresTopic = env("PLAYPULSE_SESSION_SCORES_TOPIC", "playtest.session_scores.v1");
        b.sessionEventsTopic = env("PLAYPULSE_SESSION_EVENTS_TOPIC", "playtest.session_events.v1");
        b.readingAuditTopic = env("PLAYPULSE_READING_AUDIT_TOPIC", "playtest.raw_reading_audit.v1");
        b.chunkAuditTopic = env("PLAYPULSE_CHUNK_AUDIT_TOPIC", "playtest.chunk_audit.v1");
        b.segmentRollupsTopic = env("PLAYPULSE_SEGMENT_ROLLUPS_TOPIC", "playtest.project_segment_rollups.v1");

        b.dedupTtlMinutes = envInt("PLAYPULSE_DEDUP_TTL_MINUTES", 1440);
        b.sessionStateTtlMinutes = envInt("PLAYPULSE_SESSION_STATE_TTL_MINUTES", 7 * 1440);
        b.maxSessionDurationSec = Math.max(1, envInt("PLAYPULSE_MAX_SESSION_DURATION_SEC", 6 * 60 * 60));
        b.supportedVersions = envSet("PLAYPULSE_SUPPORTED_VERSIONS", "1,v1");

        b.affectDimensions = envSet("PLAYPULSE_AFFECT_DIMENSIONS",
                "frustration,confusion,delight,boredom,surprise,engagement,neutral");
        b.physioDimensions = envSet("PLAYPULSE_PHYSIO_DIMENSIONS", "heart_rate,hrv,breathing_rate");
        b.baselineDimensions = envSet("PLAYPULSE_BASELINE_DIMENSIONS", "neutral");

        b.chunkAnalysisUrl = env("PLAYPULSE_CHUNK_ANALYSIS_URL", "http://chunk-analyzer:8080/v1/analyze");
        b.chunkAnalysisMaxAttempts = Math.max(1, envInt("PLAYPULSE_CHUNK_ANALYSIS_MAX_ATTEMPTS", 4));
        b.chunkAnalysisInitialBackoffMs = envLong("PLAYPULSE_CHUNK_ANALYSIS_INITIAL_BACKOFF_MS", 500L);
        b.chunkAnalysisMaxBackoffMs = envLong("PLAYPULSE_CHUNK_ANALYSIS_MAX_BACKOFF_MS", 8000L);
        b.chunkAnalysisTimeoutMs = envLong("PLAYPULSE_CHUNK_ANALYSIS_TIMEOUT_MS", 120_000L);
        b.chunkAnalysisCapacity = envInt("PLAYPULSE_CHUNK_ANALYSIS_CAPACITY", 16);

        b.maxRecordSizeBytes = envInt("PLAYPULSE_MAX_RECORD_BYTES", 1_000_000);
        b.checkpointIntervalMs = envLong("PLAYPULSE_CHECKPOINT_INTERVAL_MS", 60_000L);
        b.metricsRateWindow = Duration.ofSeconds(envInt("PLAYPULSE_METRICS_RATE_WINDOW_SEC", 60));
        return new FusionJobConfig(b);
    }

    private static String env(String key, String defaultValue) {
        String value = System.getenv(key);
        return value == null || value.isEmpty() ? defaultValue : value;
    }

    private static int envInt(String key, int defaultValue) {
        String value = System.getenv(key);
        if (value == null || value.isEmpty()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException ex) {
            return defaultValue;
        }
    }

    private static long envLong(String key, long defaultValue) {
        String value = System.getenv(key);
        if (value == null || value.isEmpty()) {
            return defaultValue;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException ex) {
            return defaultValue;
        }
    }

    private static Set<String> envSet(String key, String defaultValue) {
        String value = System.getenv(key);
        String raw = value == null || value.isEmpty() ? defaultValue : value;
        if (raw == null || raw.trim().isEmpty()) {
            return new LinkedHashSet<>();
        }
        return new LinkedHashSet<>(Arrays.asList(raw.trim().split("\\s*,\\s*")));
    }

    private static final class Builder {
        String kafkaBootstrap;
        String inputTopic;
        String dlqTopic;
        String quarantineTopic;
        String kafkaGroupId;
        String fusedRowsTopic;
        String verdictsTopic;
        String sessionScoresTopic;
        String sessionEventsTopic;
        String readingAuditTopic;
        String chunkAuditTopic;
        String segmentRollupsTopic;
        int dedupTtlMinutes;
        int sessionStateTtlMinutes;
        int maxSessionDurationSec;
        Set<String> supportedVersions;
        Set<String> affectDimensions;
        Set<String> physioDimensions;
        Set<String> baselineDimensions;
        String chunkAnalysisUrl;
        int chunkAnalysisMaxAttempts;
        long chunkAnalysisInitialBackoffMs;
        long chunkAnalysisMaxBackoffMs;
        long chunkAnalysisTimeoutMs;
        int chunkAnalysisCapacity;
        int maxRecordSizeBytes;
        long checkpointIntervalMs;
        Duration metricsRateWindow;
    }
}
