package com.playpulse.analytics.sink;

import org.apache.flink.metrics.Counter;
import org.apache.flink.metrics.MetricGroup;
import org.apache.flink.streaming.api.functions.ProcessFunction;
import org.apache.flink.util.Collector;
import org.apache.flink.util.OutputTag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.playpulse.analytics.model.RejectedEventEnvelope;

import java.io.Serializable;
import java.nio.charset.StandardCharsets;

/**
 * Maps records to JSON rows and enforces a max row size.
 * Oversized rows are routed to the DLQ when a failure handler is given, otherwise dropped.
 * DLQ and quarantine streams are guarded without a handler so a rejected envelope never loops back.
 */
public class RowGuardProcessFunction<T> extends ProcessFunction<T, String> {
    private static final Logger LOG = LoggerFactory.getLogger(RowGuardProcessFunction.class);

    /**
     * Builds the DLQ envelope for a record whose row exceeded the limit.
     */
    @FunctionalInterface
    public interface GuardFailureHandler<T> extends Serializable {
        RejectedEventEnvelope onOversize(T value, String reason, String details);
    }

    public static final String REASON_RECORD_TOO_LARGE = "record_too_large";

    private final String recordKind;
    private final RowMapper<T> mapper;
    private final OutputTag<RejectedEventEnvelope> dlqTag;
    private final int sizeLimitBytes;
    private final GuardFailureHandler<T> failureHandler;
    private transient Counter oversizeCounter;
    private transient Counter emittedCounter;

    public RowGuardProcessFunction(
            String recordKind,
            RowMapper<T> mapper,
            OutputTag<RejectedEventEnvelope> dlqTag,
            int sizeLimitBytes,
            GuardFailureHandler<T> failureHandler) {
        this.recordKind = recordKind;
        this.mapper = mapper;
        this.dlqTag = dlqTag;
        this.sizeLimitBytes = sizeLimitBytes;
        this.failureHandler = failureHandler;
    }

    /**
     * Drop-only guard, used for DLQ and quarantine envelopes.
     */
    public static <T> RowGuardProcessFunction<T> dropping(String recordKind, RowMapper<T> mapper, int sizeLimitBytes) {
        return new RowGuardProcessFunction<>(recordKind, mapper, null, sizeLimitBytes, null);
    }

    @Override
    public void open(org.apache.flink.configuration.Configuration parameters) {
        MetricGroup metrics = getRuntimeContext().getMetricGroup()
                .addGroup("playpulse")
                .addGroup("sink_guard");
        oversizeCounter = metrics.counter("oversize_drops");
        emittedCounter = metrics.counter("rows_emitted");
    }

    @Override
    public void processElement(T value, Context ctx, Collector<String> out) {
        if (value == null) {
            return;
        }
        String row = mapper.map(value);
        int sizeBytes = rowSizeBytes(row);
        if (sizeBytes > sizeLimitBytes) {
            if (oversizeCounter != null) {
                oversizeCounter.inc();
            }
            String details = recordKind + " row size " + sizeBytes + " exceeds limit " + sizeLimitBytes;
            if (failureHandler != null && dlqTag != null) {
                ctx.output(dlqTag, failureHandler.onOversize(value, REASON_RECORD_TOO_LARGE, details));
            } else {
                LOG.warn("Dropping oversized row ({} bytes) for sink guard (kind={})", sizeBytes, recordKind);
            }
            return;
        }
        if (emittedCounter != null) {
            emittedCounter.inc();
        }
        out.collect(row);
    }

    static int rowSizeBytes(String row) {
        return row.getBytes(StandardCharsets.UTF_8).length;
    }
}
