package com.playpulse.analytics.quality;

import org.apache.flink.api.common.state.StateTtlConfig;
import org.apache.flink.api.common.state.ValueState;
import org.apache.flink.api.common.state.ValueStateDescriptor;
import org.apache.flink.api.common.time.Time;
import org.apache.flink.configuration.Configuration;
import org.apache.flink.metrics.Counter;
import org.apache.flink.metrics.MeterView;
import org.apache.flink.metrics.MetricGroup;
import org.apache.flink.streaming.api.functions.KeyedProcessFunction;
import org.apache.flink.util.Collector;
import org.apache.flink.util.OutputTag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;

import com.playpulse.analytics.model.RejectedEventEnvelope;
import com.playpulse.analytics.model.TelemetryEvent;

import java.io.Serializable;

/**
 * First-arrival-wins filter keyed by {@link QualityGateProcessFunction.DedupKey}.
 *
 * <p>For chunk windows the key is the session window, so a second observation or analysis request
 * for a window already seen is quarantined even when it carries a new event id and different content.
 * The quarantine envelope names the event that claimed the key first.</p>
 */
public class DeduplicationProcessFunction extends KeyedProcessFunction<String, ValidatedEvent, ValidatedEvent> {
    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(DeduplicationProcessFunction.class);

    public static final String REASON_CHUNK_WINDOW = "duplicate_chunk_window";
    public static final String REASON_EVENT_ID = "duplicate_event_id";
    public static final String REASON_PAYLOAD = "duplicate_payload";

    private final FusionJobConfig config;
    private final OutputTag<RejectedEventEnvelope> quarantineTag;
    private transient ValueState<FirstArrival> firstArrivalState;
    private transient Counter acceptedCounter;
    private transient Counter duplicateCounter;
    private transient Counter duplicateWindowCounter;

    public DeduplicationProcessFunction(FusionJobConfig config, OutputTag<RejectedEventEnvelope> quarantineTag) {
        this.config = config;
        this.quarantineTag = quarantineTag;
    }

    @Override
    public void open(Configuration parameters) {
        StateTtlConfig ttlConfig = StateTtlConfig
                .newBuilder(Time.minutes(config.dedupTtlMinutes))
                .setUpdateType(StateTtlConfig.UpdateType.OnCreateAndWrite)
                .setStateVisibility(StateTtlConfig.StateVisibility.NeverReturnExpired)
                .build();
        ValueStateDescriptor<FirstArrival> descriptor = new ValueStateDescriptor<>("first-arrival", FirstArrival.class);
        descriptor.enableTimeToLive(ttlConfig);
        firstArrivalState = getRuntimeContext().getState(descriptor);

        MetricGroup metrics = getRuntimeContext().getMetricGroup()
                .addGroup("playpulse")
                .addGroup("dedup");
        acceptedCounter = metrics.counter("accepted");
        duplicateCounter = metrics.counter("duplicates");
        duplicateWindowCounter = metrics.counter("duplicate_chunk_windows");
        metrics.meter("duplicate_rate", new MeterView(duplicateCounter, (int) config.metricsRateWindow.getSeconds()));
        LOG.info("Deduplication initialized (ttlMinutes={})", config.dedupTtlMinutes);
    }

    @Override
    public void processElement(ValidatedEvent validated, Context ctx, Collector<ValidatedEvent> out) throws Exception {
        if (validated == null || validated.event == null) {
            return;
        }
        TelemetryEvent event = validated.event;
        FirstArrival first = firstArrivalState.value();
        if (first == null) {
            firstArrivalState.update(FirstArrival.of(event, windowIndexOf(validated)));
            acceptedCounter.inc();
            out.collect(validated);
            return;
        }

        String reason = reasonFor(event.dedupStrategy);
        duplicateCounter.inc();
        if (REASON_CHUNK_WINDOW.equals(reason)) {
            duplicateWindowCounter.inc();
            LOG.info("Late chunk for claimed window dropped (session={}, type={}, window={}, id={}, firstId={})",
                    event.sessionId, event.eventType, first.windowIndex, event.eventId, first.eventId);
        } else {
            LOG.debug("Duplicate detected (id={}, type={}, session={}, key={}, firstId={})",
                    event.eventId, event.eventType, event.sessionId, event.dedupKey, first.eventId);
        }
        ctx.output(quarantineTag, RejectedEventEnvelopeFactory.forDedupFailure(event, reason, first.describe()));
    }

    static String reasonFor(String dedupStrategy) {
        if (QualityGateProcessFunction.STRATEGY_SESSION_WINDOW.equals(dedupStrategy)) {
            return REASON_CHUNK_WINDOW;
        }
        if (QualityGateProcessFunction.STRATEGY_EVENT_ID.equals(dedupStrategy)) {
            return REASON_EVENT_ID;
        }
        return REASON_PAYLOAD;
    }

    private static Integer windowIndexOf(ValidatedEvent validated) {
        if (!QualityGateProcessFunction.STRATEGY_SESSION_WINDOW.equals(validated.event.dedupStrategy)) {
            return null;
        }
        JsonNode data = validated.data();
        JsonNode windowIndex = data == null ? null : data.path("window_index");
        return windowIndex != null && windowIndex.isIntegralNumber() ? windowIndex.asInt() : null;
    }

    /**
     * The event that claimed a dedup key.
     */
    public static class FirstArrival implements Serializable {
        private static final long serialVersionUID = 1L;

        public String eventId;
        public String eventType;
        public Integer windowIndex;
        public long eventTimestamp;

        public FirstArrival() {}

        static FirstArrival of(TelemetryEvent event, Integer windowIndex) {
            FirstArrival first = new FirstArrival();
            first.eventId = event.eventId;
            first.eventType = event.eventType;
            first.windowIndex = windowIndex;
            first.eventTimestamp = event.timestamp;
            return first;
        }

        String describe() {
            StringBuilder sb = new StringBuilder("first=").append(eventId).append(" (type=").append(eventType);
            if (windowIndex != null) {
                sb.append(", window=").append(windowIndex);
            }
            return sb.append(", ts=").append(eventTimestamp).append(')').toString();
        }
    }
}
