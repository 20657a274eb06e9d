package com.playpulse.analytics.session;

import org.apache.flink.api.common.state.ListState;
import org.apache.flink.api.common.state.ListStateDescriptor;
import org.apache.flink.api.common.state.StateTtlConfig;
import org.apache.flink.api.common.state.ValueState;
import org.apache.flink.api.common.state.ValueStateDescriptor;
import org.apache.flink.api.common.time.Time;
import org.apache.flink.configuration.Configuration;
import org.apache.flink.metrics.Counter;
import org.apache.flink.metrics.MetricGroup;
import org.apache.flink.streaming.api.functions.KeyedProcessFunction;
import org.apache.flink.util.Collector;

import com.playpulse.analytics.catalog.SegmentSpecCatalog;
import com.playpulse.analytics.model.ChunkObservation;
import com.playpulse.analytics.model.FinalizeRequest;
import com.playpulse.analytics.model.SegmentSpec;
import com.playpulse.analytics.model.SensorReading;
import com.playpulse.analytics.model.SensorStream;
import com.playpulse.analytics.quality.FusionJobConfig;
import com.playpulse.analytics.util.BuildMetadata;
import com.playpulse.analytics.util.SessionKey;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Stateful session builder keyed by session id.
 *
 * <p>Chunk observations and sensor readings are retained raw in keyed list state. Each
 * {@code session_finalize} signal recomputes the whole session from that state and emits one
 * {@link SessionFinalization} with a bumped finalization version, so a late chunk followed by a
 * second finalize replaces the earlier result. All state expires after the session TTL.</p>
 */
public class SessionFinalizeFunction extends KeyedProcessFunction<String, SessionSignal, SessionFinalization> {
    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(SessionFinalizeFunction.class);

    private final FusionJobConfig config;
    private final SegmentSpecCatalog catalog;
    private final SessionFinalizer finalizer;

    private transient ListState<ChunkObservation> chunkState;
    private transient ListState<SensorReading> affectState;
    private transient ListState<SensorReading> physioState;
    private transient ValueState<SessionAccumulator> metaState;

    private transient Counter finalizedCounter;
    private transient Counter insufficientCounter;
    private transient Counter refinalizedCounter;

    public SessionFinalizeFunction(FusionJobConfig config, SegmentSpecCatalog catalog) {
        this.config = config;
        this.catalog = catalog;
        this.finalizer = SessionFinalizer.fromConfig(config);
    }

    @Override
    public void open(Configuration parameters) {
        StateTtlConfig ttlConfig = StateTtlConfig
                .newBuilder(Time.minutes(config.sessionStateTtlMinutes))
                .setUpdateType(StateTtlConfig.UpdateType.OnCreateAndWrite)
                .setStateVisibility(StateTtlConfig.StateVisibility.NeverReturnExpired)
                .build();

        ListStateDescriptor<ChunkObservation> chunks = new ListStateDescriptor<>("session-chunks", ChunkObservation.class);
        chunks.enableTimeToLive(ttlConfig);
        ListStateDescriptor<SensorReading> affect = new ListStateDescriptor<>("session-affect-readings", SensorReading.class);
        affect.enableTimeToLive(ttlConfig);
        ListStateDescriptor<SensorReading> physio = new ListStateDescriptor<>("session-physio-readings", SensorReading.class);
        physio.enableTimeToLive(ttlConfig);
        ValueStateDescriptor<SessionAccumulator> meta = new ValueStateDescriptor<>("session-meta", SessionAccumulator.class);
        meta.enableTimeToLive(ttlConfig);

        chunkState = getRuntimeContext().getListState(chunks);
        affectState = getRuntimeContext().getListState(affect);
        physioState = getRuntimeContext().getListState(physio);
        metaState = getRuntimeContext().getState(meta);

        MetricGroup metrics = getRuntimeContext().getMetricGroup()
                .addGroup("playpulse")
                .addGroup("finalize");
        finalizedCounter = metrics.counter("finalized");
        insufficientCounter = metrics.counter("insufficient_data");
        refinalizedCounter = metrics.counter("refinalized");

        LOG.info("Session finalizer initialized (stateTtlMinutes={}, catalogVersion={}, build_version={})",
                config.sessionStateTtlMinutes, catalog.version(), BuildMetadata.current().identity());
    }

    @Override
    public void processElement(SessionSignal signal, Context ctx, Collector<SessionFinalization> out) throws Exception {
        if (signal == null || SessionKey.isMissing(signal.sessionId) || signal.signalType == null) {
            return;
        }

        SessionAccumulator meta = metaState.value();
        if (meta == null) {
            meta = new SessionAccumulator();
            meta.sessionId = signal.sessionId;
            meta.firstSignalTimestamp = signal.signalTimestamp;
        }
        if (meta.projectId == null) {
            meta.projectId = SessionKey.idOrNull(signal.projectId);
        }
        meta.lastSignalTimestamp = Math.max(meta.lastSignalTimestamp, signal.signalTimestamp);

        switch (signal.signalType) {
            case CHUNK:
                if (signal.chunk != null) {
                    chunkState.add(signal.chunk);
                    meta.chunkCount++;
                }
                metaState.update(meta);
                break;
            case READING:
                addReading(meta, signal.reading);
                metaState.update(meta);
                break;
            case FINALIZE:
                finalizeSession(meta, signal, out);
                break;
            default:
                LOG.warn("Ignoring unsupported session signal (session={}, type={})", signal.sessionId, signal.signalType);
        }
    }

    private void addReading(SessionAccumulator meta, SensorReading reading) throws Exception {
        if (reading == null || reading.stream == null) {
            return;
        }
        if (reading.stream == SensorStream.AFFECT) {
            affectState.add(reading);
            meta.affectReadingCount++;
        } else {
            physioState.add(reading);
            meta.physioReadingCount++;
        }
    }

    private void finalizeSession(SessionAccumulator meta, SessionSignal signal, Collector<SessionFinalization> out)
            throws Exception {
        FinalizeRequest request = signal.finalizeRequest;
        if (request != null && !SessionKey.isMissing(request.projectId)) {
            meta.projectId = request.projectId;
        }
        if (meta.finalizationVersion > 0) {
            refinalizedCounter.inc();
        }
        meta.finalizationVersion++;
        metaState.update(meta);

        SessionInputs inputs = new SessionInputs();
        inputs.sessionId = signal.sessionId;
        inputs.projectId = meta.projectId;
        inputs.chunks = toList(chunkState.get());
        inputs.affect = toList(affectState.get());
        inputs.physio = toList(physioState.get());
        inputs.request = request;
        inputs.specs = resolveSpecs(request, meta.projectId);
        inputs.finalizationVersion = meta.finalizationVersion;
        inputs.finalizedAtMs = request != null && request.requestedAtMs > 0 ? request.requestedAtMs : signal.signalTimestamp;

        SessionFinalization finalization = finalizer.finalizeSession(inputs);
        if (finalization.completed()) {
            finalizedCounter.inc();
        } else {
            insufficientCounter.inc();
        }
        out.collect(finalization);
    }

    private List<SegmentSpec> resolveSpecs(FinalizeRequest request, String projectId) {
        if (request != null && request.segments != null) {
            return new ArrayList<>(request.segments);
        }
        return catalog.specsFor(projectId);
    }

    private static <T> List<T> toList(Iterable<T> values) {
        List<T> list = new ArrayList<>();
        if (values == null) {
            return list;
        }
        for (T value : values) {
            list.add(value);
        }
        return list;
    }
}
