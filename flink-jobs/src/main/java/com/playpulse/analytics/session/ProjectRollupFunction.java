package com.playpulse.analytics.session;

import org.apache.flink.api.common.state.MapState;
import org.apache.flink.api.common.state.MapStateDescriptor;
import org.apache.flink.api.common.state.StateTtlConfig;
import org.apache.flink.api.common.time.Time;
import org.apache.flink.configuration.Configuration;
import org.apache.flink.streaming.api.functions.KeyedProcessFunction;
import org.apache.flink.util.Collector;

import com.playpulse.analytics.aggregate.ProjectAggregate;
import com.playpulse.analytics.aggregate.ProjectAggregator;
import com.playpulse.analytics.aggregate.SessionVerdicts;
import com.playpulse.analytics.quality.FusionJobConfig;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Keeps the latest verdict set per finalized session of a project and re-derives the project
 * view after every finalization. Keyed by project id.
 */
public class ProjectRollupFunction extends KeyedProcessFunction<String, SessionFinalization, ProjectAggregate> {
    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(ProjectRollupFunction.class);

    private final FusionJobConfig config;
    private transient MapState<String, SessionVerdicts> sessionsState;

    public ProjectRollupFunction(FusionJobConfig config) {
        this.config = config;
    }

    @Override
    public void open(Configuration parameters) {
        StateTtlConfig ttlConfig = StateTtlConfig
                .newBuilder(Time.minutes(config.sessionStateTtlMinutes))
                .setUpdateType(StateTtlConfig.UpdateType.OnCreateAndWrite)
                .setStateVisibility(StateTtlConfig.StateVisibility.NeverReturnExpired)
                .build();
        MapStateDescriptor<String, SessionVerdicts> descriptor =
                new MapStateDescriptor<>("project-session-verdicts", String.class, SessionVerdicts.class);
        descriptor.enableTimeToLive(ttlConfig);
        sessionsState = getRuntimeContext().getMapState(descriptor);
    }

    @Override
    public void processElement(SessionFinalization finalization, Context ctx, Collector<ProjectAggregate> out)
            throws Exception {
        if (finalization == null || finalization.sessionId == null) {
            return;
        }

        SessionVerdicts previous = sessionsState.get(finalization.sessionId);
        if (previous != null && previous.finalizationVersion > finalization.finalizationVersion) {
            LOG.debug("Ignoring stale finalization (project={}, session={}, version={}, current={})",
                    ctx.getCurrentKey(), finalization.sessionId, finalization.finalizationVersion,
                    previous.finalizationVersion);
            return;
        }

        if (finalization.completed()) {
            SessionVerdicts latest = new SessionVerdicts(
                    finalization.sessionId, finalization.finalizedAtMs, finalization.verdicts);
            latest.finalizationVersion = finalization.finalizationVersion;
            sessionsState.put(finalization.sessionId, latest);
        } else {
            sessionsState.remove(finalization.sessionId);
        }

        List<SessionVerdicts> sessions = new ArrayList<>();
        for (SessionVerdicts sessionVerdicts : sessionsState.values()) {
            sessions.add(sessionVerdicts);
        }
        out.collect(ProjectAggregator.aggregate(ctx.getCurrentKey(), sessions, finalization.finalizedAtMs));
    }
}
