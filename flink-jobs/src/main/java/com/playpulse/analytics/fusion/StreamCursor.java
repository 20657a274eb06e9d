package com.playpulse.analytics.fusion;

import com.playpulse.analytics.model.SensorReading;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Forward-only cursor over one sensor stream, sorted by timestamp once on construction.
 */
final class StreamCursor {
    private final List<SensorReading> readings;
    private int position;
    private int lastFreshSecond = Integer.MIN_VALUE;

    StreamCursor(List<SensorReading> readings) {
        this.readings = new ArrayList<>();
        if (readings != null) {
            for (SensorReading reading : readings) {
                if (reading != null && reading.values != null) {
                    this.readings.add(reading);
                }
            }
        }
        this.readings.sort(Comparator.comparingDouble(r -> r.timestampSec));
    }

    /**
     * Consumes every reading whose second is at or before {@code t}, in timestamp order.
     * Must be called with non-decreasing {@code t}.
     */
    List<SensorReading> advanceTo(int t) {
        List<SensorReading> consumed = new ArrayList<>();
        while (position < readings.size() && readings.get(position).second() <= t) {
            SensorReading reading = readings.get(position++);
            if (reading.second() == t) {
                lastFreshSecond = t;
            }
            consumed.add(reading);
        }
        return consumed;
    }

    boolean freshAt(int t) {
        return lastFreshSecond == t;
    }

    /**
     * Seconds since the stream was last fresh; {@link Long#MAX_VALUE} when it never was.
     */
    long ageAt(int t) {
        return lastFreshSecond == Integer.MIN_VALUE ? Long.MAX_VALUE : (long) t - lastFreshSecond;
    }
}
