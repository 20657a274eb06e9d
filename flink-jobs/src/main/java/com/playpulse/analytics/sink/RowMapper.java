package com.playpulse.analytics.sink;

/**
 * Converts a record into a single JSON row.
 */
@FunctionalInterface
public interface RowMapper<T> extends java.io.Serializable {
    String map(T payload);
}
