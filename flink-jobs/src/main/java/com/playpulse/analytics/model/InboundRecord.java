package com.playpulse.analytics.model;

import java.io.Serializable;
import java.util.HashMap;
import java.util.Map;

/**
 * Raw Kafka record as handed to the quality gate.
 */
public class InboundRecord implements Serializable {
    private static final long serialVersionUID = 1L;

    public String topic;
    public int partition;
    public long offset;
    public long recordTimestamp;
    public byte[] value;
    public String key;
    public Map<String, String> headers = new HashMap<>();

    public InboundRecord() {}
}
