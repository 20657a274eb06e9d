package com.playpulse.analytics.sink;

import org.apache.flink.api.common.serialization.SimpleStringSchema;
import org.apache.flink.connector.kafka.sink.KafkaRecordSerializationSchema;
import org.apache.flink.connector.kafka.sink.KafkaSink;

import com.playpulse.analytics.quality.FusionJobConfig;

/**
 * Builds one JSON-row Kafka sink per outbound topic.
 */
public final class KafkaSinkFactory {
    private KafkaSinkFactory() {}

    public static KafkaSink<String> build(FusionJobConfig config, String topic) {
        return KafkaSink.<String>builder()
                .setBootstrapServers(config.kafkaBootstrap)
                .setRecordSerializer(KafkaRecordSerializationSchema.builder()
                        .setTopic(topic)
                        .setValueSerializationSchema(new SimpleStringSchema())
                        .build())
                .build();
    }
}
