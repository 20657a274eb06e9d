package com.playpulse.analytics.pipeline;

import org.apache.flink.api.common.typeinfo.TypeInformation;
import org.apache.flink.connector.kafka.source.reader.deserializer.KafkaRecordDeserializationSchema;
import org.apache.flink.util.Collector;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.common.header.Header;

import com.playpulse.analytics.model.InboundRecord;

import java.nio.charset.StandardCharsets;

/**
 * Keeps raw bytes plus source coordinates so the quality gate can point DLQ entries back at Kafka.
 */
public class InboundRecordDeserializationSchema implements KafkaRecordDeserializationSchema<InboundRecord> {
    private static final long serialVersionUID = 1L;

    @Override
    public void deserialize(ConsumerRecord<byte[], byte[]> record, Collector<InboundRecord> out) {
        out.collect(toInboundRecord(record));
    }

    static InboundRecord toInboundRecord(ConsumerRecord<byte[], byte[]> record) {
        InboundRecord inbound = new InboundRecord();
        inbound.topic = record.topic();
        inbound.partition = record.partition();
        inbound.offset = record.offset();
        inbound.recordTimestamp = record.timestamp();
        inbound.value = record.value();
        inbound.key = record.key() == null ? null : new String(record.key(), StandardCharsets.UTF_8);
        if (record.headers() != null) {
            for (Header header : record.headers()) {
                if (header.value() != null) {
                    inbound.headers.put(header.key(), new String(header.value(), StandardCharsets.UTF_8));
                }
            }
        }
        return inbound;
    }

    @Override
    public TypeInformation<InboundRecord> getProducedType() {
        return TypeInformation.of(InboundRecord.class);
    }
}
