package org.zhelev.avroconsumer;

import org.apache.kafka.clients.consumer.ConsumerRecord;

public class RecordDecodeException extends AvroConsumerException {

    public static final int UNKNOWN_SCHEMA_ID = -1;

    private final ConsumerRecord<byte[], byte[]> consumerRecord;

    private final int schemaId;

    public RecordDecodeException(String message, ConsumerRecord<byte[], byte[]> consumerRecord) {
        super(message);
        this.consumerRecord = consumerRecord;
        this.schemaId = UNKNOWN_SCHEMA_ID;
    }

    public RecordDecodeException(String message, ConsumerRecord<byte[], byte[]> consumerRecord, int schemaId) {
        super(message);
        this.consumerRecord = consumerRecord;
        this.schemaId = schemaId;
    }

    public RecordDecodeException(String message, Throwable cause, ConsumerRecord<byte[], byte[]> consumerRecord,
                                 int schemaId) {
        super(message, cause);
        this.consumerRecord = consumerRecord;
        this.schemaId = schemaId;
    }

    public ConsumerRecord<byte[], byte[]> getConsumerRecord() {
        return consumerRecord;
    }

    /**
     * @return the schema id read from the payload, or {@link #UNKNOWN_SCHEMA_ID} when the payload was too short
     */
    public int getSchemaId() {
        return schemaId;
    }

}
