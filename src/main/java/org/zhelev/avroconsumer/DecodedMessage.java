package org.zhelev.avroconsumer;

import java.time.Instant;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;

/**
 * A record whose Avro payload has been decoded to its JSON form, together with the Kafka metadata it came with.
 */
public final class DecodedMessage {

    private final int schemaId;
    private final String topic;
    private final int partition;
    private final long offset;
    private final String key;
    private final String value;
    private final Map<String, String> headers;
    private final Instant timestamp;

    public DecodedMessage(int schemaId, String topic, int partition, long offset, String key, String value,
                          Map<String, String> headers, Instant timestamp) {
        this.schemaId = schemaId;
        this.topic = topic;
        this.partition = partition;
        this.offset = offset;
        this.key = key;
        this.value = value;
        this.headers = headers == null ? Collections.emptyMap() : Collections.unmodifiableMap(headers);
        this.timestamp = timestamp;
    }

    public int getSchemaId() {
        return schemaId;
    }

    public String getTopic() {
        return topic;
    }

    public int getPartition() {
        return partition;
    }

    public long getOffset() {
        return offset;
    }

    public String getKey() {
        return key;
    }

    /**
     * @return the payload in Avro JSON encoding
     */
    public String getValue() {
        return value;
    }

    /**
     * @return the record headers, empty if the record had none
     */
    public Map<String, String> getHeaders() {
        return headers;
    }

    /**
     * @return the record timestamp, or {@code null} if the broker did not supply one
     */
    public Instant getTimestamp() {
        return timestamp;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DecodedMessage that)) return false;
        return schemaId == that.schemaId && partition == that.partition && offset == that.offset
                && Objects.equals(topic, that.topic) && Objects.equals(key, that.key)
                && Objects.equals(value, that.value) && headers.equals(that.headers)
                && Objects.equals(timestamp, that.timestamp);
    }

    @Override
    public int hashCode() {
        return Objects.hash(schemaId, topic, partition, offset, key, value, headers, timestamp);
    }

    @Override
    public String toString() {
        return "DecodedMessage{schemaId=" + schemaId + ", topic='" + topic + "', partition=" + partition
                + ", offset=" + offset + ", key='" + key + "', value=" + value + ", headers=" + headers
                + ", timestamp=" + timestamp + '}';
    }
}
