package org.zhelev.avroconsumer.decode;

import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.common.header.Header;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.zhelev.avroconsumer.DecodedMessage;
import org.zhelev.avroconsumer.RecordDecodeException;
import org.zhelev.avroconsumer.SchemaResolutionException;
import org.zhelev.avroconsumer.registry.SchemaCodec;
import org.zhelev.avroconsumer.registry.SchemaResolver;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Decodes records framed the schema registry way:
 * <pre>
 * byte 0     magic byte
 * bytes 1-4  schema id, big endian
 * bytes 5..  avro binary payload
 * </pre>
 * The magic byte is only checked when {@code validateMagicByte} is set.
 */
public class RecordDecoder {

    private static final Logger log = LoggerFactory.getLogger(RecordDecoder.class);

    public static final byte MAGIC_BYTE = 0x0;

    public static final int HEADER_SIZE = 5;

    private final boolean validateMagicByte;

    public RecordDecoder() {
        this(false);
    }

    public RecordDecoder(boolean validateMagicByte) {
        this.validateMagicByte = validateMagicByte;
    }

    /**
     * Decodes one record. Failures of the resolver are rethrown as they are.
     *
     * @throws RecordDecodeException     if the payload is too short, or its body cannot be read or re-encoded
     * @throws SchemaResolutionException if the resolver cannot supply the writer schema
     */
    public DecodedMessage decode(ConsumerRecord<byte[], byte[]> record, SchemaResolver resolver)
            throws RecordDecodeException, SchemaResolutionException {

        byte[] payload = record.value();
        if (payload == null || payload.length < HEADER_SIZE) {
            throw new RecordDecodeException("Payload of " + describe(record) + " has " + (payload == null ? 0 : payload.length)
                    + " bytes, at least " + HEADER_SIZE + " are required", record);
        }

        int schemaId = ByteBuffer.wrap(payload, 1, 4).getInt();
        if (validateMagicByte && payload[0] != MAGIC_BYTE) {
            throw new RecordDecodeException("Unknown magic byte " + payload[0] + " in " + describe(record), record, schemaId);
        }

        SchemaCodec codec = resolver.resolve(schemaId);

        Object nativeValue;
        try {
            nativeValue = codec.binaryToNative(payload, HEADER_SIZE, payload.length - HEADER_SIZE);
        } catch (IOException e) {
            throw new RecordDecodeException("Cannot decode " + describe(record) + " with schema " + schemaId, e, record, schemaId);
        }

        byte[] textual;
        try {
            textual = codec.nativeToTextual(nativeValue);
        } catch (IOException e) {
            throw new RecordDecodeException("Cannot encode " + describe(record) + " as json", e, record, schemaId);
        }

        if (log.isTraceEnabled()) {
            log.trace("Decoded {} with schema {}", describe(record), schemaId);
        }

        return new DecodedMessage(schemaId, record.topic(), record.partition(), record.offset(),
                toKey(record.key()), new String(textual, StandardCharsets.UTF_8),
                toHeaders(record), toTimestamp(record.timestamp()));
    }

    private static String toKey(byte[] key) {
        return key == null ? "" : new String(key, StandardCharsets.UTF_8);
    }

    private static Map<String, String> toHeaders(ConsumerRecord<byte[], byte[]> record) {
        if (record.headers() == null) {
            return null;
        }
        Map<String, String> headers = new LinkedHashMap<>();
        for (Header header : record.headers()) {
            byte[] value = header.value();
            headers.put(header.key(), value == null ? "" : new String(value, StandardCharsets.UTF_8));
        }
        return headers.isEmpty() ? null : headers;
    }

    private static Instant toTimestamp(long timestamp) {
        return timestamp == ConsumerRecord.NO_TIMESTAMP ? null : Instant.ofEpochMilli(timestamp);
    }

    static String describe(ConsumerRecord<?, ?> record) {
        return record.topic() + "-" + record.partition() + "@" + record.offset();
    }
}
