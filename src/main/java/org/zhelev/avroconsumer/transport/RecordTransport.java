package org.zhelev.avroconsumer.transport;

import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.zhelev.avroconsumer.TransportException;

/**
 * The consumer group client as seen by the event loop: three independent event channels, offset acknowledgment
 * and close. Closing the transport closes all three channels.
 */
public interface RecordTransport extends AutoCloseable {

    /**
     * Starts delivering records. Calling it again has no effect.
     */
    void start();

    EventChannel<ConsumerRecord<byte[], byte[]>> records();

    EventChannel<TransportException> errors();

    EventChannel<GroupNotification> notifications();

    /**
     * Marks the record's position as processed; it will not be delivered again to this group after a restart.
     */
    void acknowledge(ConsumerRecord<byte[], byte[]> record);

    /**
     * Releases the connection. Safe to call more than once.
     *
     * @throws TransportException if the underlying client failed to close cleanly
     */
    @Override
    void close() throws TransportException;

}
