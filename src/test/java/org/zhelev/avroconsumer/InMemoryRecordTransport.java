package org.zhelev.avroconsumer;

import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.zhelev.avroconsumer.transport.EventChannel;
import org.zhelev.avroconsumer.transport.GroupNotification;
import org.zhelev.avroconsumer.transport.RecordTransport;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

class InMemoryRecordTransport implements RecordTransport {

    private final EventChannel<ConsumerRecord<byte[], byte[]>> records = new EventChannel<>("records", 1024);
    private final EventChannel<TransportException> errors = new EventChannel<>("errors", 1024);
    private final EventChannel<GroupNotification> notifications = new EventChannel<>("notifications", 1024);

    final List<ConsumerRecord<byte[], byte[]>> acknowledged = new CopyOnWriteArrayList<>();
    final AtomicInteger closeCount = new AtomicInteger();
    final List<String> events = new CopyOnWriteArrayList<>();
    volatile boolean started = false;
    volatile RuntimeException startFailure;

    void publish(ConsumerRecord<byte[], byte[]> record) {
        if (!records.trySend(record)) {
            throw new IllegalStateException("records channel rejected " + record);
        }
    }

    List<Long> acknowledgedOffsets() {
        return acknowledged.stream().map(ConsumerRecord::offset).toList();
    }

    @Override
    public void start() {
        if (startFailure != null) {
            throw startFailure;
        }
        started = true;
    }

    @Override
    public EventChannel<ConsumerRecord<byte[], byte[]>> records() {
        return records;
    }

    @Override
    public EventChannel<TransportException> errors() {
        return errors;
    }

    @Override
    public EventChannel<GroupNotification> notifications() {
        return notifications;
    }

    @Override
    public void acknowledge(ConsumerRecord<byte[], byte[]> record) {
        acknowledged.add(record);
        events.add("ack-" + record.offset());
    }

    @Override
    public void close() {
        closeCount.incrementAndGet();
        events.add("close");
        records.close();
        errors.close();
        notifications.close();
    }
}
