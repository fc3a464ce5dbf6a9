package org.zhelev.avroconsumer.transport;

import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.ConsumerRebalanceListener;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.ConsumerRecords;
import org.apache.kafka.clients.consumer.KafkaConsumer;
import org.apache.kafka.clients.consumer.OffsetAndMetadata;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.TopicPartition;
import org.apache.kafka.common.errors.InterruptException;
import org.apache.kafka.common.serialization.ByteArrayDeserializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.zhelev.avroconsumer.AvroConsumerConfig;
import org.zhelev.avroconsumer.ConsumerConnectionException;
import org.zhelev.avroconsumer.TransportException;
import org.zhelev.avroconsumer.utils.NamedThreadFactory;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

import static org.apache.kafka.clients.CommonClientConfigs.BOOTSTRAP_SERVERS_CONFIG;
import static org.apache.kafka.clients.consumer.ConsumerConfig.*;

/**
 * {@link RecordTransport} backed by a Kafka consumer group member.
 *
 * <p>The {@link Consumer} is not thread safe, so one poll thread owns it: it polls, feeds the record channel,
 * reports poll and commit failures on the error channel, turns rebalance callbacks into {@link GroupNotification}s
 * and commits acknowledged offsets. {@link #acknowledge} only records {@code offset + 1} per partition; those marks
 * are committed asynchronously every {@code commitInterval}, synchronously when partitions are revoked and on close.
 *
 * <p>When the record channel is full the assigned partitions are paused, so the group membership stays alive while
 * the application catches up.
 */
public class KafkaRecordTransport implements RecordTransport, ConsumerRebalanceListener {

    private static final Logger log = LoggerFactory.getLogger(KafkaRecordTransport.class);

    private final Consumer<byte[], byte[]> consumer;

    private final List<String> topics;

    private final AvroConsumerConfig config;

    private final EventChannel<ConsumerRecord<byte[], byte[]>> records;

    private final EventChannel<TransportException> errors;

    private final EventChannel<GroupNotification> notifications;

    private final Map<TopicPartition, OffsetAndMetadata> acknowledged = new ConcurrentHashMap<>();

    // poll thread only
    private final Deque<ConsumerRecord<byte[], byte[]>> pending = new ArrayDeque<>();

    private long lastCommit;

    private volatile boolean running = false;

    private volatile TransportException closeFailure;

    private boolean started = false;

    private boolean closed = false;

    private Thread pollThread;

    public KafkaRecordTransport(Consumer<byte[], byte[]> consumer, List<String> topics, AvroConsumerConfig config) {
        this.consumer = consumer;
        this.topics = List.copyOf(topics);
        this.config = config;
        this.records = new EventChannel<>("records", config.getChannelBufferSize());
        this.errors = new EventChannel<>("errors", config.getChannelBufferSize());
        this.notifications = new EventChannel<>("notifications", config.getChannelBufferSize());
    }

    /**
     * Creates a consumer for {@code groupId} and checks that the cluster answers metadata requests for every topic
     * within {@code connectTimeout}.
     *
     * @throws ConsumerConnectionException if the consumer cannot be created or the cluster cannot be reached
     */
    public static KafkaRecordTransport connect(List<String> servers, String groupId, List<String> topics,
                                               AvroConsumerConfig config) {
        Properties properties = consumerProperties(servers, groupId, config);

        Consumer<byte[], byte[]> consumer;
        try {
            consumer = new KafkaConsumer<>(properties);
        } catch (KafkaException e) {
            throw new ConsumerConnectionException("Cannot create kafka consumer for " + servers, e);
        }

        try {
            for (String topic : topics) {
                consumer.partitionsFor(topic, config.getConnectTimeout());
            }
        } catch (KafkaException e) {
            try {
                consumer.close(Duration.ZERO);
            } catch (KafkaException closeException) {
                log.warn(closeException.getMessage(), closeException);
            }
            throw new ConsumerConnectionException("Kafka cluster " + servers + " unreachable", e);
        }

        log.info("Connected to {} as group {} for topics {}", servers, groupId, topics);
        return new KafkaRecordTransport(consumer, topics, config);
    }

    static Properties consumerProperties(List<String> servers, String groupId, AvroConsumerConfig config) {
        Properties properties = new Properties();
        properties.putAll(config.getConsumerProperties());
        properties.put(BOOTSTRAP_SERVERS_CONFIG, String.join(",", servers));
        properties.put(GROUP_ID_CONFIG, groupId);
        properties.put(KEY_DESERIALIZER_CLASS_CONFIG, ByteArrayDeserializer.class.getCanonicalName());
        properties.put(VALUE_DESERIALIZER_CLASS_CONFIG, ByteArrayDeserializer.class.getCanonicalName());
        properties.put(ENABLE_AUTO_COMMIT_CONFIG, "false"); // offsets are committed from acknowledgments
        properties.put(AUTO_OFFSET_RESET_CONFIG, config.getInitialOffset().getAutoOffsetReset());
        if (config.getClientId() != null) {
            properties.put(CLIENT_ID_CONFIG, config.getClientId());
        }
        return properties;
    }

    @Override
    public synchronized void start() {
        if (closed) {
            throw new IllegalStateException("Transport for " + topics + " is closed");
        }
        if (started) {
            return;
        }
        started = true;
        running = true;
        pollThread = NamedThreadFactory.newThreadFactory("kafka-poll-" + String.join(",", topics), "-%d", true,
                (t, e) -> log.error("Error in Thread: " + t.getName(), e)).newThread(this::pollLoop);
        pollThread.start();
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
        TopicPartition partition = new TopicPartition(record.topic(), record.partition());
        acknowledged.merge(partition, new OffsetAndMetadata(record.offset() + 1),
                (previous, next) -> next.offset() > previous.offset() ? next : previous);
    }

    private void pollLoop() {
        try {
            consumer.subscribe(topics, this);
            lastCommit = System.nanoTime();

            while (running) {
                try {
                    ConsumerRecords<byte[], byte[]> polled = consumer.poll(config.getPollDuration());
                    polled.forEach(pending::addLast);
                    dispatchPending();
                    applyBackPressure();
                    commitIfDue();
                } catch (InterruptException e) {
                    log.warn("Poll thread for {} interrupted", topics);
                    running = false;
                } catch (KafkaException e) {
                    reportError(new TransportException("Polling " + topics + " failed", e));
                    pauseAfterError();
                }
            }
        } catch (InterruptedException e) {
            log.warn("Poll thread for {} interrupted", topics);
            Thread.currentThread().interrupt();
        } catch (RuntimeException e) {
            log.error(e.getMessage(), e);
            reportError(new TransportException("Transport for " + topics + " stopped", e));
        } finally {
            running = false;
            shutdownConsumer();
        }
    }

    private void dispatchPending() throws InterruptedException {
        ConsumerRecord<byte[], byte[]> record;
        while (running && (record = pending.peekFirst()) != null) {
            if (!records.send(record, config.getPollDuration())) {
                return;
            }
            pending.pollFirst();
        }
    }

    private void applyBackPressure() {
        if (!pending.isEmpty()) {
            Set<TopicPartition> assignment = consumer.assignment();
            if (!consumer.paused().containsAll(assignment)) {
                if (log.isDebugEnabled()) {
                    log.debug("Record channel full ({} pending), pausing {}", pending.size(), assignment);
                }
                consumer.pause(assignment);
            }
        } else if (!consumer.paused().isEmpty()) {
            log.debug("Record channel drained, resuming {}", consumer.paused());
            consumer.resume(consumer.paused());
        }
    }

    private void pauseAfterError() {
        try {
            TimeUnit.NANOSECONDS.sleep(config.getPollDuration().toNanos());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            running = false;
        }
    }

    private void commitIfDue() {
        if (acknowledged.isEmpty() || System.nanoTime() - lastCommit < config.getCommitInterval().toNanos()) {
            return;
        }
        lastCommit = System.nanoTime();

        Set<TopicPartition> assignment = consumer.assignment();
        acknowledged.keySet().removeIf(partition -> {
            boolean unassigned = !assignment.contains(partition);
            if (unassigned && log.isDebugEnabled()) {
                log.debug("Dropping acknowledgment for unassigned partition {}", partition);
            }
            return unassigned;
        });

        Map<TopicPartition, OffsetAndMetadata> offsets = takeAcknowledged(assignment);
        if (offsets.isEmpty()) {
            return;
        }
        consumer.commitAsync(offsets, (committed, err) -> {
            if (err == null) {
                log.debug("Successfully committed => {}", committed);
            } else {
                log.error("Error on commit {}", offsets);
                reportError(new TransportException("Offset commit failed for " + offsets, err));
            }
        });
    }

    private Map<TopicPartition, OffsetAndMetadata> takeAcknowledged(Collection<TopicPartition> partitions) {
        Map<TopicPartition, OffsetAndMetadata> offsets = new HashMap<>();
        for (TopicPartition partition : partitions) {
            OffsetAndMetadata offset = acknowledged.get(partition);
            // a newer acknowledgment that raced in stays for the next commit
            if (offset != null && acknowledged.remove(partition, offset)) {
                offsets.put(partition, offset);
            }
        }
        return offsets;
    }

    private void commitSync(Collection<TopicPartition> partitions, String reason) {
        Map<TopicPartition, OffsetAndMetadata> offsets = takeAcknowledged(partitions);
        if (offsets.isEmpty()) {
            return;
        }
        try {
            consumer.commitSync(offsets);
            log.info("Committed {} on {}", offsets, reason);
        } catch (KafkaException e) {
            log.error("Error on commit {} on {}", offsets, reason);
            reportError(new TransportException("Offset commit failed for " + offsets + " on " + reason, e));
        }
    }

    @Override
    public void onPartitionsRevoked(Collection<TopicPartition> partitions) {
        log.warn("Partitions revoked: {}", partitions);
        dropPending(partitions);
        commitSync(partitions, "revoke");

        Set<TopicPartition> current = new HashSet<>(consumer.assignment());
        current.removeAll(partitions);
        notifyGroup(GroupNotification.of(GroupNotification.Type.REBALANCE_START, List.of(), partitions, current));
    }

    @Override
    public void onPartitionsAssigned(Collection<TopicPartition> partitions) {
        log.warn("Got assigned some new partitions: {}", partitions);
        notifyGroup(GroupNotification.of(GroupNotification.Type.REBALANCE_OK, partitions, List.of(), consumer.assignment()));
    }

    @Override
    public void onPartitionsLost(Collection<TopicPartition> partitions) {
        log.warn("Partitions lost: {}", partitions);
        dropPending(partitions);
        acknowledged.keySet().removeAll(partitions);

        Set<TopicPartition> current = new HashSet<>(consumer.assignment());
        current.removeAll(partitions);
        notifyGroup(GroupNotification.of(GroupNotification.Type.REBALANCE_ERROR, List.of(), partitions, current));
    }

    private void dropPending(Collection<TopicPartition> partitions) {
        pending.removeIf(record -> partitions.contains(new TopicPartition(record.topic(), record.partition())));
    }

    private void reportError(TransportException error) {
        if (!config.isReturnErrors()) {
            log.error(error.getMessage(), error.getCause());
            return;
        }
        if (!errors.trySend(error)) {
            log.warn("Error channel full or closed, dropping: {}", error.getMessage());
        }
    }

    private void notifyGroup(GroupNotification notification) {
        if (!config.isReturnNotifications()) {
            log.debug("{}", notification);
            return;
        }
        if (!notifications.trySend(notification)) {
            log.warn("Notification channel full or closed, dropping: {}", notification);
        }
    }

    private void shutdownConsumer() {
        try {
            commitSync(consumer.assignment(), "close");
            consumer.close(config.getCloseTimeout());
            log.info("Closed kafka consumer for {}", topics);
        } catch (KafkaException e) {
            log.error(e.getMessage(), e);
            closeFailure = new TransportException("Closing kafka consumer for " + topics + " failed", e);
        } finally {
            records.close();
            errors.close();
            notifications.close();
        }
    }

    @Override
    public void close() throws TransportException {
        synchronized (this) {
            if (closed) {
                return;
            }
            closed = true;
            running = false;
        }

        if (pollThread != null) {
            try {
                pollThread.join(config.getCloseTimeout().plus(config.getPollDuration()).toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            if (pollThread.isAlive()) {
                log.warn("Poll thread {} did not stop within {}", pollThread.getName(), config.getCloseTimeout());
            }
        } else {
            shutdownConsumer();
        }

        if (closeFailure != null) {
            throw closeFailure;
        }
    }
}
