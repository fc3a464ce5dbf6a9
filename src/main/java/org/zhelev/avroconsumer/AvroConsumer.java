package org.zhelev.avroconsumer;

import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.zhelev.avroconsumer.decode.RecordDecoder;
import org.zhelev.avroconsumer.registry.CachedSchemaRegistryClient;
import org.zhelev.avroconsumer.registry.SchemaCodec;
import org.zhelev.avroconsumer.registry.SchemaResolver;
import org.zhelev.avroconsumer.transport.EventChannel;
import org.zhelev.avroconsumer.transport.GroupNotification;
import org.zhelev.avroconsumer.transport.KafkaRecordTransport;
import org.zhelev.avroconsumer.transport.RecordTransport;
import org.zhelev.avroconsumer.utils.NamedThreadFactory;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * Consumes schema registry framed Avro records from one topic and hands them to {@link ConsumerCallbacks} as JSON.
 *
 * <p>{@link #consume()} runs the event loop on the calling thread: every record is decoded, passed to
 * {@code onDataReceived} (or {@code onError} when decoding fails) and then acknowledged, whatever the outcome, so a
 * malformed record never blocks its partition. Transport errors and rebalance notifications are drained by two
 * background threads; they stop when the transport is closed, so always {@link #close()} the consumer.
 */
public class AvroConsumer implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(AvroConsumer.class);

    public enum State {
        CREATED, RUNNING, DRAINING, TERMINATED, CLOSED
    }

    private final RecordTransport transport;

    private final SchemaResolver schemaResolver;

    private final ConsumerCallbacks callbacks;

    private final AvroConsumerConfig config;

    private final RecordDecoder recordDecoder;

    private final ShutdownSignal shutdownSignal = new ShutdownSignal();

    private final ExecutorService executorService;

    private final AtomicReference<State> state = new AtomicReference<>(State.CREATED);

    private final CountDownLatch loopStopped = new CountDownLatch(1);

    private volatile Thread loopThread;

    public AvroConsumer(RecordTransport transport, SchemaResolver schemaResolver, ConsumerCallbacks callbacks,
                        AvroConsumerConfig config) {
        this.transport = transport;
        this.schemaResolver = schemaResolver;
        this.callbacks = callbacks != null ? callbacks : ConsumerCallbacks.none();
        this.config = config;
        this.recordDecoder = new RecordDecoder(config.isValidateMagicByte());
        this.executorService = Executors.newFixedThreadPool(2, NamedThreadFactory.newThreadFactory(
                "avro-consumer-events", "-%d", true,
                (t, e) -> log.error("Error in Thread: " + t.getName(), e)));

        if (config.isReturnErrors() && this.callbacks.getOnError().isEmpty()) {
            log.warn("Errors are returned but no error callback is registered, errors will only be logged");
        }
    }

    /**
     * Creates a consumer with {@link AvroConsumerConfig#defaultConfig()}.
     */
    public static AvroConsumer create(List<String> kafkaServers, List<String> schemaRegistryServers, String topic,
                                      String groupId, ConsumerCallbacks callbacks) {
        return create(kafkaServers, schemaRegistryServers, topic, groupId, callbacks, AvroConsumerConfig.defaultConfig());
    }

    /**
     * Connects to the cluster as a member of {@code groupId} subscribed to {@code topic}, and resolves schemas
     * through the given registry servers.
     *
     * @throws ConsumerConnectionException if the cluster or the registry cannot be reached
     */
    public static AvroConsumer create(List<String> kafkaServers, List<String> schemaRegistryServers, String topic,
                                      String groupId, ConsumerCallbacks callbacks, AvroConsumerConfig config) {
        CachedSchemaRegistryClient schemaRegistryClient = new CachedSchemaRegistryClient(schemaRegistryServers, config);
        KafkaRecordTransport transport = KafkaRecordTransport.connect(kafkaServers, groupId, List.of(topic), config);
        return new AvroConsumer(transport, schemaRegistryClient, callbacks, config);
    }

    public SchemaCodec getSchema(int schemaId) throws SchemaResolutionException {
        return schemaResolver.resolve(schemaId);
    }

    public State getState() {
        return state.get();
    }

    /**
     * Runs the event loop until {@link #shutdown()} or {@link #close()} is called or the thread is interrupted.
     */
    public void consume() {
        consume(shutdownSignal);
    }

    /**
     * Runs the event loop until {@code signal} fires, {@link #shutdown()} or {@link #close()} is called, or the
     * thread is interrupted. The record being processed when shutdown is requested is finished and acknowledged;
     * no further record is taken, even one that arrives while the loop is waiting.
     *
     * @throws IllegalStateException if the consumer already ran or is closed
     */
    public void consume(ShutdownSignal signal) {
        if (!state.compareAndSet(State.CREATED, State.RUNNING)) {
            throw new IllegalStateException("Cannot consume, consumer is " + state.get());
        }
        loopThread = Thread.currentThread();

        long processed = 0;
        try {
            transport.start();
            startEventDrains();
            log.info("Consuming records");

            EventChannel<ConsumerRecord<byte[], byte[]>> records = transport.records();
            // a stop request must not wait out selectTimeout
            signal.onTrigger(records::wakeUp);
            shutdownSignal.onTrigger(records::wakeUp);

            while (!isShutdownRequested(signal)) {
                ConsumerRecord<byte[], byte[]> record = records.receive(config.getSelectTimeout(),
                        () -> isShutdownRequested(signal));
                if (record == null) {
                    if (records.isDrained()) {
                        log.warn("Record channel closed by the transport");
                        break;
                    }
                    continue;
                }
                process(record);
                processed++;
            }
        } catch (InterruptedException e) {
            log.warn("Interrupted while waiting for records");
            Thread.currentThread().interrupt();
        } finally {
            state.compareAndSet(State.RUNNING, State.DRAINING);
            log.info("Stopped consuming after {} records", processed);
            state.compareAndSet(State.DRAINING, State.TERMINATED);
            loopStopped.countDown();
        }
    }

    private boolean isShutdownRequested(ShutdownSignal signal) {
        return signal.isTriggered() || shutdownSignal.isTriggered() || Thread.currentThread().isInterrupted();
    }

    /**
     * Requests the event loop to stop. Does not close the consumer.
     */
    public void shutdown() {
        shutdownSignal.trigger();
    }

    void process(ConsumerRecord<byte[], byte[]> record) {
        DecodedMessage message = null;
        try {
            message = recordDecoder.decode(record, schemaResolver);
        } catch (RuntimeException e) {
            if (log.isDebugEnabled()) {
                log.debug("Cannot decode {}-{}@{}: {}", record.topic(), record.partition(), record.offset(), e.getMessage());
            }
            deliverError(e);
        }

        if (message != null) {
            deliverData(message);
        }

        transport.acknowledge(record);
    }

    private void deliverData(DecodedMessage message) {
        Optional<Consumer<DecodedMessage>> handler = callbacks.getOnDataReceived();
        if (handler.isEmpty()) {
            log.trace("No data callback, dropping {}", message);
            return;
        }
        try {
            handler.get().accept(message);
        } catch (RuntimeException e) {
            log.error("Data callback failed for {}-{}@{}", message.getTopic(), message.getPartition(), message.getOffset(), e);
            deliverError(e);
        }
    }

    private void deliverError(Throwable error) {
        Optional<Consumer<Throwable>> handler = callbacks.getOnError();
        if (handler.isEmpty()) {
            log.warn("No error callback, dropping: {}", error.getMessage());
            return;
        }
        try {
            handler.get().accept(error);
        } catch (RuntimeException e) {
            log.error("Error callback failed", e);
        }
    }

    private void deliverNotification(GroupNotification notification) {
        Optional<Consumer<GroupNotification>> handler = callbacks.getOnNotification();
        if (handler.isEmpty()) {
            log.debug("No notification callback, dropping {}", notification);
            return;
        }
        try {
            handler.get().accept(notification);
        } catch (RuntimeException e) {
            log.error("Notification callback failed", e);
        }
    }

    private void startEventDrains() {
        if (config.isReturnErrors()) {
            executorService.execute(() -> drain(transport.errors(), this::deliverError));
        }
        if (config.isReturnNotifications()) {
            executorService.execute(() -> drain(transport.notifications(), this::deliverNotification));
        }
    }

    // runs until the transport closes the channel, not until shutdown
    private <T> void drain(EventChannel<T> channel, Consumer<T> handler) {
        try {
            while (!channel.isDrained()) {
                T event = channel.receive(config.getSelectTimeout());
                if (event != null) {
                    handler.accept(event);
                }
            }
            log.debug("Channel {} closed", channel.getName());
        } catch (InterruptedException e) {
            log.warn("Interrupted while draining {}", channel.getName());
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Stops the event loop if it is running and waits up to {@code closeTimeout} for it to finish the record in
     * flight, then closes the transport and waits for the error and notification threads to finish. Calling it again
     * has no effect.
     *
     * @throws TransportException if the transport failed to close cleanly
     */
    @Override
    public void close() throws TransportException {
        State previous = state.getAndSet(State.CLOSED);
        if (previous == State.CLOSED) {
            return;
        }
        shutdownSignal.trigger();
        log.warn("Closing consumer");
        if (previous == State.RUNNING || previous == State.DRAINING) {
            awaitLoop();
        }
        try {
            transport.close();
        } finally {
            executorService.shutdown();
            try {
                if (!executorService.awaitTermination(config.getCloseTimeout().toMillis(), TimeUnit.MILLISECONDS)) {
                    log.warn("Event threads did not stop within {}", config.getCloseTimeout());
                    executorService.shutdownNow();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                executorService.shutdownNow();
            }
        }
    }

    // the record in flight is finished and acknowledged before the transport commits and closes
    private void awaitLoop() {
        if (Thread.currentThread() == loopThread) {
            return;
        }
        try {
            if (!loopStopped.await(config.getCloseTimeout().toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Event loop did not stop within {}", config.getCloseTimeout());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
