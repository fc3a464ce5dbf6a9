package org.zhelev.avroconsumer.transport;

import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.MockConsumer;
import org.apache.kafka.clients.consumer.OffsetAndMetadata;
import org.apache.kafka.clients.consumer.OffsetCommitCallback;
import org.apache.kafka.clients.consumer.OffsetResetStrategy;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.TopicPartition;
import org.apache.kafka.common.serialization.ByteArrayDeserializer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.zhelev.avroconsumer.AvroConsumerConfig;
import org.zhelev.avroconsumer.ConsumerConnectionException;
import org.zhelev.avroconsumer.InitialOffset;
import org.zhelev.avroconsumer.TestRecords;
import org.zhelev.avroconsumer.TransportException;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.concurrent.ConcurrentHashMap;

import static org.apache.kafka.clients.CommonClientConfigs.BOOTSTRAP_SERVERS_CONFIG;
import static org.apache.kafka.clients.consumer.ConsumerConfig.*;
import static org.awaitility.Awaitility.await;

public class KafkaRecordTransportTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(5);

    private static final TopicPartition PARTITION_0 = new TopicPartition(TestRecords.TOPIC, 0);
    private static final TopicPartition PARTITION_1 = new TopicPartition(TestRecords.TOPIC, 1);

    /**
     * Keeps every commit, the mock itself forgets them on re-subscribe.
     */
    static class RecordingMockConsumer extends MockConsumer<byte[], byte[]> {

        final Map<TopicPartition, OffsetAndMetadata> commits = new ConcurrentHashMap<>();
        final Map<TopicPartition, OffsetAndMetadata> syncCommits = new ConcurrentHashMap<>();

        RecordingMockConsumer() {
            super(OffsetResetStrategy.EARLIEST);
        }

        @Override
        public synchronized void commitSync(Map<TopicPartition, OffsetAndMetadata> offsets) {
            syncCommits.putAll(offsets);
            commits.putAll(offsets);
            super.commitSync(offsets);
        }

        @Override
        public synchronized void commitAsync(Map<TopicPartition, OffsetAndMetadata> offsets,
                                             OffsetCommitCallback callback) {
            commits.putAll(offsets);
            super.commitAsync(offsets, callback);
        }
    }

    private RecordingMockConsumer consumer;

    private AvroConsumerConfig config;

    private KafkaRecordTransport transport;

    @BeforeEach
    void setUp() {
        consumer = new RecordingMockConsumer();
        config = AvroConsumerConfig.defaultConfig();
        config.setPollDuration(Duration.ofMillis(10));
        config.setCommitInterval(Duration.ZERO);
        config.setCloseTimeout(Duration.ofSeconds(1));
    }

    @AfterEach
    void tearDown() {
        if (transport != null) {
            transport.close();
        }
    }

    private KafkaRecordTransport newTransport() {
        transport = new KafkaRecordTransport(consumer, List.of(TestRecords.TOPIC), config);
        return transport;
    }

    @SafeVarargs
    private final void assignWithRecords(ConsumerRecord<byte[], byte[]>... records) {
        consumer.schedulePollTask(() -> {
            consumer.rebalance(List.of(PARTITION_0));
            consumer.updateBeginningOffsets(Map.of(PARTITION_0, 0L));
            for (ConsumerRecord<byte[], byte[]> record : records) {
                consumer.addRecord(record);
            }
        });
    }

    @Test
    void acknowledgedOffsetsAreCommitted() throws InterruptedException {
        assignWithRecords(TestRecords.point(0), TestRecords.point(1));
        newTransport().start();

        ConsumerRecord<byte[], byte[]> first = transport.records().receive(TIMEOUT);
        ConsumerRecord<byte[], byte[]> second = transport.records().receive(TIMEOUT);
        Assertions.assertEquals(0, first.offset());
        Assertions.assertEquals(1, second.offset());

        transport.acknowledge(first);
        await().atMost(TIMEOUT).until(() -> consumer.commits.containsKey(PARTITION_0));
        Assertions.assertEquals(1, consumer.commits.get(PARTITION_0).offset());

        transport.acknowledge(second);
        await().atMost(TIMEOUT).until(() -> consumer.commits.get(PARTITION_0).offset() == 2);

        transport.close();
        Assertions.assertTrue(consumer.closed());
        Assertions.assertTrue(transport.records().isDrained());
        Assertions.assertTrue(transport.errors().isClosed());
        Assertions.assertTrue(transport.notifications().isClosed());
    }

    @Test
    void olderAcknowledgmentDoesNotMoveTheMarkBack() {
        consumer.assign(List.of(PARTITION_0));
        newTransport();

        transport.acknowledge(TestRecords.point(5));
        transport.acknowledge(TestRecords.point(3));
        transport.close();

        Assertions.assertEquals(6, consumer.syncCommits.get(PARTITION_0).offset());
    }

    @Test
    void pollFailuresReachTheErrorChannel() throws InterruptedException {
        consumer.setPollException(new KafkaException("broker gone"));
        newTransport().start();

        TransportException error = transport.errors().receive(TIMEOUT);

        Assertions.assertNotNull(error);
        Assertions.assertEquals("broker gone", error.getCause().getMessage());
    }

    @Test
    void pollFailuresAreOnlyLoggedWhenErrorsAreNotReturned() throws InterruptedException {
        config.setReturnErrors(false);
        consumer.setPollException(new KafkaException("broker gone"));
        assignWithRecords(TestRecords.point(0));
        newTransport().start();

        Assertions.assertNotNull(transport.records().receive(TIMEOUT));
        Assertions.assertEquals(0, transport.errors().size());
    }

    @Test
    void rebalanceCallbacksBecomeNotifications() throws InterruptedException {
        consumer.assign(List.of(PARTITION_0, PARTITION_1));
        newTransport();
        transport.acknowledge(TestRecords.point(4));

        transport.onPartitionsRevoked(List.of(PARTITION_0));
        GroupNotification revoked = transport.notifications().receive(TIMEOUT);
        Assertions.assertEquals(GroupNotification.Type.REBALANCE_START, revoked.getType());
        Assertions.assertEquals(Map.of(TestRecords.TOPIC, List.of(0)), revoked.getReleased());
        Assertions.assertEquals(Map.of(TestRecords.TOPIC, List.of(1)), revoked.getCurrent());
        Assertions.assertEquals(5, consumer.syncCommits.get(PARTITION_0).offset());

        transport.onPartitionsAssigned(List.of(PARTITION_0));
        GroupNotification assigned = transport.notifications().receive(TIMEOUT);
        Assertions.assertEquals(GroupNotification.Type.REBALANCE_OK, assigned.getType());
        Assertions.assertEquals(Map.of(TestRecords.TOPIC, List.of(0)), assigned.getClaimed());
        Assertions.assertEquals(Map.of(TestRecords.TOPIC, List.of(0, 1)), assigned.getCurrent());

        transport.acknowledge(TestRecords.record(1, 9, new byte[]{0, 0, 0, 0, 7, 2}));
        transport.onPartitionsLost(List.of(PARTITION_1));
        GroupNotification lost = transport.notifications().receive(TIMEOUT);
        Assertions.assertEquals(GroupNotification.Type.REBALANCE_ERROR, lost.getType());
        Assertions.assertEquals(Map.of(TestRecords.TOPIC, List.of(1)), lost.getReleased());

        transport.close();
        Assertions.assertFalse(consumer.syncCommits.containsKey(PARTITION_1));
    }

    @Test
    void notificationsAreNotQueuedWhenDisabled() {
        config.setReturnNotifications(false);
        consumer.assign(List.of(PARTITION_0));
        newTransport();

        transport.onPartitionsAssigned(List.of(PARTITION_0));

        Assertions.assertEquals(0, transport.notifications().size());
    }

    @Test
    void closeWithoutStartClosesTheConsumer() {
        newTransport().close();

        Assertions.assertTrue(consumer.closed());
        Assertions.assertTrue(transport.records().isDrained());
        Assertions.assertTrue(transport.errors().isDrained());
        Assertions.assertThrows(IllegalStateException.class, transport::start);
        transport.close();
    }

    @Test
    void fullRecordChannelPausesAssignedPartitions() throws InterruptedException {
        config.setChannelBufferSize(1);
        assignWithRecords(TestRecords.point(0), TestRecords.point(1), TestRecords.point(2));
        newTransport().start();

        await().atMost(TIMEOUT).until(() -> consumer.paused().contains(PARTITION_0));

        List<Long> offsets = new ArrayList<>();
        for (int i = 0; i < 3; i++) {
            offsets.add(transport.records().receive(TIMEOUT).offset());
        }
        Assertions.assertEquals(List.of(0L, 1L, 2L), offsets);

        await().atMost(TIMEOUT).until(() -> consumer.paused().isEmpty());
    }

    @Test
    void consumerPropertiesForceByteArraysAndManualCommits() {
        Properties overrides = new Properties();
        overrides.put(ENABLE_AUTO_COMMIT_CONFIG, "true");
        overrides.put(MAX_POLL_RECORDS_CONFIG, "10");
        config.setConsumerProperties(overrides);
        config.setInitialOffset(InitialOffset.COMMITTED);
        config.setClientId("avro-test");

        Properties properties = KafkaRecordTransport.consumerProperties(List.of("a:9092", "b:9092"), "group-1", config);

        Assertions.assertEquals("a:9092,b:9092", properties.get(BOOTSTRAP_SERVERS_CONFIG));
        Assertions.assertEquals("group-1", properties.get(GROUP_ID_CONFIG));
        Assertions.assertEquals("false", properties.get(ENABLE_AUTO_COMMIT_CONFIG));
        Assertions.assertEquals("none", properties.get(AUTO_OFFSET_RESET_CONFIG));
        Assertions.assertEquals("10", properties.get(MAX_POLL_RECORDS_CONFIG));
        Assertions.assertEquals("avro-test", properties.get(CLIENT_ID_CONFIG));
        Assertions.assertEquals(ByteArrayDeserializer.class.getCanonicalName(), properties.get(VALUE_DESERIALIZER_CLASS_CONFIG));
    }

    @Test
    void invalidBootstrapServersFailToConnect() {
        Assertions.assertThrows(ConsumerConnectionException.class,
                () -> KafkaRecordTransport.connect(List.of("localhost:notaport"), "group-1", List.of(TestRecords.TOPIC), config));
    }
}
