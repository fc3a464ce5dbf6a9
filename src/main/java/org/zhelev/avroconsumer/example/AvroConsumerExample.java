package org.zhelev.avroconsumer.example;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.zhelev.avroconsumer.AvroConsumer;
import org.zhelev.avroconsumer.AvroConsumerConfig;
import org.zhelev.avroconsumer.ConsumerCallbacks;
import org.zhelev.avroconsumer.ShutdownSignal;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

public class AvroConsumerExample {

    private static final Logger log = LoggerFactory.getLogger(AvroConsumerExample.class);

    private static final List<String> KAFKA_SERVERS = List.of("192.168.1.170:29092", "192.168.1.170:39092", "192.168.1.170:49092");
    private static final List<String> SCHEMA_REGISTRY_SERVERS = List.of("http://192.168.1.170:8081");
    private static final String TOPIC = "idmusers";
    private static final String CONSUMER_GROUP_ID = "avro-consumer-example";

    public static void main(String[] args) {

        ConsumerCallbacks callbacks = ConsumerCallbacks.builder()
                .onDataReceived(message -> log.info("Received schema {} partition {} offset {} => {}",
                        message.getSchemaId(), message.getPartition(), message.getOffset(), message.getValue()))
                .onError(error -> log.error(error.getMessage(), error))
                .onNotification(notification -> log.info("Rebalanced: {}", notification))
                .build();

        AvroConsumerConfig config = AvroConsumerConfig.defaultConfig();
        config.setPollDuration(Duration.ofMillis(100));

        ShutdownSignal shutdownSignal = new ShutdownSignal();
        CountDownLatch stopped = new CountDownLatch(1);

        // SIGINT / SIGTERM run the shutdown hooks; keep the JVM alive until offsets are committed
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            shutdownSignal.trigger();
            try {
                if (!stopped.await(30, TimeUnit.SECONDS)) {
                    log.warn("Consumer did not stop in time");
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }, "avro-consumer-shutdown"));

        try (AvroConsumer consumer = AvroConsumer.create(KAFKA_SERVERS, SCHEMA_REGISTRY_SERVERS, TOPIC,
                CONSUMER_GROUP_ID, callbacks, config)) {
            consumer.consume(shutdownSignal);
        } finally {
            stopped.countDown();
        }
    }

}
