package org.zhelev.avroconsumer.transport;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

public class EventChannelTest {

    @Test
    void fullChannelRejectsTrySend() throws InterruptedException {
        EventChannel<String> channel = new EventChannel<>("test", 1);

        Assertions.assertTrue(channel.trySend("a"));
        Assertions.assertFalse(channel.trySend("b"));
        Assertions.assertFalse(channel.send("b", Duration.ofMillis(10)));
        Assertions.assertEquals("a", channel.receive(Duration.ZERO));
    }

    @Test
    void closedChannelHandsOutWhatItHolds() throws InterruptedException {
        EventChannel<String> channel = new EventChannel<>("test", 4);
        channel.trySend("a");
        channel.close();

        Assertions.assertFalse(channel.trySend("b"));
        Assertions.assertFalse(channel.isDrained());
        Assertions.assertEquals("a", channel.receive(Duration.ofMillis(10)));
        Assertions.assertTrue(channel.isDrained());
        Assertions.assertNull(channel.receive(Duration.ofSeconds(5)));
    }

    @Test
    void wakeUpEndsAnAbortedReceiveWithoutTakingEvents() throws Exception {
        EventChannel<String> channel = new EventChannel<>("test", 4);
        AtomicBoolean stop = new AtomicBoolean();
        CompletableFuture<String> received = CompletableFuture.supplyAsync(() -> {
            try {
                return channel.receive(Duration.ofSeconds(30), stop::get);
            } catch (InterruptedException e) {
                throw new IllegalStateException(e);
            }
        });

        stop.set(true);
        channel.wakeUp();

        Assertions.assertNull(received.get(5, TimeUnit.SECONDS));
        Assertions.assertTrue(channel.trySend("late"));
        Assertions.assertNull(channel.receive(Duration.ZERO, stop::get));
        Assertions.assertEquals(1, channel.size());
    }
}
