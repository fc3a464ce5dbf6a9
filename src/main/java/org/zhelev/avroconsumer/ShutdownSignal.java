package org.zhelev.avroconsumer;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * One-shot cancellation token observed by {@link AvroConsumer#consume(ShutdownSignal)}.
 * Callers wire OS signals or other triggers to {@link #trigger()}.
 */
public class ShutdownSignal {

    private final CountDownLatch latch = new CountDownLatch(1);

    private final List<Runnable> listeners = new CopyOnWriteArrayList<>();

    public void trigger() {
        synchronized (latch) {
            if (isTriggered()) {
                return;
            }
            latch.countDown();
        }
        listeners.forEach(Runnable::run);
    }

    public boolean isTriggered() {
        return latch.getCount() == 0;
    }

    public boolean await(Duration timeout) throws InterruptedException {
        return latch.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    /**
     * Runs {@code listener} once the signal fires, right away if it already has.
     */
    public void onTrigger(Runnable listener) {
        synchronized (latch) {
            if (!isTriggered()) {
                listeners.add(listener);
                return;
            }
        }
        listener.run();
    }
}
