package org.zhelev.avroconsumer.transport;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.BooleanSupplier;

/**
 * Bounded hand-off between the transport's poll thread and its readers. A closed channel rejects new events but
 * still hands out the ones it holds; it is drained once it is closed and empty.
 *
 * <p>A reader waiting in {@link #receive(Duration, BooleanSupplier)} re-checks its abort condition whenever the
 * channel is woken by {@link #wakeUp()}, so a stop request does not have to wait for the timeout.
 *
 * @param <T> event type
 */
public class EventChannel<T> implements AutoCloseable {

    private static final BooleanSupplier NEVER = () -> false;

    private final String name;

    private final int capacity;

    private final Deque<T> queue = new ArrayDeque<>();

    private final ReentrantLock lock = new ReentrantLock();

    private final Condition notEmpty = lock.newCondition();

    private final Condition notFull = lock.newCondition();

    private volatile boolean closed = false;

    public EventChannel(String name, int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Capacity of channel " + name + " must be positive: " + capacity);
        }
        this.name = name;
        this.capacity = capacity;
    }

    public String getName() {
        return name;
    }

    /**
     * Waits up to {@code timeout} for room in the channel.
     *
     * @return {@code false} if the channel is closed or still full after the timeout
     */
    public boolean send(T event, Duration timeout) throws InterruptedException {
        long nanos = timeout.toNanos();
        lock.lockInterruptibly();
        try {
            while (!closed && queue.size() >= capacity) {
                if (nanos <= 0) {
                    return false;
                }
                nanos = notFull.awaitNanos(nanos);
            }
            return enqueue(event);
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return {@code false} if the channel is closed or full
     */
    public boolean trySend(T event) {
        lock.lock();
        try {
            return queue.size() < capacity && enqueue(event);
        } finally {
            lock.unlock();
        }
    }

    private boolean enqueue(T event) {
        if (closed) {
            return false;
        }
        queue.addLast(event);
        notEmpty.signal();
        return true;
    }

    /**
     * @return the next event, or {@code null} if none arrived within {@code timeout}
     */
    public T receive(Duration timeout) throws InterruptedException {
        return receive(timeout, NEVER);
    }

    /**
     * Waits up to {@code timeout} for the next event. {@code abort} is checked before an event is taken, so once it
     * holds no further event leaves the channel.
     *
     * @return the next event, or {@code null} on timeout, abort or when the channel is drained
     */
    public T receive(Duration timeout, BooleanSupplier abort) throws InterruptedException {
        long nanos = timeout.toNanos();
        lock.lockInterruptibly();
        try {
            while (true) {
                if (abort.getAsBoolean()) {
                    return null;
                }
                T event = queue.pollFirst();
                if (event != null) {
                    notFull.signal();
                    return event;
                }
                if (closed || nanos <= 0) {
                    return null;
                }
                nanos = notEmpty.awaitNanos(nanos);
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Wakes the readers waiting on this channel so they re-check their abort condition.
     */
    public void wakeUp() {
        lock.lock();
        try {
            notEmpty.signalAll();
        } finally {
            lock.unlock();
        }
    }

    public boolean isClosed() {
        return closed;
    }

    public boolean isDrained() {
        lock.lock();
        try {
            return closed && queue.isEmpty();
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return queue.size();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void close() {
        lock.lock();
        try {
            closed = true;
            notEmpty.signalAll();
            notFull.signalAll();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public String toString() {
        return "EventChannel{" + name + ", size=" + size() + ", closed=" + closed + '}';
    }
}
