package org.zhelev.avroconsumer.utils;

import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Names threads with a given prefix and index format.
 *
 * @author krasimir.zhelev@gmail.com
 */
public final class NamedThreadFactory {

    private NamedThreadFactory() {
    }

    /**
     * Creates and returns a new ThreadFactory instance that names threads with a given prefix and index format.
     *
     * @param prefix The prefix to use when naming threads
     * @param idxFormat A format string for the thread index, e.g. {@code "-t%01d"}
     * @param daemon Whether the created threads are daemon threads
     * @param exceptionHandler An uncaught exception handler to set for each thread created by this factory
     * @return A new ThreadFactory instance
     */
    public static ThreadFactory newThreadFactory(final String prefix, final String idxFormat, final boolean daemon,
                                                 final Thread.UncaughtExceptionHandler exceptionHandler) {

        return new ThreadFactory() {
            private final AtomicLong threadIndex = new AtomicLong(0);

            @Override
            public Thread newThread(Runnable runnable) {
                Thread thread = new Thread(runnable);
                thread.setName(prefix + String.format(idxFormat, threadIndex.getAndIncrement()));
                thread.setDaemon(daemon);
                thread.setUncaughtExceptionHandler(exceptionHandler);
                return thread;
            }
        };
    }
}
