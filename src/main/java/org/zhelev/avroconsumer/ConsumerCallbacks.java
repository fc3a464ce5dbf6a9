package org.zhelev.avroconsumer;

import org.zhelev.avroconsumer.transport.GroupNotification;

import java.util.Optional;
import java.util.function.Consumer;

/**
 * The application's handlers for decoded messages, errors and group rebalance notifications.
 * Every handler is optional; events without a handler are dropped.
 *
 * <pre>{@code
 * ConsumerCallbacks callbacks = ConsumerCallbacks.builder()
 *         .onDataReceived(message -> log.info("{}", message.getValue()))
 *         .onError(error -> log.error(error.getMessage(), error))
 *         .build();
 * }</pre>
 */
public final class ConsumerCallbacks {

    private final Consumer<DecodedMessage> onDataReceived;
    private final Consumer<Throwable> onError;
    private final Consumer<GroupNotification> onNotification;

    private ConsumerCallbacks(Builder builder) {
        this.onDataReceived = builder.onDataReceived;
        this.onError = builder.onError;
        this.onNotification = builder.onNotification;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static ConsumerCallbacks none() {
        return builder().build();
    }

    public Optional<Consumer<DecodedMessage>> getOnDataReceived() {
        return Optional.ofNullable(onDataReceived);
    }

    public Optional<Consumer<Throwable>> getOnError() {
        return Optional.ofNullable(onError);
    }

    public Optional<Consumer<GroupNotification>> getOnNotification() {
        return Optional.ofNullable(onNotification);
    }

    public static final class Builder {

        private Consumer<DecodedMessage> onDataReceived;
        private Consumer<Throwable> onError;
        private Consumer<GroupNotification> onNotification;

        private Builder() {
        }

        public Builder onDataReceived(Consumer<DecodedMessage> onDataReceived) {
            this.onDataReceived = onDataReceived;
            return this;
        }

        public Builder onError(Consumer<Throwable> onError) {
            this.onError = onError;
            return this;
        }

        public Builder onNotification(Consumer<GroupNotification> onNotification) {
            this.onNotification = onNotification;
            return this;
        }

        public ConsumerCallbacks build() {
            return new ConsumerCallbacks(this);
        }
    }
}
