package org.zhelev.avroconsumer;

/**
 * Failure reported by the Kafka transport (poll, offset commit or close). Delivered on the error channel.
 */
public class TransportException extends AvroConsumerException {

    public TransportException(String message, Throwable cause) {
        super(message, cause);
    }

}
