package org.zhelev.avroconsumer;

/**
 * Thrown while creating a consumer when the Kafka cluster or the schema registry cannot be reached.
 */
public class ConsumerConnectionException extends AvroConsumerException {

    public ConsumerConnectionException(String message) {
        super(message);
    }

    public ConsumerConnectionException(String message, Throwable cause) {
        super(message, cause);
    }

}
