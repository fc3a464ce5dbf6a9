package org.zhelev.avroconsumer;

/**
 * Base type of all failures raised by the avro consumer.
 */
public class AvroConsumerException extends RuntimeException {

    public AvroConsumerException(String message) {
        super(message);
    }

    public AvroConsumerException(String message, Throwable cause) {
        super(message, cause);
    }

}
