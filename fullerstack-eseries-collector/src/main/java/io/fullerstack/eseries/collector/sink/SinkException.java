package io.fullerstack.eseries.collector.sink;

/**
 * A batch could not be written. The batch is dropped; there is no retry queue.
 */
public class SinkException extends RuntimeException {

    public SinkException(String message) {
        super(message);
    }

    public SinkException(String message, Throwable cause) {
        super(message, cause);
    }
}
