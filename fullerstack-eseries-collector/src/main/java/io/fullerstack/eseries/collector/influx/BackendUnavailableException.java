package io.fullerstack.eseries.collector.influx;

/**
 * The metrics backend could not be reached or answered with a server error.
 */
public class BackendUnavailableException extends RuntimeException {

    public BackendUnavailableException(String message) {
        super(message);
    }

    public BackendUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
