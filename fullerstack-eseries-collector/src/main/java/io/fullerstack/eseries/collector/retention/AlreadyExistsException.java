package io.fullerstack.eseries.collector.retention;

/**
 * A create statement named a policy or rule that already exists.
 */
public class AlreadyExistsException extends RuntimeException {

    public AlreadyExistsException(String message) {
        super(message);
    }
}
