package io.fullerstack.eseries.collector.influx;

/**
 * The backend rejected an InfluxQL statement.
 */
public class InfluxQueryException extends RuntimeException {

    public InfluxQueryException(String message) {
        super(message);
    }
}
