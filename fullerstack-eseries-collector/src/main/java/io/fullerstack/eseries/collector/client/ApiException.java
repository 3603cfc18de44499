package io.fullerstack.eseries.collector.client;

/**
 * Failure of a management API request.
 * <p>
 * API failures are never retried within a cycle; the scheduler runs the task again on
 * its next due tick.
 */
public class ApiException extends RuntimeException {

    public enum Kind {
        /**
         * Timeout, refused connection, TLS or I/O failure.
         */
        TRANSIENT_NETWORK,

        /**
         * The API answered with a non-2xx status.
         */
        HTTP_STATUS,

        /**
         * The response body is not the JSON the caller expected.
         */
        PAYLOAD
    }

    private final Kind kind;
    private final int statusCode;

    public ApiException(Kind kind, String message, Throwable cause) {
        this(kind, -1, message, cause);
    }

    public ApiException(Kind kind, int statusCode, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.statusCode = statusCode;
    }

    public static ApiException status(int statusCode, String path) {
        return new ApiException(Kind.HTTP_STATUS, statusCode, "HTTP " + statusCode + " from " + path, null);
    }

    public static ApiException payload(String message) {
        return new ApiException(Kind.PAYLOAD, message, null);
    }

    public Kind kind() {
        return kind;
    }

    /**
     * HTTP status, or -1 when the request got no response.
     */
    public int statusCode() {
        return statusCode;
    }
}
