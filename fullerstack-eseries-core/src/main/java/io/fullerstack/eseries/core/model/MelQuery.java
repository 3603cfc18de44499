package io.fullerstack.eseries.core.model;

/**
 * Parameters of one major-event-log request.
 *
 * @param startSequence First sequence number to fetch, or {@link #FROM_BEGINNING}
 * @param count         Maximum number of events to fetch
 */
public record MelQuery(
        long startSequence,
        int count
) {
    /**
     * Sentinel understood by the API as "start from the oldest retained event".
     */
    public static final long FROM_BEGINNING = -1L;

    public MelQuery {
        if (count <= 0) {
            throw new IllegalArgumentException("count must be positive, got: " + count);
        }
        if (startSequence < FROM_BEGINNING) {
            throw new IllegalArgumentException("startSequence must be >= -1, got: " + startSequence);
        }
    }

    public boolean fromBeginning() {
        return startSequence == FROM_BEGINNING;
    }
}
