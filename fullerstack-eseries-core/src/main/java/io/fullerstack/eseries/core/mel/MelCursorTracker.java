package io.fullerstack.eseries.core.mel;

import io.fullerstack.eseries.core.model.MelQuery;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;
import java.util.OptionalLong;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Tracks the last ingested major-event-log sequence number per system.
 * <p>
 * Each cycle requests at most one page starting after the cursor; a backlog larger than a
 * page drains over the following cycles. The cursor only moves forward: a lower maximum
 * than the stored cursor is logged as a regression and ignored.
 */
public class MelCursorTracker {
    private static final Logger logger = LoggerFactory.getLogger(MelCursorTracker.class);

    public static final int DEFAULT_PAGE_SIZE = 8192;

    private final MelCursorStore store;
    private final int pageSize;
    private final Map<String, Long> cursors = new ConcurrentHashMap<>();
    private final Set<String> seeded = ConcurrentHashMap.newKeySet();

    public MelCursorTracker(MelCursorStore store, int pageSize) {
        this.store = Objects.requireNonNull(store, "store cannot be null");
        if (pageSize <= 0) {
            throw new IllegalArgumentException("pageSize must be positive, got: " + pageSize);
        }
        this.pageSize = pageSize;
    }

    public MelCursorTracker(int pageSize) {
        this(MelCursorStore.none(), pageSize);
    }

    /**
     * Query for the next page of events.
     * <p>
     * On the first call for a system without a cursor the store is asked for the last
     * written sequence. A store failure propagates and the store is asked again next cycle.
     *
     * @param sysId Storage system WWN
     * @return Query starting after the cursor, or from the beginning if there is none
     */
    public MelQuery nextQuery(String sysId) {
        Objects.requireNonNull(sysId, "sysId cannot be null");
        if (!cursors.containsKey(sysId) && seeded.add(sysId)) {
            OptionalLong stored;
            try {
                stored = store.lastSequence(sysId);
            } catch (RuntimeException e) {
                seeded.remove(sysId);
                throw e;
            }
            if (stored.isPresent()) {
                logger.info("Resuming MEL ingestion for {} after sequence {}", sysId, stored.getAsLong());
                advance(sysId, stored.getAsLong());
            }
        }

        Long last = cursors.get(sysId);
        long start = last == null ? MelQuery.FROM_BEGINNING : last + 1;
        return new MelQuery(start, pageSize);
    }

    /**
     * Move the cursor forward after a page was written.
     *
     * @param sysId   Storage system WWN
     * @param maxSeen Highest sequence number in the written page
     * @return true if the cursor moved
     */
    public boolean advance(String sysId, long maxSeen) {
        Objects.requireNonNull(sysId, "sysId cannot be null");
        boolean[] moved = new boolean[1];
        cursors.compute(sysId, (id, current) -> {
            if (current == null || maxSeen > current) {
                moved[0] = true;
                return maxSeen;
            }
            if (maxSeen < current) {
                logger.warn("MEL cursor regression for {}: stored {}, response max {}; not applied",
                        sysId, current, maxSeen);
            }
            return current;
        });
        return moved[0];
    }

    /**
     * Last ingested sequence number, empty if the system has no cursor yet.
     */
    public OptionalLong cursor(String sysId) {
        Long last = cursors.get(sysId);
        return last == null ? OptionalLong.empty() : OptionalLong.of(last);
    }

    public int pageSize() {
        return pageSize;
    }
}
