package io.fullerstack.eseries.core.failures;

import com.fasterxml.jackson.databind.JsonNode;
import io.fullerstack.eseries.core.model.FailureKey;
import io.fullerstack.eseries.core.model.FailureRecord;
import io.fullerstack.eseries.core.model.FailureTransition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Emits failure state transitions instead of full failure snapshots.
 * <p>
 * Each failure tuple ({@link FailureKey}) moves through Unknown, Active and Resolved:
 * <ul>
 *   <li>reported and not known to be active: ACTIVATED</li>
 *   <li>known to be active and no longer reported: RESOLVED</li>
 *   <li>anything else: no transition</li>
 * </ul>
 * A payload whose hash matches the previous cycle is skipped entirely.
 * <p>
 * Known state comes from an in-memory cache, or once per cycle from the
 * {@link FailureStateStore} when the cache for a system is cold.
 * <p>
 * <b>Thread safety:</b> cycles for the same system are serialized by a per-system lock;
 * different systems reconcile independently.
 */
public class FailureReconciler {
    private static final Logger logger = LoggerFactory.getLogger(FailureReconciler.class);

    private final FailureStateStore store;
    private final ChecksumGuard checksumGuard;
    private final Clock clock;
    private final Map<String, Map<FailureKey, FailureRecord>> knownBySystem = new ConcurrentHashMap<>();
    private final Map<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    public FailureReconciler(FailureStateStore store, ChecksumGuard checksumGuard) {
        this(store, checksumGuard, Clock.systemUTC());
    }

    public FailureReconciler(FailureStateStore store, ChecksumGuard checksumGuard, Clock clock) {
        this.store = Objects.requireNonNull(store, "store cannot be null");
        this.checksumGuard = Objects.requireNonNull(checksumGuard, "checksumGuard cannot be null");
        this.clock = Objects.requireNonNull(clock, "clock cannot be null");
    }

    /**
     * Reconcile the latest failure payload of one system.
     *
     * @param sysId   Storage system WWN
     * @param payload Raw {@code failures} response (a JSON array of failure objects)
     * @return Transitions to write, or {@link ReconcileResult#unchanged()} on a checksum hit
     */
    public ReconcileResult reconcile(String sysId, JsonNode payload) {
        Objects.requireNonNull(sysId, "sysId cannot be null");
        Objects.requireNonNull(payload, "payload cannot be null");

        ReentrantLock lock = locks.computeIfAbsent(sysId, id -> new ReentrantLock());
        lock.lock();
        try {
            String hash = ChecksumGuard.hash(payload.toString());
            if (checksumGuard.unchanged(sysId, hash)) {
                logger.debug("Failure payload for {} unchanged, skipping reconciliation", sysId);
                return ReconcileResult.unchanged();
            }

            Map<FailureKey, FailureRecord> known = knownBySystem.get(sysId);
            if (known == null) {
                known = loadKnown(sysId);
            }
            Set<FailureKey> reported = reportedKeys(sysId, payload);
            Instant now = clock.instant();

            Map<FailureKey, FailureRecord> next = new LinkedHashMap<>(known);
            List<FailureTransition> transitions = new ArrayList<>();

            for (FailureKey key : reported) {
                FailureRecord previous = known.get(key);
                if (previous == null || !previous.active()) {
                    FailureRecord activated = new FailureRecord(sysId, key.failureType(), key.objectRef(),
                            key.objectType(), true, now);
                    next.put(key, activated);
                    transitions.add(new FailureTransition(activated, FailureTransition.Kind.ACTIVATED));
                }
            }
            for (FailureRecord previous : known.values()) {
                if (previous.active() && !reported.contains(previous.key())) {
                    FailureRecord resolved = previous.withActive(false, now);
                    next.put(previous.key(), resolved);
                    transitions.add(new FailureTransition(resolved, FailureTransition.Kind.RESOLVED));
                }
            }

            knownBySystem.put(sysId, next);
            checksumGuard.record(sysId, hash);

            if (!transitions.isEmpty()) {
                logger.info("Failure reconciliation for {}: {} reported, {} transitions",
                        sysId, reported.size(), transitions.size());
            }
            return new ReconcileResult(transitions, false);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Drop cached state and checksum for a system. The next cycle re-reads the durable store,
     * so transitions that were computed but never written are emitted again.
     */
    public void invalidate(String sysId) {
        ReentrantLock lock = locks.computeIfAbsent(sysId, id -> new ReentrantLock());
        lock.lock();
        try {
            knownBySystem.remove(sysId);
            checksumGuard.forget(sysId);
            logger.debug("Invalidated failure state for {}", sysId);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Currently cached state of a system's failures, empty if cold.
     */
    public List<FailureRecord> knownFailures(String sysId) {
        Map<FailureKey, FailureRecord> known = knownBySystem.get(sysId);
        return known == null ? List.of() : List.copyOf(known.values());
    }

    private Map<FailureKey, FailureRecord> loadKnown(String sysId) {
        Map<FailureKey, FailureRecord> known = new LinkedHashMap<>();
        for (FailureRecord record : store.lastKnownFailures(sysId)) {
            FailureRecord existing = known.get(record.key());
            if (existing == null || !record.lastTransition().isBefore(existing.lastTransition())) {
                known.put(record.key(), record);
            }
        }
        logger.debug("Loaded {} known failures for {} from store", known.size(), sysId);
        return known;
    }

    private static Set<FailureKey> reportedKeys(String sysId, JsonNode payload) {
        Set<FailureKey> reported = new LinkedHashSet<>();
        if (!payload.isArray()) {
            logger.warn("Failure payload for {} is not a list ({}), treating as empty", sysId, payload.getNodeType());
            return reported;
        }
        for (JsonNode failure : payload) {
            JsonNode type = failure.get("failureType");
            if (type == null || type.isNull() || type.asText().isBlank()) {
                logger.warn("Skipping failure entry without failureType on {}: {}", sysId, failure);
                continue;
            }
            reported.add(new FailureKey(type.asText(), textOrNull(failure, "objectRef"),
                    textOrNull(failure, "objectType")));
        }
        return reported;
    }

    private static String textOrNull(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }
}
