package io.fullerstack.eseries.core.failures;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Remembers the hash of the last reconciled failure payload per system, so an unchanged
 * payload can be skipped without comparing failure sets.
 */
public class ChecksumGuard {

    private final Map<String, String> lastHashes = new ConcurrentHashMap<>();

    /**
     * SHA-256 of the payload text, lowercase hex.
     */
    public static String hash(String payload) {
        Objects.requireNonNull(payload, "payload cannot be null");
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(payload.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            // every JDK is required to ship SHA-256
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    /**
     * @return true if {@code hash} equals the last recorded hash for the system
     */
    public boolean unchanged(String sysId, String hash) {
        return hash.equals(lastHashes.get(sysId));
    }

    public void record(String sysId, String hash) {
        lastHashes.put(sysId, hash);
    }

    public void forget(String sysId) {
        lastHashes.remove(sysId);
    }

    public Optional<String> lastHash(String sysId) {
        return Optional.ofNullable(lastHashes.get(sysId));
    }
}
