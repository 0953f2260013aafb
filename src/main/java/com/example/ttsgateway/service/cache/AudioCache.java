package com.example.ttsgateway.service.cache;

import java.util.Optional;

/**
 * Best-effort store of synthesized audio keyed by request fingerprint.
 * <p>
 * Neither operation throws. There is no locking around a fingerprint, so concurrent identical
 * requests may each miss, synthesize and write; the last write wins.
 */
public interface AudioCache {

    Optional<byte[]> lookup(CacheFingerprint fingerprint);

    void store(CacheFingerprint fingerprint, byte[] audio);

    boolean isEnabled();
}
