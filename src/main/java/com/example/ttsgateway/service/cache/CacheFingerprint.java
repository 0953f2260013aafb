package com.example.ttsgateway.service.cache;

import com.example.ttsgateway.service.SynthesisRequest;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Arrays;
import java.util.HexFormat;

/**
 * SHA-256 digest of the fields that determine the synthesized audio.
 * <p>
 * The raw text never becomes part of the store key.
 */
public final class CacheFingerprint {

    private static final String DELIMITER = " | ";

    private final byte[] digest;

    private CacheFingerprint(byte[] digest) {
        this.digest = digest;
    }

    public static CacheFingerprint of(SynthesisRequest request) {
        return new CacheFingerprint(sha256(canonicalKey(request)));
    }

    /**
     * {@code text | voice | mode | rate}, followed by {@code | format} when a format was requested.
     */
    static String canonicalKey(SynthesisRequest request) {
        StringBuilder key = new StringBuilder()
                .append(request.text()).append(DELIMITER)
                .append(request.voice()).append(DELIMITER)
                .append(request.mode().displayName()).append(DELIMITER)
                .append(formatRate(request.speakingRate()));
        if (request.preferredFormat() != null) {
            key.append("| ").append(request.preferredFormat());
        }
        return key.toString();
    }

    public byte[] bytes() {
        return digest.clone();
    }

    public String toHex() {
        return HexFormat.of().formatHex(digest);
    }

    private static String formatRate(Double rate) {
        if (rate == null || rate == 0.0d) {
            return "0";
        }
        if (!Double.isFinite(rate)) {
            return Double.toString(rate);
        }
        return BigDecimal.valueOf(rate).stripTrailingZeros().toPlainString();
    }

    private static byte[] sha256(String value) {
        try {
            return MessageDigest.getInstance("SHA-256").digest(value.getBytes(StandardCharsets.UTF_8));
        } catch (NoSuchAlgorithmException ex) {
            throw new IllegalStateException("SHA-256 is not available", ex);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof CacheFingerprint other && Arrays.equals(digest, other.digest);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(digest);
    }

    @Override
    public String toString() {
        return toHex();
    }
}
