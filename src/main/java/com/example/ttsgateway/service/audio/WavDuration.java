package com.example.ttsgateway.service.audio;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Optional;

/**
 * Reads the playback duration of a RIFF/WAVE file from its {@code fmt } and {@code data} chunks.
 * <p>
 * Streamed WAV output often carries a placeholder data size, so the size is clamped to the bytes present.
 */
public final class WavDuration {

    private WavDuration() {
    }

    public static Optional<Duration> of(byte[] bytes) {
        if (bytes == null || bytes.length < 12) {
            return Optional.empty();
        }
        if (!hasAscii(bytes, 0, "RIFF") || !hasAscii(bytes, 8, "WAVE")) {
            return Optional.empty();
        }

        long byteRate = -1;
        int offset = 12;
        while (offset + 8 <= bytes.length) {
            int dataOffset = offset + 8;
            long chunkSize = uint32Le(bytes, offset + 4);

            if (hasAscii(bytes, offset, "fmt ")) {
                if (chunkSize < 16 || dataOffset + 16 > bytes.length) {
                    return Optional.empty();
                }
                byteRate = uint32Le(bytes, dataOffset + 8);
            } else if (hasAscii(bytes, offset, "data")) {
                if (byteRate <= 0) {
                    return Optional.empty();
                }
                long available = bytes.length - (long) dataOffset;
                long dataSize = Math.min(chunkSize, available);
                return Optional.of(Duration.ofNanos(dataSize * 1_000_000_000L / byteRate));
            }

            long next = dataOffset + chunkSize + (chunkSize % 2);
            if (next > bytes.length) {
                return Optional.empty();
            }
            offset = (int) next;
        }
        return Optional.empty();
    }

    private static boolean hasAscii(byte[] bytes, int offset, String expected) {
        if (offset < 0 || offset + expected.length() > bytes.length) {
            return false;
        }
        byte[] expectedBytes = expected.getBytes(StandardCharsets.US_ASCII);
        for (int i = 0; i < expectedBytes.length; i++) {
            if (bytes[offset + i] != expectedBytes[i]) {
                return false;
            }
        }
        return true;
    }

    private static long uint32Le(byte[] bytes, int offset) {
        return ((long) bytes[offset] & 0xff)
                | (((long) bytes[offset + 1] & 0xff) << 8)
                | (((long) bytes[offset + 2] & 0xff) << 16)
                | (((long) bytes[offset + 3] & 0xff) << 24);
    }
}
