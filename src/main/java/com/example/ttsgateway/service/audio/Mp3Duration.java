package com.example.ttsgateway.service.audio;

import java.time.Duration;
import java.util.Optional;

/**
 * Estimates MP3 duration by walking MPEG audio frame headers. ID3v2 tags are skipped and
 * bytes that do not form a valid header are stepped over until the next frame sync.
 */
public final class Mp3Duration {

    private static final int[][] BITRATES_KBPS = {
            // MPEG-1 layer I, II, III
            {0, 32, 64, 96, 128, 160, 192, 224, 256, 288, 320, 352, 384, 416, 448},
            {0, 32, 48, 56, 64, 80, 96, 112, 128, 160, 192, 224, 256, 320, 384},
            {0, 32, 40, 48, 56, 64, 80, 96, 112, 128, 160, 192, 224, 256, 320},
            // MPEG-2/2.5 layer I, II/III
            {0, 32, 48, 56, 64, 80, 96, 112, 128, 144, 160, 176, 192, 224, 256},
            {0, 8, 16, 24, 32, 40, 48, 56, 64, 80, 96, 112, 128, 144, 160}
    };

    private static final int[][] SAMPLE_RATES = {
            {11025, 12000, 8000},   // MPEG-2.5
            {0, 0, 0},              // reserved
            {22050, 24000, 16000},  // MPEG-2
            {44100, 48000, 32000}   // MPEG-1
    };

    private Mp3Duration() {
    }

    /**
     * Empty when no MPEG frame could be found.
     */
    public static Optional<Duration> of(byte[] bytes) {
        if (bytes == null) {
            return Optional.empty();
        }
        int offset = skipId3v2(bytes);
        long nanos = 0;
        int frames = 0;

        while (offset + 4 <= bytes.length) {
            // trailing ID3v1 tag
            if (bytes.length - offset == 128 && bytes[offset] == 'T' && bytes[offset + 1] == 'A' && bytes[offset + 2] == 'G') {
                break;
            }
            FrameHeader header = FrameHeader.parse(bytes, offset);
            if (header == null) {
                offset++;
                continue;
            }
            nanos += header.samples() * 1_000_000_000L / header.sampleRate();
            frames++;
            offset += header.length();
        }
        return frames == 0 ? Optional.empty() : Optional.of(Duration.ofNanos(nanos));
    }

    private static int skipId3v2(byte[] bytes) {
        if (bytes.length < 10 || bytes[0] != 'I' || bytes[1] != 'D' || bytes[2] != '3') {
            return 0;
        }
        int size = ((bytes[6] & 0x7f) << 21)
                | ((bytes[7] & 0x7f) << 14)
                | ((bytes[8] & 0x7f) << 7)
                | (bytes[9] & 0x7f);
        boolean footer = (bytes[5] & 0x10) != 0;
        return Math.min(bytes.length, 10 + size + (footer ? 10 : 0));
    }

    private record FrameHeader(int length, int samples, int sampleRate) {

        static FrameHeader parse(byte[] bytes, int offset) {
            int b1 = bytes[offset + 1] & 0xff;
            int b2 = bytes[offset + 2] & 0xff;
            if ((bytes[offset] & 0xff) != 0xff || (b1 & 0xe0) != 0xe0) {
                return null;
            }
            int version = (b1 >> 3) & 0x03;
            int layerBits = (b1 >> 1) & 0x03;
            int bitrateIndex = b2 >> 4;
            int sampleRateIndex = (b2 >> 2) & 0x03;
            int padding = (b2 >> 1) & 0x01;
            if (version == 1 || layerBits == 0 || bitrateIndex == 0 || bitrateIndex == 15 || sampleRateIndex == 3) {
                return null;
            }

            int layer = 4 - layerBits;
            boolean mpeg1 = version == 3;
            int table = mpeg1 ? layer - 1 : (layer == 1 ? 3 : 4);
            int bitrate = BITRATES_KBPS[table][bitrateIndex] * 1000;
            int sampleRate = SAMPLE_RATES[version][sampleRateIndex];

            int samples;
            int length;
            if (layer == 1) {
                samples = 384;
                length = (12 * bitrate / sampleRate + padding) * 4;
            } else {
                samples = (layer == 3 && !mpeg1) ? 576 : 1152;
                length = samples / 8 * bitrate / sampleRate + padding;
            }
            if (length < 4) {
                return null;
            }
            return new FrameHeader(length, samples, sampleRate);
        }
    }
}
