package com.example.ttsgateway.service.audio;

import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class Mp3DurationTest {

    // MPEG-1 layer III, 128 kbps, 44.1 kHz, no padding: 417 bytes and 1152 samples per frame
    private static final byte[] FRAME_HEADER = {(byte) 0xff, (byte) 0xfb, (byte) 0x90, 0x00};
    private static final int FRAME_LENGTH = 417;

    @Test
    void sumsFrameDurations() {
        Duration duration = Mp3Duration.of(frames(100)).orElseThrow();

        assertThat(duration).isBetween(Duration.ofMillis(2610), Duration.ofMillis(2615));
    }

    @Test
    void skipsId3v2Tag() {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        out.writeBytes(new byte[]{'I', 'D', '3', 4, 0, 0, 0, 0, 0, 20});
        out.writeBytes(new byte[20]);
        out.writeBytes(frames(10));

        Duration duration = Mp3Duration.of(out.toByteArray()).orElseThrow();

        assertThat(duration).isBetween(Duration.ofMillis(260), Duration.ofMillis(262));
    }

    @Test
    void ignoresTrailingId3v1Tag() {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        out.writeBytes(frames(10));
        byte[] tag = new byte[128];
        tag[0] = 'T';
        tag[1] = 'A';
        tag[2] = 'G';
        out.writeBytes(tag);

        assertThat(Mp3Duration.of(out.toByteArray())).isEqualTo(Mp3Duration.of(frames(10)));
    }

    @Test
    void returnsEmptyForNonMpegData() {
        assertThat(Mp3Duration.of("definitely not audio".getBytes())).isEmpty();
        assertThat(Mp3Duration.of(new byte[0])).isEmpty();
        assertThat(Mp3Duration.of(null)).isEmpty();
    }

    private static byte[] frames(int count) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        for (int i = 0; i < count; i++) {
            byte[] frame = new byte[FRAME_LENGTH];
            System.arraycopy(FRAME_HEADER, 0, frame, 0, FRAME_HEADER.length);
            out.writeBytes(frame);
        }
        return out.toByteArray();
    }
}
