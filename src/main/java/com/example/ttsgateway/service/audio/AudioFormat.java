package com.example.ttsgateway.service.audio;

import org.springframework.http.MediaType;

import java.util.Locale;

public enum AudioFormat {
    MP3(MediaType.valueOf("audio/mpeg")),
    OGG_OPUS(MediaType.valueOf("audio/opus")),
    OGG_VORBIS(MediaType.valueOf("audio/ogg")),
    WAV(MediaType.valueOf("audio/wav")),
    PCM(MediaType.valueOf("audio/pcm"));

    private final MediaType mediaType;

    AudioFormat(MediaType mediaType) {
        this.mediaType = mediaType;
    }

    public MediaType mediaType() {
        return mediaType;
    }

    /**
     * Lower-cased, trimmed format hint, or {@code null} when absent.
     */
    public static String normalizeHint(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return value.trim().toLowerCase(Locale.ROOT);
    }
}
