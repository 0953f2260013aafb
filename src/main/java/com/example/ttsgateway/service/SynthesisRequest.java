package com.example.ttsgateway.service;

import java.util.Objects;

/**
 * One synthesis call as received from a client.
 *
 * @param speakingRate     provider-specific rate, {@code null} for the provider default
 * @param maxLengthSeconds upper bound on the returned audio duration, {@code null} for none
 * @param preferredFormat  provider-specific output format hint, {@code null} for the default
 */
public record SynthesisRequest(
        String text,
        TtsMode mode,
        String voice,
        Double speakingRate,
        Long maxLengthSeconds,
        String preferredFormat
) {

    public SynthesisRequest {
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(mode, "mode");
        Objects.requireNonNull(voice, "voice");
    }
}
