package com.example.ttsgateway.service;

import com.example.ttsgateway.error.GatewayException;

public enum TtsMode {
    GTTS("gTTS"),
    POLLY("Polly"),
    ESPEAK("eSpeak"),
    GCLOUD("gCloud");

    private final String displayName;

    TtsMode(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() {
        return displayName;
    }

    /**
     * Resolves a mode by its wire name. Matching is case-sensitive.
     */
    public static TtsMode fromName(String value) {
        if (value == null || value.isBlank()) {
            throw GatewayException.invalidParameter("mode must not be empty");
        }
        for (TtsMode mode : values()) {
            if (mode.displayName.equals(value)) {
                return mode;
            }
        }
        throw GatewayException.invalidParameter("Unknown mode: " + value);
    }

    @Override
    public String toString() {
        return displayName;
    }
}
