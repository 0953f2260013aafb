package com.example.ttsgateway.service.credential;

import java.time.Duration;
import java.time.Instant;

public record CredentialToken(String value, Instant expiresAt) {

    /**
     * True once {@code now} has reached {@code expiresAt - skew}.
     */
    public boolean isExpired(Instant now, Duration skew) {
        return !now.isBefore(expiresAt.minus(skew));
    }
}
