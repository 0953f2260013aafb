package com.example.ttsgateway.error;

import org.springframework.http.HttpStatus;

/**
 * Stable machine-readable error codes returned in every error body.
 * <p>
 * Server-caused errors share code {@code 0} and never expose their message to clients.
 */
public enum ErrorCode {
    UNKNOWN(0, HttpStatus.INTERNAL_SERVER_ERROR, false),
    BACKEND_UNAVAILABLE(0, HttpStatus.BAD_GATEWAY, false),
    CREDENTIAL_ERROR(0, HttpStatus.BAD_GATEWAY, false),
    UNKNOWN_VOICE(1, HttpStatus.BAD_REQUEST, true),
    AUDIO_TOO_LONG(2, HttpStatus.BAD_REQUEST, true),
    INVALID_SPEAKING_RATE(3, HttpStatus.BAD_REQUEST, true),
    UNAUTHORIZED(4, HttpStatus.FORBIDDEN, true),
    MODE_UNAVAILABLE(5, HttpStatus.BAD_REQUEST, true),
    INVALID_PARAMETER(6, HttpStatus.BAD_REQUEST, true);

    private final int code;
    private final HttpStatus status;
    private final boolean clientVisible;

    ErrorCode(int code, HttpStatus status, boolean clientVisible) {
        this.code = code;
        this.status = status;
        this.clientVisible = clientVisible;
    }

    public int code() {
        return code;
    }

    public HttpStatus status() {
        return status;
    }

    public boolean clientVisible() {
        return clientVisible;
    }
}
