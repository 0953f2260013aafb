package com.example.ttsgateway.service.cache;

public class AudioCipherException extends RuntimeException {

    public AudioCipherException(String message) {
        super(message);
    }

    public AudioCipherException(String message, Throwable cause) {
        super(message, cause);
    }
}
