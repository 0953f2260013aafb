package com.example.ttsgateway.service.backend.espeak;

class EspeakException extends RuntimeException {

    EspeakException(String message) {
        super(message);
    }

    EspeakException(String message, Throwable cause) {
        super(message, cause);
    }
}
