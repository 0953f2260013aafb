package com.example.ttsgateway.service.backend.espeak;

/**
 * One row of {@code espeak-ng --voices}.
 */
public record EspeakVoice(int priority, String language, String gender, String name, String file) {
}
