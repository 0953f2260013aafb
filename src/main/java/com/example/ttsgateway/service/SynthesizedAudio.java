package com.example.ttsgateway.service;

import org.springframework.http.MediaType;

public record SynthesizedAudio(byte[] bytes, MediaType contentType) {
}
