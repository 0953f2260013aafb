package com.example.ttsgateway.service;

public record VoiceDescriptor(String name, String language) {
}
