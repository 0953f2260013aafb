package com.example.ttsgateway.service;

import com.example.ttsgateway.error.GatewayException;
import org.springframework.http.MediaType;

import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

class FakeBackend implements TtsBackend {

    final AtomicInteger synthesizeCalls = new AtomicInteger();
    final AtomicInteger voiceChecks = new AtomicInteger();

    private final TtsMode mode;
    private final Set<String> voices;
    private final OptionalDouble maxRate;

    byte[] audio = {1, 2, 3};
    long audioSeconds;
    RuntimeException failure;

    FakeBackend(TtsMode mode, OptionalDouble maxRate, String... voices) {
        this.mode = mode;
        this.maxRate = maxRate;
        this.voices = Set.of(voices);
    }

    @Override
    public TtsMode mode() {
        return mode;
    }

    @Override
    public List<VoiceDescriptor> listVoices() {
        return voices.stream().sorted().map(voice -> new VoiceDescriptor(voice, "Test")).toList();
    }

    @Override
    public List<?> listRawVoices() {
        return List.of(Map.of("voices", voices.size()));
    }

    @Override
    public boolean isValidVoice(String voice) {
        voiceChecks.incrementAndGet();
        return voices.contains(voice);
    }

    @Override
    public OptionalDouble maxSpeakingRate() {
        return maxRate;
    }

    @Override
    public SynthesizedAudio synthesize(String text, String voice, Double speakingRate, String preferredFormat) {
        synthesizeCalls.incrementAndGet();
        if (failure != null) {
            throw failure;
        }
        return new SynthesizedAudio(audio, contentType(preferredFormat));
    }

    @Override
    public MediaType contentType(String preferredFormat) {
        if (preferredFormat != null && !preferredFormat.equals("mp3")) {
            throw GatewayException.invalidParameter("Unsupported preferred_format: " + preferredFormat);
        }
        return MediaType.valueOf("audio/mpeg");
    }

    @Override
    public boolean checkLength(byte[] audio, long limitSeconds) {
        return audioSeconds < limitSeconds;
    }
}
