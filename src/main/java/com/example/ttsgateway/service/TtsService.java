package com.example.ttsgateway.service;

import com.example.ttsgateway.error.GatewayException;
import com.example.ttsgateway.service.cache.AudioCache;
import com.example.ttsgateway.service.cache.CacheFingerprint;
import com.example.ttsgateway.web.RequestIdFilter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Routes a synthesis request to its backend.
 * <p>
 * Steps run in a fixed order and stop at the first failure: speaking rate, voice, cache lookup,
 * synthesis (followed by a background cache write), length check. The length check runs on cached
 * audio too, since a later caller may ask for a stricter limit than the one the entry was created under.
 */
@Service
public class TtsService {

    private static final Logger log = LoggerFactory.getLogger(TtsService.class);

    private final BackendRegistry registry;
    private final AudioCache audioCache;
    private final Executor cacheWriteExecutor;

    public TtsService(BackendRegistry registry,
                      AudioCache audioCache,
                      @Qualifier("cacheWriteExecutor") Executor cacheWriteExecutor) {
        this.registry = registry;
        this.audioCache = audioCache;
        this.cacheWriteExecutor = cacheWriteExecutor;
    }

    public SynthesizedAudio dispatch(SynthesisRequest request) {
        String requestId = currentRequestId();
        TtsBackend backend = registry.require(request.mode());

        checkSpeakingRate(backend, request.speakingRate());
        checkVoice(backend, request.voice());

        CacheFingerprint fingerprint = CacheFingerprint.of(request);
        Optional<byte[]> cached = audioCache.lookup(fingerprint);
        if (cached.isPresent()) {
            checkLength(backend, cached.get(), request.maxLengthSeconds());
            log.debug("TTS served from cache request_id={} mode={} voice={} fingerprint={}",
                    requestId, request.mode(), request.voice(), fingerprint);
            return new SynthesizedAudio(cached.get(), backend.contentType(request.preferredFormat()));
        }

        SynthesizedAudio audio = synthesize(backend, request);
        log.debug("TTS generated request_id={} mode={} voice={} audio_bytes={} content_type={}",
                requestId, request.mode(), request.voice(), audio.bytes().length, audio.contentType());
        storeInBackground(fingerprint, audio.bytes());

        checkLength(backend, audio.bytes(), request.maxLengthSeconds());
        return audio;
    }

    public List<?> listVoices(TtsMode mode, boolean raw) {
        TtsBackend backend = registry.require(mode);
        return callBackend(mode, () -> raw ? backend.listRawVoices() : backend.listVoices());
    }

    public List<String> listModes() {
        return registry.modes().stream()
                .map(TtsMode::displayName)
                .toList();
    }

    private void checkSpeakingRate(TtsBackend backend, Double speakingRate) {
        if (speakingRate == null) {
            return;
        }
        if (!Double.isFinite(speakingRate)) {
            throw GatewayException.invalidSpeakingRate(speakingRate);
        }
        OptionalDouble max = backend.maxSpeakingRate();
        if (max.isPresent() && speakingRate > max.getAsDouble()) {
            throw GatewayException.invalidSpeakingRate(speakingRate);
        }
    }

    private void checkVoice(TtsBackend backend, String voice) {
        boolean valid = callBackend(backend.mode(), () -> backend.isValidVoice(voice));
        if (!valid) {
            throw GatewayException.unknownVoice(voice);
        }
    }

    private SynthesizedAudio synthesize(TtsBackend backend, SynthesisRequest request) {
        return callBackend(backend.mode(), () -> backend.synthesize(
                request.text(),
                request.voice(),
                request.speakingRate(),
                request.preferredFormat()));
    }

    private void checkLength(TtsBackend backend, byte[] audio, Long maxLengthSeconds) {
        if (maxLengthSeconds == null) {
            return;
        }
        if (!backend.checkLength(audio, maxLengthSeconds)) {
            throw GatewayException.audioTooLong();
        }
    }

    private void storeInBackground(CacheFingerprint fingerprint, byte[] audio) {
        if (!audioCache.isEnabled()) {
            return;
        }
        try {
            cacheWriteExecutor.execute(() -> {
                try {
                    audioCache.store(fingerprint, audio);
                } catch (RuntimeException ex) {
                    log.error("Cache write failed fingerprint={} error={}", fingerprint, ex.getMessage(), ex);
                }
            });
        } catch (RejectedExecutionException ex) {
            log.warn("Cache write skipped, executor saturated fingerprint={}", fingerprint);
        }
    }

    private <T> T callBackend(TtsMode mode, BackendCall<T> call) {
        try {
            return call.call();
        } catch (GatewayException ex) {
            throw ex;
        } catch (RuntimeException ex) {
            throw GatewayException.backendUnavailable(mode, ex.getMessage(), ex);
        }
    }

    private String currentRequestId() {
        String requestId = MDC.get(RequestIdFilter.REQUEST_ID_MDC_KEY);
        if (requestId == null || requestId.isBlank()) {
            return "unknown";
        }
        return requestId;
    }

    @FunctionalInterface
    private interface BackendCall<T> {
        T call();
    }
}
