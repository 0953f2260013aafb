package com.example.ttsgateway.service;

import com.example.ttsgateway.error.GatewayException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Backends available to this process, keyed by mode. Built once at startup from whichever
 * providers are configured; an unconfigured provider is simply absent.
 */
public class BackendRegistry {

    private static final Logger log = LoggerFactory.getLogger(BackendRegistry.class);

    private final Map<TtsMode, TtsBackend> backends;

    public BackendRegistry(List<TtsBackend> backends) {
        Map<TtsMode, TtsBackend> byMode = new EnumMap<>(TtsMode.class);
        for (TtsBackend backend : backends) {
            TtsBackend previous = byMode.put(backend.mode(), backend);
            if (previous != null) {
                throw new IllegalStateException("Duplicate backend for mode " + backend.mode());
            }
        }
        this.backends = Collections.unmodifiableMap(byMode);
        log.info("TTS backends registered modes={}", this.backends.keySet());
    }

    public TtsBackend require(TtsMode mode) {
        TtsBackend backend = backends.get(mode);
        if (backend == null) {
            throw GatewayException.modeUnavailable(mode);
        }
        return backend;
    }

    public List<TtsMode> modes() {
        return List.copyOf(backends.keySet());
    }
}
