package com.example.ttsgateway.service.cache;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.Optional;

public class EncryptedAudioCache implements AudioCache {

    private static final Logger log = LoggerFactory.getLogger(EncryptedAudioCache.class);

    private final KeyValueStore store;
    private final AudioCipher cipher;

    public EncryptedAudioCache(KeyValueStore store, AudioCipher cipher) {
        this.store = store;
        this.cipher = cipher;
    }

    @Override
    public Optional<byte[]> lookup(CacheFingerprint fingerprint) {
        Optional<byte[]> sealed;
        try {
            sealed = store.get(fingerprint.bytes());
        } catch (RuntimeException ex) {
            log.warn("Cache lookup failed, treating as miss fingerprint={} error={}", fingerprint, ex.getMessage());
            return Optional.empty();
        }
        if (sealed.isEmpty()) {
            log.debug("Cache miss fingerprint={}", fingerprint);
            return Optional.empty();
        }
        try {
            byte[] audio = cipher.decrypt(new String(sealed.get(), StandardCharsets.UTF_8));
            log.debug("Cache hit fingerprint={} audio_bytes={}", fingerprint, audio.length);
            return Optional.of(audio);
        } catch (AudioCipherException ex) {
            log.warn("Cached entry could not be decrypted, treating as miss fingerprint={} error={}",
                    fingerprint, ex.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public void store(CacheFingerprint fingerprint, byte[] audio) {
        try {
            String sealed = cipher.encrypt(audio);
            store.set(fingerprint.bytes(), sealed.getBytes(StandardCharsets.UTF_8));
            log.debug("Cached audio fingerprint={} audio_bytes={}", fingerprint, audio.length);
        } catch (RuntimeException ex) {
            log.error("Failed to cache audio fingerprint={} error={}", fingerprint, ex.getMessage(), ex);
        }
    }

    @Override
    public boolean isEnabled() {
        return true;
    }
}
