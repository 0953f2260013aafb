package com.example.ttsgateway.service.cache;

import java.util.Optional;

public class DisabledAudioCache implements AudioCache {

    @Override
    public Optional<byte[]> lookup(CacheFingerprint fingerprint) {
        return Optional.empty();
    }

    @Override
    public void store(CacheFingerprint fingerprint, byte[] audio) {
    }

    @Override
    public boolean isEnabled() {
        return false;
    }
}
