package com.example.ttsgateway.service.cache;

import java.util.Optional;

public interface KeyValueStore {

    Optional<byte[]> get(byte[] key);

    void set(byte[] key, byte[] value);
}
