package com.example.ttsgateway.service.cache;

/**
 * Symmetric encryption for cached audio at rest.
 */
public interface AudioCipher {

    String encrypt(byte[] plaintext);

    /**
     * @throws AudioCipherException if the token is malformed, tampered with, or sealed under another key
     */
    byte[] decrypt(String token);
}
