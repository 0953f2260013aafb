package com.example.ttsgateway.service.cache;

import javax.crypto.Cipher;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.nio.ByteBuffer;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Base64;

/**
 * AES-256-GCM. Tokens are {@code base64url(version | iv | ciphertext+tag)}.
 */
public class AesGcmAudioCipher implements AudioCipher {

    private static final byte VERSION = 1;
    private static final int KEY_BYTES = 32;
    private static final int IV_BYTES = 12;
    private static final int TAG_BITS = 128;
    private static final String TRANSFORMATION = "AES/GCM/NoPadding";

    private final SecretKeySpec key;
    private final SecureRandom random;

    public AesGcmAudioCipher(byte[] key) {
        this(key, new SecureRandom());
    }

    AesGcmAudioCipher(byte[] key, SecureRandom random) {
        if (key == null || key.length != KEY_BYTES) {
            throw new IllegalArgumentException("Cache key must be exactly " + KEY_BYTES + " bytes");
        }
        this.key = new SecretKeySpec(key.clone(), "AES");
        this.random = random;
    }

    /**
     * Builds a cipher from a base64 (standard or URL-safe) encoded 32-byte key.
     */
    public static AesGcmAudioCipher fromBase64Key(String encodedKey) {
        if (encodedKey == null || encodedKey.isBlank()) {
            throw new IllegalArgumentException("Cache key is not set");
        }
        String normalized = encodedKey.trim().replace('-', '+').replace('_', '/');
        byte[] decoded;
        try {
            decoded = Base64.getDecoder().decode(normalized);
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Cache key is not valid base64", ex);
        }
        return new AesGcmAudioCipher(decoded);
    }

    @Override
    public String encrypt(byte[] plaintext) {
        byte[] iv = new byte[IV_BYTES];
        random.nextBytes(iv);
        try {
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.ENCRYPT_MODE, key, new GCMParameterSpec(TAG_BITS, iv));
            cipher.updateAAD(new byte[]{VERSION});
            byte[] sealed = cipher.doFinal(plaintext);
            ByteBuffer token = ByteBuffer.allocate(1 + IV_BYTES + sealed.length);
            token.put(VERSION).put(iv).put(sealed);
            return Base64.getUrlEncoder().withoutPadding().encodeToString(token.array());
        } catch (GeneralSecurityException ex) {
            throw new AudioCipherException("Unable to encrypt audio", ex);
        }
    }

    @Override
    public byte[] decrypt(String token) {
        if (token == null || token.isEmpty()) {
            throw new AudioCipherException("Token is empty");
        }
        byte[] raw;
        try {
            raw = Base64.getUrlDecoder().decode(token);
        } catch (IllegalArgumentException ex) {
            throw new AudioCipherException("Token is not valid base64url", ex);
        }
        if (raw.length < 1 + IV_BYTES + TAG_BITS / 8) {
            throw new AudioCipherException("Token is truncated");
        }
        if (raw[0] != VERSION) {
            throw new AudioCipherException("Unsupported token version " + raw[0]);
        }
        try {
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.DECRYPT_MODE, key, new GCMParameterSpec(TAG_BITS, raw, 1, IV_BYTES));
            cipher.updateAAD(new byte[]{VERSION});
            return cipher.doFinal(raw, 1 + IV_BYTES, raw.length - 1 - IV_BYTES);
        } catch (GeneralSecurityException ex) {
            throw new AudioCipherException("Unable to decrypt audio", ex);
        }
    }
}
