package com.example.ttsgateway.service.credential;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Signing material of a cloud service account. Only used locally to sign tokens, never sent anywhere.
 */
public record ServiceAccountKey(String privateKeyPem, String clientEmail, String keyId) {

    @Override
    public String toString() {
        return "ServiceAccountKey[clientEmail=" + clientEmail + ", keyId=" + keyId + "]";
    }

    public static ServiceAccountKey fromFile(Path path, ObjectMapper objectMapper) {
        try {
            return fromJson(Files.readString(path, StandardCharsets.UTF_8), objectMapper);
        } catch (IOException ex) {
            throw new CredentialException("Unable to read service account key file " + path, ex);
        }
    }

    public static ServiceAccountKey fromJson(String json, ObjectMapper objectMapper) {
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (IOException ex) {
            throw new CredentialException("Service account key JSON is invalid", ex);
        }
        if (root == null || !root.isObject()) {
            throw new CredentialException("Service account key JSON is invalid");
        }
        String privateKey = trimToNull(root.path("private_key").asText(null));
        String clientEmail = trimToNull(root.path("client_email").asText(null));
        String keyId = trimToNull(root.path("private_key_id").asText(null));
        if (privateKey == null || clientEmail == null) {
            throw new CredentialException("Service account key JSON is missing private_key or client_email");
        }
        return new ServiceAccountKey(privateKey, clientEmail, keyId);
    }

    private static String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
