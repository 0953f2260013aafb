package com.example.ttsgateway.service.credential;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.PrivateKey;
import java.security.Signature;
import java.time.Duration;
import java.time.Instant;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Signs self-issued RS256 JWTs that the cloud provider accepts directly as bearer tokens,
 * so no token exchange round trip is needed.
 */
public class ServiceAccountJwtSigner implements TokenSigner {

    private final ServiceAccountKey key;
    private final PrivateKey privateKey;
    private final String audience;
    private final Duration lease;
    private final ObjectMapper objectMapper;

    public ServiceAccountJwtSigner(ServiceAccountKey key, String audience, Duration lease, ObjectMapper objectMapper) {
        this.key = key;
        this.privateKey = PemPrivateKeys.readRsaPrivateKey(key.privateKeyPem());
        this.audience = audience;
        this.lease = lease;
        this.objectMapper = objectMapper;
    }

    @Override
    public CredentialToken sign(Instant issuedAt) {
        Instant expiresAt = issuedAt.plus(lease);

        Map<String, Object> header = new LinkedHashMap<>();
        header.put("alg", "RS256");
        header.put("typ", "JWT");
        if (key.keyId() != null) {
            header.put("kid", key.keyId());
        }

        Map<String, Object> claims = new LinkedHashMap<>();
        claims.put("iss", key.clientEmail());
        claims.put("sub", key.clientEmail());
        claims.put("aud", audience);
        claims.put("iat", issuedAt.getEpochSecond());
        claims.put("exp", expiresAt.getEpochSecond());

        String signingInput = base64Url(toJson(header)) + "." + base64Url(toJson(claims));
        try {
            Signature signature = Signature.getInstance("SHA256withRSA");
            signature.initSign(privateKey);
            signature.update(signingInput.getBytes(StandardCharsets.US_ASCII));
            return new CredentialToken(signingInput + "." + base64Url(signature.sign()), expiresAt);
        } catch (GeneralSecurityException ex) {
            throw new CredentialException("Failed to sign service account JWT", ex);
        }
    }

    private byte[] toJson(Map<String, Object> payload) {
        try {
            return objectMapper.writeValueAsBytes(payload);
        } catch (JsonProcessingException ex) {
            throw new CredentialException("Unable to build JWT payload", ex);
        }
    }

    private static String base64Url(byte[] bytes) {
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }
}
