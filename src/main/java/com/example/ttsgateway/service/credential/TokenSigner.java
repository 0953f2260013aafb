package com.example.ttsgateway.service.credential;

import java.time.Instant;

@FunctionalInterface
public interface TokenSigner {

    /**
     * Signs a fresh token whose lease starts at {@code issuedAt}.
     *
     * @throws CredentialException if the signing material cannot be used
     */
    CredentialToken sign(Instant issuedAt);
}
