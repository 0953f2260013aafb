package com.example.ttsgateway.service.credential;

import com.example.ttsgateway.error.GatewayException;
import com.example.ttsgateway.service.TtsMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Owns the current bearer token of one backend and refreshes it lazily when a caller finds it expired.
 * <p>
 * Reads are lock-free. The first caller to observe expiry signs a replacement while holding the refresh
 * lock; callers arriving meanwhile block on the lock and then reuse the token it installed, so each expiry
 * window produces at most one refresh. The lock never covers network I/O.
 */
public class SelfSignedTokenProvider implements AccessTokenProvider {

    private static final Logger log = LoggerFactory.getLogger(SelfSignedTokenProvider.class);

    private final TtsMode owner;
    private final TokenSigner signer;
    private final Clock clock;
    private final Duration skew;
    private final ReentrantLock refreshLock = new ReentrantLock();

    private volatile CredentialToken current;

    public SelfSignedTokenProvider(TtsMode owner, TokenSigner signer, Clock clock, Duration skew) {
        this.owner = owner;
        this.signer = signer;
        this.clock = clock;
        this.skew = skew == null ? Duration.ZERO : skew;
    }

    @Override
    public String getToken() {
        CredentialToken snapshot = current;
        if (snapshot != null && !snapshot.isExpired(clock.instant(), skew)) {
            return snapshot.value();
        }
        return refreshSingleflight(false);
    }

    @Override
    public void forceRefresh() {
        refreshSingleflight(true);
    }

    CredentialToken currentToken() {
        return current;
    }

    private String refreshSingleflight(boolean force) {
        refreshLock.lock();
        try {
            Instant now = clock.instant();
            CredentialToken snapshot = current;
            if (!force && snapshot != null && !snapshot.isExpired(now, skew)) {
                return snapshot.value();
            }
            CredentialToken refreshed = sign(now);
            current = refreshed;
            log.info("Credential token refreshed backend={} expires_at={} forced={}",
                    owner, refreshed.expiresAt(), force);
            return refreshed.value();
        } finally {
            refreshLock.unlock();
        }
    }

    private CredentialToken sign(Instant now) {
        try {
            CredentialToken token = signer.sign(now);
            if (token == null || token.value() == null || token.value().isBlank()) {
                throw new CredentialException("Signer returned an empty token");
            }
            return token;
        } catch (CredentialException ex) {
            throw GatewayException.credentialError(owner, ex.getMessage(), ex);
        }
    }
}
