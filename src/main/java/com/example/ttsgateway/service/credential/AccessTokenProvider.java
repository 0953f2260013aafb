package com.example.ttsgateway.service.credential;

public interface AccessTokenProvider {

    /**
     * Returns a bearer token that was valid when read.
     */
    String getToken();

    /**
     * Replaces the current token regardless of its expiry, e.g. after the provider rejected it.
     */
    void forceRefresh();
}
