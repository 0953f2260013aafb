package com.example.ttsgateway.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@Validated
@ConfigurationProperties(prefix = "app.gcloud")
public class GoogleCloudProperties {

    private boolean enabled;

    @NotBlank
    private String baseUrl = "https://texttospeech.googleapis.com";

    private String credentialsFile;

    private String credentialsJson;

    @NotBlank
    private String tokenAudience = "https://texttospeech.googleapis.com/";

    @NotNull
    private Duration tokenLease = Duration.ofHours(1);

    @NotNull
    private Duration tokenSkew = Duration.ofSeconds(60);

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    public String getCredentialsFile() {
        return credentialsFile;
    }

    public void setCredentialsFile(String credentialsFile) {
        this.credentialsFile = credentialsFile;
    }

    public String getCredentialsJson() {
        return credentialsJson;
    }

    public void setCredentialsJson(String credentialsJson) {
        this.credentialsJson = credentialsJson;
    }

    public String getTokenAudience() {
        return tokenAudience;
    }

    public void setTokenAudience(String tokenAudience) {
        this.tokenAudience = tokenAudience;
    }

    public Duration getTokenLease() {
        return tokenLease;
    }

    public void setTokenLease(Duration tokenLease) {
        this.tokenLease = tokenLease;
    }

    public Duration getTokenSkew() {
        return tokenSkew;
    }

    public void setTokenSkew(Duration tokenSkew) {
        this.tokenSkew = tokenSkew;
    }
}
