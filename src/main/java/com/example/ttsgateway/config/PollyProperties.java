package com.example.ttsgateway.config;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "app.polly")
public class PollyProperties {

    private boolean enabled;

    @NotBlank
    private String region = "us-east-1";

    /**
     * Static credentials; when both are unset the default AWS credential chain is used.
     */
    private String accessKeyId;

    private String secretAccessKey;

    private boolean neuralEnabled = true;

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getRegion() {
        return region;
    }

    public void setRegion(String region) {
        this.region = region;
    }

    public String getAccessKeyId() {
        return accessKeyId;
    }

    public void setAccessKeyId(String accessKeyId) {
        this.accessKeyId = accessKeyId;
    }

    public String getSecretAccessKey() {
        return secretAccessKey;
    }

    public void setSecretAccessKey(String secretAccessKey) {
        this.secretAccessKey = secretAccessKey;
    }

    public boolean isNeuralEnabled() {
        return neuralEnabled;
    }

    public void setNeuralEnabled(boolean neuralEnabled) {
        this.neuralEnabled = neuralEnabled;
    }
}
