package com.example.ttsgateway.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "app.espeak")
public class EspeakProperties {

    private boolean enabled = true;

    @NotBlank
    private String executable = "espeak-ng";

    @Min(1)
    private long timeoutMs = 15000;

    @Min(1)
    private int maxStderrBytes = 8192;

    @Min(1)
    private Integer concurrencyMaxProcesses;

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getExecutable() {
        return executable;
    }

    public void setExecutable(String executable) {
        this.executable = executable;
    }

    public long getTimeoutMs() {
        return timeoutMs;
    }

    public void setTimeoutMs(long timeoutMs) {
        this.timeoutMs = timeoutMs;
    }

    public int getMaxStderrBytes() {
        return maxStderrBytes;
    }

    public void setMaxStderrBytes(int maxStderrBytes) {
        this.maxStderrBytes = maxStderrBytes;
    }

    public Integer getConcurrencyMaxProcesses() {
        return concurrencyMaxProcesses;
    }

    public void setConcurrencyMaxProcesses(Integer concurrencyMaxProcesses) {
        this.concurrencyMaxProcesses = concurrencyMaxProcesses;
    }
}
