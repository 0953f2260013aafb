package com.example.ttsgateway.error;

import com.example.ttsgateway.service.TtsMode;
import org.springframework.http.HttpStatus;

import java.util.Locale;

public class GatewayException extends RuntimeException {

    private final ErrorCode errorCode;
    private final TtsMode provider;

    public GatewayException(ErrorCode errorCode, String message) {
        this(errorCode, message, null, null);
    }

    public GatewayException(ErrorCode errorCode, String message, TtsMode provider, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.provider = provider;
    }

    public static GatewayException invalidSpeakingRate(double rate) {
        return new GatewayException(ErrorCode.INVALID_SPEAKING_RATE,
                "Invalid speaking rate: " + formatRate(rate));
    }

    public static GatewayException unknownVoice(String voice) {
        return new GatewayException(ErrorCode.UNKNOWN_VOICE, "Unknown voice: " + voice);
    }

    public static GatewayException audioTooLong() {
        return new GatewayException(ErrorCode.AUDIO_TOO_LONG, "Max length exceeded!");
    }

    public static GatewayException unauthorized() {
        return new GatewayException(ErrorCode.UNAUTHORIZED, "Unauthorized request");
    }

    public static GatewayException modeUnavailable(TtsMode mode) {
        return new GatewayException(ErrorCode.MODE_UNAVAILABLE, "Mode not available: " + mode.displayName());
    }

    public static GatewayException invalidParameter(String message) {
        return new GatewayException(ErrorCode.INVALID_PARAMETER, message);
    }

    public static GatewayException backendUnavailable(TtsMode provider, String message, Throwable cause) {
        return new GatewayException(ErrorCode.BACKEND_UNAVAILABLE,
                provider.displayName() + " backend unavailable: " + message, provider, cause);
    }

    public static GatewayException credentialError(TtsMode provider, String message, Throwable cause) {
        return new GatewayException(ErrorCode.CREDENTIAL_ERROR,
                provider.displayName() + " credential error: " + message, provider, cause);
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }

    public HttpStatus getStatus() {
        return errorCode.status();
    }

    public TtsMode getProvider() {
        return provider;
    }

    public boolean isClientCaused() {
        return errorCode.clientVisible();
    }

    private static String formatRate(double rate) {
        if (rate == Math.rint(rate) && !Double.isInfinite(rate)) {
            return String.format(Locale.ROOT, "%.1f", rate);
        }
        return Double.toString(rate);
    }
}
