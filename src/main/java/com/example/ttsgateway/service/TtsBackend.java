package com.example.ttsgateway.service;

import org.springframework.http.MediaType;

import java.util.List;
import java.util.OptionalDouble;

/**
 * Uniform capability set every text-to-speech provider is wrapped behind.
 * <p>
 * Implementations must be safe for unlimited concurrent use and must not retry failed provider calls
 * on their own. Provider failures surface as {@link com.example.ttsgateway.error.GatewayException}s with
 * {@code BACKEND_UNAVAILABLE} or {@code CREDENTIAL_ERROR} codes.
 */
public interface TtsBackend {

    TtsMode mode();

    /**
     * Voices in the normalized {@code name/language} projection.
     */
    List<VoiceDescriptor> listVoices();

    /**
     * Voices as the provider describes them. Elements are serialized to JSON as-is.
     */
    List<?> listRawVoices();

    /**
     * May require a network round trip for providers whose catalog is remote.
     */
    boolean isValidVoice(String voice);

    /**
     * Upper bound for the speaking rate, or empty when the provider accepts any rate.
     */
    OptionalDouble maxSpeakingRate();

    SynthesizedAudio synthesize(String text, String voice, Double speakingRate, String preferredFormat);

    /**
     * Content type of audio produced for the given format hint, used for cached audio.
     */
    MediaType contentType(String preferredFormat);

    /**
     * Returns {@code false} when the audio is known to be at least {@code limitSeconds} long.
     */
    boolean checkLength(byte[] audio, long limitSeconds);
}
