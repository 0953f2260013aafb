package com.example.ttsgateway.service.backend.gcloud;

import com.example.ttsgateway.error.GatewayException;
import com.example.ttsgateway.service.SynthesizedAudio;
import com.example.ttsgateway.service.TtsBackend;
import com.example.ttsgateway.service.TtsMode;
import com.example.ttsgateway.service.VoiceDescriptor;
import com.example.ttsgateway.service.audio.AudioFormat;
import com.example.ttsgateway.service.credential.AccessTokenProvider;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;

import java.util.ArrayList;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * Google Cloud Text-to-Speech over REST, authenticated with a self-signed service-account JWT.
 */
public class GoogleCloudTtsBackend implements TtsBackend {

    private static final Logger log = LoggerFactory.getLogger(GoogleCloudTtsBackend.class);
    private static final String VOICES_PATH = "/v1/voices";
    private static final String SYNTHESIZE_PATH = "/v1/text:synthesize";
    private static final double MAX_SPEAKING_RATE = 4.0;

    private final RestClient restClient;
    private final AccessTokenProvider tokenProvider;
    private final Object voicesLock = new Object();

    private volatile List<JsonNode> voices;

    public GoogleCloudTtsBackend(RestClient restClient, AccessTokenProvider tokenProvider) {
        this.restClient = restClient;
        this.tokenProvider = tokenProvider;
    }

    @Override
    public TtsMode mode() {
        return TtsMode.GCLOUD;
    }

    @Override
    public List<VoiceDescriptor> listVoices() {
        return voices().stream()
                .map(voice -> new VoiceDescriptor(
                        voice.path("name").asText(),
                        voice.path("languageCodes").path(0).asText(null)))
                .toList();
    }

    @Override
    public List<?> listRawVoices() {
        return voices();
    }

    @Override
    public boolean isValidVoice(String voice) {
        return voices().stream().anyMatch(known -> voice.equals(known.path("name").asText()));
    }

    @Override
    public OptionalDouble maxSpeakingRate() {
        return OptionalDouble.of(MAX_SPEAKING_RATE);
    }

    @Override
    public SynthesizedAudio synthesize(String text, String voice, Double speakingRate, String preferredFormat) {
        GoogleEncoding encoding = GoogleEncoding.fromHint(preferredFormat);
        Map<String, Object> body = synthesizeBody(text, voice, speakingRate, encoding);
        JsonNode response = call(() -> restClient.post()
                .uri(SYNTHESIZE_PATH)
                .headers(this::setAuthHeader)
                .contentType(MediaType.APPLICATION_JSON)
                .body(body)
                .retrieve()
                .body(JsonNode.class));

        String audioContent = response == null ? null : response.path("audioContent").asText(null);
        if (audioContent == null || audioContent.isBlank()) {
            throw GatewayException.backendUnavailable(mode(), "response has no audioContent", null);
        }
        try {
            byte[] audio = Base64.getDecoder().decode(audioContent);
            log.debug("gCloud synthesis finished voice={} encoding={} audio_bytes={}", voice, encoding, audio.length);
            return new SynthesizedAudio(audio, encoding.audioFormat().mediaType());
        } catch (IllegalArgumentException ex) {
            throw GatewayException.backendUnavailable(mode(), "audioContent is not valid base64", ex);
        }
    }

    @Override
    public MediaType contentType(String preferredFormat) {
        return GoogleEncoding.fromHint(preferredFormat).audioFormat().mediaType();
    }

    @Override
    public boolean checkLength(byte[] audio, long limitSeconds) {
        return true;
    }

    static String languageCode(String voice) {
        String[] parts = voice.split("-", 3);
        if (parts.length < 2) {
            return voice;
        }
        return parts[0] + "-" + parts[1];
    }

    private Map<String, Object> synthesizeBody(String text, String voice, Double speakingRate, GoogleEncoding encoding) {
        Map<String, Object> audioConfig = new LinkedHashMap<>();
        audioConfig.put("audioEncoding", encoding.name());
        if (speakingRate != null && speakingRate > 0) {
            audioConfig.put("speakingRate", speakingRate);
        }

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("input", Map.of("text", text));
        body.put("voice", Map.of("languageCode", languageCode(voice), "name", voice));
        body.put("audioConfig", audioConfig);
        return body;
    }

    private List<JsonNode> voices() {
        List<JsonNode> loaded = voices;
        if (loaded != null) {
            return loaded;
        }
        synchronized (voicesLock) {
            if (voices == null) {
                voices = fetchVoices();
                log.info("gCloud voices loaded count={}", voices.size());
            }
            return voices;
        }
    }

    private List<JsonNode> fetchVoices() {
        JsonNode response = call(() -> restClient.get()
                .uri(VOICES_PATH)
                .headers(this::setAuthHeader)
                .retrieve()
                .body(JsonNode.class));
        List<JsonNode> fetched = new ArrayList<>();
        if (response != null) {
            response.path("voices").forEach(fetched::add);
        }
        return List.copyOf(fetched);
    }

    private void setAuthHeader(HttpHeaders headers) {
        headers.setBearerAuth(tokenProvider.getToken());
    }

    private <T> T call(UpstreamCall<T> call) {
        try {
            return call.call();
        } catch (RestClientResponseException ex) {
            throw mapUpstreamException(ex);
        } catch (ResourceAccessException ex) {
            throw GatewayException.backendUnavailable(mode(), "upstream connection error", ex);
        }
    }

    private GatewayException mapUpstreamException(RestClientResponseException ex) {
        int status = ex.getStatusCode().value();
        if (isAuthFailure(ex)) {
            // the rejected token is dropped so the next request signs a fresh one
            log.warn("gCloud rejected bearer token status={}", status);
            tokenProvider.forceRefresh();
            return GatewayException.credentialError(mode(), "upstream rejected credentials with status " + status, ex);
        }
        return GatewayException.backendUnavailable(mode(), "upstream returned status " + status, ex);
    }

    private boolean isAuthFailure(RestClientResponseException ex) {
        int status = ex.getStatusCode().value();
        return status == HttpStatus.UNAUTHORIZED.value() || status == HttpStatus.FORBIDDEN.value();
    }

    @FunctionalInterface
    private interface UpstreamCall<T> {
        T call();
    }

    enum GoogleEncoding {
        OGG_OPUS(AudioFormat.OGG_OPUS),
        MP3(AudioFormat.MP3),
        LINEAR16(AudioFormat.WAV);

        private final AudioFormat audioFormat;

        GoogleEncoding(AudioFormat audioFormat) {
            this.audioFormat = audioFormat;
        }

        AudioFormat audioFormat() {
            return audioFormat;
        }

        static GoogleEncoding fromHint(String hint) {
            String normalized = AudioFormat.normalizeHint(hint);
            if (normalized == null) {
                return OGG_OPUS;
            }
            return switch (normalized) {
                case "ogg", "ogg_opus", "opus" -> OGG_OPUS;
                case "mp3" -> MP3;
                case "wav", "linear16" -> LINEAR16;
                default -> throw GatewayException.invalidParameter("Unsupported preferred_format for gCloud: " + hint);
            };
        }
    }
}
