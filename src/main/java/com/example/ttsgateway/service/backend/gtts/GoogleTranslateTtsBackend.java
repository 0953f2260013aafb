package com.example.ttsgateway.service.backend.gtts;

import com.example.ttsgateway.config.GoogleTranslateProperties;
import com.example.ttsgateway.error.GatewayException;
import com.example.ttsgateway.service.SynthesizedAudio;
import com.example.ttsgateway.service.TtsBackend;
import com.example.ttsgateway.service.TtsMode;
import com.example.ttsgateway.service.VoiceDescriptor;
import com.example.ttsgateway.service.audio.AudioFormat;
import com.example.ttsgateway.service.audio.Mp3Duration;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.io.ClassPathResource;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * Free web TTS behind the translate endpoint. Voices are language codes; the rate and format hints are ignored.
 */
@Component
@ConditionalOnProperty(prefix = "app.gtts", name = "enabled", havingValue = "true", matchIfMissing = true)
public class GoogleTranslateTtsBackend implements TtsBackend {

    private static final Logger log = LoggerFactory.getLogger(GoogleTranslateTtsBackend.class);
    private static final String VOICES_RESOURCE = "voices/gtts-voices.json";
    private static final String TTS_PATH = "/translate_tts";
    private static final TypeReference<LinkedHashMap<String, String>> VOICE_MAP = new TypeReference<>() {
    };

    private final RestClient restClient;
    private final GoogleTranslateProperties properties;
    private final Map<String, String> voices;

    public GoogleTranslateTtsBackend(@Qualifier("gttsRestClient") RestClient restClient,
                                     GoogleTranslateProperties properties,
                                     ObjectMapper objectMapper) {
        this.restClient = restClient;
        this.properties = properties;
        this.voices = loadVoices(objectMapper);
    }

    @Override
    public TtsMode mode() {
        return TtsMode.GTTS;
    }

    @Override
    public List<VoiceDescriptor> listVoices() {
        return voices.entrySet().stream()
                .map(entry -> new VoiceDescriptor(entry.getKey(), entry.getValue()))
                .toList();
    }

    @Override
    public List<?> listRawVoices() {
        return List.of(voices);
    }

    @Override
    public boolean isValidVoice(String voice) {
        return voices.containsKey(voice);
    }

    @Override
    public OptionalDouble maxSpeakingRate() {
        return OptionalDouble.empty();
    }

    @Override
    public SynthesizedAudio synthesize(String text, String voice, Double speakingRate, String preferredFormat) {
        List<String> chunks = splitText(text, properties.getMaxChunkLength());
        ByteArrayOutputStream audio = new ByteArrayOutputStream();
        for (int idx = 0; idx < chunks.size(); idx++) {
            audio.writeBytes(fetchChunk(chunks.get(idx), voice, idx, chunks.size()));
        }
        log.debug("gTTS synthesis finished voice={} chunks={} audio_bytes={}", voice, chunks.size(), audio.size());
        return new SynthesizedAudio(audio.toByteArray(), AudioFormat.MP3.mediaType());
    }

    @Override
    public MediaType contentType(String preferredFormat) {
        return AudioFormat.MP3.mediaType();
    }

    @Override
    public boolean checkLength(byte[] audio, long limitSeconds) {
        return Mp3Duration.of(audio)
                .map(duration -> duration.getSeconds() < limitSeconds)
                .orElse(true);
    }

    private byte[] fetchChunk(String chunk, String voice, int idx, int total) {
        Map<String, Object> params = Map.of(
                "tl", voice,
                "q", chunk,
                "total", total,
                "idx", idx,
                "textlen", chunk.length()
        );
        try {
            byte[] body = restClient.get()
                    .uri(builder -> builder.path(TTS_PATH)
                            .queryParam("ie", "UTF-8")
                            .queryParam("client", "tw-ob")
                            .queryParam("tl", "{tl}")
                            .queryParam("q", "{q}")
                            .queryParam("total", "{total}")
                            .queryParam("idx", "{idx}")
                            .queryParam("textlen", "{textlen}")
                            .build(params))
                    .header(HttpHeaders.USER_AGENT, "Mozilla/5.0")
                    .retrieve()
                    .body(byte[].class);
            return body == null ? new byte[0] : body;
        } catch (RestClientResponseException ex) {
            throw GatewayException.backendUnavailable(mode(),
                    "upstream returned status " + ex.getStatusCode().value(), ex);
        } catch (ResourceAccessException ex) {
            throw GatewayException.backendUnavailable(mode(), "upstream connection error", ex);
        }
    }

    /**
     * Splits on whitespace into chunks of at most {@code maxLength} characters; longer words are cut.
     */
    static List<String> splitText(String text, int maxLength) {
        List<String> chunks = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        for (String word : text.trim().split("\\s+")) {
            if (word.isEmpty()) {
                continue;
            }
            while (word.length() > maxLength) {
                if (!current.isEmpty()) {
                    chunks.add(current.toString());
                    current.setLength(0);
                }
                chunks.add(word.substring(0, maxLength));
                word = word.substring(maxLength);
            }
            int needed = current.isEmpty() ? word.length() : current.length() + 1 + word.length();
            if (needed > maxLength) {
                chunks.add(current.toString());
                current.setLength(0);
            }
            if (!current.isEmpty()) {
                current.append(' ');
            }
            current.append(word);
        }
        if (!current.isEmpty()) {
            chunks.add(current.toString());
        }
        return chunks;
    }

    private static Map<String, String> loadVoices(ObjectMapper objectMapper) {
        try (InputStream in = new ClassPathResource(VOICES_RESOURCE).getInputStream()) {
            return Collections.unmodifiableMap(objectMapper.readValue(in, VOICE_MAP));
        } catch (IOException ex) {
            throw new IllegalStateException("Unable to load " + VOICES_RESOURCE, ex);
        }
    }
}
