package com.example.ttsgateway.service.backend.espeak;

import com.example.ttsgateway.config.EspeakProperties;
import com.example.ttsgateway.error.GatewayException;
import com.example.ttsgateway.service.SynthesizedAudio;
import com.example.ttsgateway.service.TtsBackend;
import com.example.ttsgateway.service.TtsMode;
import com.example.ttsgateway.service.VoiceDescriptor;
import com.example.ttsgateway.service.audio.AudioFormat;
import com.example.ttsgateway.service.audio.WavDuration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.OptionalDouble;

/**
 * Local synthesizer run as a child process per request. Output is always WAV.
 */
@Component
@ConditionalOnProperty(prefix = "app.espeak", name = "enabled", havingValue = "true", matchIfMissing = true)
public class EspeakBackend implements TtsBackend {

    private static final Logger log = LoggerFactory.getLogger(EspeakBackend.class);
    private static final double MAX_WORDS_PER_MINUTE = 400.0;

    private final EspeakRunner runner;
    private final Object voicesLock = new Object();

    private volatile List<EspeakVoice> voices;

    @Autowired
    public EspeakBackend(EspeakProperties properties) {
        this(new ProcessEspeakRunner(properties));
    }

    EspeakBackend(EspeakRunner runner) {
        this.runner = runner;
    }

    @Override
    public TtsMode mode() {
        return TtsMode.ESPEAK;
    }

    @Override
    public List<VoiceDescriptor> listVoices() {
        return voices().stream()
                .map(voice -> new VoiceDescriptor(voice.language(), voice.name()))
                .toList();
    }

    @Override
    public List<?> listRawVoices() {
        return voices();
    }

    @Override
    public boolean isValidVoice(String voice) {
        return voices().stream().anyMatch(known -> known.language().equals(voice));
    }

    @Override
    public OptionalDouble maxSpeakingRate() {
        return OptionalDouble.of(MAX_WORDS_PER_MINUTE);
    }

    @Override
    public SynthesizedAudio synthesize(String text, String voice, Double speakingRate, String preferredFormat) {
        List<String> args = new ArrayList<>();
        args.add("--stdout");
        args.add("--stdin");
        args.add("-v");
        args.add(voice);
        int wordsPerMinute = speakingRate == null ? 0 : speakingRate.intValue();
        if (wordsPerMinute > 0) {
            args.add("-s");
            args.add(String.valueOf(wordsPerMinute));
        }
        byte[] audio = run(args, text.getBytes(StandardCharsets.UTF_8));
        log.debug("eSpeak synthesis finished voice={} words_per_minute={} audio_bytes={}", voice, wordsPerMinute, audio.length);
        return new SynthesizedAudio(audio, AudioFormat.WAV.mediaType());
    }

    @Override
    public MediaType contentType(String preferredFormat) {
        return AudioFormat.WAV.mediaType();
    }

    @Override
    public boolean checkLength(byte[] audio, long limitSeconds) {
        return WavDuration.of(audio)
                .map(duration -> duration.getSeconds() < limitSeconds)
                .orElse(true);
    }

    private List<EspeakVoice> voices() {
        List<EspeakVoice> loaded = voices;
        if (loaded != null) {
            return loaded;
        }
        synchronized (voicesLock) {
            if (voices == null) {
                String listing = new String(run(List.of("--voices"), null), StandardCharsets.UTF_8);
                voices = parseVoices(listing);
                log.info("eSpeak voices loaded count={}", voices.size());
            }
            return voices;
        }
    }

    private byte[] run(List<String> args, byte[] stdin) {
        try {
            return runner.run(args, stdin);
        } catch (EspeakException ex) {
            throw GatewayException.backendUnavailable(mode(), ex.getMessage(), ex);
        }
    }

    /**
     * Parses the table printed by {@code --voices}:
     * {@code Pty Language Age/Gender VoiceName File Other Languages}.
     */
    static List<EspeakVoice> parseVoices(String listing) {
        List<EspeakVoice> parsed = new ArrayList<>();
        for (String line : listing.split("\\R")) {
            String trimmed = line.trim();
            if (trimmed.isEmpty() || trimmed.startsWith("Pty")) {
                continue;
            }
            String[] columns = trimmed.split("\\s+");
            if (columns.length < 5) {
                continue;
            }
            int priority;
            try {
                priority = Integer.parseInt(columns[0]);
            } catch (NumberFormatException ex) {
                continue;
            }
            String ageGender = columns[2];
            int slash = ageGender.indexOf('/');
            String gender = slash >= 0 ? ageGender.substring(slash + 1) : ageGender;
            String name = columns[3].replace('_', ' ');
            parsed.add(new EspeakVoice(priority, columns[1], gender, name, columns[4]));
        }
        return List.copyOf(parsed);
    }
}
