package com.example.ttsgateway.service.backend.polly;

import com.example.ttsgateway.config.PollyProperties;
import com.example.ttsgateway.error.GatewayException;
import com.example.ttsgateway.service.SynthesizedAudio;
import com.example.ttsgateway.service.TtsBackend;
import com.example.ttsgateway.service.TtsMode;
import com.example.ttsgateway.service.VoiceDescriptor;
import com.example.ttsgateway.service.audio.AudioFormat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.web.util.HtmlUtils;
import software.amazon.awssdk.core.ResponseBytes;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.polly.PollyClient;
import software.amazon.awssdk.services.polly.model.DescribeVoicesRequest;
import software.amazon.awssdk.services.polly.model.DescribeVoicesResponse;
import software.amazon.awssdk.services.polly.model.Engine;
import software.amazon.awssdk.services.polly.model.OutputFormat;
import software.amazon.awssdk.services.polly.model.SynthesizeSpeechRequest;
import software.amazon.awssdk.services.polly.model.SynthesizeSpeechResponse;
import software.amazon.awssdk.services.polly.model.TextType;
import software.amazon.awssdk.services.polly.model.Voice;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * AWS Polly. The speaking rate is a percentage applied through SSML prosody.
 */
public class PollyBackend implements TtsBackend {

    private static final Logger log = LoggerFactory.getLogger(PollyBackend.class);
    private static final double MAX_RATE_PERCENT = 500.0;

    private final PollyClient pollyClient;
    private final PollyProperties properties;
    private final Object voicesLock = new Object();

    private volatile List<PollyVoice> voices;

    public PollyBackend(PollyClient pollyClient, PollyProperties properties) {
        this.pollyClient = pollyClient;
        this.properties = properties;
    }

    @Override
    public TtsMode mode() {
        return TtsMode.POLLY;
    }

    @Override
    public List<VoiceDescriptor> listVoices() {
        return voices().stream()
                .map(voice -> new VoiceDescriptor(voice.id(), voice.languageCode()))
                .toList();
    }

    @Override
    public List<?> listRawVoices() {
        return voices();
    }

    @Override
    public boolean isValidVoice(String voice) {
        return findVoice(voice).isPresent();
    }

    @Override
    public OptionalDouble maxSpeakingRate() {
        return OptionalDouble.of(MAX_RATE_PERCENT);
    }

    @Override
    public SynthesizedAudio synthesize(String text, String voice, Double speakingRate, String preferredFormat) {
        PollyFormat format = PollyFormat.fromHint(preferredFormat);
        boolean ssml = speakingRate != null;
        SynthesizeSpeechRequest request = SynthesizeSpeechRequest.builder()
                .text(ssml ? toSsml(text, speakingRate) : text)
                .textType(ssml ? TextType.SSML : TextType.TEXT)
                .voiceId(voice)
                .engine(engineFor(voice))
                .outputFormat(format.outputFormat())
                .build();
        try {
            ResponseBytes<SynthesizeSpeechResponse> response = pollyClient.synthesizeSpeechAsBytes(request);
            byte[] audio = response.asByteArray();
            log.debug("Polly synthesis finished voice={} format={} audio_bytes={} request_characters={}",
                    voice, format, audio.length, response.response().requestCharacters());
            return new SynthesizedAudio(audio, format.audioFormat().mediaType());
        } catch (SdkException ex) {
            throw GatewayException.backendUnavailable(mode(), ex.getMessage(), ex);
        }
    }

    @Override
    public MediaType contentType(String preferredFormat) {
        return PollyFormat.fromHint(preferredFormat).audioFormat().mediaType();
    }

    @Override
    public boolean checkLength(byte[] audio, long limitSeconds) {
        return true;
    }

    static String toSsml(String text, double speakingRate) {
        long percent = (long) speakingRate;
        return "<speak><prosody rate=\"" + percent + "%\">" + HtmlUtils.htmlEscape(text, "UTF-8") + "</prosody></speak>";
    }

    private Engine engineFor(String voice) {
        boolean neural = properties.isNeuralEnabled()
                && findVoice(voice).map(PollyVoice::supportsNeural).orElse(false);
        return neural ? Engine.NEURAL : Engine.STANDARD;
    }

    private Optional<PollyVoice> findVoice(String voiceId) {
        return voices().stream()
                .filter(voice -> voice.id().equals(voiceId))
                .findFirst();
    }

    private List<PollyVoice> voices() {
        List<PollyVoice> loaded = voices;
        if (loaded != null) {
            return loaded;
        }
        synchronized (voicesLock) {
            if (voices == null) {
                voices = describeVoices();
                log.info("Polly voices loaded count={}", voices.size());
            }
            return voices;
        }
    }

    private List<PollyVoice> describeVoices() {
        List<PollyVoice> collected = new ArrayList<>();
        String nextToken = null;
        try {
            do {
                DescribeVoicesResponse response = pollyClient.describeVoices(DescribeVoicesRequest.builder()
                        .nextToken(nextToken)
                        .build());
                for (Voice voice : response.voices()) {
                    collected.add(new PollyVoice(
                            voice.idAsString(),
                            voice.name(),
                            voice.genderAsString(),
                            voice.languageCodeAsString(),
                            voice.languageName(),
                            voice.supportedEnginesAsStrings()));
                }
                nextToken = response.nextToken();
            } while (nextToken != null && !nextToken.isBlank());
        } catch (SdkException ex) {
            throw GatewayException.backendUnavailable(mode(), "unable to describe voices: " + ex.getMessage(), ex);
        }
        return List.copyOf(collected);
    }

    enum PollyFormat {
        MP3(OutputFormat.MP3, AudioFormat.MP3),
        OGG_VORBIS(OutputFormat.OGG_VORBIS, AudioFormat.OGG_VORBIS),
        PCM(OutputFormat.PCM, AudioFormat.PCM);

        private final OutputFormat outputFormat;
        private final AudioFormat audioFormat;

        PollyFormat(OutputFormat outputFormat, AudioFormat audioFormat) {
            this.outputFormat = outputFormat;
            this.audioFormat = audioFormat;
        }

        OutputFormat outputFormat() {
            return outputFormat;
        }

        AudioFormat audioFormat() {
            return audioFormat;
        }

        static PollyFormat fromHint(String hint) {
            String normalized = AudioFormat.normalizeHint(hint);
            if (normalized == null) {
                return OGG_VORBIS;
            }
            return switch (normalized) {
                case "mp3" -> MP3;
                case "ogg", "ogg_vorbis" -> OGG_VORBIS;
                case "pcm" -> PCM;
                default -> throw GatewayException.invalidParameter("Unsupported preferred_format for Polly: " + hint);
            };
        }
    }
}
