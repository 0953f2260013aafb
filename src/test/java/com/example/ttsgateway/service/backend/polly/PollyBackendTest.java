package com.example.ttsgateway.service.backend.polly;

import com.example.ttsgateway.config.PollyProperties;
import com.example.ttsgateway.error.ErrorCode;
import com.example.ttsgateway.error.GatewayException;
import com.example.ttsgateway.service.SynthesizedAudio;
import com.example.ttsgateway.service.VoiceDescriptor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.http.MediaType;
import software.amazon.awssdk.core.ResponseBytes;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.services.polly.PollyClient;
import software.amazon.awssdk.services.polly.model.DescribeVoicesRequest;
import software.amazon.awssdk.services.polly.model.DescribeVoicesResponse;
import software.amazon.awssdk.services.polly.model.Engine;
import software.amazon.awssdk.services.polly.model.OutputFormat;
import software.amazon.awssdk.services.polly.model.SynthesizeSpeechRequest;
import software.amazon.awssdk.services.polly.model.SynthesizeSpeechResponse;
import software.amazon.awssdk.services.polly.model.TextType;
import software.amazon.awssdk.services.polly.model.Voice;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class PollyBackendTest {

    private PollyClient pollyClient;
    private PollyProperties properties;
    private PollyBackend backend;

    @BeforeEach
    void setUp() {
        pollyClient = mock(PollyClient.class);
        properties = new PollyProperties();
        backend = new PollyBackend(pollyClient, properties);

        when(pollyClient.describeVoices(any(DescribeVoicesRequest.class)))
                .thenReturn(DescribeVoicesResponse.builder()
                        .voices(voice("Joanna", "en-US", "standard", "neural"))
                        .nextToken("page-2")
                        .build())
                .thenReturn(DescribeVoicesResponse.builder()
                        .voices(voice("Celine", "fr-FR", "standard"))
                        .build());
    }

    @Test
    void collectsAllVoicePagesOnce() {
        assertThat(backend.isValidVoice("Joanna")).isTrue();
        assertThat(backend.isValidVoice("Celine")).isTrue();
        assertThat(backend.isValidVoice("joanna")).isFalse();
        assertThat(backend.listVoices()).containsExactly(
                new VoiceDescriptor("Joanna", "en-US"),
                new VoiceDescriptor("Celine", "fr-FR"));

        verify(pollyClient, times(2)).describeVoices(any(DescribeVoicesRequest.class));
    }

    @Test
    void sendsSsmlWithProsodyRateAndNeuralEngine() {
        stubSynthesis(new byte[]{4, 5});

        SynthesizedAudio audio = backend.synthesize("Tom & Jerry", "Joanna", 150.0, null);

        assertThat(audio.bytes()).containsExactly(4, 5);
        assertThat(audio.contentType()).isEqualTo(MediaType.valueOf("audio/ogg"));

        SynthesizeSpeechRequest request = capturedRequest();
        assertThat(request.textType()).isEqualTo(TextType.SSML);
        assertThat(request.text()).isEqualTo("<speak><prosody rate=\"150%\">Tom &amp; Jerry</prosody></speak>");
        assertThat(request.engine()).isEqualTo(Engine.NEURAL);
        assertThat(request.outputFormat()).isEqualTo(OutputFormat.OGG_VORBIS);
    }

    @Test
    void sendsPlainTextWithStandardEngineWhenNeuralUnsupported() {
        stubSynthesis(new byte[]{1});

        SynthesizedAudio audio = backend.synthesize("Bonjour", "Celine", null, "mp3");

        SynthesizeSpeechRequest request = capturedRequest();
        assertThat(request.textType()).isEqualTo(TextType.TEXT);
        assertThat(request.text()).isEqualTo("Bonjour");
        assertThat(request.engine()).isEqualTo(Engine.STANDARD);
        assertThat(request.outputFormat()).isEqualTo(OutputFormat.MP3);
        assertThat(audio.contentType()).isEqualTo(MediaType.valueOf("audio/mpeg"));
    }

    @Test
    void honoursNeuralSwitch() {
        properties.setNeuralEnabled(false);
        stubSynthesis(new byte[]{1});

        backend.synthesize("Hello", "Joanna", null, null);

        assertThat(capturedRequest().engine()).isEqualTo(Engine.STANDARD);
    }

    @Test
    void rejectsUnsupportedFormat() {
        assertThatThrownBy(() -> backend.synthesize("Hello", "Joanna", null, "flac"))
                .isInstanceOf(GatewayException.class)
                .satisfies(ex -> assertThat(((GatewayException) ex).getErrorCode())
                        .isEqualTo(ErrorCode.INVALID_PARAMETER));
    }

    @Test
    void mapsSdkFailureToBackendUnavailable() {
        when(pollyClient.synthesizeSpeechAsBytes(any(SynthesizeSpeechRequest.class)))
                .thenThrow(SdkClientException.create("connection reset"));

        assertThatThrownBy(() -> backend.synthesize("Hello", "Joanna", null, null))
                .isInstanceOf(GatewayException.class)
                .satisfies(ex -> assertThat(((GatewayException) ex).getErrorCode())
                        .isEqualTo(ErrorCode.BACKEND_UNAVAILABLE));
    }

    @Test
    void advertisesMaxRateOf500() {
        assertThat(backend.maxSpeakingRate()).hasValue(500.0);
        assertThat(backend.checkLength(new byte[0], 1)).isTrue();
    }

    private void stubSynthesis(byte[] audio) {
        when(pollyClient.synthesizeSpeechAsBytes(any(SynthesizeSpeechRequest.class)))
                .thenReturn(ResponseBytes.fromByteArray(
                        SynthesizeSpeechResponse.builder().requestCharacters(audio.length).build(), audio));
    }

    private SynthesizeSpeechRequest capturedRequest() {
        ArgumentCaptor<SynthesizeSpeechRequest> captor = ArgumentCaptor.forClass(SynthesizeSpeechRequest.class);
        verify(pollyClient).synthesizeSpeechAsBytes(captor.capture());
        return captor.getValue();
    }

    private static Voice voice(String id, String languageCode, String... engines) {
        return Voice.builder()
                .id(id)
                .name(id)
                .gender("Female")
                .languageCode(languageCode)
                .languageName(languageCode)
                .supportedEnginesWithStrings(engines)
                .build();
    }
}
