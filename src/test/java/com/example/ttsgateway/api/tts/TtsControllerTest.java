package com.example.ttsgateway.api.tts;

import com.example.ttsgateway.config.GatewayProperties;
import com.example.ttsgateway.error.GatewayException;
import com.example.ttsgateway.service.SynthesisRequest;
import com.example.ttsgateway.service.SynthesizedAudio;
import com.example.ttsgateway.service.TtsMode;
import com.example.ttsgateway.service.TtsService;
import com.example.ttsgateway.service.VoiceDescriptor;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(TtsController.class)
class TtsControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private TtsService ttsService;

    @Test
    void returnsAudioWithBackendContentType() throws Exception {
        given(ttsService.dispatch(any())).willReturn(
                new SynthesizedAudio(new byte[]{1, 2, 3}, MediaType.valueOf("audio/opus")));

        mockMvc.perform(get("/tts")
                        .param("text", "Hello")
                        .param("mode", "gCloud")
                        .param("lang", "en-US-Wavenet-A")
                        .param("speaking_rate", "1.5")
                        .param("max_length", "30")
                        .param("preferred_format", "ogg"))
                .andExpect(status().isOk())
                .andExpect(header().string("Content-Type", "audio/opus"))
                .andExpect(content().bytes(new byte[]{1, 2, 3}));

        ArgumentCaptor<SynthesisRequest> captor = ArgumentCaptor.forClass(SynthesisRequest.class);
        verify(ttsService).dispatch(captor.capture());
        assertThat(captor.getValue()).isEqualTo(
                new SynthesisRequest("Hello", TtsMode.GCLOUD, "en-US-Wavenet-A", 1.5, 30L, "ogg"));
    }

    @Test
    void mapsClientErrorsToCodes() throws Exception {
        given(ttsService.dispatch(any())).willThrow(GatewayException.invalidSpeakingRate(4.0001));

        mockMvc.perform(get("/tts")
                        .param("text", "Hello")
                        .param("mode", "gCloud")
                        .param("lang", "en-US-Wavenet-A")
                        .param("speaking_rate", "4.0001"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.display").value("Invalid speaking rate: 4.0001"))
                .andExpect(jsonPath("$.code").value(3));
    }

    @Test
    void hidesServerErrorDetails() throws Exception {
        given(ttsService.dispatch(any())).willThrow(
                GatewayException.backendUnavailable(TtsMode.POLLY, "connection reset by 10.0.0.7", null));

        mockMvc.perform(get("/tts")
                        .param("text", "Hello")
                        .param("mode", "Polly")
                        .param("lang", "Joanna"))
                .andExpect(status().isBadGateway())
                .andExpect(jsonPath("$.display").value("Unknown error"))
                .andExpect(jsonPath("$.code").value(0));
    }

    @Test
    void rejectsUnknownModeBeforeDispatch() throws Exception {
        mockMvc.perform(get("/tts")
                        .param("text", "Hello")
                        .param("mode", "gcloud")
                        .param("lang", "en"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value(6));

        verifyNoInteractions(ttsService);
    }

    @Test
    void rejectsMissingAndMalformedParameters() throws Exception {
        mockMvc.perform(get("/tts").param("mode", "gTTS").param("lang", "en"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.display").value("Missing parameter: text"))
                .andExpect(jsonPath("$.code").value(6));

        mockMvc.perform(get("/tts")
                        .param("text", "Hello")
                        .param("mode", "gTTS")
                        .param("lang", "en")
                        .param("max_length", "ten"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value(6));
    }

    @Test
    void listsVoicesAndModes() throws Exception {
        given(ttsService.listVoices(TtsMode.GTTS, false)).willAnswer(invocation ->
                List.of(new VoiceDescriptor("en", "English")));
        given(ttsService.listModes()).willReturn(List.of("gTTS", "eSpeak"));

        mockMvc.perform(get("/voices").param("mode", "gTTS"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].name").value("en"))
                .andExpect(jsonPath("$[0].language").value("English"));

        mockMvc.perform(get("/modes"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0]").value("gTTS"))
                .andExpect(jsonPath("$[1]").value("eSpeak"));
    }

    @Test
    void passesRawFlagToVoiceListing() throws Exception {
        given(ttsService.listVoices(TtsMode.ESPEAK, true)).willAnswer(invocation -> List.of());

        mockMvc.perform(get("/voices").param("mode", "eSpeak").param("raw", "true"))
                .andExpect(status().isOk())
                .andExpect(content().json("[]"));

        verify(ttsService).listVoices(TtsMode.ESPEAK, true);
    }

    @Test
    void echoesRequestIdHeader() throws Exception {
        given(ttsService.listModes()).willReturn(List.of("gTTS"));

        mockMvc.perform(get("/modes").header("X-Request-Id", "rid-123"))
                .andExpect(status().isOk())
                .andExpect(header().string("X-Request-Id", "rid-123"));
    }

    @TestConfiguration
    @EnableConfigurationProperties(GatewayProperties.class)
    static class GatewayPropertiesConfig {
    }
}
