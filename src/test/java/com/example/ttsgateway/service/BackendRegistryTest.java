package com.example.ttsgateway.service;

import com.example.ttsgateway.error.ErrorCode;
import com.example.ttsgateway.error.GatewayException;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.OptionalDouble;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BackendRegistryTest {

    @Test
    void listsModesInDeclarationOrder() {
        BackendRegistry registry = new BackendRegistry(List.of(
                new FakeBackend(TtsMode.GCLOUD, OptionalDouble.of(4.0), "a"),
                new FakeBackend(TtsMode.GTTS, OptionalDouble.empty(), "en"),
                new FakeBackend(TtsMode.ESPEAK, OptionalDouble.of(400.0), "en")));

        assertThat(registry.modes()).containsExactly(TtsMode.GTTS, TtsMode.ESPEAK, TtsMode.GCLOUD);
        assertThat(registry.require(TtsMode.GTTS).mode()).isEqualTo(TtsMode.GTTS);
    }

    @Test
    void rejectsUnconfiguredMode() {
        BackendRegistry registry = new BackendRegistry(List.of());

        assertThatThrownBy(() -> registry.require(TtsMode.POLLY))
                .isInstanceOf(GatewayException.class)
                .hasMessage("Mode not available: Polly")
                .satisfies(ex -> assertThat(((GatewayException) ex).getErrorCode())
                        .isEqualTo(ErrorCode.MODE_UNAVAILABLE));
    }

    @Test
    void rejectsDuplicateBackends() {
        List<TtsBackend> backends = List.of(
                new FakeBackend(TtsMode.GTTS, OptionalDouble.empty(), "en"),
                new FakeBackend(TtsMode.GTTS, OptionalDouble.empty(), "fr"));

        assertThatThrownBy(() -> new BackendRegistry(backends))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void resolvesWireNamesCaseSensitively() {
        assertThat(TtsMode.fromName("gCloud")).isEqualTo(TtsMode.GCLOUD);
        assertThatThrownBy(() -> TtsMode.fromName("gcloud"))
                .isInstanceOf(GatewayException.class)
                .hasMessage("Unknown mode: gcloud");
    }
}
