package com.example.ttsgateway.service.backend.polly;

import java.util.List;

public record PollyVoice(
        String id,
        String name,
        String gender,
        String languageCode,
        String languageName,
        List<String> supportedEngines
) {

    boolean supportsNeural() {
        return supportedEngines != null && supportedEngines.contains("neural");
    }
}
