package com.example.ttsgateway.api.tts;

import com.example.ttsgateway.service.SynthesisRequest;
import com.example.ttsgateway.service.SynthesizedAudio;
import com.example.ttsgateway.service.TtsMode;
import com.example.ttsgateway.service.TtsService;
import com.example.ttsgateway.web.RequestIdFilter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
public class TtsController {

    private static final Logger log = LoggerFactory.getLogger(TtsController.class);

    private final TtsService ttsService;

    public TtsController(TtsService ttsService) {
        this.ttsService = ttsService;
    }

    @GetMapping("/tts")
    public ResponseEntity<byte[]> tts(@RequestParam("text") String text,
                                      @RequestParam("mode") String mode,
                                      @RequestParam("lang") String lang,
                                      @RequestParam(name = "speaking_rate", required = false) Double speakingRate,
                                      @RequestParam(name = "max_length", required = false) Long maxLength,
                                      @RequestParam(name = "preferred_format", required = false) String preferredFormat) {
        TtsMode ttsMode = TtsMode.fromName(mode);
        log.info("TTS request received request_id={} mode={} voice={} speaking_rate={} max_length={} preferred_format={} text_length={}",
                currentRequestId(), ttsMode, lang, speakingRate, maxLength, preferredFormat, text.length());

        SynthesizedAudio audio = ttsService.dispatch(
                new SynthesisRequest(text, ttsMode, lang, speakingRate, maxLength, preferredFormat));
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(audio.contentType());
        return ResponseEntity.ok().headers(headers).body(audio.bytes());
    }

    @GetMapping("/voices")
    public List<?> voices(@RequestParam("mode") String mode,
                          @RequestParam(name = "raw", defaultValue = "false") boolean raw) {
        return ttsService.listVoices(TtsMode.fromName(mode), raw);
    }

    @GetMapping("/modes")
    public List<String> modes() {
        return ttsService.listModes();
    }

    private String currentRequestId() {
        String requestId = MDC.get(RequestIdFilter.REQUEST_ID_MDC_KEY);
        if (requestId == null || requestId.isBlank()) {
            return "unknown";
        }
        return requestId;
    }
}
