package me.go_gradually.echomind.infrastructure.voice.tts;

import me.go_gradually.echomind.application.voice.port.TtsGateway;
import me.go_gradually.echomind.domain.speech.SynthesizedAudio;
import me.go_gradually.echomind.infrastructure.shared.config.AppProperties;
import me.go_gradually.echomind.infrastructure.voice.audio.WavCodec;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Piper behind an OpenAI-compatible {@code /v1/audio/speech} endpoint; replies are WAV.
 */
@Component
public class OpenAiCompatTtsGateway implements TtsGateway {
    private static final String SPEECH_PATH = "/v1/audio/speech";

    private final WebClient webClient;
    private final AppProperties.Tts settings;

    @Autowired
    public OpenAiCompatTtsGateway(@Qualifier("ttsWebClient") WebClient webClient, AppProperties properties) {
        this(webClient, properties.getIntegrations().getTts());
    }

    OpenAiCompatTtsGateway(WebClient webClient, AppProperties.Tts settings) {
        this.webClient = webClient;
        this.settings = settings;
    }

    @Override
    public SynthesizedAudio synthesize(String text, String voice) throws Exception {
        if (text == null || text.isBlank()) {
            return new SynthesizedAudio(new float[0], 22050);
        }
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("model", settings.getModel());
        payload.put("voice", voice == null || voice.isBlank() ? settings.getVoice() : voice.trim());
        payload.put("input", text);
        payload.put("response_format", "wav");
        if (settings.getLengthScale() > 0 && settings.getLengthScale() != 1.0) {
            payload.put("speed", 1.0 / settings.getLengthScale());
        }

        byte[] wav;
        try {
            wav = webClient.post()
                    .uri(endpoint())
                    .contentType(MediaType.APPLICATION_JSON)
                    .accept(MediaType.parseMediaType("audio/wav"), MediaType.APPLICATION_OCTET_STREAM)
                    .bodyValue(payload)
                    .retrieve()
                    .bodyToMono(byte[].class)
                    .block();
        } catch (WebClientResponseException e) {
            throw new IllegalStateException("Speech synthesis failed: " + e.getStatusCode().value() + " " + e.getResponseBodyAsString(), e);
        }
        if (wav == null || wav.length == 0) {
            throw new IllegalStateException("Speech synthesis returned an empty body");
        }
        return WavCodec.decode(wav);
    }

    private String endpoint() {
        String base = settings.getBaseUrl() == null ? "" : settings.getBaseUrl().trim();
        if (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return base + SPEECH_PATH;
    }
}
