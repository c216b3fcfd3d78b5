package me.go_gradually.echomind.infrastructure.voice.stt;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.go_gradually.echomind.application.voice.port.SttGateway;
import me.go_gradually.echomind.infrastructure.shared.config.AppProperties;
import me.go_gradually.echomind.infrastructure.voice.audio.WavCodec;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.http.client.MultipartBodyBuilder;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

/**
 * Posts each utterance as a mono WAV to an OpenAI-compatible {@code /v1/audio/transcriptions} server
 * (faster-whisper-server, whisper.cpp, LocalAI).
 */
@Component
public class OpenAiCompatSttGateway implements SttGateway {
    private static final String TRANSCRIPTIONS_PATH = "/v1/audio/transcriptions";

    private final WebClient webClient;
    private final AppProperties.Stt settings;
    private final ObjectMapper objectMapper = new ObjectMapper();

    @Autowired
    public OpenAiCompatSttGateway(@Qualifier("sttWebClient") WebClient webClient, AppProperties properties) {
        this(webClient, properties.getIntegrations().getStt());
    }

    OpenAiCompatSttGateway(WebClient webClient, AppProperties.Stt settings) {
        this.webClient = webClient;
        this.settings = settings;
    }

    @Override
    public String transcribe(float[] audio, int sampleRate) throws Exception {
        MultipartBodyBuilder builder = new MultipartBodyBuilder();
        builder.part("file", WavCodec.encodeMono16(audio, sampleRate))
                .header("Content-Disposition", "form-data; name=file; filename=utterance.wav")
                .contentType(MediaType.parseMediaType("audio/wav"));
        builder.part("model", settings.getModel());
        builder.part("response_format", "json");
        builder.part("temperature", "0");
        if (settings.getLanguage() != null && !settings.getLanguage().isBlank()) {
            builder.part("language", settings.getLanguage().trim());
        }

        String response;
        try {
            response = webClient.post()
                    .uri(endpoint())
                    .contentType(MediaType.MULTIPART_FORM_DATA)
                    .body(BodyInserters.fromMultipartData(builder.build()))
                    .retrieve()
                    .bodyToMono(String.class)
                    .block();
        } catch (WebClientResponseException e) {
            throw new IllegalStateException("Transcription failed: " + e.getStatusCode().value() + " " + e.getResponseBodyAsString(), e);
        }
        JsonNode root = objectMapper.readTree(response == null ? "{}" : response);
        return root.path("text").asText("").trim();
    }

    private String endpoint() {
        String base = settings.getBaseUrl() == null ? "" : settings.getBaseUrl().trim();
        if (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return base + TRANSCRIPTIONS_PATH;
    }
}
