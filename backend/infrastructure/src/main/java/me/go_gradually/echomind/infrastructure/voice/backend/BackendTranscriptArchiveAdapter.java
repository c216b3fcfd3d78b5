package me.go_gradually.echomind.infrastructure.voice.backend;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.go_gradually.echomind.application.voice.model.StoredTranscript;
import me.go_gradually.echomind.application.voice.port.TranscriptArchivePort;
import me.go_gradually.echomind.infrastructure.shared.config.AppProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
public class BackendTranscriptArchiveAdapter implements TranscriptArchivePort {
    private static final String STORE_PATH = "/api/transcribe/store";

    private final WebClient webClient;
    private final AppProperties.Backend settings;
    private final ObjectMapper objectMapper = new ObjectMapper();

    @Autowired
    public BackendTranscriptArchiveAdapter(@Qualifier("backendWebClient") WebClient webClient, AppProperties properties) {
        this(webClient, properties.getIntegrations().getBackend());
    }

    BackendTranscriptArchiveAdapter(WebClient webClient, AppProperties.Backend settings) {
        this.webClient = webClient;
        this.settings = settings;
    }

    @Override
    public StoredTranscript store(String rawText, String echotag) throws Exception {
        String base = BackendUrls.base(settings);
        if (base.isEmpty()) {
            throw new IllegalStateException("Transcript archive back end is not configured");
        }
        if (rawText == null || rawText.isBlank()) {
            throw new IllegalArgumentException("Nothing to archive");
        }
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("raw_text", rawText);
        if (echotag != null && !echotag.isBlank()) {
            payload.put("echotag", echotag.trim());
        }

        String body;
        try {
            body = webClient.post()
                    .uri(base + STORE_PATH)
                    .contentType(MediaType.APPLICATION_JSON)
                    .accept(MediaType.APPLICATION_JSON)
                    .bodyValue(payload)
                    .retrieve()
                    .bodyToMono(String.class)
                    .block(Duration.ofSeconds(settings.getTimeoutSeconds()));
        } catch (WebClientResponseException e) {
            throw new IllegalStateException(BackendUrls.errorMessage(objectMapper, e), e);
        }
        JsonNode root = objectMapper.readTree(body == null ? "{}" : body);
        List<String> tags = new ArrayList<>();
        for (JsonNode tag : root.path("tags")) {
            if (tag.isTextual() && !tag.asText().isBlank()) {
                tags.add(tag.asText().trim());
            }
        }
        return new StoredTranscript(root.path("transcript_id").asText(""), tags);
    }
}
