package me.go_gradually.echomind.infrastructure.voice.backend;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.go_gradually.echomind.application.voice.model.KnowledgeBaseQuery;
import me.go_gradually.echomind.application.voice.port.KnowledgeBaseGateway;
import me.go_gradually.echomind.infrastructure.shared.config.AppProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.logging.Logger;

@Component
public class BackendKnowledgeBaseGateway implements KnowledgeBaseGateway {
    private static final Logger log = Logger.getLogger(BackendKnowledgeBaseGateway.class.getName());
    private static final String ASK_VOICE_PATH = "/api/chat/ask-voice";

    private final WebClient webClient;
    private final AppProperties.Backend settings;
    private final ObjectMapper objectMapper = new ObjectMapper();

    @Autowired
    public BackendKnowledgeBaseGateway(@Qualifier("backendWebClient") WebClient webClient, AppProperties properties) {
        this(webClient, properties.getIntegrations().getBackend());
    }

    BackendKnowledgeBaseGateway(WebClient webClient, AppProperties.Backend settings) {
        this.webClient = webClient;
        this.settings = settings;
    }

    @Override
    public boolean isConfigured() {
        return !BackendUrls.base(settings).isEmpty();
    }

    @Override
    public String ask(KnowledgeBaseQuery query) throws Exception {
        if (!isConfigured()) {
            throw new IllegalStateException("Knowledge base back end is not configured");
        }
        // HashMap: persona may be null and is sent as JSON null
        Map<String, Object> payload = new HashMap<>();
        payload.put("message", query.message());
        payload.put("persona", query.persona());
        payload.put("context_window", query.contextWindow());
        payload.put("use_knowledge_base", true);
        payload.put("advanced_rag", true);
        log.fine(() -> "voice.kb.ask persona=" + query.persona() + " context_window=" + query.contextWindow());

        String body;
        try {
            body = webClient.post()
                    .uri(BackendUrls.base(settings) + ASK_VOICE_PATH)
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
        return root.path("answer").asText("").trim();
    }
}
