package me.go_gradually.echomind.infrastructure.voice.llm;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.go_gradually.echomind.application.voice.port.LlmClient;
import me.go_gradually.echomind.application.voice.port.LlmTokenListener;
import me.go_gradually.echomind.domain.conversation.ChatMessage;
import me.go_gradually.echomind.infrastructure.shared.config.AppProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;
import java.util.stream.Stream;

/**
 * Chat client for OpenAI-compatible {@code /v1/chat/completions} servers (Ollama, vLLM, llama.cpp).
 * Streaming replies are read as server-sent events and end at {@code [DONE]}.
 */
@Component
public class OpenAiCompatLlmClient implements LlmClient {
    private static final Logger log = Logger.getLogger(OpenAiCompatLlmClient.class.getName());
    private static final String DONE_MARKER = "[DONE]";

    private final WebClient webClient;
    private final AppProperties.Llm settings;
    private final ObjectMapper objectMapper = new ObjectMapper();

    @Autowired
    public OpenAiCompatLlmClient(@Qualifier("llmWebClient") WebClient webClient, AppProperties properties) {
        this(webClient, properties.getIntegrations().getLlm());
    }

    OpenAiCompatLlmClient(WebClient webClient, AppProperties.Llm settings) {
        this.webClient = webClient;
        this.settings = settings;
    }

    @Override
    public void streamTokens(List<ChatMessage> messages, LlmTokenListener listener) throws Exception {
        Map<String, Object> payload = payload(messages, true);
        logRequest(payload, true);
        try (Stream<String> lines = webClient.post()
                .uri(settings.getUrl())
                .headers(this::applyAuthorization)
                .contentType(MediaType.APPLICATION_JSON)
                .accept(MediaType.TEXT_EVENT_STREAM, MediaType.APPLICATION_JSON)
                .bodyValue(payload)
                .retrieve()
                .bodyToFlux(String.class)
                .timeout(Duration.ofSeconds(settings.getStreamTimeoutSeconds()))
                .toStream(1)) {
            Iterator<String> iterator = lines.iterator();
            while (iterator.hasNext()) {
                if (Thread.currentThread().isInterrupted()) {
                    throw new InterruptedException("LLM stream interrupted");
                }
                String data = dataOf(iterator.next());
                if (data.isEmpty()) {
                    continue;
                }
                if (DONE_MARKER.equals(data)) {
                    return;
                }
                String token = deltaContent(data);
                if (!token.isEmpty()) {
                    listener.onToken(token);
                }
            }
        } catch (WebClientResponseException e) {
            throw new IllegalStateException("LLM stream failed: " + resolveErrorMessage(e.getResponseBodyAsString()), e);
        }
    }

    @Override
    public String complete(List<ChatMessage> messages) throws Exception {
        Map<String, Object> payload = payload(messages, false);
        logRequest(payload, false);
        String body;
        try {
            body = webClient.post()
                    .uri(settings.getUrl())
                    .headers(this::applyAuthorization)
                    .contentType(MediaType.APPLICATION_JSON)
                    .accept(MediaType.APPLICATION_JSON)
                    .bodyValue(payload)
                    .retrieve()
                    .bodyToMono(String.class)
                    .block(Duration.ofSeconds(settings.getCompletionTimeoutSeconds()));
        } catch (WebClientResponseException e) {
            throw new IllegalStateException("LLM request failed: " + resolveErrorMessage(e.getResponseBodyAsString()), e);
        }
        JsonNode root = objectMapper.readTree(body == null ? "{}" : body);
        JsonNode choices = root.path("choices");
        if (!choices.isArray() || choices.isEmpty()) {
            throw new IllegalStateException("LLM response has no choices");
        }
        return choices.get(0).path("message").path("content").asText("").trim();
    }

    private Map<String, Object> payload(List<ChatMessage> messages, boolean stream) {
        List<Map<String, String>> wireMessages = new ArrayList<>();
        for (ChatMessage message : messages) {
            Map<String, String> wire = new LinkedHashMap<>();
            wire.put("role", message.role().wireName());
            wire.put("content", message.content());
            wireMessages.add(wire);
        }
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("model", settings.getModel());
        payload.put("messages", wireMessages);
        payload.put("temperature", settings.getTemperature());
        payload.put("max_tokens", settings.getMaxTokens());
        payload.put("stream", stream);
        return payload;
    }

    private void applyAuthorization(HttpHeaders headers) {
        String apiKey = settings.getApiKey();
        if (apiKey != null && !apiKey.isBlank()) {
            headers.setBearerAuth(apiKey.trim());
        }
    }

    // SSE bodies arrive as bare data values; plain line-delimited bodies keep their "data:" prefix.
    private String dataOf(String line) {
        if (line == null) {
            return "";
        }
        String trimmed = line.trim();
        if (trimmed.startsWith("data:")) {
            return trimmed.substring("data:".length()).trim();
        }
        return trimmed;
    }

    private String deltaContent(String data) {
        try {
            JsonNode choices = objectMapper.readTree(data).path("choices");
            if (!choices.isArray() || choices.isEmpty()) {
                return "";
            }
            JsonNode content = choices.get(0).path("delta").path("content");
            return content.isTextual() ? content.asText() : "";
        } catch (Exception e) {
            log.fine(() -> "voice.llm.stream.skip_line reason=" + e.getMessage());
            return "";
        }
    }

    private void logRequest(Map<String, Object> payload, boolean stream) {
        if (settings.isLogPayloads()) {
            log.info(() -> "voice.llm.request stream=" + stream + " url=" + settings.getUrl() + " payload=" + toJson(payload));
            return;
        }
        log.fine(() -> "voice.llm.request stream=" + stream
                + " model=" + settings.getModel()
                + " messages=" + ((List<?>) payload.get("messages")).size());
    }

    private String toJson(Map<String, Object> payload) {
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (Exception e) {
            return String.valueOf(payload);
        }
    }

    private String resolveErrorMessage(String body) {
        try {
            JsonNode root = objectMapper.readTree(body == null || body.isBlank() ? "{}" : body);
            JsonNode error = root.path("error");
            String message = error.isTextual() ? error.asText() : error.path("message").asText("");
            if (!message.isBlank()) {
                return message;
            }
        } catch (Exception ignored) {
            // not JSON; fall through to the raw body
        }
        return body == null || body.isBlank() ? "Unknown LLM error" : body;
    }
}
