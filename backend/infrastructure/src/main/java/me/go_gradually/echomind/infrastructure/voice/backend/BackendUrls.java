package me.go_gradually.echomind.infrastructure.voice.backend;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.go_gradually.echomind.infrastructure.shared.config.AppProperties;
import org.springframework.web.reactive.function.client.WebClientResponseException;

final class BackendUrls {
    private BackendUrls() {
    }

    /** Configured back-end base without trailing slashes, or empty when unset. */
    static String base(AppProperties.Backend settings) {
        String url = settings == null || settings.getChatUrl() == null ? "" : settings.getChatUrl().trim();
        while (url.endsWith("/")) {
            url = url.substring(0, url.length() - 1);
        }
        return url;
    }

    /** FastAPI error bodies carry the reason under {@code detail}. */
    static String errorMessage(ObjectMapper objectMapper, WebClientResponseException e) {
        String body = e.getResponseBodyAsString();
        try {
            JsonNode detail = objectMapper.readTree(body == null || body.isBlank() ? "{}" : body).path("detail");
            if (detail.isTextual() && !detail.asText().isBlank()) {
                return "Back end returned " + e.getStatusCode().value() + ": " + detail.asText();
            }
        } catch (Exception ignored) {
            // not JSON; fall through to the raw body
        }
        return "Back end returned " + e.getStatusCode().value() + (body == null || body.isBlank() ? "" : ": " + body);
    }
}
