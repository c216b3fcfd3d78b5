package me.go_gradually.echomind.application.voice.model;

public record KnowledgeBaseQuery(String message, String persona, String contextWindow) {
    public static final String DEFAULT_CONTEXT_WINDOW = "all";

    public KnowledgeBaseQuery {
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("message is required");
        }
        persona = persona == null || persona.isBlank() ? null : persona.trim();
        contextWindow = contextWindow == null || contextWindow.isBlank() ? DEFAULT_CONTEXT_WINDOW : contextWindow.trim();
    }
}
