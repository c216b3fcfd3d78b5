package me.go_gradually.echomind.application.voice.port;

import me.go_gradually.echomind.domain.conversation.ChatMessage;

import java.util.List;

public interface LlmClient {
    /**
     * Streams the reply token by token and returns when the stream ends. Implementations must abort
     * promptly when the calling thread is interrupted.
     */
    void streamTokens(List<ChatMessage> messages, LlmTokenListener listener) throws Exception;

    String complete(List<ChatMessage> messages) throws Exception;
}
