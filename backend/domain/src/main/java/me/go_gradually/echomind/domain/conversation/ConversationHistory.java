package me.go_gradually.echomind.domain.conversation;

import java.util.ArrayList;
import java.util.LinkedList;
import java.util.List;

/**
 * Chat turns sent to the LLM, bounded by turn count and an approximate token budget
 * (roughly four characters per token). Oldest messages are dropped first.
 */
public final class ConversationHistory {
    private final int maxTurns;
    private final int maxTokens;
    private final LinkedList<ChatMessage> messages = new LinkedList<>();

    public ConversationHistory(int maxTurns, int maxTokens) {
        if (maxTurns <= 0 || maxTokens <= 0) {
            throw new IllegalArgumentException("history limits must be positive");
        }
        this.maxTurns = maxTurns;
        this.maxTokens = maxTokens;
    }

    public static int approxTokens(String text) {
        return Math.max(1, (text == null ? 0 : text.length()) / 4);
    }

    public synchronized void appendTurn(String userText, String assistantText, String systemPrompt) {
        messages.addLast(ChatMessage.user(userText));
        messages.addLast(ChatMessage.assistant(assistantText));
        trim(systemPrompt);
    }

    public synchronized void trim(String systemPrompt) {
        while (messages.size() > maxTurns * 2) {
            messages.removeFirst();
        }
        int total = approxTokens(systemPrompt);
        for (ChatMessage message : messages) {
            total += approxTokens(message.content());
        }
        while (!messages.isEmpty() && total > maxTokens) {
            total -= approxTokens(messages.removeFirst().content());
        }
    }

    public synchronized List<ChatMessage> snapshot() {
        return List.copyOf(new ArrayList<>(messages));
    }

    public synchronized void clear() {
        messages.clear();
    }

    public synchronized int size() {
        return messages.size();
    }
}
