package me.go_gradually.echomind.domain.conversation;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ConversationHistoryTest {

    @Test
    void appendTurn_keepsAtMostTwiceMaxTurnsMessages() {
        ConversationHistory history = new ConversationHistory(2, 10_000);

        history.appendTurn("u1", "a1", "sys");
        history.appendTurn("u2", "a2", "sys");
        history.appendTurn("u3", "a3", "sys");

        List<ChatMessage> messages = history.snapshot();
        assertEquals(4, messages.size());
        assertEquals(ChatMessage.user("u2"), messages.get(0));
        assertEquals(ChatMessage.assistant("a3"), messages.get(3));
    }

    @Test
    void appendTurn_dropsOldestUntilTokenBudgetFits() {
        ConversationHistory history = new ConversationHistory(12, 30);
        String forty = "x".repeat(40);

        history.appendTurn(forty, forty, "");
        history.appendTurn(forty, forty, "");

        // system 1 + 10 per message, budget 30 leaves two messages
        assertEquals(2, history.size());
        assertEquals(ChatRole.USER, history.snapshot().get(0).role());
    }

    @Test
    void approxTokens_isAtLeastOne() {
        assertEquals(1, ConversationHistory.approxTokens(""));
        assertEquals(25, ConversationHistory.approxTokens("y".repeat(100)));
    }

    @Test
    void clear_removesEverything() {
        ConversationHistory history = new ConversationHistory(12, 1400);
        history.appendTurn("hi", "hello", "sys");

        history.clear();

        assertTrue(history.snapshot().isEmpty());
    }
}
