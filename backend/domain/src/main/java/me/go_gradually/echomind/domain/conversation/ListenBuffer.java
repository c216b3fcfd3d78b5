package me.go_gradually.echomind.domain.conversation;

import java.util.ArrayList;
import java.util.List;

/**
 * Utterances heard while in listen-only mode, in arrival order.
 */
public final class ListenBuffer {
    private final List<String> utterances = new ArrayList<>();

    public synchronized void add(String utterance) {
        if (utterance != null && !utterance.isBlank()) {
            utterances.add(utterance.trim());
        }
    }

    /** Returns the buffered utterances joined by a space and empties the buffer. */
    public synchronized String drain() {
        String joined = String.join(" ", utterances);
        utterances.clear();
        return joined;
    }

    public synchronized void clear() {
        utterances.clear();
    }

    public synchronized List<String> snapshot() {
        return List.copyOf(utterances);
    }

    public synchronized boolean isEmpty() {
        return utterances.isEmpty();
    }
}
