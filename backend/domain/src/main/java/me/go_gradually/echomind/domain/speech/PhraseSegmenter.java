package me.go_gradually.echomind.domain.speech;

/**
 * Accumulates streamed tokens and cuts them into speakable phrases. One instance per reply.
 */
public final class PhraseSegmenter {
    private final PhraseSettings settings;
    private final StringBuilder buffer = new StringBuilder();
    private long lastTokenAtMs;

    public PhraseSegmenter(PhraseSettings settings, long startedAtMs) {
        this.settings = settings;
        this.lastTokenAtMs = startedAtMs;
    }

    public static boolean commitNeeded(String buffer, long lastTokenAtMs, long nowMs, PhraseSettings settings) {
        String trimmed = buffer == null ? "" : buffer.trim();
        int length = trimmed.length();
        if (length >= settings.maxChars()) {
            return true;
        }
        if (length < settings.minChars()) {
            return false;
        }
        return SpeechText.endsSentence(trimmed) || nowMs - lastTokenAtMs >= settings.commitPauseMs();
    }

    /**
     * Appends a token and returns the committed phrase, or {@code null} when the buffer keeps growing.
     * The pause rule measures the gap before this token.
     */
    public String offer(String token, long nowMs) {
        if (token == null || token.isEmpty()) {
            return null;
        }
        buffer.append(token);
        long previousTokenAt = lastTokenAtMs;
        lastTokenAtMs = nowMs;
        if (!commitNeeded(buffer.toString(), previousTokenAt, nowMs, settings)) {
            return null;
        }
        return take();
    }

    /** Called while waiting for the next token; commits when the model has paused long enough. */
    public String onIdle(long nowMs) {
        if (!commitNeeded(buffer.toString(), lastTokenAtMs, nowMs, settings)) {
            return null;
        }
        return take();
    }

    /** Remaining text at end of stream, or {@code null} when nothing speakable is left. */
    public String flush() {
        return take();
    }

    public String pending() {
        return buffer.toString();
    }

    private String take() {
        String phrase = buffer.toString().trim();
        buffer.setLength(0);
        return phrase.isEmpty() ? null : phrase;
    }
}
