package me.go_gradually.echomind.domain.speech;

public record PhraseSettings(int minChars, int maxChars, long commitPauseMs) {
    public PhraseSettings {
        minChars = Math.max(1, minChars);
        maxChars = Math.max(minChars, maxChars);
        commitPauseMs = Math.max(0L, commitPauseMs);
    }

    public static PhraseSettings defaults() {
        return new PhraseSettings(28, 120, 180L);
    }
}
