package me.go_gradually.echomind.domain.speech;

import java.util.List;
import java.util.Locale;

/**
 * Keyword "emotion" heuristic that nudges client playback speed.
 */
public final class PlaybackRate {
    public static final double NEUTRAL = 1.00;
    static final double POSITIVE = 1.06;
    static final double NEGATIVE = 0.96;
    static final double URGENT = 1.02;

    private static final List<String> POSITIVE_WORDS = List.of("great", "awesome", "perfect", "nice", "congrats", "yay", "happy");
    private static final List<String> NEGATIVE_WORDS = List.of("sorry", "unfortunately", "sad", "issue", "problem", "can't", "cannot");
    private static final List<String> URGENT_WORDS = List.of("warning", "important", "careful", "critical");

    private PlaybackRate() {
    }

    public static double forText(String text, boolean emotionMode) {
        if (!emotionMode || text == null) {
            return NEUTRAL;
        }
        String lower = text.toLowerCase(Locale.ROOT);
        if (containsAny(lower, POSITIVE_WORDS)) {
            return POSITIVE;
        }
        if (containsAny(lower, NEGATIVE_WORDS)) {
            return NEGATIVE;
        }
        if (containsAny(lower, URGENT_WORDS)) {
            return URGENT;
        }
        return NEUTRAL;
    }

    private static boolean containsAny(String text, List<String> words) {
        for (String word : words) {
            if (text.contains(word)) {
                return true;
            }
        }
        return false;
    }
}
