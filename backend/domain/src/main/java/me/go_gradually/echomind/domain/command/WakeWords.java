package me.go_gradually.echomind.domain.command;

import java.util.List;
import java.util.Locale;

public final class WakeWords {
    private WakeWords() {
    }

    /** Removes a leading case-insensitive wake word and the separators that follow it. */
    public static String strip(String utterance, String wakeWord) {
        String text = utterance == null ? "" : utterance.trim();
        String word = wakeWord == null ? "" : wakeWord.trim().toLowerCase(Locale.ROOT);
        if (word.isEmpty() || !text.toLowerCase(Locale.ROOT).startsWith(word)) {
            return text;
        }
        int index = word.length();
        while (index < text.length() && " ,;:".indexOf(text.charAt(index)) >= 0) {
            index++;
        }
        return text.substring(index).trim();
    }

    public static boolean startsWithWakeWord(String utterance, String wakeWord) {
        if (wakeWord == null || wakeWord.isBlank() || utterance == null) {
            return false;
        }
        return utterance.trim().toLowerCase(Locale.ROOT).startsWith(wakeWord.trim().toLowerCase(Locale.ROOT));
    }

    public static boolean containsTrigger(String utterance, List<String> triggerPhrases) {
        if (utterance == null || triggerPhrases == null) {
            return false;
        }
        String lower = utterance.toLowerCase(Locale.ROOT);
        for (String phrase : triggerPhrases) {
            if (phrase != null && !phrase.isBlank() && lower.contains(phrase.toLowerCase(Locale.ROOT))) {
                return true;
            }
        }
        return false;
    }
}
