package me.go_gradually.echomind.domain.speech;

import java.util.regex.Pattern;

/**
 * Plain-text normalization applied to everything that is spoken or shown as assistant text.
 */
public final class SpeechText {
    private static final Pattern LINK = Pattern.compile("\\[([^\\]]*)\\]\\([^)]*\\)");
    private static final Pattern BOLD = Pattern.compile("\\*\\*");
    private static final Pattern UNDERLINE = Pattern.compile("__");
    private static final Pattern ASTERISK = Pattern.compile("\\*");
    private static final Pattern UNDERSCORE = Pattern.compile("_");
    private static final Pattern BACKTICK = Pattern.compile("`");
    private static final Pattern HEADER = Pattern.compile("^#+\\s*", Pattern.MULTILINE);
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern SENTENCE_END = Pattern.compile("[.!?]\\s*$");

    private SpeechText() {
    }

    public static String stripMarkdown(String text) {
        if (text == null || text.isBlank()) {
            return "";
        }
        String s = text.trim();
        s = LINK.matcher(s).replaceAll("$1");
        s = BOLD.matcher(s).replaceAll("");
        s = UNDERLINE.matcher(s).replaceAll("");
        s = ASTERISK.matcher(s).replaceAll("");
        s = UNDERSCORE.matcher(s).replaceAll(" ");
        s = BACKTICK.matcher(s).replaceAll("");
        s = HEADER.matcher(s).replaceAll("");
        s = WHITESPACE.matcher(s).replaceAll(" ");
        return s.trim();
    }

    public static boolean endsSentence(String text) {
        return text != null && SENTENCE_END.matcher(text.trim()).find();
    }
}
