package me.go_gradually.echomind.domain.memory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Keyword tags used only to annotate entries, never for ranking.
 */
public final class MemoryTagger {
    private static final Pattern FACT_CHECK = Pattern.compile("\\b(fact|check|verify|true|false|claim)\\b");
    private static final Pattern SUMMARY = Pattern.compile("\\b(summarize|summary|recap)\\b");
    private static final Pattern TEMPORAL = Pattern.compile("\\b(when|time|minute|hour|last)\\b");
    private static final Pattern RECALL = Pattern.compile("\\b(what did i say|what did we discuss)\\b");

    private MemoryTagger() {
    }

    public static List<String> tags(String text) {
        String normalized = text == null ? "" : text.toLowerCase(Locale.ROOT);
        List<String> tags = new ArrayList<>();
        if (FACT_CHECK.matcher(normalized).find()) {
            tags.add("fact_check");
        }
        if (SUMMARY.matcher(normalized).find()) {
            tags.add("summary");
        }
        if (TEMPORAL.matcher(normalized).find()) {
            tags.add("temporal");
        }
        if (RECALL.matcher(normalized).find()) {
            tags.add("recall");
        }
        return tags;
    }
}
