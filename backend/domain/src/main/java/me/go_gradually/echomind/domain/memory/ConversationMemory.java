package me.go_gradually.echomind.domain.memory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Rolling, time-windowed transcript of one session. Entries whose end time falls outside the window are
 * evicted on every call, so no query ever returns them.
 */
public final class ConversationMemory {
    public static final double DEFAULT_WINDOW_MINUTES = 30.0;
    private static final DateTimeFormatter CLOCK_FORMAT = DateTimeFormatter.ofPattern("HH:mm");
    private static final Pattern WORD = Pattern.compile("\\w+", Pattern.UNICODE_CHARACTER_CLASS);

    private final Duration window;
    private final Clock clock;
    private final List<MemoryEntry> entries = new ArrayList<>();
    private volatile ZoneId zone;

    public ConversationMemory(double windowMinutes, Clock clock) {
        this.window = minutes(Math.max(0.1, windowMinutes));
        this.clock = clock;
        this.zone = clock.getZone();
    }

    public synchronized MemoryEntry addText(String text, Speaker speaker) {
        return addText(text, speaker, null);
    }

    public synchronized MemoryEntry addText(String text, Speaker speaker, List<String> tags) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("memory text must not be blank");
        }
        Instant now = clock.instant();
        List<String> entryTags = tags == null || tags.isEmpty() ? MemoryTagger.tags(text) : tags;
        MemoryEntry entry = new MemoryEntry(now, now, text, entryTags, speaker);
        evict(now);
        entries.add(entry);
        return entry;
    }

    public synchronized List<MemoryEntry> queryLast(double minutes) {
        Instant now = clock.instant();
        evict(now);
        Instant cutoff = now.minus(minutes(minutes));
        List<MemoryEntry> out = new ArrayList<>();
        for (MemoryEntry entry : entries) {
            if (!entry.tsEnd().isBefore(cutoff)) {
                out.add(entry);
            }
        }
        return out;
    }

    /** Entries containing any word of the query, case-insensitively. */
    public synchronized List<MemoryEntry> queryTopic(String query) {
        if (query == null || query.isBlank()) {
            return List.of();
        }
        evict(clock.instant());
        Set<String> words = words(query);
        if (words.isEmpty()) {
            return List.copyOf(entries);
        }
        List<MemoryEntry> out = new ArrayList<>();
        for (MemoryEntry entry : entries) {
            String text = entry.text().toLowerCase(Locale.ROOT);
            for (String word : words) {
                if (text.contains(word)) {
                    out.add(entry);
                    break;
                }
            }
        }
        return out;
    }

    /** Transcript of the last minutes as {@code [HH:mm] Speaker: text} lines ordered by start time. */
    public String summarizeLast(double minutes) {
        List<MemoryEntry> recent = new ArrayList<>(queryLast(minutes));
        recent.sort(Comparator.comparing(MemoryEntry::tsStart));
        List<String> lines = new ArrayList<>();
        for (MemoryEntry entry : recent) {
            lines.add("[" + formatClock(entry.tsStart()) + "] " + entry.speaker().label() + ": " + entry.text());
        }
        return String.join("\n", lines);
    }

    /** Like {@link #summarizeLast(double)} but keeps only the last {@code maxChars} characters. */
    public String contextFor(double minutes, int maxChars) {
        String transcript = summarizeLast(minutes);
        if (transcript.length() <= maxChars) {
            return transcript;
        }
        return transcript.substring(transcript.length() - maxChars).trim();
    }

    public String formatClock(Instant instant) {
        return CLOCK_FORMAT.format(instant.atZone(zone));
    }

    public void useZone(ZoneId zone) {
        if (zone != null) {
            this.zone = zone;
        }
    }

    public synchronized void clear() {
        entries.clear();
    }

    public synchronized int size() {
        evict(clock.instant());
        return entries.size();
    }

    private void evict(Instant now) {
        Instant cutoff = now.minus(window);
        entries.removeIf(entry -> entry.tsEnd().isBefore(cutoff));
    }

    private static Set<String> words(String query) {
        Set<String> words = new LinkedHashSet<>();
        Matcher matcher = WORD.matcher(query.toLowerCase(Locale.ROOT));
        while (matcher.find()) {
            words.add(matcher.group());
        }
        return words;
    }

    private static Duration minutes(double minutes) {
        return Duration.ofMillis(Math.round(minutes * 60_000.0));
    }
}
