package me.go_gradually.echomind.domain.memory;

import java.time.Instant;
import java.util.List;

public record MemoryEntry(Instant tsStart, Instant tsEnd, String text, List<String> tags, Speaker speaker) {
    public MemoryEntry {
        if (tsStart == null || tsEnd == null) {
            throw new IllegalArgumentException("timestamps are required");
        }
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("text is required");
        }
        text = text.trim();
        tags = tags == null ? List.of() : List.copyOf(tags);
        speaker = speaker == null ? Speaker.USER : speaker;
    }
}
