package me.go_gradually.echomind.application.voice.model;

import java.util.List;

public record StoredTranscript(String transcriptId, List<String> tags) {
    public StoredTranscript {
        tags = tags == null ? List.of() : List.copyOf(tags);
    }
}
