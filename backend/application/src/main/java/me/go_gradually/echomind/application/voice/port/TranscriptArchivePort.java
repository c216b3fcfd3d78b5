package me.go_gradually.echomind.application.voice.port;

import me.go_gradually.echomind.application.voice.model.StoredTranscript;

public interface TranscriptArchivePort {
    StoredTranscript store(String rawText, String echotag) throws Exception;
}
