package me.go_gradually.echomind.application.catalog.model;

public class VoiceDownloadException extends RuntimeException {
    private final String voiceId;

    public VoiceDownloadException(String voiceId, String message, Throwable cause) {
        super(message, cause);
        this.voiceId = voiceId;
    }

    public String getVoiceId() {
        return voiceId;
    }
}
