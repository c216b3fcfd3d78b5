package me.go_gradually.echomind.application.voice.model;

public class VoiceSessionOpenCommand {
    private String sessionId;

    public VoiceSessionOpenCommand() {
    }

    public VoiceSessionOpenCommand(String sessionId) {
        this.sessionId = sessionId;
    }

    public String getSessionId() {
        return sessionId;
    }

    public void setSessionId(String sessionId) {
        this.sessionId = sessionId;
    }
}
