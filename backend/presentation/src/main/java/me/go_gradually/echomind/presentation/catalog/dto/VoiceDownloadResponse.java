package me.go_gradually.echomind.presentation.catalog.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public class VoiceDownloadResponse {
    private boolean ok;
    @JsonProperty("voice_id")
    private String voiceId;

    public boolean isOk() {
        return ok;
    }

    public void setOk(boolean ok) {
        this.ok = ok;
    }

    public String getVoiceId() {
        return voiceId;
    }

    public void setVoiceId(String voiceId) {
        this.voiceId = voiceId;
    }
}
