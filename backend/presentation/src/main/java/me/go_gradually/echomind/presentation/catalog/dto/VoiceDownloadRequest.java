package me.go_gradually.echomind.presentation.catalog.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;

public class VoiceDownloadRequest {
    @NotBlank(message = "voice_id required")
    @JsonProperty("voice_id")
    private String voiceId;

    public String getVoiceId() {
        return voiceId;
    }

    public void setVoiceId(String voiceId) {
        this.voiceId = voiceId;
    }
}
