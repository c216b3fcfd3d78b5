package me.go_gradually.echomind.presentation.catalog.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public class InstalledVoicesResponse {
    @JsonProperty("voice_ids")
    private List<String> voiceIds = List.of();

    public List<String> getVoiceIds() {
        return voiceIds;
    }

    public void setVoiceIds(List<String> voiceIds) {
        this.voiceIds = voiceIds;
    }
}
