package me.go_gradually.echomind.application.voice.model;

import java.util.Locale;

public enum OutboundType {
    HELLO,
    CONTEXT_ACK,
    PROFILE_UPDATE,
    EVENT,
    ASR_FINAL,
    ASSISTANT_TEXT,
    ASSISTANT_TEXT_PARTIAL,
    ASSISTANT_PHRASE,
    AUDIO_OUT,
    CANCEL,
    MEMORY_EVENT,
    MEMORY_INFO,
    STORED,
    ERROR;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
