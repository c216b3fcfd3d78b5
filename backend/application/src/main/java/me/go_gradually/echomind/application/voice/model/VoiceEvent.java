package me.go_gradually.echomind.application.voice.model;

public enum VoiceEvent {
    USER_SPEECH_START,
    USER_SPEECH_END,
    THINKING,
    SPEAKING,
    BACK_TO_LISTENING
}
