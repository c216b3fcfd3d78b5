package me.go_gradually.echomind.domain.vad;

public enum GateDecision {
    NONE,
    SPEECH_STARTED,
    UTTERANCE_DISCARDED,
    UTTERANCE_READY
}
