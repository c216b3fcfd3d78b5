package me.go_gradually.echomind.domain.conversation;

public enum SessionPhase {
    IDLE,
    LISTENING,
    THINKING,
    SPEAKING;

    public boolean isAssistantActive() {
        return this == THINKING || this == SPEAKING;
    }
}
