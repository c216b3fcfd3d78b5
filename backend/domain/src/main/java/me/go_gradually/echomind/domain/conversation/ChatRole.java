package me.go_gradually.echomind.domain.conversation;

import java.util.Locale;

public enum ChatRole {
    SYSTEM,
    USER,
    ASSISTANT;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
