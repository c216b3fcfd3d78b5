package me.go_gradually.echomind.domain.memory;

import java.util.Locale;

public enum Speaker {
    USER,
    ASSISTANT;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public String label() {
        String lower = wireName();
        return Character.toUpperCase(lower.charAt(0)) + lower.substring(1);
    }
}
