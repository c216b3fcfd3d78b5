package me.go_gradually.echomind.domain.command;

public enum MemoryQueryType {
    RECAP,
    SUMMARIZE,
    TIMESTAMPS,
    WHEN_MENTIONED
}
