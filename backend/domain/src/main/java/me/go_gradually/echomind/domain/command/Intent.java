package me.go_gradually.echomind.domain.command;

public enum Intent {
    NONE,
    SET_ASSISTANT_NAME,
    SET_USER_NAME,
    SET_TIMEZONE,
    SET_LOCATION,
    LISTEN_ONLY_ON,
    LISTEN_ONLY_OFF,
    RESUME_LISTENING,
    CLEAR_MEMORY,
    MEMORY_RECALL,
    ARCHIVE_CONVERSATION,
    MEMORY_QUERY,
    FACT_CHECK
}
