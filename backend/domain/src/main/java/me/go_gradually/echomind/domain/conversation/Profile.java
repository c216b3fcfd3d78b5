package me.go_gradually.echomind.domain.conversation;

import me.go_gradually.echomind.domain.util.TextUtils;

import java.time.DateTimeException;
import java.time.ZoneId;
import java.util.Optional;

/**
 * Session-scoped identity of the assistant and the user. Replaced as a whole on every change.
 */
public record Profile(String assistantName,
                      String wakeWord,
                      String userName,
                      String timezone,
                      String location) {
    public static final String DEFAULT_ASSISTANT_NAME = "EchoMind";
    public static final String DEFAULT_TIMEZONE = "America/New_York";

    public Profile {
        assistantName = TextUtils.firstNonBlank(TextUtils.trimToEmpty(assistantName), DEFAULT_ASSISTANT_NAME);
        wakeWord = TextUtils.firstNonBlank(TextUtils.trimToEmpty(wakeWord), assistantName);
        userName = TextUtils.trimToEmpty(userName);
        timezone = TextUtils.firstNonBlank(TextUtils.trimToEmpty(timezone), DEFAULT_TIMEZONE);
        location = TextUtils.trimToEmpty(location);
    }

    public static Profile defaults() {
        return new Profile(DEFAULT_ASSISTANT_NAME, DEFAULT_ASSISTANT_NAME, "", DEFAULT_TIMEZONE, "");
    }

    /** Renaming the assistant also moves the wake word. */
    public Profile withAssistantName(String name) {
        return new Profile(name, name, userName, timezone, location);
    }

    public Profile withWakeWord(String value) {
        return new Profile(assistantName, value, userName, timezone, location);
    }

    public Profile withUserName(String value) {
        return new Profile(assistantName, wakeWord, value, timezone, location);
    }

    public Profile withTimezone(String value) {
        return new Profile(assistantName, wakeWord, userName, value, location);
    }

    public Profile withLocation(String value) {
        return new Profile(assistantName, wakeWord, userName, timezone, value);
    }

    public Optional<ZoneId> zoneId() {
        try {
            return Optional.of(ZoneId.of(timezone));
        } catch (DateTimeException e) {
            return Optional.empty();
        }
    }

    public String promptLine() {
        StringBuilder builder = new StringBuilder()
                .append("Assistant name: ").append(assistantName).append(". ")
                .append("User name: ").append(TextUtils.firstNonBlank(userName, "User")).append(". ")
                .append("Timezone: ").append(timezone).append('.');
        if (!location.isEmpty()) {
            builder.append(" Location: ").append(location).append('.');
        }
        return builder.toString();
    }
}
