package me.go_gradually.echomind.domain.command;

import me.go_gradually.echomind.domain.conversation.Profile;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Deterministic keyword router. Rules are checked in a fixed order and the first match wins.
 */
public final class KeywordCommandRouter implements CommandRouter {
    private static final List<String> ASSISTANT_NAME_PREFIXES = List.of(
            "your name is ", "call yourself ", "change wake word to ", "wake word is ", "you're called "
    );
    private static final List<String> USER_NAME_PREFIXES = List.of("my name is ", "call me ");
    private static final List<String> TIMEZONE_CUES = List.of(
            "set timezone to ", "timezone is ", "my timezone is ", "i'm in timezone "
    );
    private static final List<String> LOCATION_PREFIXES = List.of(
            "i'm in ", "i am in ", "location is ", "i'm at ", "set location to "
    );
    private static final List<String> LISTEN_ON_CUES = List.of(
            "listen to conversation", "start listening", "just listen", "keep listening"
    );
    private static final List<String> LISTEN_OFF_CUES = List.of(
            "stop listening", "pause listening", "pause", "don't listen", "stop"
    );
    private static final List<String> RESUME_CUES = List.of("resume listening", "resume", "start listening again");
    private static final List<String> CLEAR_CUES = List.of(
            "clear memory", "clear conversation", "forget everything", "reset memory"
    );
    private static final List<String> RECALL_CUES = List.of(
            "what do you remember", "what have you heard", "what do you know so far"
    );
    private static final List<String> ARCHIVE_CUES = List.of(
            "save this conversation", "save the conversation", "store this conversation", "save conversation"
    );
    private static final List<String> RECAP_CUES = List.of(
            "what did i say", "what did we say", "what was said", "recap", "last minutes"
    );
    private static final List<String> SUMMARIZE_CUES = List.of("summarize", "summary", "summarise");
    private static final List<String> WHEN_CUES = List.of(
            "when did we", "when did i", "when did you", "when was", "when did we mention", "when did we talk about"
    );
    private static final List<String> WHEN_PREFIXES = List.of(
            "when did we talk about", "when did we mention", "when did we", "when did i", "when did you", "when was"
    );
    private static final List<String> TIMESTAMP_CUES = List.of(
            "timestamps and tags", "give timestamps", "list with timestamps", "who said what"
    );
    private static final List<String> FACT_CHECK_CUES = List.of(
            "fact check", "fact check it", "fact check that", "verify that", "verify it"
    );
    private static final Set<String> TOPIC_STOP_WORDS = Set.of(
            "a", "an", "the", "about", "it", "that", "this", "we", "i", "you", "us", "mention", "mentioned",
            "talk", "talked", "discuss", "discussed", "say", "said", "did", "was", "is", "of", "last", "time"
    );

    private static final Pattern LAST_MINUTES = Pattern.compile("(?:last|past)\\s+(\\d+)\\s*(?:minute|min)s?\\b");
    private static final Pattern MINUTES_AGO = Pattern.compile("(\\d+)\\s*(?:minute|min)s?\\s*(?:ago|back)");
    private static final Pattern TIMEZONE_VALUE = Pattern.compile(
            "(?:timezone|time zone)\\s+(?:is|to)?\\s*([\\w/\\s+-]+?)(?:\\s*\\.|$)", Pattern.CASE_INSENSITIVE
    );
    private static final Pattern TIMEZONE_FALLBACK = Pattern.compile(
            "(?:set\\s+)?timezone\\s+to\\s+([\\w/\\s+-]+)", Pattern.CASE_INSENSITIVE
    );
    private static final Pattern TRAILING_PUNCTUATION = Pattern.compile("[.!?]+\\s*$");
    private static final Pattern NON_WORD = Pattern.compile("[^\\w\\s']", Pattern.UNICODE_CHARACTER_CLASS);

    @Override
    public RouteResult route(String utterance,
                             Profile profile,
                             String memorySummary,
                             boolean listenOnly,
                             List<String> triggerPhrases) {
        String text = utterance == null ? "" : utterance.trim();
        String normalized = text.toLowerCase(Locale.ROOT);
        if (normalized.isEmpty()) {
            return RouteResult.unhandled();
        }

        String assistantName = extractAfter(normalized, ASSISTANT_NAME_PREFIXES);
        if (assistantName != null && assistantName.length() < 80) {
            return RouteResult.reply(Intent.SET_ASSISTANT_NAME,
                    "Got it. I'll respond to the name " + assistantName + ".",
                    CommandEffects.assistantName(assistantName));
        }

        String userName = extractAfter(normalized, USER_NAME_PREFIXES);
        if (userName != null && userName.length() < 80) {
            return RouteResult.reply(Intent.SET_USER_NAME,
                    "Nice to meet you, " + userName + ".",
                    CommandEffects.userName(userName));
        }

        if (containsAny(normalized, TIMEZONE_CUES)) {
            String timezone = extractTimezone(text);
            if (timezone != null && timezone.length() < 60) {
                return RouteResult.reply(Intent.SET_TIMEZONE,
                        "Timezone set to " + timezone + ".",
                        CommandEffects.timezone(timezone));
            }
        }

        String location = extractAfter(normalized, LOCATION_PREFIXES);
        if (location != null && location.length() < 120) {
            return RouteResult.reply(Intent.SET_LOCATION,
                    "Noted. Location: " + location + ".",
                    CommandEffects.location(location));
        }

        if (containsAny(normalized, LISTEN_ON_CUES)) {
            return RouteResult.reply(Intent.LISTEN_ONLY_ON,
                    "I'm now listening to the conversation. Say your wake word or 'now you can speak' when you want me to respond.",
                    CommandEffects.listenOnly(true));
        }

        if (containsAny(normalized, LISTEN_OFF_CUES) && isStopListening(normalized)) {
            return RouteResult.reply(Intent.LISTEN_ONLY_OFF,
                    "Stopped listening. Say 'start listening' when you want me to listen again.",
                    CommandEffects.listenOnly(false));
        }

        if (containsAny(normalized, RESUME_CUES)) {
            return RouteResult.reply(Intent.RESUME_LISTENING,
                    "Resuming. I'm listening again.",
                    CommandEffects.listenOnly(true));
        }

        if (containsAny(normalized, CLEAR_CUES)) {
            return RouteResult.reply(Intent.CLEAR_MEMORY, "Memory cleared.", CommandEffects.clearMemoryEffect());
        }

        if (containsAny(normalized, RECALL_CUES)) {
            return RouteResult.reply(Intent.MEMORY_RECALL, recallResponse(memorySummary), CommandEffects.none());
        }

        if (containsAny(normalized, ARCHIVE_CUES)) {
            return RouteResult.reply(Intent.ARCHIVE_CONVERSATION,
                    "Saving this conversation to your knowledge base.",
                    CommandEffects.archiveEffect());
        }

        Double minutes = extractMinutes(normalized);
        if (minutes != null && containsAny(normalized, RECAP_CUES)) {
            return RouteResult.query(new MemoryQuery(MemoryQueryType.RECAP, minutes, null));
        }
        if (minutes != null && containsAny(normalized, SUMMARIZE_CUES)) {
            return RouteResult.query(new MemoryQuery(MemoryQueryType.SUMMARIZE, minutes, null));
        }

        if (containsAny(normalized, WHEN_CUES)) {
            return RouteResult.query(new MemoryQuery(
                    MemoryQueryType.WHEN_MENTIONED,
                    minutes == null ? 0 : minutes,
                    extractTopic(normalized)
            ));
        }

        if (containsAny(normalized, TIMESTAMP_CUES)) {
            return RouteResult.query(new MemoryQuery(MemoryQueryType.TIMESTAMPS, minutes == null ? 0 : minutes, null));
        }

        if (containsAny(normalized, FACT_CHECK_CUES)) {
            return RouteResult.factCheck();
        }

        return RouteResult.unhandled();
    }

    static Double extractMinutes(String normalized) {
        Matcher matcher = LAST_MINUTES.matcher(normalized);
        if (matcher.find()) {
            return Double.parseDouble(matcher.group(1));
        }
        matcher = MINUTES_AGO.matcher(normalized);
        if (matcher.find()) {
            return Double.parseDouble(matcher.group(1));
        }
        return null;
    }

    static String extractTopic(String normalized) {
        String rest = normalized;
        for (String prefix : WHEN_PREFIXES) {
            int index = rest.indexOf(prefix);
            if (index >= 0) {
                rest = rest.substring(index + prefix.length());
                break;
            }
        }
        List<String> words = new ArrayList<>();
        for (String word : NON_WORD.matcher(rest).replaceAll(" ").split("\\s+")) {
            if (!word.isBlank() && !TOPIC_STOP_WORDS.contains(word)) {
                words.add(word);
            }
        }
        return words.isEmpty() ? normalized : String.join(" ", words);
    }

    private String extractTimezone(String text) {
        Matcher matcher = TIMEZONE_VALUE.matcher(text);
        if (!matcher.find()) {
            matcher = TIMEZONE_FALLBACK.matcher(text);
            if (!matcher.find()) {
                return null;
            }
        }
        String value = matcher.group(1).trim();
        return value.isEmpty() ? null : value;
    }

    private boolean isStopListening(String normalized) {
        return normalized.contains("listening") || normalized.contains("pause") || normalized.contains("don't listen");
    }

    private String recallResponse(String memorySummary) {
        if (memorySummary == null || memorySummary.isBlank()) {
            return "I don't have anything from the last few minutes yet.";
        }
        return "Here's what I remember from the last few minutes: " + memorySummary.trim();
    }

    private String extractAfter(String normalized, List<String> prefixes) {
        for (String prefix : prefixes) {
            if (normalized.startsWith(prefix)) {
                String rest = TRAILING_PUNCTUATION.matcher(normalized.substring(prefix.length())).replaceAll("").trim();
                if (!rest.isEmpty()) {
                    return rest;
                }
            }
        }
        return null;
    }

    private boolean containsAny(String normalized, List<String> cues) {
        for (String cue : cues) {
            if (normalized.contains(cue)) {
                return true;
            }
        }
        return false;
    }
}
