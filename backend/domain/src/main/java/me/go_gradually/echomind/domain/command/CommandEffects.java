package me.go_gradually.echomind.domain.command;

/**
 * Session mutations requested by a routed command. Null fields mean "leave unchanged".
 */
public record CommandEffects(String assistantName,
                             String userName,
                             String timezone,
                             String location,
                             Boolean listenOnly,
                             boolean clearMemory,
                             boolean archiveConversation) {
    private static final CommandEffects NONE = new CommandEffects(null, null, null, null, null, false, false);

    public static CommandEffects none() {
        return NONE;
    }

    public static CommandEffects assistantName(String value) {
        return new CommandEffects(value, null, null, null, null, false, false);
    }

    public static CommandEffects userName(String value) {
        return new CommandEffects(null, value, null, null, null, false, false);
    }

    public static CommandEffects timezone(String value) {
        return new CommandEffects(null, null, value, null, null, false, false);
    }

    public static CommandEffects location(String value) {
        return new CommandEffects(null, null, null, value, null, false, false);
    }

    public static CommandEffects listenOnly(boolean value) {
        return new CommandEffects(null, null, null, null, value, false, false);
    }

    public static CommandEffects clearMemoryEffect() {
        return new CommandEffects(null, null, null, null, null, true, false);
    }

    public static CommandEffects archiveEffect() {
        return new CommandEffects(null, null, null, null, null, false, true);
    }

    public boolean changesProfile() {
        return assistantName != null || userName != null || timezone != null || location != null;
    }
}
