package me.go_gradually.echomind.domain.command;

public record RouteResult(Intent intent, String responseText, CommandEffects effects, MemoryQuery memoryQuery) {
    public RouteResult {
        intent = intent == null ? Intent.NONE : intent;
        effects = effects == null ? CommandEffects.none() : effects;
    }

    public static RouteResult unhandled() {
        return new RouteResult(Intent.NONE, null, CommandEffects.none(), null);
    }

    public static RouteResult reply(Intent intent, String responseText, CommandEffects effects) {
        return new RouteResult(intent, responseText, effects, null);
    }

    public static RouteResult query(MemoryQuery query) {
        return new RouteResult(Intent.MEMORY_QUERY, null, CommandEffects.none(), query);
    }

    public static RouteResult factCheck() {
        return new RouteResult(Intent.FACT_CHECK, null, CommandEffects.none(), null);
    }

    public boolean handled() {
        return intent != Intent.NONE;
    }

    public boolean isFactCheck() {
        return intent == Intent.FACT_CHECK;
    }

    /** Answered directly with {@link #responseText()}, without any model call. */
    public boolean isDirectReply() {
        return handled() && responseText != null && memoryQuery == null && !isFactCheck();
    }
}
