package me.go_gradually.echomind.application.voice.session;

import me.go_gradually.echomind.domain.conversation.ConversationHistory;
import me.go_gradually.echomind.domain.conversation.ListenBuffer;
import me.go_gradually.echomind.domain.conversation.Profile;
import me.go_gradually.echomind.domain.memory.ConversationMemory;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.UnaryOperator;

/**
 * Mutable state of one session: profile, client context, chat history and memory. Written by the
 * socket thread and the reply task, so every field is either atomic, volatile or internally locked.
 */
final class VoiceSessionState {
    private final AtomicReference<Profile> profile;
    private final AtomicBoolean listenOnly = new AtomicBoolean(false);
    private final AtomicLong turnIds = new AtomicLong(0L);
    private final ConversationHistory history;
    private final ConversationMemory memory;
    private final ListenBuffer listenBuffer = new ListenBuffer();

    private volatile String systemPrompt;
    private volatile boolean useKnowledgeBase;
    private volatile String persona = "";
    private volatile String contextWindow = "all";
    private volatile List<String> triggerPhrases;
    private volatile String ttsVoice;

    VoiceSessionState(SessionSettings settings, Clock clock) {
        this.profile = new AtomicReference<>(settings.defaultProfile());
        this.history = new ConversationHistory(settings.historyMaxTurns(), settings.historyMaxTokens());
        this.memory = new ConversationMemory(settings.memoryWindowMinutes(), clock);
        this.systemPrompt = settings.systemPrompt();
        this.triggerPhrases = settings.triggerPhrases();
        this.ttsVoice = settings.defaultTtsVoice();
        settings.defaultProfile().zoneId().ifPresent(memory::useZone);
    }

    Profile profile() {
        return profile.get();
    }

    Profile updateProfile(UnaryOperator<Profile> change) {
        Profile updated = profile.updateAndGet(change);
        updated.zoneId().ifPresent(memory::useZone);
        return updated;
    }

    boolean isListenOnly() {
        return listenOnly.get();
    }

    void setListenOnly(boolean value) {
        listenOnly.set(value);
    }

    long nextTurnId() {
        return turnIds.incrementAndGet();
    }

    ConversationHistory history() {
        return history;
    }

    ConversationMemory memory() {
        return memory;
    }

    ListenBuffer listenBuffer() {
        return listenBuffer;
    }

    String systemPrompt() {
        return systemPrompt;
    }

    void setSystemPrompt(String systemPrompt) {
        this.systemPrompt = systemPrompt;
    }

    boolean useKnowledgeBase() {
        return useKnowledgeBase;
    }

    void setUseKnowledgeBase(boolean useKnowledgeBase) {
        this.useKnowledgeBase = useKnowledgeBase;
    }

    String persona() {
        return persona;
    }

    void setPersona(String persona) {
        this.persona = persona;
    }

    String contextWindow() {
        return contextWindow;
    }

    void setContextWindow(String contextWindow) {
        this.contextWindow = contextWindow;
    }

    List<String> triggerPhrases() {
        return triggerPhrases;
    }

    void setTriggerPhrases(List<String> triggerPhrases) {
        this.triggerPhrases = List.copyOf(triggerPhrases);
    }

    String ttsVoice() {
        return ttsVoice;
    }

    void setTtsVoice(String ttsVoice) {
        this.ttsVoice = ttsVoice;
    }
}
