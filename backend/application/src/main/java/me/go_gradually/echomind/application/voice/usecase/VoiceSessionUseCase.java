package me.go_gradually.echomind.application.voice.usecase;

import me.go_gradually.echomind.application.voice.model.VoiceEventSink;
import me.go_gradually.echomind.application.voice.model.VoiceSession;
import me.go_gradually.echomind.application.voice.model.VoiceSessionOpenCommand;
import me.go_gradually.echomind.application.voice.policy.VoicePolicy;
import me.go_gradually.echomind.application.voice.session.DefaultVoiceSession;
import me.go_gradually.echomind.application.voice.session.SessionCollaborators;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

public class VoiceSessionUseCase {
    private final SessionCollaborators collaborators;
    private final VoicePolicy voicePolicy;
    private final Map<String, AtomicReference<VoiceSession>> sessionsById = new ConcurrentHashMap<>();

    public VoiceSessionUseCase(SessionCollaborators collaborators, VoicePolicy voicePolicy) {
        this.collaborators = collaborators;
        this.voicePolicy = voicePolicy;
    }

    public VoiceSession open(VoiceSessionOpenCommand command, VoiceEventSink sink) {
        if (command == null || isBlank(command.getSessionId())) {
            throw new IllegalArgumentException("sessionId is required");
        }
        if (sink == null) {
            throw new IllegalArgumentException("sink is required");
        }
        String sessionId = command.getSessionId().trim();
        // the slot reserves the id before any worker runs, so a session closing mid-open removes its own entry
        AtomicReference<VoiceSession> slot = new AtomicReference<>();
        if (sessionsById.putIfAbsent(sessionId, slot) != null) {
            throw new IllegalArgumentException("Voice session already open: " + sessionId);
        }
        try {
            VoiceSession session = DefaultVoiceSession.open(
                    sessionId,
                    voicePolicy,
                    collaborators,
                    sink,
                    () -> sessionsById.remove(sessionId, slot)
            );
            slot.set(session);
            return session;
        } catch (RuntimeException e) {
            sessionsById.remove(sessionId, slot);
            throw e;
        }
    }

    public Optional<VoiceSession> find(String sessionId) {
        if (isBlank(sessionId)) {
            return Optional.empty();
        }
        AtomicReference<VoiceSession> slot = sessionsById.get(sessionId);
        return slot == null ? Optional.empty() : Optional.ofNullable(slot.get());
    }

    public void close(String sessionId) {
        find(sessionId).ifPresent(VoiceSession::close);
    }

    public int activeSessions() {
        return sessionsById.size();
    }

    private boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
