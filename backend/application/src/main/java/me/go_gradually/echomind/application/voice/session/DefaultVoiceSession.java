package me.go_gradually.echomind.application.voice.session;

import me.go_gradually.echomind.application.voice.model.SessionContextUpdate;
import me.go_gradually.echomind.application.voice.model.SpeechCoreListener;
import me.go_gradually.echomind.application.voice.model.SpeechCoreSession;
import me.go_gradually.echomind.application.voice.model.VoiceEvent;
import me.go_gradually.echomind.application.voice.model.VoiceEventSink;
import me.go_gradually.echomind.application.voice.model.VoiceSession;
import me.go_gradually.echomind.application.voice.policy.VoicePolicy;
import me.go_gradually.echomind.domain.audio.AudioFrame;
import me.go_gradually.echomind.domain.audio.UtteranceBuffer;
import me.go_gradually.echomind.domain.conversation.Profile;
import me.go_gradually.echomind.domain.util.TextUtils;
import me.go_gradually.echomind.domain.vad.EnergySpeechClassifier;
import me.go_gradually.echomind.domain.vad.GateDecision;
import me.go_gradually.echomind.domain.vad.VoiceActivityGate;

import java.util.Arrays;
import java.util.Base64;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.logging.Logger;

/**
 * One live voice conversation.
 * <p>
 * Transport threads only enqueue frames and control changes. A single consumer task owns the voice
 * activity gate, a finalize task per utterance produces the reply and a single dispatcher task writes
 * to the client.
 */
public final class DefaultVoiceSession implements VoiceSession {
    static final String HELLO_NOTE =
            "EchoMind: Context + memory + listen-only. Say 'listen to conversation' or use wake word.";

    private static final Logger log = Logger.getLogger(DefaultVoiceSession.class.getName());
    private static final long POLL_MILLIS = 100L;
    private static final AudioFrame END_OF_INPUT = new AudioFrame(-1.0, new byte[0]);

    private final String sessionId;
    private final SessionSettings settings;
    private final SessionCollaborators collaborators;
    private final VoiceSessionState state;
    private final CancellationController cancellation;
    private final OutboundDispatcher dispatcher;
    private final VoiceEventPublisher publisher;
    private final SpeechPlayer player;
    private final TurnProcessor turns;
    private final VoiceActivityGate gate;
    private final BlockingQueue<AudioFrame> inbound;
    private final AtomicBoolean ingesting = new AtomicBoolean(true);
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final AtomicReference<SpeechCoreSession> speechCore = new AtomicReference<>();
    private final AtomicReference<Future<?>> finalizeTask = new AtomicReference<>();
    private final List<Future<?>> sessionTasks = new CopyOnWriteArrayList<>();
    private final Runnable onClosed;

    private DefaultVoiceSession(String sessionId,
                                SessionSettings settings,
                                SessionCollaborators collaborators,
                                VoiceEventSink sink,
                                Runnable onClosed) {
        this.sessionId = sessionId;
        this.settings = settings;
        this.collaborators = collaborators;
        this.onClosed = onClosed == null ? () -> {
        } : onClosed;
        this.state = new VoiceSessionState(settings, collaborators.clock());
        this.cancellation = new CancellationController(this::onCancelled);
        this.dispatcher = new OutboundDispatcher(
                settings.outboundQueueMessages(),
                cancellation::generation,
                sink,
                collaborators.metrics(),
                this::close
        );
        this.publisher = new VoiceEventPublisher(dispatcher, cancellation);
        this.player = new SpeechPlayer(
                collaborators.tts(),
                collaborators.metrics(),
                publisher,
                cancellation,
                state,
                speechCore::get,
                settings.emotionMode()
        );
        this.turns = new TurnProcessor(settings, state, collaborators, publisher, cancellation, player);
        this.gate = new VoiceActivityGate(
                settings.format(),
                settings.vad(),
                new EnergySpeechClassifier(settings.vadAggressiveness()),
                UtteranceBuffer.forDuration(settings.format(), settings.maxUtteranceMs())
        );
        this.inbound = new ArrayBlockingQueue<>(settings.inboundQueueFrames());
    }

    /**
     * Creates the session, starts its workers and sends the greeting sequence.
     */
    public static DefaultVoiceSession open(String sessionId,
                                           VoicePolicy policy,
                                           SessionCollaborators collaborators,
                                           VoiceEventSink sink,
                                           Runnable onClosed) {
        DefaultVoiceSession session = new DefaultVoiceSession(
                sessionId,
                SessionSettings.from(policy),
                collaborators,
                sink,
                onClosed
        );
        session.startWorkers();
        return session;
    }

    private void startWorkers() {
        sessionTasks.add(collaborators.executor().submit(dispatcher::run));
        attachSpeechCore();
        sessionTasks.add(collaborators.executor().submit(this::consumeFrames));
        publisher.hello(sessionId, HELLO_NOTE);
        publisher.contextAck(state.systemPrompt(), null);
        publisher.profileUpdate(state.profile());
        if (!settings.introPhrase().isEmpty()) {
            long generation = cancellation.generation();
            cancellation.register(collaborators.executor().submit(() -> player.playIntro(generation, settings.introPhrase())));
        }
        log.info(() -> "voice.session.opened sessionId=" + sessionId);
    }

    private void attachSpeechCore() {
        if (collaborators.speechCore() == null || !collaborators.speechCore().isEnabled()) {
            return;
        }
        try {
            speechCore.set(collaborators.speechCore().open(new CoreListener()));
        } catch (Exception e) {
            log.warning(() -> "voice.speech_core.unavailable sessionId=" + sessionId + " reason=" + e.getMessage());
        }
    }

    @Override
    public String sessionId() {
        return sessionId;
    }

    @Override
    public void appendAudio(byte[] pcm16, double timestamp) {
        if (closed.get() || !ingesting.get() || pcm16 == null || pcm16.length == 0) {
            return;
        }
        int frameBytes = settings.format().frameBytes();
        if (pcm16.length % frameBytes != 0) {
            log.fine(() -> "voice.audio.dropped sessionId=" + sessionId + " bytes=" + pcm16.length);
            return;
        }
        for (int offset = 0; offset < pcm16.length; offset += frameBytes) {
            offerFrame(new AudioFrame(timestamp, Arrays.copyOfRange(pcm16, offset, offset + frameBytes)));
        }
    }

    @Override
    public void appendBase64Audio(String pcm16Base64, Double timestamp) {
        if (TextUtils.isBlank(pcm16Base64)) {
            return;
        }
        byte[] pcm16;
        try {
            pcm16 = Base64.getDecoder().decode(pcm16Base64);
        } catch (IllegalArgumentException e) {
            reportProtocolError("Invalid base64 audio chunk");
            return;
        }
        double ts = timestamp == null ? collaborators.clock().millis() / 1000.0 : timestamp;
        appendAudio(pcm16, ts);
    }

    @Override
    public void start() {
        ingesting.set(true);
    }

    @Override
    public void resume() {
        ingesting.set(true);
    }

    @Override
    public void pause() {
        ingesting.set(false);
        inbound.clear();
        long generation = cancellation.cancelAssistantPipeline(false, true);
        log.fine(() -> "voice.session.paused sessionId=" + sessionId + " generation=" + generation);
    }

    @Override
    public void endOfStream() {
        if (closed.get()) {
            return;
        }
        ingesting.set(false);
        offerFrame(END_OF_INPUT);
    }

    @Override
    public void updateContext(SessionContextUpdate update) {
        if (update == null) {
            return;
        }
        String prompt = TextUtils.trimToEmpty(update.getSystemPrompt());
        if (!prompt.isEmpty()) {
            state.setSystemPrompt(prompt);
        }
        state.setUseKnowledgeBase(Boolean.TRUE.equals(update.getUseKnowledgeBase()));
        state.setPersona(TextUtils.trimToEmpty(update.getPersona()));
        state.setContextWindow(TextUtils.firstNonBlank(TextUtils.trimToEmpty(update.getContextWindow()), "all"));
        Profile profile = state.updateProfile(current -> applyProfile(current, update));
        state.setListenOnly(Boolean.TRUE.equals(update.getListenOnly()));
        if (update.getTriggerPhrases() != null) {
            state.setTriggerPhrases(SessionSettings.normalizeTriggers(update.getTriggerPhrases()));
        }
        boolean cleared = Boolean.TRUE.equals(update.getClearMemory());
        if (cleared) {
            state.history().clear();
            state.listenBuffer().clear();
        }
        switchVoice(TextUtils.trimToEmpty(update.getPiperVoice()));
        publisher.contextAck(state.systemPrompt(), cleared);
        publisher.profileUpdate(profile);
    }

    @Override
    public void clearMemory() {
        state.history().clear();
        publisher.contextAck(state.systemPrompt(), true);
    }

    @Override
    public void reportProtocolError(String message) {
        log.fine(() -> "voice.protocol.error sessionId=" + sessionId + " message=" + message);
        publisher.error("protocol", message, null);
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        ingesting.set(false);
        cancellation.cancelAssistantPipeline(false, false);
        inbound.clear();
        dispatcher.close();
        for (Future<?> task : sessionTasks) {
            task.cancel(true);
        }
        SpeechCoreSession core = speechCore.getAndSet(null);
        if (core != null) {
            try {
                core.close();
            } catch (RuntimeException e) {
                log.warning(() -> "voice.speech_core.close_failed sessionId=" + sessionId + " reason=" + e.getMessage());
            }
        }
        log.info(() -> "voice.session.closed sessionId=" + sessionId);
        onClosed.run();
    }

    boolean isClosed() {
        return closed.get();
    }

    private Profile applyProfile(Profile current, SessionContextUpdate update) {
        Profile next = current;
        if (update.getAssistantName() != null && !update.getAssistantName().isBlank()) {
            next = next.withAssistantName(update.getAssistantName().trim());
        }
        if (update.getWakeWord() != null && !update.getWakeWord().isBlank()) {
            next = next.withWakeWord(update.getWakeWord().trim());
        }
        if (update.getUserName() != null) {
            next = next.withUserName(update.getUserName());
        }
        if (update.getTimezone() != null) {
            next = next.withTimezone(update.getTimezone());
        }
        if (update.getLocation() != null) {
            next = next.withLocation(update.getLocation());
        }
        return next;
    }

    private void switchVoice(String voiceId) {
        if (voiceId.isEmpty() || collaborators.voiceCatalog() == null) {
            return;
        }
        if (!collaborators.voiceCatalog().isInstalled(voiceId)) {
            log.warning(() -> "voice.tts.voice_missing sessionId=" + sessionId + " voiceId=" + voiceId);
            return;
        }
        state.setTtsVoice(voiceId);
    }

    private void offerFrame(AudioFrame frame) {
        while (!inbound.offer(frame)) {
            if (inbound.poll() != null) {
                collaborators.metrics().incrementDroppedFrame();
            }
        }
    }

    private void consumeFrames() {
        while (!closed.get()) {
            AudioFrame frame;
            try {
                frame = inbound.poll(POLL_MILLIS, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
            if (cancellation.consumeInputReset()) {
                gate.reset();
            }
            if (frame == null) {
                continue;
            }
            try {
                consume(frame);
            } catch (RuntimeException e) {
                log.warning(() -> "voice.audio.consume_failed sessionId=" + sessionId + " reason=" + e.getMessage());
                publisher.error("audio", e.getMessage(), null);
            }
        }
    }

    private void consume(AudioFrame frame) {
        if (frame == END_OF_INPUT) {
            onGateDecision(gate.forceEndpoint());
            return;
        }
        forwardToSpeechCore(frame);
        onGateDecision(gate.offer(frame, cancellation.isAssistantActive()));
    }

    private void onGateDecision(GateDecision decision) {
        switch (decision) {
            case SPEECH_STARTED -> {
                if (cancellation.isAssistantActive()) {
                    collaborators.metrics().incrementBargeIn();
                }
                long generation = cancellation.cancelAssistantPipeline(true, true);
                log.fine(() -> "voice.session.barge_in sessionId=" + sessionId + " generation=" + generation);
                publisher.event(VoiceEvent.USER_SPEECH_START, generation);
            }
            case UTTERANCE_DISCARDED -> publisher.event(VoiceEvent.USER_SPEECH_END, cancellation.generation());
            case UTTERANCE_READY -> {
                long generation = cancellation.generation();
                publisher.event(VoiceEvent.USER_SPEECH_END, generation);
                scheduleFinalize(generation, gate.utteranceAudio());
            }
            default -> {
            }
        }
    }

    private void scheduleFinalize(long generation, float[] audio) {
        Future<?> previous = finalizeTask.get();
        if (previous != null && !previous.isDone()) {
            previous.cancel(true);
        }
        Future<?> task = collaborators.executor().submit(() -> turns.process(generation, audio));
        finalizeTask.set(task);
        cancellation.register(task);
    }

    private void forwardToSpeechCore(AudioFrame frame) {
        SpeechCoreSession core = speechCore.get();
        if (core == null) {
            return;
        }
        try {
            core.sendAudio(frame.pcm16(), settings.format().sampleRate());
        } catch (RuntimeException e) {
            log.warning(() -> "voice.speech_core.send_failed sessionId=" + sessionId + " reason=" + e.getMessage());
        }
    }

    private void onCancelled(long generation, boolean sendCancel) {
        if (sendCancel) {
            publisher.cancel(generation);
        }
        SpeechCoreSession core = speechCore.get();
        if (core == null) {
            return;
        }
        try {
            core.cancel(generation);
        } catch (RuntimeException e) {
            log.warning(() -> "voice.speech_core.cancel_failed sessionId=" + sessionId + " generation=" + generation
                    + " reason=" + e.getMessage());
        }
    }

    private final class CoreListener implements SpeechCoreListener {
        @Override
        public void onAudio(Long generation, int sampleRate, byte[] pcm16) {
            long target = generation == null ? cancellation.generation() : generation;
            if (!cancellation.isCurrent(target)) {
                return;
            }
            publisher.audio(target, sampleRate, 1.0, pcm16);
        }

        @Override
        public void onError(String message) {
            log.warning(() -> "voice.speech_core.error sessionId=" + sessionId + " message=" + message);
        }
    }
}
