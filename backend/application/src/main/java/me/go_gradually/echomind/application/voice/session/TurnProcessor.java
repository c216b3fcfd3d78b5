package me.go_gradually.echomind.application.voice.session;

import me.go_gradually.echomind.application.voice.model.KnowledgeBaseQuery;
import me.go_gradually.echomind.application.voice.model.StoredTranscript;
import me.go_gradually.echomind.application.voice.model.VoiceEvent;
import me.go_gradually.echomind.domain.command.CommandEffects;
import me.go_gradually.echomind.domain.command.MemoryQuery;
import me.go_gradually.echomind.domain.command.RouteResult;
import me.go_gradually.echomind.domain.command.WakeWords;
import me.go_gradually.echomind.domain.conversation.ChatMessage;
import me.go_gradually.echomind.domain.conversation.Profile;
import me.go_gradually.echomind.domain.conversation.SessionPhase;
import me.go_gradually.echomind.domain.memory.MemoryEntry;
import me.go_gradually.echomind.domain.memory.Speaker;
import me.go_gradually.echomind.domain.speech.PhraseSegmenter;
import me.go_gradually.echomind.domain.speech.SpeechText;
import me.go_gradually.echomind.domain.util.TextUtils;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.logging.Logger;

/**
 * Runs one finalized utterance from transcription to the spoken answer. Every emission is fenced by
 * the generation captured when the utterance ended.
 */
final class TurnProcessor {
    static final String LISTENING_MODE_ON = "listening_mode_on";
    static final String LISTENING_MODE_OFF = "listening_mode_off";
    static final double MIN_CLIP_SECONDS = 0.25;
    static final String ARCHIVE_TAG = "voice";

    private static final Logger log = Logger.getLogger(TurnProcessor.class.getName());
    private static final int TOKEN_QUEUE_CAPACITY = 4000;
    private static final Object END_OF_STREAM = new Object();

    private final SessionSettings settings;
    private final VoiceSessionState state;
    private final SessionCollaborators collaborators;
    private final VoiceEventPublisher publisher;
    private final CancellationController cancellation;
    private final SpeechPlayer player;

    TurnProcessor(SessionSettings settings,
                  VoiceSessionState state,
                  SessionCollaborators collaborators,
                  VoiceEventPublisher publisher,
                  CancellationController cancellation,
                  SpeechPlayer player) {
        this.settings = settings;
        this.state = state;
        this.collaborators = collaborators;
        this.publisher = publisher;
        this.cancellation = cancellation;
        this.player = player;
    }

    void process(long generation, float[] audio) {
        long started = System.nanoTime();
        try {
            runTurn(generation, audio);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.fine(() -> "voice.turn.interrupted generation=" + generation);
        } catch (RuntimeException e) {
            fail(generation, "turn", e);
            publisher.event(VoiceEvent.BACK_TO_LISTENING, generation);
        } finally {
            cancellation.setPhaseIfCurrent(generation, SessionPhase.IDLE);
            collaborators.metrics().recordVoiceTurnLatency(Duration.ofNanos(System.nanoTime() - started));
        }
    }

    private void runTurn(long generation, float[] audio) throws InterruptedException {
        if (!cancellation.setPhaseIfCurrent(generation, SessionPhase.THINKING)) {
            return;
        }
        publisher.event(VoiceEvent.THINKING, generation);
        if (audio == null || audio.length < settings.format().samplesFor(MIN_CLIP_SECONDS)) {
            return;
        }
        String userText = SpeechText.stripMarkdown(transcribe(generation, audio));
        if (userText.isEmpty() || !cancellation.isCurrent(generation)) {
            return;
        }
        remember(userText, Speaker.USER);

        Profile profile = state.profile();
        boolean wakeWordTriggered = WakeWords.startsWithWakeWord(userText, profile.wakeWord());
        boolean triggered = wakeWordTriggered || WakeWords.containsTrigger(userText, state.triggerPhrases());
        RouteResult route = collaborators.router().route(
                userText,
                profile,
                state.memory().contextFor(5, 500),
                state.isListenOnly(),
                state.triggerPhrases()
        );
        log.fine(() -> "voice.turn.routed generation=" + generation + " intent=" + route.intent());
        applyEffects(route.effects());

        if (route.isDirectReply()) {
            directReply(generation, userText, route.responseText());
            return;
        }
        if (state.isListenOnly() && !triggered) {
            state.listenBuffer().add(userText);
            publisher.asrFinal(state.nextTurnId(), generation, userText);
            publisher.event(VoiceEvent.BACK_TO_LISTENING, generation);
            return;
        }

        String query = userText;
        if (state.isListenOnly()) {
            state.setListenOnly(false);
            publisher.memoryEvent(LISTENING_MODE_OFF);
            String buffered = state.listenBuffer().drain();
            if (!buffered.isBlank()) {
                query = (buffered + " " + userText).trim();
            }
            String stripped = WakeWords.strip(userText, profile.wakeWord());
            if (wakeWordTriggered && !stripped.isEmpty()) {
                query = stripped;
            }
        }
        if (!cancellation.isCurrent(generation)) {
            return;
        }
        publisher.asrFinal(state.nextTurnId(), generation, query);
        publisher.event(VoiceEvent.SPEAKING, generation);

        if (route.isFactCheck()) {
            factCheck(generation, query);
        } else if (route.memoryQuery() != null) {
            answerMemoryQuery(generation, query, route.memoryQuery());
        } else if (useKnowledgeBase()) {
            answerFromKnowledgeBase(generation, query);
        } else {
            streamReply(generation, query);
        }
        publisher.event(VoiceEvent.BACK_TO_LISTENING, generation);
    }

    private String transcribe(long generation, float[] audio) throws InterruptedException {
        long started = System.nanoTime();
        try {
            String text = collaborators.stt().transcribe(audio, settings.format().sampleRate());
            collaborators.metrics().recordSttLatency(Duration.ofNanos(System.nanoTime() - started));
            return text;
        } catch (InterruptedException e) {
            throw e;
        } catch (Exception e) {
            collaborators.metrics().incrementSttError();
            fail(generation, "stt", e);
            return "";
        }
    }

    private void directReply(long generation, String userText, String responseText) {
        publisher.asrFinal(state.nextTurnId(), generation, userText);
        publisher.event(VoiceEvent.SPEAKING, generation);
        publisher.assistantText(generation, responseText);
        if (player.speak(generation, responseText)) {
            remember(responseText, Speaker.ASSISTANT);
        }
        publisher.event(VoiceEvent.BACK_TO_LISTENING, generation);
    }

    private void applyEffects(CommandEffects effects) {
        if (effects.assistantName() != null) {
            publisher.profileUpdate(state.updateProfile(p -> p.withAssistantName(effects.assistantName())));
        }
        if (effects.userName() != null) {
            publisher.profileUpdate(state.updateProfile(p -> p.withUserName(effects.userName())));
        }
        if (effects.timezone() != null) {
            publisher.profileUpdate(state.updateProfile(p -> p.withTimezone(effects.timezone())));
        }
        if (effects.location() != null) {
            publisher.profileUpdate(state.updateProfile(p -> p.withLocation(effects.location())));
        }
        if (effects.listenOnly() != null) {
            boolean listenOnly = effects.listenOnly();
            state.setListenOnly(listenOnly);
            log.fine(() -> "voice.session.listen_only value=" + listenOnly);
            publisher.memoryEvent(listenOnly ? LISTENING_MODE_ON : LISTENING_MODE_OFF);
        }
        if (effects.clearMemory()) {
            state.history().clear();
            state.listenBuffer().clear();
            state.memory().clear();
        }
        if (effects.archiveConversation()) {
            archiveConversation();
        }
    }

    private void factCheck(long generation, String query) throws InterruptedException {
        String transcript = state.memory().contextFor(10, 3000);
        if (useKnowledgeBase()) {
            try {
                String answer = collaborators.knowledgeBase().ask(new KnowledgeBaseQuery(
                        "Fact-check the following. User request: " + query + "\n\nContext:\n" + transcript,
                        state.persona(),
                        state.contextWindow()
                ));
                deliverAnswer(generation, query, answer);
            } catch (InterruptedException e) {
                throw e;
            } catch (Exception e) {
                fail(generation, "backend_rag", e);
            }
            return;
        }
        String prompt = "You are a fact-checking assistant. Based ONLY on the following conversation transcript, "
                + "identify any factual claims and assess their accuracy. If you have no external sources, "
                + "clearly state uncertainty and give reasoning. Be concise.\n\nTranscript:\n" + transcript;
        try {
            deliverAnswer(generation, query, complete(buildMessages(query, prompt)));
        } catch (InterruptedException e) {
            throw e;
        } catch (Exception e) {
            fail(generation, "llm", e);
        }
    }

    private void answerMemoryQuery(long generation, String query, MemoryQuery memoryQuery) throws InterruptedException {
        switch (memoryQuery.type()) {
            case RECAP -> recap(generation, memoryQuery);
            case SUMMARIZE -> summarize(generation, memoryQuery);
            case TIMESTAMPS -> timestamps(generation, memoryQuery);
            case WHEN_MENTIONED -> whenMentioned(generation, query, memoryQuery);
        }
    }

    private void recap(long generation, MemoryQuery query) {
        int minutes = query.wholeMinutes();
        String recap = state.memory().summarizeLast(query.minutes());
        String reply;
        if (recap.isEmpty()) {
            reply = "I don't have anything in the last " + minutes + " minutes.";
        } else {
            Map<String, Object> info = new LinkedHashMap<>();
            info.put("summary", recap);
            info.put("minutes", query.minutes());
            publisher.memoryInfo(generation, info);
            reply = recap.length() < 1500
                    ? "In the last " + minutes + " minutes, here's what was said:\n\n" + recap
                    : TextUtils.ellipsize(recap, 1500);
        }
        publisher.assistantText(generation, reply);
        player.speak(generation, TextUtils.trimToLength(reply, 500));
    }

    private void summarize(long generation, MemoryQuery query) throws InterruptedException {
        int minutes = query.wholeMinutes();
        String transcript = state.memory().summarizeLast(query.minutes());
        if (transcript.isEmpty()) {
            player.speak(generation, "No conversation in the last " + minutes + " minutes to summarize.");
            return;
        }
        List<ChatMessage> messages = buildMessages(
                "Summarize this conversation from the last " + minutes + " minutes in 2-4 sentences.",
                "You are a concise summarizer. Output only the summary, no preamble.\n\nConversation:\n"
                        + TextUtils.trimToLength(transcript, 3000)
        );
        String summary;
        try {
            summary = SpeechText.stripMarkdown(complete(messages));
        } catch (InterruptedException e) {
            throw e;
        } catch (Exception e) {
            fail(generation, "llm", e);
            player.speak(generation, "I couldn't generate a summary.");
            return;
        }
        publisher.assistantText(generation, summary);
        player.speak(generation, summary);
    }

    private void timestamps(long generation, MemoryQuery query) {
        List<MemoryEntry> entries = state.memory().queryLast(query.minutes());
        List<String> lines = new ArrayList<>();
        List<Map<String, Object>> wireEntries = new ArrayList<>();
        for (MemoryEntry entry : entries) {
            String line = "[" + state.memory().formatClock(entry.tsStart()) + "] "
                    + entry.speaker().wireName() + ": " + TextUtils.ellipsize(entry.text(), 80);
            if (!entry.tags().isEmpty()) {
                line += " tags=" + entry.tags();
            }
            lines.add(line);
            wireEntries.add(toWire(entry));
        }
        String reply = lines.isEmpty() ? "No entries in that window." : String.join("\n", lines);
        Map<String, Object> info = new LinkedHashMap<>();
        info.put("entries", wireEntries);
        publisher.memoryInfo(generation, info);
        publisher.assistantText(generation, reply);
        player.speak(generation, TextUtils.trimToLength(reply, 400));
    }

    private void whenMentioned(long generation, String query, MemoryQuery memoryQuery) throws InterruptedException {
        String topic = TextUtils.firstNonBlank(memoryQuery.topic(), query);
        if (state.memory().queryTopic(topic).isEmpty()) {
            player.speak(generation, "I don't have any mentions of that in recent conversation.");
            return;
        }
        List<ChatMessage> messages = buildMessages(
                "When did we talk about this? User asked: " + query,
                "Use only this transcript. List approximate times and who said what.\n\n"
                        + TextUtils.trimToLength(state.memory().summarizeLast(30), 2500)
        );
        String answer;
        try {
            answer = SpeechText.stripMarkdown(complete(messages));
        } catch (InterruptedException e) {
            throw e;
        } catch (Exception e) {
            fail(generation, "llm", e);
            player.speak(generation, "I couldn't find that.");
            return;
        }
        publisher.assistantText(generation, answer);
        player.speak(generation, answer);
    }

    private void answerFromKnowledgeBase(long generation, String query) throws InterruptedException {
        try {
            String answer = collaborators.knowledgeBase().ask(
                    new KnowledgeBaseQuery(query, state.persona(), state.contextWindow())
            );
            deliverAnswer(generation, query, answer);
        } catch (InterruptedException e) {
            throw e;
        } catch (Exception e) {
            fail(generation, "backend_rag", e);
        }
    }

    private void streamReply(long generation, String query) throws InterruptedException {
        List<ChatMessage> messages = buildMessages(query, replySystemPrompt());
        BlockingQueue<Object> tokens = new LinkedBlockingQueue<>(TOKEN_QUEUE_CAPACITY);
        Future<?> producer = collaborators.executor().submit(() -> produceTokens(messages, tokens));
        cancellation.register(producer);
        try {
            consumeTokens(generation, query, messages, tokens);
        } finally {
            producer.cancel(true);
        }
    }

    private void consumeTokens(long generation,
                               String query,
                               List<ChatMessage> messages,
                               BlockingQueue<Object> tokens) throws InterruptedException {
        PhraseSegmenter segmenter = new PhraseSegmenter(settings.phrase(), nowMillis());
        StringBuilder reply = new StringBuilder();
        while (true) {
            if (!cancellation.isCurrent(generation)) {
                return;
            }
            Object item = tokens.poll(settings.phrase().commitPauseMs(), TimeUnit.MILLISECONDS);
            if (item == null) {
                String phrase = segmenter.onIdle(nowMillis());
                if (phrase != null && !player.commitPhrase(generation, phrase)) {
                    return;
                }
                continue;
            }
            if (item == END_OF_STREAM) {
                break;
            }
            if (item instanceof StreamFailure) {
                fallBackToCompletion(generation, query, messages, ((StreamFailure) item).cause());
                return;
            }
            String token = (String) item;
            reply.append(token);
            publisher.assistantTextPartial(generation, SpeechText.stripMarkdown(reply.toString()));
            String phrase = segmenter.offer(token, nowMillis());
            if (phrase != null && !player.commitPhrase(generation, phrase)) {
                return;
            }
        }
        String rest = segmenter.flush();
        if (rest != null && !player.commitPhrase(generation, rest)) {
            return;
        }
        String finalText = SpeechText.stripMarkdown(reply.toString());
        if (finalText.isEmpty() || !cancellation.isCurrent(generation)) {
            return;
        }
        publisher.assistantText(generation, finalText);
        persist(query, finalText);
    }

    private void produceTokens(List<ChatMessage> messages, BlockingQueue<Object> tokens) {
        long started = System.nanoTime();
        try {
            collaborators.llm().streamTokens(messages, tokens::put);
            collaborators.metrics().recordLlmLatency(Duration.ofNanos(System.nanoTime() - started));
            signal(tokens, END_OF_STREAM);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (Exception e) {
            collaborators.metrics().incrementLlmError();
            signal(tokens, new StreamFailure(e));
        }
    }

    private void fallBackToCompletion(long generation,
                                      String query,
                                      List<ChatMessage> messages,
                                      Exception cause) throws InterruptedException {
        fail(generation, "llm_stream", cause);
        String reply;
        try {
            reply = complete(messages);
        } catch (InterruptedException e) {
            throw e;
        } catch (Exception e) {
            fail(generation, "llm", e);
            return;
        }
        deliverAnswer(generation, query, reply);
    }

    /** Shows, speaks and persists a complete (non-streamed) answer. */
    private void deliverAnswer(long generation, String query, String answer) {
        String raw = TextUtils.trimToEmpty(answer);
        String clean = SpeechText.stripMarkdown(raw);
        if (!cancellation.isCurrent(generation)) {
            return;
        }
        if (!clean.isEmpty()) {
            publisher.assistantText(generation, clean);
        }
        if (!player.speak(generation, raw)) {
            return;
        }
        persist(query, TextUtils.firstNonBlank(clean, raw));
    }

    private String complete(List<ChatMessage> messages) throws Exception {
        long started = System.nanoTime();
        try {
            String reply = collaborators.llm().complete(messages);
            collaborators.metrics().recordLlmLatency(Duration.ofNanos(System.nanoTime() - started));
            return reply == null ? "" : reply;
        } catch (InterruptedException e) {
            throw e;
        } catch (Exception e) {
            collaborators.metrics().incrementLlmError();
            throw e;
        }
    }

    List<ChatMessage> buildMessages(String userText, String systemPrompt) {
        state.history().trim(systemPrompt);
        List<ChatMessage> messages = new ArrayList<>();
        messages.add(ChatMessage.system(systemPrompt));
        messages.addAll(state.history().snapshot());
        messages.add(ChatMessage.user(userText));
        return messages;
    }

    String replySystemPrompt() {
        String base = state.systemPrompt().trim();
        String context = state.memory().contextFor(15, 3500);
        if (!context.isEmpty()) {
            base = base + "\n\nRecent conversation context (for reference):\n" + context;
        }
        return state.profile().promptLine() + " " + base;
    }

    private void persist(String userText, String assistantText) {
        if (TextUtils.isBlank(assistantText)) {
            return;
        }
        state.history().appendTurn(userText, assistantText, state.systemPrompt());
        remember(assistantText, Speaker.ASSISTANT);
    }

    private void remember(String text, Speaker speaker) {
        try {
            state.memory().addText(text, speaker);
        } catch (RuntimeException e) {
            log.warning(() -> "voice.memory.add_failed speaker=" + speaker.wireName() + " reason=" + e.getMessage());
        }
    }

    private void archiveConversation() {
        String transcript = state.memory().summarizeLast(settings.memoryWindowMinutes());
        if (transcript.isBlank() || collaborators.archive() == null) {
            log.fine("voice.archive.skipped reason=empty");
            return;
        }
        collaborators.executor().submit(() -> {
            try {
                StoredTranscript stored = collaborators.archive().store(transcript, ARCHIVE_TAG);
                log.fine(() -> "voice.archive.stored transcriptId=" + stored.transcriptId());
                publisher.stored(stored);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } catch (Exception e) {
                log.warning(() -> "voice.archive.failed reason=" + e.getMessage());
            }
        });
    }

    private boolean useKnowledgeBase() {
        return state.useKnowledgeBase()
                && collaborators.knowledgeBase() != null
                && collaborators.knowledgeBase().isConfigured();
    }

    private void fail(long generation, String where, Exception e) {
        if (!cancellation.isCurrent(generation)) {
            return;
        }
        log.warning(() -> "voice.turn.failed where=" + where + " generation=" + generation + " reason=" + e.getMessage());
        publisher.error(where, e.getMessage(), generation);
    }

    private long nowMillis() {
        return collaborators.clock().millis();
    }

    private static Map<String, Object> toWire(MemoryEntry entry) {
        Map<String, Object> wire = new LinkedHashMap<>();
        wire.put("ts_start", entry.tsStart().toEpochMilli() / 1000.0);
        wire.put("ts_end", entry.tsEnd().toEpochMilli() / 1000.0);
        wire.put("text", entry.text());
        wire.put("tags", entry.tags());
        wire.put("speaker", entry.speaker().wireName());
        return wire;
    }

    private static void signal(BlockingQueue<Object> tokens, Object marker) {
        try {
            tokens.put(marker);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private record StreamFailure(Exception cause) {
    }
}
