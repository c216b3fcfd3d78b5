package me.go_gradually.echomind.application.voice.session;

import me.go_gradually.echomind.application.shared.port.MetricsPort;
import me.go_gradually.echomind.application.voice.model.SpeechCoreSession;
import me.go_gradually.echomind.application.voice.model.VoiceEvent;
import me.go_gradually.echomind.application.voice.port.TtsGateway;
import me.go_gradually.echomind.domain.conversation.SessionPhase;
import me.go_gradually.echomind.domain.speech.PlaybackChunk;
import me.go_gradually.echomind.domain.speech.PlaybackEncoder;
import me.go_gradually.echomind.domain.speech.PlaybackRate;
import me.go_gradually.echomind.domain.speech.SpeechText;
import me.go_gradually.echomind.domain.speech.SynthesizedAudio;

import java.time.Duration;
import java.util.Iterator;
import java.util.function.Supplier;
import java.util.logging.Logger;

/**
 * Synthesizes text and streams it as fenced {@code audio_out} chunks. Runs on the reply worker.
 */
final class SpeechPlayer {
    private static final Logger log = Logger.getLogger(SpeechPlayer.class.getName());
    private static final double INTRO_RATE = 1.0;

    private final TtsGateway tts;
    private final MetricsPort metrics;
    private final VoiceEventPublisher publisher;
    private final CancellationController cancellation;
    private final VoiceSessionState state;
    private final Supplier<SpeechCoreSession> speechCore;
    private final boolean emotionMode;
    private final PlaybackEncoder replyEncoder = PlaybackEncoder.replies();
    private final PlaybackEncoder introEncoder = PlaybackEncoder.intro();

    SpeechPlayer(TtsGateway tts,
                 MetricsPort metrics,
                 VoiceEventPublisher publisher,
                 CancellationController cancellation,
                 VoiceSessionState state,
                 Supplier<SpeechCoreSession> speechCore,
                 boolean emotionMode) {
        this.tts = tts;
        this.metrics = metrics;
        this.publisher = publisher;
        this.cancellation = cancellation;
        this.state = state;
        this.speechCore = speechCore;
        this.emotionMode = emotionMode;
    }

    /**
     * Speaks {@code text} under {@code generation}. Returns false when synthesis failed or the generation
     * was cancelled before every chunk went out.
     */
    boolean speak(long generation, String text) {
        String phrase = SpeechText.stripMarkdown(text);
        if (phrase.isEmpty()) {
            return cancellation.isCurrent(generation);
        }
        SynthesizedAudio audio = synthesize(generation, phrase, "tts");
        if (audio == null) {
            return false;
        }
        if (audio.isEmpty()) {
            return cancellation.isCurrent(generation);
        }
        if (!cancellation.setPhaseIfCurrent(generation, SessionPhase.SPEAKING)) {
            return false;
        }
        return play(replyEncoder.encode(audio, generation, PlaybackRate.forText(phrase, emotionMode)), generation);
    }

    /**
     * Emits a committed phrase. With a speech core that accepts text the phrase is injected there
     * instead of being synthesized locally; a failed injection falls back to local synthesis.
     */
    boolean commitPhrase(long generation, String phrase) {
        String trimmed = phrase == null ? "" : phrase.trim();
        if (trimmed.isEmpty()) {
            return cancellation.isCurrent(generation);
        }
        if (!publisher.assistantPhrase(generation, trimmed)) {
            return false;
        }
        SpeechCoreSession core = speechCore.get();
        if (core != null && core.supportsTextInjection()) {
            try {
                core.injectText(trimmed, generation);
                return cancellation.isCurrent(generation);
            } catch (RuntimeException e) {
                log.warning(() -> "voice.speech_core.inject_failed generation=" + generation + " reason=" + e.getMessage());
            }
        }
        return speak(generation, trimmed);
    }

    void playIntro(long generation, String introPhrase) {
        String phrase = SpeechText.stripMarkdown(introPhrase);
        if (phrase.isEmpty() || !cancellation.isCurrent(generation)) {
            return;
        }
        publisher.event(VoiceEvent.SPEAKING, generation);
        SynthesizedAudio audio = synthesize(generation, phrase, "tts_intro");
        if (audio == null || !cancellation.setPhaseIfCurrent(generation, SessionPhase.SPEAKING)) {
            return;
        }
        if (!play(introEncoder.encode(audio, generation, INTRO_RATE), generation)) {
            return;
        }
        cancellation.setPhaseIfCurrent(generation, SessionPhase.IDLE);
        publisher.event(VoiceEvent.BACK_TO_LISTENING, generation);
    }

    private SynthesizedAudio synthesize(long generation, String phrase, String where) {
        long started = System.nanoTime();
        try {
            SynthesizedAudio audio = tts.synthesize(phrase, state.ttsVoice());
            metrics.recordTtsLatency(Duration.ofNanos(System.nanoTime() - started));
            if (audio == null) {
                throw new IllegalStateException("TTS returned no audio");
            }
            return audio;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return null;
        } catch (Exception e) {
            if (!cancellation.isCurrent(generation)) {
                return null;
            }
            metrics.incrementTtsError();
            log.warning(() -> "voice.tts.failed where=" + where + " generation=" + generation + " reason=" + e.getMessage());
            publisher.error(where, e.getMessage(), generation);
            return null;
        }
    }

    private boolean play(Iterator<PlaybackChunk> chunks, long generation) {
        while (chunks.hasNext()) {
            if (!cancellation.isCurrent(generation) || Thread.currentThread().isInterrupted()) {
                return false;
            }
            if (!publisher.audio(chunks.next())) {
                return false;
            }
        }
        return cancellation.isCurrent(generation);
    }
}
