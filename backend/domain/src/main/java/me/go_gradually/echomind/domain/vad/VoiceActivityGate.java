package me.go_gradually.echomind.domain.vad;

import me.go_gradually.echomind.domain.audio.AudioFormat;
import me.go_gradually.echomind.domain.audio.AudioFrame;
import me.go_gradually.echomind.domain.audio.Pcm16;
import me.go_gradually.echomind.domain.audio.UtteranceBuffer;

/**
 * Per-frame speech/silence state machine. Owned by a single consumer thread.
 * <p>
 * Speech starts after {@code leadFrames} consecutive speech frames (more while the assistant is active) and
 * ends after {@code endpointSilenceFrames} consecutive silent frames. Utterances with fewer than
 * {@code minSpeechFrames} speech frames are discarded.
 */
public final class VoiceActivityGate {
    private final AudioFormat format;
    private final VadSettings settings;
    private final SpeechClassifier classifier;
    private final UtteranceBuffer utterance;

    private boolean inSpeech;
    private int speechLeadCount;
    private int speechFrames;
    private int silenceCount;

    public VoiceActivityGate(AudioFormat format,
                             VadSettings settings,
                             SpeechClassifier classifier,
                             UtteranceBuffer utterance) {
        this.format = format;
        this.settings = settings;
        this.classifier = classifier;
        this.utterance = utterance;
    }

    public GateDecision offer(AudioFrame frame, boolean assistantActive) {
        if (isSpeechFrame(frame)) {
            return onSpeech(frame, assistantActive);
        }
        return onSilence(frame);
    }

    public GateDecision forceEndpoint() {
        speechLeadCount = 0;
        if (!inSpeech) {
            return GateDecision.NONE;
        }
        return endUtterance();
    }

    public void reset() {
        inSpeech = false;
        speechLeadCount = 0;
        speechFrames = 0;
        silenceCount = 0;
        utterance.reset();
    }

    public float[] utteranceAudio() {
        return utterance.toFloatAudio();
    }

    public boolean isInSpeech() {
        return inSpeech;
    }

    public int speechLeadCount() {
        return speechLeadCount;
    }

    private boolean isSpeechFrame(AudioFrame frame) {
        if (Pcm16.rms(frame.pcm16()) < settings.energyFloor()) {
            return false;
        }
        return classifier.isSpeech(frame.pcm16(), format.sampleRate());
    }

    private GateDecision onSpeech(AudioFrame frame, boolean assistantActive) {
        silenceCount = 0;
        speechFrames++;
        speechLeadCount++;
        GateDecision decision = GateDecision.NONE;
        if (!inSpeech && speechLeadCount >= settings.leadFrames(assistantActive)) {
            inSpeech = true;
            utterance.reset();
            speechFrames = speechLeadCount;
            decision = GateDecision.SPEECH_STARTED;
        }
        if (inSpeech) {
            utterance.push(frame);
        }
        return decision;
    }

    private GateDecision onSilence(AudioFrame frame) {
        speechLeadCount = 0;
        if (!inSpeech) {
            speechFrames = 0;
            return GateDecision.NONE;
        }
        silenceCount++;
        if (settings.tailFrames() > 0) {
            utterance.push(frame);
        }
        if (silenceCount < settings.endpointSilenceFrames()) {
            return GateDecision.NONE;
        }
        return endUtterance();
    }

    private GateDecision endUtterance() {
        inSpeech = false;
        boolean tooShort = speechFrames < settings.minSpeechFrames();
        speechFrames = 0;
        silenceCount = 0;
        return tooShort ? GateDecision.UTTERANCE_DISCARDED : GateDecision.UTTERANCE_READY;
    }
}
