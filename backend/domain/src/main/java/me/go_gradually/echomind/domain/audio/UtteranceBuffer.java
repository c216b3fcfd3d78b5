package me.go_gradually.echomind.domain.audio;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Bounded ring of the most recent frames of the current utterance. Oldest frames drop first.
 */
public final class UtteranceBuffer {
    private final int capacityFrames;
    private final Deque<AudioFrame> frames = new ArrayDeque<>();

    public UtteranceBuffer(int capacityFrames) {
        if (capacityFrames <= 0) {
            throw new IllegalArgumentException("UtteranceBuffer capacity must be positive");
        }
        this.capacityFrames = capacityFrames;
    }

    public static UtteranceBuffer forDuration(AudioFormat format, int maxUtteranceMs) {
        return new UtteranceBuffer(format.framesFor(maxUtteranceMs, 1));
    }

    public void push(AudioFrame frame) {
        frames.addLast(frame);
        while (frames.size() > capacityFrames) {
            frames.removeFirst();
        }
    }

    public void reset() {
        frames.clear();
    }

    public int size() {
        return frames.size();
    }

    public int capacity() {
        return capacityFrames;
    }

    public boolean isEmpty() {
        return frames.isEmpty();
    }

    public byte[] toPcm16() {
        int total = 0;
        for (AudioFrame frame : frames) {
            total += frame.size();
        }
        byte[] out = new byte[total];
        int offset = 0;
        for (AudioFrame frame : frames) {
            System.arraycopy(frame.pcm16(), 0, out, offset, frame.size());
            offset += frame.size();
        }
        return out;
    }

    public float[] toFloatAudio() {
        return Pcm16.toFloat(toPcm16());
    }
}
