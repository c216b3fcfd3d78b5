package me.go_gradually.echomind.domain.speech;

import me.go_gradually.echomind.domain.audio.Pcm16;

import java.util.Arrays;
import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Splits synthesized audio into fixed-duration PCM16 chunks with short linear fades at both edges.
 * Chunks are computed lazily so a caller that stops iterating never pays for the rest.
 */
public final class PlaybackEncoder {
    public static final double REPLY_CHUNK_SECONDS = 0.35;
    public static final double INTRO_CHUNK_SECONDS = 0.22;
    private static final int MIN_CHUNK_SAMPLES = 256;
    private static final double FADE_MS = 4.0;

    private final double chunkSeconds;
    private final double fadeMs;

    public PlaybackEncoder(double chunkSeconds, double fadeMs) {
        this.chunkSeconds = chunkSeconds;
        this.fadeMs = fadeMs;
    }

    public static PlaybackEncoder replies() {
        return new PlaybackEncoder(REPLY_CHUNK_SECONDS, FADE_MS);
    }

    public static PlaybackEncoder intro() {
        return new PlaybackEncoder(INTRO_CHUNK_SECONDS, 0.0);
    }

    public int chunkSamples(int sampleRate) {
        return Math.max(MIN_CHUNK_SAMPLES, (int) (sampleRate * chunkSeconds));
    }

    public Iterator<PlaybackChunk> encode(SynthesizedAudio audio, long generation, double playbackRate) {
        float[] samples = audio.samples();
        int sampleRate = audio.sampleRate();
        int step = chunkSamples(sampleRate);
        return new Iterator<>() {
            private int offset;

            @Override
            public boolean hasNext() {
                return offset < samples.length;
            }

            @Override
            public PlaybackChunk next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                int end = Math.min(samples.length, offset + step);
                float[] part = Arrays.copyOfRange(samples, offset, end);
                offset = end;
                applyFade(part, sampleRate, fadeMs);
                return new PlaybackChunk(generation, sampleRate, playbackRate, Pcm16.fromFloat(part));
            }
        };
    }

    /** Linear ramp over the first and last {@code fadeMs}, bounded to half the chunk. */
    public static void applyFade(float[] chunk, int sampleRate, double fadeMs) {
        if (chunk.length == 0) {
            return;
        }
        int n = Math.min((int) (sampleRate * (fadeMs / 1000.0)), chunk.length / 2);
        if (n <= 0) {
            return;
        }
        for (int i = 0; i < n; i++) {
            float gain = (i + 1) / (float) (n + 1);
            chunk[i] *= gain;
            chunk[chunk.length - 1 - i] *= gain;
        }
    }
}
