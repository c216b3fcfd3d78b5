package me.go_gradually.echomind.domain.audio;

/**
 * Mono PCM16 little-endian stream layout shared by the client and the session.
 */
public record AudioFormat(int sampleRate, int frameMs) {
    public AudioFormat {
        if (sampleRate <= 0) {
            throw new IllegalArgumentException("sampleRate must be positive");
        }
        if (frameMs <= 0) {
            throw new IllegalArgumentException("frameMs must be positive");
        }
    }

    public int frameSamples() {
        return sampleRate * frameMs / 1000;
    }

    public int frameBytes() {
        return frameSamples() * 2;
    }

    public int framesFor(int durationMs, int minimum) {
        return Math.max(minimum, durationMs / frameMs);
    }

    public int samplesFor(double seconds) {
        return (int) (sampleRate * seconds);
    }
}
