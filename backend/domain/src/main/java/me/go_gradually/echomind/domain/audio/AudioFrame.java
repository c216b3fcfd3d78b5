package me.go_gradually.echomind.domain.audio;

/**
 * One fixed-size PCM16 frame as received from the client. The byte array is never written after construction.
 */
public record AudioFrame(double timestamp, byte[] pcm16) {
    public AudioFrame {
        if (pcm16 == null) {
            throw new IllegalArgumentException("pcm16 is required");
        }
    }

    public int size() {
        return pcm16.length;
    }
}
