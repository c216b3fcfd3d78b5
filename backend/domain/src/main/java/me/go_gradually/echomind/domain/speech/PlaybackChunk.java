package me.go_gradually.echomind.domain.speech;

public record PlaybackChunk(long generation, int sampleRate, double playbackRate, byte[] pcm16) {
}
