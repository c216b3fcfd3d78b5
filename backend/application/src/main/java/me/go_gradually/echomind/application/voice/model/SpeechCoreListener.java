package me.go_gradually.echomind.application.voice.model;

public interface SpeechCoreListener {
    void onAudio(Long generation, int sampleRate, byte[] pcm16);

    void onError(String message);
}
