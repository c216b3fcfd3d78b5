package me.go_gradually.echomind.application.voice.model;

public interface SpeechCoreSession {
    void sendAudio(byte[] pcm16, int sampleRate);

    void injectText(String text, long generation);

    void cancel(long generation);

    boolean supportsTextInjection();

    void close();
}
