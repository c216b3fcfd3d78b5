package me.go_gradually.echomind.application.voice.model;

/**
 * Control surface of one live voice session, driven by the transport layer.
 */
public interface VoiceSession {
    String sessionId();

    /** Raw PCM16 payload; exact multiples of the frame size are split into frames, anything else is dropped. */
    void appendAudio(byte[] pcm16, double timestamp);

    void appendBase64Audio(String pcm16Base64, Double timestamp);

    void start();

    void pause();

    void resume();

    void endOfStream();

    void updateContext(SessionContextUpdate update);

    void clearMemory();

    void reportProtocolError(String message);

    void close();
}
