package me.go_gradually.echomind.domain.vad;

public interface SpeechClassifier {
    boolean isSpeech(byte[] pcm16, int sampleRate);
}
