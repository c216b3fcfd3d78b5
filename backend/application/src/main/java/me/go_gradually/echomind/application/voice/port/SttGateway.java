package me.go_gradually.echomind.application.voice.port;

public interface SttGateway {
    String transcribe(float[] audio, int sampleRate) throws Exception;
}
