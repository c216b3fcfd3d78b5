package me.go_gradually.echomind.application.voice.port;

@FunctionalInterface
public interface LlmTokenListener {
    void onToken(String token) throws InterruptedException;
}
