package me.go_gradually.echomind.application.voice.model;

@FunctionalInterface
public interface VoiceEventSink {
    /** Returns false when the client can no longer receive messages. */
    boolean send(OutboundMessage message);
}
