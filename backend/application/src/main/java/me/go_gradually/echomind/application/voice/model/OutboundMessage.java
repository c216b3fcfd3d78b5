package me.go_gradually.echomind.application.voice.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One client-bound message. {@code generation} is null for messages that are never fenced
 * (handshake, acknowledgements, profile and archive notifications).
 */
public record OutboundMessage(OutboundType type, Long generation, Map<String, Object> payload) {
    public OutboundMessage {
        if (type == null) {
            throw new IllegalArgumentException("type is required");
        }
        payload = payload == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
    }

    public boolean isFenced() {
        return generation != null;
    }

    /** Flat wire form with {@code type} first. */
    public Map<String, Object> toWire() {
        Map<String, Object> wire = new LinkedHashMap<>();
        wire.put("type", type.wireName());
        wire.putAll(payload);
        return wire;
    }
}
