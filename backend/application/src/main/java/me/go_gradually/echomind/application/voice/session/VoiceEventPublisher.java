package me.go_gradually.echomind.application.voice.session;

import me.go_gradually.echomind.application.voice.model.OutboundMessage;
import me.go_gradually.echomind.application.voice.model.OutboundType;
import me.go_gradually.echomind.application.voice.model.StoredTranscript;
import me.go_gradually.echomind.application.voice.model.VoiceEvent;
import me.go_gradually.echomind.domain.conversation.Profile;
import me.go_gradually.echomind.domain.speech.PlaybackChunk;

import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Builds the client protocol messages. Generation-tagged messages are only enqueued while their
 * generation is current.
 */
final class VoiceEventPublisher {
    private final OutboundDispatcher dispatcher;
    private final CancellationController cancellation;

    VoiceEventPublisher(OutboundDispatcher dispatcher, CancellationController cancellation) {
        this.dispatcher = dispatcher;
        this.cancellation = cancellation;
    }

    void hello(String sessionId, String note) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("session_id", sessionId);
        payload.put("note", note);
        unfenced(OutboundType.HELLO, payload);
    }

    void contextAck(String systemPrompt, Boolean cleared) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("system_prompt", systemPrompt);
        if (cleared != null) {
            payload.put("cleared", cleared);
        }
        unfenced(OutboundType.CONTEXT_ACK, payload);
    }

    void profileUpdate(Profile profile) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("assistant_name", profile.assistantName());
        payload.put("wake_word", profile.wakeWord());
        payload.put("user_name", profile.userName());
        payload.put("timezone", profile.timezone());
        payload.put("location", profile.location());
        unfenced(OutboundType.PROFILE_UPDATE, payload);
    }

    boolean event(VoiceEvent event, long generation) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("event", event.name());
        payload.put("generation_id", generation);
        return fenced(generation, OutboundType.EVENT, payload);
    }

    boolean asrFinal(long turnId, long generation, String text) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("turn_id", turnId);
        payload.put("generation_id", generation);
        payload.put("text", text);
        return fenced(generation, OutboundType.ASR_FINAL, payload);
    }

    boolean assistantText(long generation, String text) {
        return text(OutboundType.ASSISTANT_TEXT, generation, text);
    }

    boolean assistantTextPartial(long generation, String text) {
        return text(OutboundType.ASSISTANT_TEXT_PARTIAL, generation, text);
    }

    boolean assistantPhrase(long generation, String text) {
        return text(OutboundType.ASSISTANT_PHRASE, generation, text);
    }

    boolean audio(PlaybackChunk chunk) {
        return audio(chunk.generation(), chunk.sampleRate(), chunk.playbackRate(), chunk.pcm16());
    }

    boolean audio(long generation, int sampleRate, double playbackRate, byte[] pcm16) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("generation_id", generation);
        payload.put("sample_rate", sampleRate);
        payload.put("playback_rate", playbackRate);
        payload.put("pcm16_b64", Base64.getEncoder().encodeToString(pcm16));
        return fenced(generation, OutboundType.AUDIO_OUT, payload);
    }

    boolean cancel(long generation) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("generation_id", generation);
        return fenced(generation, OutboundType.CANCEL, payload);
    }

    void memoryEvent(String event) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("event", event);
        unfenced(OutboundType.MEMORY_EVENT, payload);
    }

    boolean memoryInfo(long generation, Map<String, Object> fields) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("generation_id", generation);
        payload.putAll(fields);
        return fenced(generation, OutboundType.MEMORY_INFO, payload);
    }

    void stored(StoredTranscript transcript) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("transcript_id", transcript.transcriptId());
        payload.put("tags", transcript.tags());
        unfenced(OutboundType.STORED, payload);
    }

    boolean error(String where, String message, Long generation) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("where", where);
        payload.put("message", message == null || message.isBlank() ? "Unknown voice session error" : message);
        if (generation == null) {
            return unfenced(OutboundType.ERROR, payload);
        }
        payload.put("generation_id", generation);
        return fenced(generation, OutboundType.ERROR, payload);
    }

    private boolean text(OutboundType type, long generation, String text) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("generation_id", generation);
        payload.put("text", text);
        return fenced(generation, type, payload);
    }

    private boolean fenced(long generation, OutboundType type, Map<String, Object> payload) {
        if (!cancellation.isCurrent(generation)) {
            return false;
        }
        return dispatcher.enqueue(new OutboundMessage(type, generation, payload));
    }

    private boolean unfenced(OutboundType type, Map<String, Object> payload) {
        return dispatcher.enqueue(new OutboundMessage(type, null, payload));
    }
}
