package me.go_gradually.echomind.presentation.voice.websocket;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.go_gradually.echomind.application.voice.model.OutboundMessage;
import me.go_gradually.echomind.application.voice.model.SessionContextUpdate;
import me.go_gradually.echomind.application.voice.model.VoiceSession;
import me.go_gradually.echomind.application.voice.model.VoiceSessionOpenCommand;
import me.go_gradually.echomind.application.voice.usecase.VoiceSessionUseCase;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.BinaryMessage;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.AbstractWebSocketHandler;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;

import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Logger;

/**
 * Browser voice socket: binary PCM16 frames or JSON control messages in, flat JSON events out.
 */
@Component
public class VoiceWebSocketHandler extends AbstractWebSocketHandler {
    private static final Logger log = Logger.getLogger(VoiceWebSocketHandler.class.getName());
    private static final int MESSAGE_SIZE_LIMIT = 1_048_576;

    private final VoiceSessionUseCase voiceSessionUseCase;
    private final ObjectMapper objectMapper = new ObjectMapper();
    private final Map<String, VoiceSession> sessionBySocketId = new ConcurrentHashMap<>();

    public VoiceWebSocketHandler(VoiceSessionUseCase voiceSessionUseCase) {
        this.voiceSessionUseCase = voiceSessionUseCase;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession rawSession) throws Exception {
        rawSession.setTextMessageSizeLimit(MESSAGE_SIZE_LIMIT);
        rawSession.setBinaryMessageSizeLimit(MESSAGE_SIZE_LIMIT);
        WebSocketSession session = new ConcurrentWebSocketSessionDecorator(rawSession, 10_000, MESSAGE_SIZE_LIMIT);
        try {
            VoiceSession voiceSession = voiceSessionUseCase.open(
                    new VoiceSessionOpenCommand(rawSession.getId()),
                    message -> send(session, message)
            );
            sessionBySocketId.put(rawSession.getId(), voiceSession);
        } catch (Exception e) {
            String message = defaultMessage(e.getMessage());
            log.warning(() -> "voice.ws.open_failed socketId=" + rawSession.getId() + " reason=" + message);
            sendRaw(session, errorPayload("session", message));
            session.close(CloseStatus.SERVER_ERROR.withReason(toCloseReason(message)));
        }
    }

    @Override
    protected void handleBinaryMessage(WebSocketSession session, BinaryMessage message) {
        VoiceSession voiceSession = sessionBySocketId.get(session.getId());
        if (voiceSession == null) {
            return;
        }
        ByteBuffer payload = message.getPayload();
        byte[] pcm16 = new byte[payload.remaining()];
        payload.get(pcm16);
        voiceSession.appendAudio(pcm16, System.currentTimeMillis() / 1000.0);
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        VoiceSession voiceSession = sessionBySocketId.get(session.getId());
        if (voiceSession == null) {
            return;
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(message.getPayload());
        } catch (JsonProcessingException e) {
            voiceSession.reportProtocolError("Invalid JSON message");
            return;
        }
        if (root == null || !root.isObject()) {
            voiceSession.reportProtocolError("Message must be a JSON object");
            return;
        }

        String type = root.path("type").asText("");
        switch (type) {
            case "audio", "audio_frame" -> voiceSession.appendBase64Audio(readString(root, "pcm16_b64"), readDouble(root, "ts"));
            case "start" -> voiceSession.start();
            case "pause" -> voiceSession.pause();
            case "resume" -> voiceSession.resume();
            case "stop", "eos" -> voiceSession.endOfStream();
            case "set_context" -> voiceSession.updateContext(toContextUpdate(root));
            case "clear_memory" -> voiceSession.clearMemory();
            default -> voiceSession.reportProtocolError("Unsupported message type: " + (type.isEmpty() ? "<missing>" : type));
        }
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) throws Exception {
        String message = exception == null ? "Transport error" : defaultMessage(exception.getMessage());
        log.warning(() -> "voice.ws.transport_error socketId=" + session.getId() + " reason=" + message);
        sendRaw(session, errorPayload("transport", message));
        VoiceSession voiceSession = sessionBySocketId.remove(session.getId());
        if (voiceSession != null) {
            voiceSession.close();
        }
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        VoiceSession voiceSession = sessionBySocketId.remove(session.getId());
        if (voiceSession != null) {
            voiceSession.close();
        }
        log.fine(() -> "voice.ws.closed socketId=" + session.getId() + " status=" + status.getCode());
    }

    private SessionContextUpdate toContextUpdate(JsonNode root) {
        SessionContextUpdate update = new SessionContextUpdate();
        update.setSystemPrompt(readString(root, "system_prompt"));
        update.setUseKnowledgeBase(readBoolean(root, "use_knowledge_base"));
        update.setPersona(readString(root, "persona"));
        update.setContextWindow(readString(root, "context_window"));
        update.setAssistantName(readString(root, "assistant_name"));
        update.setWakeWord(readString(root, "wake_word"));
        update.setUserName(readString(root, "user_name"));
        update.setTimezone(readString(root, "timezone"));
        update.setLocation(readString(root, "location"));
        update.setListenOnly(readBoolean(root, "listen_only"));
        update.setTriggerPhrases(readStringList(root, "trigger_phrases"));
        update.setClearMemory(readBoolean(root, "clear_memory"));
        update.setPiperVoice(readString(root, "piper_voice"));
        return update;
    }

    private boolean send(WebSocketSession session, OutboundMessage message) {
        return sendRaw(session, message.toWire());
    }

    private boolean sendRaw(WebSocketSession session, Map<String, Object> payload) {
        if (!session.isOpen()) {
            return false;
        }
        try {
            session.sendMessage(new TextMessage(objectMapper.writeValueAsString(payload)));
            return true;
        } catch (Exception e) {
            log.fine(() -> "voice.ws.send_failed socketId=" + session.getId() + " reason=" + e.getMessage());
            return false;
        }
    }

    // non-text scalars are stringified; null and missing stay null
    private String readString(JsonNode node, String field) {
        JsonNode value = node.path(field);
        if (value.isMissingNode() || value.isNull() || value.isContainerNode()) {
            return null;
        }
        return value.asText();
    }

    private Boolean readBoolean(JsonNode node, String field) {
        JsonNode value = node.path(field);
        if (value.isMissingNode() || value.isNull()) {
            return null;
        }
        if (value.isTextual()) {
            String text = value.asText().trim();
            return !text.isEmpty() && !"false".equalsIgnoreCase(text) && !"0".equals(text);
        }
        return value.asBoolean(false);
    }

    private Double readDouble(JsonNode node, String field) {
        JsonNode value = node.path(field);
        return value.isNumber() ? value.asDouble() : null;
    }

    private List<String> readStringList(JsonNode node, String field) {
        JsonNode value = node.path(field);
        if (!value.isArray()) {
            return null;
        }
        List<String> items = new ArrayList<>();
        for (JsonNode item : value) {
            if (!item.isNull() && !item.isContainerNode()) {
                items.add(item.asText());
            }
        }
        return items;
    }

    private Map<String, Object> errorPayload(String where, String message) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("type", "error");
        payload.put("where", where);
        payload.put("message", message);
        return payload;
    }

    private String defaultMessage(String message) {
        return message == null || message.isBlank() ? "Voice session failed" : message;
    }

    private String toCloseReason(String message) {
        String normalized = message == null ? "" : message.replace('\r', ' ').replace('\n', ' ').trim();
        if (normalized.isBlank()) {
            return "Voice session failed";
        }
        return normalized.length() > 120 ? normalized.substring(0, 120) : normalized;
    }
}
