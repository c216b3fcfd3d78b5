package me.go_gradually.echomind.presentation.voice.websocket;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.go_gradually.echomind.application.voice.model.OutboundMessage;
import me.go_gradually.echomind.application.voice.model.OutboundType;
import me.go_gradually.echomind.application.voice.model.SessionContextUpdate;
import me.go_gradually.echomind.application.voice.model.VoiceEventSink;
import me.go_gradually.echomind.application.voice.model.VoiceSession;
import me.go_gradually.echomind.application.voice.model.VoiceSessionOpenCommand;
import me.go_gradually.echomind.application.voice.usecase.VoiceSessionUseCase;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.web.socket.BinaryMessage;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class VoiceWebSocketHandlerTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Mock
    private VoiceSessionUseCase useCase;
    @Mock
    private WebSocketSession webSocketSession;
    @Mock
    private VoiceSession voiceSession;

    private VoiceWebSocketHandler handler;

    @BeforeEach
    void setUp() {
        handler = new VoiceWebSocketHandler(useCase);
        lenient().when(webSocketSession.getId()).thenReturn("ws-1");
        lenient().when(webSocketSession.isOpen()).thenReturn(true);
    }

    @Test
    void afterConnectionEstablished_opensSessionKeyedBySocketId() throws Exception {
        when(useCase.open(any(), any())).thenReturn(voiceSession);

        handler.afterConnectionEstablished(webSocketSession);

        ArgumentCaptor<VoiceSessionOpenCommand> captor = ArgumentCaptor.forClass(VoiceSessionOpenCommand.class);
        verify(useCase).open(captor.capture(), any());
        assertEquals("ws-1", captor.getValue().getSessionId());
    }

    @Test
    void sink_writesFlatJsonWithTypeFirst() throws Exception {
        ArgumentCaptor<VoiceEventSink> sinkCaptor = ArgumentCaptor.forClass(VoiceEventSink.class);
        when(useCase.open(any(), sinkCaptor.capture())).thenReturn(voiceSession);
        handler.afterConnectionEstablished(webSocketSession);

        boolean sent = sinkCaptor.getValue().send(new OutboundMessage(OutboundType.ASR_FINAL, 2L,
                Map.of("turn_id", 1, "generation_id", 2L, "text", "hello")));

        assertTrue(sent);
        ArgumentCaptor<TextMessage> messageCaptor = ArgumentCaptor.forClass(TextMessage.class);
        verify(webSocketSession).sendMessage(messageCaptor.capture());
        String payload = messageCaptor.getValue().getPayload();
        assertTrue(payload.startsWith("{\"type\":\"asr_final\""));
        JsonNode root = objectMapper.readTree(payload);
        assertEquals(2L, root.path("generation_id").asLong());
        assertEquals("hello", root.path("text").asText());
    }

    @Test
    void sink_reportsClosedSocket() throws Exception {
        ArgumentCaptor<VoiceEventSink> sinkCaptor = ArgumentCaptor.forClass(VoiceEventSink.class);
        when(useCase.open(any(), sinkCaptor.capture())).thenReturn(voiceSession);
        handler.afterConnectionEstablished(webSocketSession);
        when(webSocketSession.isOpen()).thenReturn(false);

        assertFalse(sinkCaptor.getValue().send(new OutboundMessage(OutboundType.HELLO, null, Map.of())));
    }

    @Test
    void afterConnectionEstablished_closesWithShortReasonWhenOpenFails() throws Exception {
        when(useCase.open(any(), any())).thenThrow(new IllegalArgumentException("x".repeat(300)));

        handler.afterConnectionEstablished(webSocketSession);

        ArgumentCaptor<CloseStatus> captor = ArgumentCaptor.forClass(CloseStatus.class);
        verify(webSocketSession).close(captor.capture());
        assertEquals(CloseStatus.SERVER_ERROR.getCode(), captor.getValue().getCode());
        assertEquals(120, captor.getValue().getReason().length());
        verify(webSocketSession).sendMessage(any(TextMessage.class));
    }

    @Test
    void handleTextMessage_routesControlMessages() throws Exception {
        openSession();

        handler.handleTextMessage(webSocketSession, new TextMessage("{\"type\":\"start\"}"));
        handler.handleTextMessage(webSocketSession, new TextMessage("{\"type\":\"pause\"}"));
        handler.handleTextMessage(webSocketSession, new TextMessage("{\"type\":\"resume\"}"));
        handler.handleTextMessage(webSocketSession, new TextMessage("{\"type\":\"stop\"}"));
        handler.handleTextMessage(webSocketSession, new TextMessage("{\"type\":\"eos\"}"));
        handler.handleTextMessage(webSocketSession, new TextMessage("{\"type\":\"clear_memory\"}"));
        handler.handleTextMessage(webSocketSession, new TextMessage("{\"type\":\"audio_frame\",\"pcm16_b64\":\"AAA=\",\"ts\":1.5}"));
        handler.handleTextMessage(webSocketSession, new TextMessage("{\"type\":\"audio\",\"pcm16_b64\":\"BBB=\"}"));

        verify(voiceSession).start();
        verify(voiceSession).pause();
        verify(voiceSession).resume();
        verify(voiceSession, times(2)).endOfStream();
        verify(voiceSession).clearMemory();
        verify(voiceSession).appendBase64Audio("AAA=", 1.5);
        verify(voiceSession).appendBase64Audio("BBB=", null);
    }

    @Test
    void handleTextMessage_mapsSetContextFields() throws Exception {
        openSession();

        handler.handleTextMessage(webSocketSession, new TextMessage("{\"type\":\"set_context\","
                + "\"system_prompt\":\"Be terse.\",\"use_knowledge_base\":true,\"persona\":\"coach\","
                + "\"context_window\":\"7d\",\"assistant_name\":\"Nova\",\"user_name\":\"Sam\","
                + "\"timezone\":\"Europe/Paris\",\"listen_only\":false,"
                + "\"trigger_phrases\":[\"go ahead\",null,\"speak up\"],\"clear_memory\":1,"
                + "\"piper_voice\":\"en_US-amy-low\"}"));

        ArgumentCaptor<SessionContextUpdate> captor = ArgumentCaptor.forClass(SessionContextUpdate.class);
        verify(voiceSession).updateContext(captor.capture());
        SessionContextUpdate update = captor.getValue();
        assertEquals("Be terse.", update.getSystemPrompt());
        assertEquals(Boolean.TRUE, update.getUseKnowledgeBase());
        assertEquals("coach", update.getPersona());
        assertEquals("7d", update.getContextWindow());
        assertEquals("Nova", update.getAssistantName());
        assertNull(update.getWakeWord());
        assertEquals("Sam", update.getUserName());
        assertEquals("Europe/Paris", update.getTimezone());
        assertNull(update.getLocation());
        assertEquals(Boolean.FALSE, update.getListenOnly());
        assertEquals(List.of("go ahead", "speak up"), update.getTriggerPhrases());
        assertEquals(Boolean.TRUE, update.getClearMemory());
        assertEquals("en_US-amy-low", update.getPiperVoice());
    }

    @Test
    void handleTextMessage_reportsProtocolErrors() throws Exception {
        openSession();

        handler.handleTextMessage(webSocketSession, new TextMessage("not json"));
        handler.handleTextMessage(webSocketSession, new TextMessage("[1,2]"));
        handler.handleTextMessage(webSocketSession, new TextMessage("{\"type\":\"dance\"}"));

        verify(voiceSession).reportProtocolError("Invalid JSON message");
        verify(voiceSession).reportProtocolError("Message must be a JSON object");
        verify(voiceSession).reportProtocolError("Unsupported message type: dance");
    }

    @Test
    void handleBinaryMessage_forwardsRawPcmStampedWithReceiveTime() throws Exception {
        openSession();
        double before = System.currentTimeMillis() / 1000.0;

        handler.handleBinaryMessage(webSocketSession, new BinaryMessage(new byte[]{1, 0, 2, 0}));

        double after = System.currentTimeMillis() / 1000.0;
        ArgumentCaptor<byte[]> captor = ArgumentCaptor.forClass(byte[].class);
        ArgumentCaptor<Double> timestamp = ArgumentCaptor.forClass(Double.class);
        verify(voiceSession).appendAudio(captor.capture(), timestamp.capture());
        assertArrayEquals(new byte[]{1, 0, 2, 0}, captor.getValue());
        assertTrue(timestamp.getValue() >= before && timestamp.getValue() <= after);
    }

    @Test
    void messagesBeforeOpen_areIgnored() throws Exception {
        handler.handleTextMessage(webSocketSession, new TextMessage("{\"type\":\"start\"}"));
        handler.handleBinaryMessage(webSocketSession, new BinaryMessage(new byte[]{1, 0}));

        verify(voiceSession, never()).start();
        verify(voiceSession, never()).appendAudio(any(), anyDouble());
    }

    @Test
    void afterConnectionClosed_closesVoiceSessionOnce() throws Exception {
        openSession();

        handler.afterConnectionClosed(webSocketSession, CloseStatus.NORMAL);
        handler.afterConnectionClosed(webSocketSession, CloseStatus.NORMAL);

        verify(voiceSession).close();
    }

    @Test
    void handleTransportError_sendsErrorAndCloses() throws Exception {
        openSession();
        doThrow(new IOException("broken pipe")).when(webSocketSession).sendMessage(any());

        handler.handleTransportError(webSocketSession, new IOException("reset by peer"));

        verify(voiceSession).close();
    }

    private void openSession() throws Exception {
        when(useCase.open(any(), any())).thenReturn(voiceSession);
        handler.afterConnectionEstablished(webSocketSession);
    }
}
