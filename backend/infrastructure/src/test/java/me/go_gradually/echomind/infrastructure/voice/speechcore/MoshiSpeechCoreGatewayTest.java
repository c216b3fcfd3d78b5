package me.go_gradually.echomind.infrastructure.voice.speechcore;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.go_gradually.echomind.application.voice.model.SpeechCoreListener;
import me.go_gradually.echomind.application.voice.model.SpeechCoreSession;
import me.go_gradually.echomind.infrastructure.shared.config.AppProperties;
import okhttp3.Response;
import okhttp3.WebSocket;
import okhttp3.WebSocketListener;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Base64;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MoshiSpeechCoreGatewayTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final BlockingQueue<String> received = new LinkedBlockingQueue<>();
    private final AtomicReference<WebSocket> serverSocket = new AtomicReference<>();
    private MockWebServer server;
    private AppProperties.SpeechCore settings;

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.enqueue(new MockResponse().withWebSocketUpgrade(new WebSocketListener() {
            @Override
            public void onOpen(WebSocket webSocket, Response response) {
                serverSocket.set(webSocket);
            }

            @Override
            public void onMessage(WebSocket webSocket, String text) {
                received.add(text);
            }
        }));
        server.start();
        settings = new AppProperties.SpeechCore();
        settings.setEnabled(true);
        settings.setUrl("ws://" + server.getHostName() + ":" + server.getPort() + "/ws");
    }

    @AfterEach
    void tearDown() throws Exception {
        server.shutdown();
    }

    @Test
    void isEnabled_followsSettings() {
        assertTrue(new MoshiSpeechCoreGateway(settings).isEnabled());
        settings.setEnabled(false);
        assertFalse(new MoshiSpeechCoreGateway(settings).isEnabled());
    }

    @Test
    void session_sendsAudioAndCancelMessages() throws Exception {
        SpeechCoreSession session = new MoshiSpeechCoreGateway(settings).open(new RecordingListener());

        session.sendAudio(new byte[]{1, 2, 3, 4}, 16000);
        session.cancel(7L);
        session.injectText("ignored without support", 7L);

        JsonNode audio = objectMapper.readTree(received.poll(5, TimeUnit.SECONDS));
        assertEquals("audio", audio.path("type").asText());
        assertEquals(16000, audio.path("sample_rate").asInt());
        assertArrayEquals(new byte[]{1, 2, 3, 4}, Base64.getDecoder().decode(audio.path("pcm16_b64").asText()));
        JsonNode cancel = objectMapper.readTree(received.poll(5, TimeUnit.SECONDS));
        assertEquals("cancel", cancel.path("type").asText());
        assertEquals(7L, cancel.path("generation_id").asLong());
        assertFalse(session.supportsTextInjection());
        assertNull(received.poll(200, TimeUnit.MILLISECONDS));
        session.close();
    }

    @Test
    void session_injectsTextWhenSupported() throws Exception {
        settings.setSupportsTextInject(true);
        SpeechCoreSession session = new MoshiSpeechCoreGateway(settings).open(new RecordingListener());

        session.injectText("Hello there.", 3L);

        JsonNode inject = objectMapper.readTree(received.poll(5, TimeUnit.SECONDS));
        assertEquals("text_inject", inject.path("type").asText());
        assertEquals("Hello there.", inject.path("text").asText());
        assertEquals(3L, inject.path("generation_id").asLong());
        session.close();
    }

    @Test
    void listener_receivesAudioOut() throws Exception {
        RecordingListener listener = new RecordingListener();
        SpeechCoreSession session = new MoshiSpeechCoreGateway(settings).open(listener);
        session.cancel(1L);
        assertNotNull(received.poll(5, TimeUnit.SECONDS));

        serverSocket.get().send("{\"type\":\"text\",\"text\":\"skip\"}");
        serverSocket.get().send("{\"type\":\"audio_out\",\"generation_id\":4,\"sample_rate\":24000,\"pcm16_b64\":\""
                + Base64.getEncoder().encodeToString(new byte[]{9, 8}) + "\"}");
        serverSocket.get().send("{\"type\":\"audio_out\",\"pcm16_b64\":\""
                + Base64.getEncoder().encodeToString(new byte[]{7, 6}) + "\"}");

        AudioOut first = listener.audio.poll(5, TimeUnit.SECONDS);
        AudioOut second = listener.audio.poll(5, TimeUnit.SECONDS);
        assertNotNull(first);
        assertEquals(4L, first.generation());
        assertEquals(24000, first.sampleRate());
        assertArrayEquals(new byte[]{9, 8}, first.pcm16());
        assertNotNull(second);
        assertNull(second.generation());
        assertEquals(24000, second.sampleRate());
        session.close();
    }

    private record AudioOut(Long generation, int sampleRate, byte[] pcm16) {
    }

    private static final class RecordingListener implements SpeechCoreListener {
        private final BlockingQueue<AudioOut> audio = new LinkedBlockingQueue<>();
        private final BlockingQueue<String> errors = new LinkedBlockingQueue<>();

        @Override
        public void onAudio(Long generation, int sampleRate, byte[] pcm16) {
            audio.add(new AudioOut(generation, sampleRate, pcm16));
        }

        @Override
        public void onError(String message) {
            errors.add(message);
        }
    }
}
