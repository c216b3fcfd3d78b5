package me.go_gradually.echomind.infrastructure.voice.speechcore;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.go_gradually.echomind.application.voice.model.SpeechCoreListener;
import me.go_gradually.echomind.application.voice.model.SpeechCoreSession;
import me.go_gradually.echomind.application.voice.port.SpeechCoreGateway;
import me.go_gradually.echomind.infrastructure.shared.config.AppProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.WebSocket;
import java.nio.ByteBuffer;
import java.time.Duration;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Logger;

/**
 * Client for an external full-duplex speech core (Moshi) speaking JSON over WebSocket:
 * {@code audio}, {@code text_inject} and {@code cancel} upstream, {@code audio_out} downstream.
 */
@Component
public class MoshiSpeechCoreGateway implements SpeechCoreGateway {
    private static final Logger log = Logger.getLogger(MoshiSpeechCoreGateway.class.getName());
    private static final int DEFAULT_OUTPUT_SAMPLE_RATE = 24000;

    private final AppProperties.SpeechCore settings;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper = new ObjectMapper();

    @Autowired
    public MoshiSpeechCoreGateway(AppProperties properties) {
        this(properties.getIntegrations().getSpeechCore());
    }

    MoshiSpeechCoreGateway(AppProperties.SpeechCore settings) {
        this.settings = settings;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(Math.max(1, settings.getConnectTimeoutSeconds())))
                .build();
    }

    @Override
    public boolean isEnabled() {
        return settings.isEnabled();
    }

    @Override
    public SpeechCoreSession open(SpeechCoreListener listener) throws Exception {
        CoreWebSocketListener webSocketListener = new CoreWebSocketListener(listener, objectMapper);
        WebSocket webSocket = httpClient.newWebSocketBuilder()
                .connectTimeout(Duration.ofSeconds(Math.max(1, settings.getConnectTimeoutSeconds())))
                .buildAsync(URI.create(settings.getUrl()), webSocketListener)
                .get(Math.max(1, settings.getConnectTimeoutSeconds()), TimeUnit.SECONDS);
        log.info(() -> "voice.speech_core.connected url=" + settings.getUrl());
        return new MoshiSpeechCoreSession(webSocket, objectMapper, settings.isSupportsTextInject());
    }

    private static final class MoshiSpeechCoreSession implements SpeechCoreSession {
        private final WebSocket webSocket;
        private final ObjectMapper objectMapper;
        private final boolean supportsTextInjection;
        private final AtomicBoolean closed = new AtomicBoolean(false);
        private final Object sendLock = new Object();

        private MoshiSpeechCoreSession(WebSocket webSocket, ObjectMapper objectMapper, boolean supportsTextInjection) {
            this.webSocket = webSocket;
            this.objectMapper = objectMapper;
            this.supportsTextInjection = supportsTextInjection;
        }

        @Override
        public void sendAudio(byte[] pcm16, int sampleRate) {
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("type", "audio");
            payload.put("sample_rate", sampleRate);
            payload.put("pcm16_b64", Base64.getEncoder().encodeToString(pcm16));
            send(payload);
        }

        @Override
        public void injectText(String text, long generation) {
            if (!supportsTextInjection || text == null || text.isBlank()) {
                return;
            }
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("type", "text_inject");
            payload.put("text", text);
            payload.put("generation_id", generation);
            send(payload);
        }

        @Override
        public void cancel(long generation) {
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("type", "cancel");
            payload.put("generation_id", generation);
            send(payload);
        }

        @Override
        public boolean supportsTextInjection() {
            return supportsTextInjection;
        }

        @Override
        public void close() {
            if (!closed.compareAndSet(false, true)) {
                return;
            }
            try {
                webSocket.sendClose(WebSocket.NORMAL_CLOSURE, "bye").get(2, TimeUnit.SECONDS);
            } catch (Exception e) {
                log.fine(() -> "voice.speech_core.close_failed reason=" + e.getMessage());
                webSocket.abort();
            }
        }

        // java.net.http allows one outstanding send per socket
        private void send(Map<String, Object> payload) {
            if (closed.get()) {
                return;
            }
            try {
                String text = objectMapper.writeValueAsString(payload);
                synchronized (sendLock) {
                    webSocket.sendText(text, true).join();
                }
            } catch (Exception e) {
                throw new IllegalStateException("Failed to send speech core message", e);
            }
        }
    }

    private static final class CoreWebSocketListener implements WebSocket.Listener {
        private final SpeechCoreListener listener;
        private final ObjectMapper objectMapper;
        private final StringBuilder textBuffer = new StringBuilder();

        private CoreWebSocketListener(SpeechCoreListener listener, ObjectMapper objectMapper) {
            this.listener = listener;
            this.objectMapper = objectMapper;
        }

        @Override
        public void onOpen(WebSocket webSocket) {
            webSocket.request(1);
        }

        @Override
        public CompletionStage<?> onText(WebSocket webSocket, CharSequence data, boolean last) {
            textBuffer.append(data);
            if (last) {
                String payload = textBuffer.toString();
                textBuffer.setLength(0);
                handleMessage(payload);
            }
            webSocket.request(1);
            return CompletableFuture.completedFuture(null);
        }

        @Override
        public CompletionStage<?> onBinary(WebSocket webSocket, ByteBuffer data, boolean last) {
            log.fine(() -> "voice.speech_core.binary_ignored bytes=" + data.remaining());
            webSocket.request(1);
            return CompletableFuture.completedFuture(null);
        }

        @Override
        public CompletionStage<?> onClose(WebSocket webSocket, int statusCode, String reason) {
            if (statusCode != WebSocket.NORMAL_CLOSURE) {
                listener.onError("Speech core closed: " + statusCode + " " + reason);
            }
            return CompletableFuture.completedFuture(null);
        }

        @Override
        public void onError(WebSocket webSocket, Throwable error) {
            listener.onError(error == null ? "Speech core websocket error" : error.getMessage());
        }

        private void handleMessage(String payload) {
            JsonNode root;
            try {
                root = objectMapper.readTree(payload);
            } catch (Exception e) {
                log.fine(() -> "voice.speech_core.invalid_json reason=" + e.getMessage());
                return;
            }
            if (!"audio_out".equals(root.path("type").asText(""))) {
                return;
            }
            String pcm = root.path("pcm16_b64").asText("");
            if (pcm.isEmpty()) {
                return;
            }
            Long generation = root.hasNonNull("generation_id") ? root.path("generation_id").asLong() : null;
            int sampleRate = root.path("sample_rate").asInt(DEFAULT_OUTPUT_SAMPLE_RATE);
            try {
                listener.onAudio(generation, sampleRate, Base64.getDecoder().decode(pcm));
            } catch (IllegalArgumentException e) {
                listener.onError("Speech core sent invalid base64 audio");
            }
        }
    }
}
