package me.go_gradually.echomind.infrastructure.voice.tts;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.go_gradually.echomind.domain.speech.SynthesizedAudio;
import me.go_gradually.echomind.infrastructure.shared.config.AppProperties;
import me.go_gradually.echomind.infrastructure.voice.audio.WavCodec;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import okio.Buffer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.web.reactive.function.client.WebClient;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class OpenAiCompatTtsGatewayTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private MockWebServer server;
    private AppProperties.Tts settings;

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();
        settings = new AppProperties.Tts();
        settings.setBaseUrl(server.url("/").toString());
    }

    @AfterEach
    void tearDown() throws Exception {
        server.shutdown();
    }

    @Test
    void synthesize_postsSpeechRequestAndDecodesWav() throws Exception {
        byte[] wav = WavCodec.encodeMono16(new float[]{0.1f, 0.2f, 0.3f}, 22050);
        server.enqueue(new MockResponse()
                .setHeader("Content-Type", "audio/wav")
                .setBody(new Buffer().write(wav)));

        SynthesizedAudio audio = gateway().synthesize("Hello there.", "en_US-amy-low");

        assertEquals(22050, audio.sampleRate());
        assertEquals(3, audio.samples().length);
        RecordedRequest request = server.takeRequest();
        assertEquals("/v1/audio/speech", request.getPath());
        JsonNode payload = objectMapper.readTree(request.getBody().readUtf8());
        assertEquals("piper", payload.path("model").asText());
        assertEquals("en_US-amy-low", payload.path("voice").asText());
        assertEquals("Hello there.", payload.path("input").asText());
        assertEquals("wav", payload.path("response_format").asText());
        assertFalse(payload.has("speed"));
    }

    @Test
    void synthesize_fallsBackToConfiguredVoiceAndLengthScale() throws Exception {
        settings.setLengthScale(2.0);
        server.enqueue(new MockResponse()
                .setHeader("Content-Type", "audio/wav")
                .setBody(new Buffer().write(WavCodec.encodeMono16(new float[]{0.0f}, 16000))));

        gateway().synthesize("Hi", " ");

        JsonNode payload = objectMapper.readTree(server.takeRequest().getBody().readUtf8());
        assertEquals("en_US-lessac-medium", payload.path("voice").asText());
        assertEquals(0.5, payload.path("speed").asDouble());
    }

    @Test
    void synthesize_blankTextSkipsRequest() throws Exception {
        SynthesizedAudio audio = gateway().synthesize("  ", null);

        assertTrue(audio.isEmpty());
        assertEquals(0, server.getRequestCount());
    }

    @Test
    void synthesize_wrapsHttpFailure() {
        server.enqueue(new MockResponse().setResponseCode(404).setBody("voice not found"));

        IllegalStateException error = assertThrows(IllegalStateException.class,
                () -> gateway().synthesize("Hello", "xx_XX-none-low"));

        assertEquals("Speech synthesis failed: 404 voice not found", error.getMessage());
    }

    private OpenAiCompatTtsGateway gateway() {
        return new OpenAiCompatTtsGateway(WebClient.builder().build(), settings);
    }
}
