package me.go_gradually.echomind.infrastructure.voice.backend;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.go_gradually.echomind.application.voice.model.StoredTranscript;
import me.go_gradually.echomind.infrastructure.shared.config.AppProperties;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class BackendTranscriptArchiveAdapterTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private MockWebServer server;
    private AppProperties.Backend settings;

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();
        settings = new AppProperties.Backend();
        settings.setChatUrl(server.url("/").toString() + "/");
    }

    @AfterEach
    void tearDown() throws Exception {
        server.shutdown();
    }

    @Test
    void store_postsRawTextWithTag() throws Exception {
        server.enqueue(new MockResponse()
                .setHeader("Content-Type", "application/json")
                .setBody("{\"transcript_id\":\"trn_42\",\"tags\":[\"budget\",\" \",\"travel\"],\"echotag\":\"voice\"}"));

        StoredTranscript stored = adapter().store("[10:00] User: plan the trip", "voice");

        assertEquals("trn_42", stored.transcriptId());
        assertEquals(List.of("budget", "travel"), stored.tags());
        RecordedRequest request = server.takeRequest();
        assertEquals("/api/transcribe/store", request.getPath());
        JsonNode payload = objectMapper.readTree(request.getBody().readUtf8());
        assertEquals("[10:00] User: plan the trip", payload.path("raw_text").asText());
        assertEquals("voice", payload.path("echotag").asText());
    }

    @Test
    void store_rejectsEmptyTranscript() {
        assertThrows(IllegalArgumentException.class, () -> adapter().store(" ", "voice"));
        assertEquals(0, server.getRequestCount());
    }

    @Test
    void store_wrapsHttpFailure() {
        server.enqueue(new MockResponse().setResponseCode(422).setBody(""));

        IllegalStateException error = assertThrows(IllegalStateException.class,
                () -> adapter().store("text", "voice"));

        assertEquals("Back end returned 422", error.getMessage());
    }

    private BackendTranscriptArchiveAdapter adapter() {
        return new BackendTranscriptArchiveAdapter(WebClient.builder().build(), settings);
    }
}
