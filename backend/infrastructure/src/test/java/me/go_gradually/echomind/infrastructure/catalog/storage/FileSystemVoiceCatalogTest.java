package me.go_gradually.echomind.infrastructure.catalog.storage;

import me.go_gradually.echomind.domain.voice.PiperVoiceId;
import me.go_gradually.echomind.infrastructure.shared.config.AppProperties;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.web.reactive.function.client.WebClient;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FileSystemVoiceCatalogTest {

    @TempDir
    Path tempDir;

    private MockWebServer server;
    private AppProperties.VoiceRepository repository;

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();
        repository = new AppProperties.VoiceRepository();
        repository.setBaseUrl(server.url("/piper").toString());
    }

    @AfterEach
    void tearDown() throws Exception {
        server.shutdown();
    }

    @Test
    void installedVoiceIds_requiresModelAndConfig() throws Exception {
        Files.writeString(tempDir.resolve("en_US-lessac-medium.onnx"), "model");
        Files.writeString(tempDir.resolve("en_US-lessac-medium.onnx.json"), "{}");
        Files.writeString(tempDir.resolve("en_GB-alan-low.onnx"), "model");
        Files.writeString(tempDir.resolve("de_DE-thorsten-high.onnx.json"), "{}");
        Files.writeString(tempDir.resolve("notes.txt"), "x");

        assertEquals(List.of("en_US-lessac-medium"), catalog(tempDir).installedVoiceIds());
    }

    @Test
    void installedVoiceIds_emptyWhenDirectoryMissing() {
        assertTrue(catalog(tempDir.resolve("missing")).installedVoiceIds().isEmpty());
    }

    @Test
    void isInstalled_rejectsPathTraversal() throws Exception {
        Files.writeString(tempDir.resolve("en_US-lessac-medium.onnx"), "model");
        Files.writeString(tempDir.resolve("en_US-lessac-medium.onnx.json"), "{}");

        FileSystemVoiceCatalog catalog = catalog(tempDir);

        assertTrue(catalog.isInstalled("en_US-lessac-medium"));
        assertFalse(catalog.isInstalled("../en_US-lessac-medium"));
        assertFalse(catalog.isInstalled("en_US-amy-low"));
    }

    @Test
    void download_fetchesModelAndConfigFromRepositoryLayout() throws Exception {
        server.enqueue(new MockResponse().setBody("onnx-bytes"));
        server.enqueue(new MockResponse().setBody("{\"audio\":{\"sample_rate\":16000}}"));
        Path voices = tempDir.resolve("voices");

        catalog(voices).download(PiperVoiceId.parse("en_US-amy-low"));

        RecordedRequest model = server.takeRequest();
        RecordedRequest config = server.takeRequest();
        assertEquals("/piper/en/en_US/amy/low/en_US-amy-low.onnx", model.getPath());
        assertEquals("/piper/en/en_US/amy/low/en_US-amy-low.onnx.json", config.getPath());
        assertEquals("EchoMind-Voice/1.0", model.getHeader("User-Agent"));
        assertEquals("onnx-bytes", Files.readString(voices.resolve("en_US-amy-low.onnx")));
        assertTrue(catalog(voices).isInstalled("en_US-amy-low"));
        assertEquals(List.of("en_US-amy-low"), catalog(voices).installedVoiceIds());
    }

    @Test
    void download_removesPartialFilesOnFailure() throws Exception {
        server.enqueue(new MockResponse().setBody("onnx-bytes"));
        server.enqueue(new MockResponse().setResponseCode(404).setBody("Entry not found"));

        IOException error = assertThrows(IOException.class,
                () -> catalog(tempDir).download(PiperVoiceId.parse("en_US-amy-low")));

        assertTrue(error.getMessage().startsWith("HTTP 404"));
        try (Stream<Path> files = Files.list(tempDir)) {
            assertEquals(0, files.count());
        }
    }

    private FileSystemVoiceCatalog catalog(Path dir) {
        return new FileSystemVoiceCatalog(WebClient.builder().build(), dir.toString(), repository);
    }
}
