package me.go_gradually.echomind.infrastructure.catalog.storage;

import me.go_gradually.echomind.application.catalog.port.VoiceCatalogPort;
import me.go_gradually.echomind.domain.voice.PiperVoiceId;
import me.go_gradually.echomind.infrastructure.shared.config.AppProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.core.io.buffer.DataBufferUtils;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Flux;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Duration;
import java.util.List;
import java.util.logging.Logger;
import java.util.stream.Stream;

/**
 * Piper voices stored as {@code <id>.onnx} plus {@code <id>.onnx.json} in one flat directory.
 */
@Component
public class FileSystemVoiceCatalog implements VoiceCatalogPort {
    private static final Logger log = Logger.getLogger(FileSystemVoiceCatalog.class.getName());
    private static final String MODEL_SUFFIX = ".onnx";
    private static final String CONFIG_SUFFIX = ".onnx.json";
    private static final String PARTIAL_SUFFIX = ".part";

    private final WebClient webClient;
    private final String voicesDir;
    private final AppProperties.VoiceRepository repository;

    @Autowired
    public FileSystemVoiceCatalog(@Qualifier("voiceRepositoryWebClient") WebClient webClient, AppProperties properties) {
        this(webClient, properties.getVoicesDir(), properties.getIntegrations().getVoiceRepository());
    }

    FileSystemVoiceCatalog(WebClient webClient, String voicesDir, AppProperties.VoiceRepository repository) {
        this.webClient = webClient;
        this.voicesDir = voicesDir;
        this.repository = repository;
    }

    @Override
    public List<String> installedVoiceIds() {
        Path root = Path.of(voicesDir);
        if (!Files.isDirectory(root)) {
            return List.of();
        }
        try (Stream<Path> files = Files.list(root)) {
            return files.map(path -> path.getFileName().toString())
                    .filter(name -> name.endsWith(MODEL_SUFFIX))
                    .map(name -> name.substring(0, name.length() - MODEL_SUFFIX.length()))
                    .filter(id -> Files.isRegularFile(root.resolve(id + CONFIG_SUFFIX)))
                    .sorted()
                    .toList();
        } catch (IOException e) {
            throw new IllegalStateException("Failed to list voices in " + root, e);
        }
    }

    @Override
    public boolean isInstalled(String voiceId) {
        if (voiceId == null || voiceId.isBlank() || voiceId.contains("/") || voiceId.contains("\\") || voiceId.contains("..")) {
            return false;
        }
        Path root = Path.of(voicesDir);
        return Files.isRegularFile(root.resolve(voiceId + MODEL_SUFFIX))
                && Files.isRegularFile(root.resolve(voiceId + CONFIG_SUFFIX));
    }

    @Override
    public void download(PiperVoiceId voiceId) throws Exception {
        Path root = Path.of(voicesDir);
        Files.createDirectories(root);
        Path model = root.resolve(voiceId.modelFileName());
        Path config = root.resolve(voiceId.configFileName());
        String base = repositoryBase() + "/" + voiceId.repositoryPath();
        try {
            fetch(base + MODEL_SUFFIX, model);
            fetch(base + CONFIG_SUFFIX, config);
        } catch (Exception e) {
            removeQuietly(model);
            removeQuietly(config);
            throw e;
        }
        log.info(() -> "voice.catalog.stored voice=" + voiceId.value() + " dir=" + root);
    }

    private void fetch(String url, Path target) throws IOException {
        Path partial = target.resolveSibling(target.getFileName() + PARTIAL_SUFFIX);
        log.fine(() -> "voice.catalog.fetch url=" + url);
        try {
            Flux<DataBuffer> body = webClient.get()
                    .uri(url)
                    .header(HttpHeaders.USER_AGENT, repository.getUserAgent())
                    .retrieve()
                    .bodyToFlux(DataBuffer.class);
            DataBufferUtils.write(body, partial)
                    .block(Duration.ofSeconds(Math.max(1, repository.getDownloadTimeoutSeconds())));
            Files.move(partial, target, StandardCopyOption.REPLACE_EXISTING);
        } catch (WebClientResponseException e) {
            throw new IOException("HTTP " + e.getStatusCode().value() + " for " + url, e);
        } catch (RuntimeException e) {
            throw new IOException(e.getMessage() == null ? "Download failed for " + url : e.getMessage(), e);
        } finally {
            removeQuietly(partial);
        }
    }

    private String repositoryBase() {
        String base = repository.getBaseUrl() == null ? "" : repository.getBaseUrl().trim();
        while (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return base;
    }

    private void removeQuietly(Path path) {
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            log.warning(() -> "voice.catalog.cleanup_failed path=" + path + " reason=" + e.getMessage());
        }
    }
}
