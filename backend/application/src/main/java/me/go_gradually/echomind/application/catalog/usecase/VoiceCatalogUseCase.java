package me.go_gradually.echomind.application.catalog.usecase;

import me.go_gradually.echomind.application.catalog.model.VoiceDownloadException;
import me.go_gradually.echomind.application.catalog.port.VoiceCatalogPort;
import me.go_gradually.echomind.domain.voice.PiperVoiceId;

import java.util.List;
import java.util.logging.Logger;

public class VoiceCatalogUseCase {
    private static final Logger log = Logger.getLogger(VoiceCatalogUseCase.class.getName());

    private final VoiceCatalogPort catalogPort;

    public VoiceCatalogUseCase(VoiceCatalogPort catalogPort) {
        this.catalogPort = catalogPort;
    }

    public List<String> installedVoiceIds() {
        return catalogPort.installedVoiceIds();
    }

    public boolean isInstalled(String voiceId) {
        if (voiceId == null || voiceId.isBlank()) {
            return false;
        }
        return catalogPort.isInstalled(voiceId.trim());
    }

    public String download(String rawVoiceId) {
        PiperVoiceId voiceId = PiperVoiceId.parse(rawVoiceId);
        try {
            catalogPort.download(voiceId);
        } catch (Exception e) {
            log.warning(() -> "voice.catalog.download_failed voice=" + voiceId.value() + " reason=" + e.getMessage());
            throw new VoiceDownloadException(
                    voiceId.value(),
                    "Download failed for " + voiceId.value() + ": " + e.getMessage(),
                    e
            );
        }
        log.info(() -> "voice.catalog.downloaded voice=" + voiceId.value());
        return voiceId.value();
    }
}
