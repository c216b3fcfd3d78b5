package me.go_gradually.echomind.presentation.catalog.controller;

import jakarta.validation.Valid;
import me.go_gradually.echomind.application.catalog.usecase.VoiceCatalogUseCase;
import me.go_gradually.echomind.presentation.catalog.dto.InstalledVoicesResponse;
import me.go_gradually.echomind.presentation.catalog.dto.VoiceDownloadRequest;
import me.go_gradually.echomind.presentation.catalog.dto.VoiceDownloadResponse;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/voices")
public class VoiceCatalogController {
    private final VoiceCatalogUseCase voiceCatalogUseCase;

    public VoiceCatalogController(VoiceCatalogUseCase voiceCatalogUseCase) {
        this.voiceCatalogUseCase = voiceCatalogUseCase;
    }

    @GetMapping("/installed")
    public InstalledVoicesResponse installed() {
        InstalledVoicesResponse response = new InstalledVoicesResponse();
        response.setVoiceIds(voiceCatalogUseCase.installedVoiceIds());
        return response;
    }

    /** Blocks until both model files are on disk. */
    @PostMapping("/download")
    public VoiceDownloadResponse download(@Valid @RequestBody VoiceDownloadRequest request) {
        String voiceId = voiceCatalogUseCase.download(request.getVoiceId());
        VoiceDownloadResponse response = new VoiceDownloadResponse();
        response.setOk(true);
        response.setVoiceId(voiceId);
        return response;
    }
}
