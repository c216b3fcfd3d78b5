package me.go_gradually.echomind.application.catalog.port;

import me.go_gradually.echomind.domain.voice.PiperVoiceId;

import java.util.List;

public interface VoiceCatalogPort {
    List<String> installedVoiceIds();

    boolean isInstalled(String voiceId);

    /** Downloads model and config; leaves no partial files behind on failure. */
    void download(PiperVoiceId voiceId) throws Exception;
}
