package me.go_gradually.echomind.application.voice.port;

import me.go_gradually.echomind.application.voice.model.SpeechCoreListener;
import me.go_gradually.echomind.application.voice.model.SpeechCoreSession;

public interface SpeechCoreGateway {
    boolean isEnabled();

    SpeechCoreSession open(SpeechCoreListener listener) throws Exception;
}
