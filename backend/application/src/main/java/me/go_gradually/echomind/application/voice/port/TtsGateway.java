package me.go_gradually.echomind.application.voice.port;

import me.go_gradually.echomind.domain.speech.SynthesizedAudio;

public interface TtsGateway {
    SynthesizedAudio synthesize(String text, String voice) throws Exception;
}
