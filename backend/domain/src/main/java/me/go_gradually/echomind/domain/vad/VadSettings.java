package me.go_gradually.echomind.domain.vad;

import me.go_gradually.echomind.domain.audio.AudioFormat;

public record VadSettings(double energyFloor,
                          int endpointSilenceFrames,
                          int minSpeechFrames,
                          int tailFrames,
                          int leadIdleFrames,
                          int leadActiveFrames) {
    public static final double DEFAULT_ENERGY_FLOOR = 0.004;

    public VadSettings {
        endpointSilenceFrames = Math.max(1, endpointSilenceFrames);
        minSpeechFrames = Math.max(1, minSpeechFrames);
        tailFrames = Math.max(0, tailFrames);
        leadIdleFrames = Math.max(1, leadIdleFrames);
        leadActiveFrames = Math.max(1, leadActiveFrames);
    }

    public static VadSettings of(AudioFormat format,
                                 int endpointSilenceMs,
                                 int minSpeechMs,
                                 int endTailMs,
                                 int leadIdleFrames,
                                 int leadActiveFrames) {
        return new VadSettings(
                DEFAULT_ENERGY_FLOOR,
                format.framesFor(endpointSilenceMs, 1),
                format.framesFor(minSpeechMs, 1),
                format.framesFor(endTailMs, 0),
                leadIdleFrames,
                leadActiveFrames
        );
    }

    public int leadFrames(boolean assistantActive) {
        return assistantActive ? leadActiveFrames : leadIdleFrames;
    }
}
