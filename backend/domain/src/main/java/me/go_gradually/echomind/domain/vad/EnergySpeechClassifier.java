package me.go_gradually.echomind.domain.vad;

import me.go_gradually.echomind.domain.audio.Pcm16;

/**
 * Frame classifier based on RMS energy and zero-crossing rate. Higher aggressiveness
 * demands louder, more voiced frames before reporting speech.
 */
public final class EnergySpeechClassifier implements SpeechClassifier {
    private static final double[] ENERGY_THRESHOLDS = {0.005, 0.008, 0.012, 0.018};
    private static final double[] MAX_ZERO_CROSSING_RATES = {0.50, 0.42, 0.36, 0.30};

    private final double energyThreshold;
    private final double maxZeroCrossingRate;

    public EnergySpeechClassifier(int aggressiveness) {
        int level = Math.max(0, Math.min(3, aggressiveness));
        this.energyThreshold = ENERGY_THRESHOLDS[level];
        this.maxZeroCrossingRate = MAX_ZERO_CROSSING_RATES[level];
    }

    @Override
    public boolean isSpeech(byte[] pcm16, int sampleRate) {
        if (pcm16 == null || pcm16.length < 4) {
            return false;
        }
        if (Pcm16.rms(pcm16) < energyThreshold) {
            return false;
        }
        return Pcm16.zeroCrossingRate(pcm16) <= maxZeroCrossingRate;
    }

    double energyThreshold() {
        return energyThreshold;
    }
}
