package me.go_gradually.echomind.domain.speech;

public record SynthesizedAudio(float[] samples, int sampleRate) {
    public SynthesizedAudio {
        if (samples == null) {
            throw new IllegalArgumentException("samples are required");
        }
        if (sampleRate <= 0) {
            throw new IllegalArgumentException("sampleRate must be positive");
        }
    }

    public boolean isEmpty() {
        return samples.length == 0;
    }
}
