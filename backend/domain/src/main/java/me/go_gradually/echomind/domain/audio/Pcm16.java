package me.go_gradually.echomind.domain.audio;

public final class Pcm16 {
    private static final double SCALE_IN = 32768.0;
    private static final double SCALE_OUT = 32767.0;

    private Pcm16() {
    }

    public static int sampleAt(byte[] pcm16, int sampleIndex) {
        int offset = sampleIndex * 2;
        return (short) ((pcm16[offset] & 0xFF) | (pcm16[offset + 1] << 8));
    }

    public static double rms(byte[] pcm16) {
        int samples = pcm16 == null ? 0 : pcm16.length / 2;
        if (samples == 0) {
            return 0.0;
        }
        double sumSquares = 0.0;
        for (int i = 0; i < samples; i++) {
            double normalized = sampleAt(pcm16, i) / SCALE_IN;
            sumSquares += normalized * normalized;
        }
        return Math.sqrt(sumSquares / samples);
    }

    public static double zeroCrossingRate(byte[] pcm16) {
        int samples = pcm16 == null ? 0 : pcm16.length / 2;
        if (samples < 2) {
            return 0.0;
        }
        int crossings = 0;
        int previous = sampleAt(pcm16, 0);
        for (int i = 1; i < samples; i++) {
            int current = sampleAt(pcm16, i);
            if ((previous >= 0) != (current >= 0)) {
                crossings++;
            }
            previous = current;
        }
        return crossings / (double) (samples - 1);
    }

    public static float[] toFloat(byte[] pcm16) {
        int samples = pcm16 == null ? 0 : pcm16.length / 2;
        float[] out = new float[samples];
        for (int i = 0; i < samples; i++) {
            out[i] = (float) (sampleAt(pcm16, i) / SCALE_IN);
        }
        return out;
    }

    public static byte[] fromFloat(float[] samples) {
        return fromFloat(samples, 0, samples.length);
    }

    public static byte[] fromFloat(float[] samples, int from, int to) {
        byte[] out = new byte[(to - from) * 2];
        int offset = 0;
        for (int i = from; i < to; i++) {
            float clipped = Math.max(-1.0f, Math.min(1.0f, samples[i]));
            short value = (short) (clipped * SCALE_OUT);
            out[offset++] = (byte) (value & 0xFF);
            out[offset++] = (byte) ((value >> 8) & 0xFF);
        }
        return out;
    }
}
