package me.go_gradually.echomind.infrastructure.voice.audio;

import me.go_gradually.echomind.domain.audio.Pcm16;
import me.go_gradually.echomind.domain.speech.SynthesizedAudio;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;

/**
 * Minimal RIFF/WAVE codec: writes mono PCM16, reads PCM16 or 32-bit float with any channel count
 * (channels are averaged down to mono).
 */
public final class WavCodec {
    private static final int HEADER_BYTES = 44;
    private static final int FORMAT_PCM = 1;
    private static final int FORMAT_IEEE_FLOAT = 3;
    private static final int FORMAT_EXTENSIBLE = 0xFFFE;

    private WavCodec() {
    }

    public static byte[] encodeMono16(float[] samples, int sampleRate) {
        byte[] pcm = Pcm16.fromFloat(samples);
        ByteBuffer buffer = ByteBuffer.allocate(HEADER_BYTES + pcm.length).order(ByteOrder.LITTLE_ENDIAN);
        buffer.put("RIFF".getBytes(StandardCharsets.US_ASCII));
        buffer.putInt(36 + pcm.length);
        buffer.put("WAVE".getBytes(StandardCharsets.US_ASCII));
        buffer.put("fmt ".getBytes(StandardCharsets.US_ASCII));
        buffer.putInt(16);
        buffer.putShort((short) FORMAT_PCM);
        buffer.putShort((short) 1);
        buffer.putInt(sampleRate);
        buffer.putInt(sampleRate * 2);
        buffer.putShort((short) 2);
        buffer.putShort((short) 16);
        buffer.put("data".getBytes(StandardCharsets.US_ASCII));
        buffer.putInt(pcm.length);
        buffer.put(pcm);
        return buffer.array();
    }

    public static SynthesizedAudio decode(byte[] wav) {
        if (wav == null || wav.length < 12) {
            throw new IllegalArgumentException("WAV payload is too short");
        }
        ByteBuffer buffer = ByteBuffer.wrap(wav).order(ByteOrder.LITTLE_ENDIAN);
        if (!"RIFF".equals(fourCc(buffer, 0)) || !"WAVE".equals(fourCc(buffer, 8))) {
            throw new IllegalArgumentException("Not a RIFF/WAVE payload");
        }
        int format = -1;
        int channels = 0;
        int sampleRate = 0;
        int bitsPerSample = 0;
        int offset = 12;
        while (offset + 8 <= wav.length) {
            String id = fourCc(buffer, offset);
            int size = buffer.getInt(offset + 4);
            int body = offset + 8;
            if ("fmt ".equals(id)) {
                format = Short.toUnsignedInt(buffer.getShort(body));
                channels = Short.toUnsignedInt(buffer.getShort(body + 2));
                sampleRate = buffer.getInt(body + 4);
                bitsPerSample = Short.toUnsignedInt(buffer.getShort(body + 14));
                if (format == FORMAT_EXTENSIBLE && size >= 26) {
                    format = Short.toUnsignedInt(buffer.getShort(body + 24));
                }
            } else if ("data".equals(id)) {
                if (format < 0) {
                    throw new IllegalArgumentException("WAV data chunk precedes fmt chunk");
                }
                // streaming writers leave the size unset
                int length = size <= 0 || body + size > wav.length ? wav.length - body : size;
                return new SynthesizedAudio(toMono(buffer, body, length, format, channels, bitsPerSample), sampleRate);
            }
            offset = body + size + (size & 1);
        }
        throw new IllegalArgumentException("WAV payload has no data chunk");
    }

    private static float[] toMono(ByteBuffer buffer, int start, int length, int format, int channels, int bitsPerSample) {
        if (channels <= 0) {
            throw new IllegalArgumentException("WAV channel count is invalid");
        }
        int bytesPerSample;
        if (format == FORMAT_PCM && bitsPerSample == 16) {
            bytesPerSample = 2;
        } else if (format == FORMAT_IEEE_FLOAT && bitsPerSample == 32) {
            bytesPerSample = 4;
        } else {
            throw new IllegalArgumentException("Unsupported WAV encoding format=" + format + " bits=" + bitsPerSample);
        }
        int frameBytes = bytesPerSample * channels;
        int frames = length / frameBytes;
        float[] out = new float[frames];
        for (int frame = 0; frame < frames; frame++) {
            int frameOffset = start + frame * frameBytes;
            float sum = 0.0f;
            for (int channel = 0; channel < channels; channel++) {
                int at = frameOffset + channel * bytesPerSample;
                sum += bytesPerSample == 2 ? buffer.getShort(at) / 32768.0f : buffer.getFloat(at);
            }
            out[frame] = sum / channels;
        }
        return out;
    }

    private static String fourCc(ByteBuffer buffer, int offset) {
        byte[] id = new byte[4];
        for (int i = 0; i < 4; i++) {
            id[i] = buffer.get(offset + i);
        }
        return new String(id, StandardCharsets.US_ASCII);
    }
}
