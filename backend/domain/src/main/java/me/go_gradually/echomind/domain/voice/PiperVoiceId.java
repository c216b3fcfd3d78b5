package me.go_gradually.echomind.domain.voice;

import java.util.Arrays;
import java.util.Locale;
import java.util.Set;

/**
 * Piper voice identifier of the form {@code locale-speaker-quality}, e.g. {@code en_US-libritts_r-medium}.
 */
public record PiperVoiceId(String value, String language, String locale, String speaker, String quality) {
    private static final Set<String> QUALITIES = Set.of("low", "medium", "high", "x_low");

    public static PiperVoiceId parse(String raw) {
        String id = raw == null ? "" : raw.trim();
        if (id.isEmpty()) {
            throw new IllegalArgumentException("Voice id is empty");
        }
        String[] parts = id.split("-", -1);
        if (parts.length < 3) {
            throw new IllegalArgumentException("Invalid Piper voice id: " + id);
        }
        String locale = parts[0];
        String quality = parts[parts.length - 1];
        String speaker = String.join("-", Arrays.copyOfRange(parts, 1, parts.length - 1));
        if (locale.isEmpty() || !locale.contains("_") || speaker.isEmpty() || quality.isEmpty()) {
            throw new IllegalArgumentException("Invalid Piper voice id: " + id);
        }
        if (!QUALITIES.contains(quality)) {
            throw new IllegalArgumentException("Invalid quality in voice id: " + id);
        }
        String language = locale.substring(0, locale.indexOf('_')).toLowerCase(Locale.ROOT);
        return new PiperVoiceId(id, language, locale, speaker, quality);
    }

    /** Repository path without extension: {@code lang/locale/speaker/quality/id}. */
    public String repositoryPath() {
        return language + "/" + locale + "/" + speaker + "/" + quality + "/" + value;
    }

    public String modelFileName() {
        return value + ".onnx";
    }

    public String configFileName() {
        return value + ".onnx.json";
    }
}
