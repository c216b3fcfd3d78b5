package me.go_gradually.echomind.application.shared.port;

import java.time.Duration;

public interface MetricsPort {
    void recordSttLatency(Duration duration);

    void recordLlmLatency(Duration duration);

    void recordTtsLatency(Duration duration);

    void recordVoiceTurnLatency(Duration duration);

    void incrementSttError();

    void incrementLlmError();

    void incrementTtsError();

    void incrementBargeIn();

    void incrementDroppedFrame();

    void incrementStaleMessage();
}
