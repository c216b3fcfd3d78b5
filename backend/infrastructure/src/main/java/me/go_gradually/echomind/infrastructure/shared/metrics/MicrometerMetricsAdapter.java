package me.go_gradually.echomind.infrastructure.shared.metrics;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import me.go_gradually.echomind.application.shared.port.MetricsPort;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
public class MicrometerMetricsAdapter implements MetricsPort {
    private final MeterRegistry meterRegistry;

    public MicrometerMetricsAdapter(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    @Override
    public void recordSttLatency(Duration duration) {
        record("voice.stt.latency", duration);
    }

    @Override
    public void recordLlmLatency(Duration duration) {
        record("voice.llm.latency", duration);
    }

    @Override
    public void recordTtsLatency(Duration duration) {
        record("voice.tts.latency", duration);
    }

    @Override
    public void recordVoiceTurnLatency(Duration duration) {
        record("voice.turn.latency", duration);
    }

    @Override
    public void incrementSttError() {
        meterRegistry.counter("voice.stt.errors").increment();
    }

    @Override
    public void incrementLlmError() {
        meterRegistry.counter("voice.llm.errors").increment();
    }

    @Override
    public void incrementTtsError() {
        meterRegistry.counter("voice.tts.errors").increment();
    }

    @Override
    public void incrementBargeIn() {
        meterRegistry.counter("voice.barge_in").increment();
    }

    @Override
    public void incrementDroppedFrame() {
        meterRegistry.counter("voice.inbound.dropped_frames").increment();
    }

    @Override
    public void incrementStaleMessage() {
        meterRegistry.counter("voice.outbound.stale_messages").increment();
    }

    private void record(String name, Duration duration) {
        Timer.builder(name)
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(meterRegistry)
                .record(duration);
    }
}
