package me.go_gradually.echomind.domain.conversation;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Monotonic fence for assistant output. Tasks capture {@link #current()} when created and must find it
 * unchanged before every visible emission.
 */
public final class GenerationEpoch {
    private final AtomicLong value = new AtomicLong(0L);

    public long current() {
        return value.get();
    }

    public long advance() {
        return value.incrementAndGet();
    }

    public boolean isCurrent(long generation) {
        return value.get() == generation;
    }
}
