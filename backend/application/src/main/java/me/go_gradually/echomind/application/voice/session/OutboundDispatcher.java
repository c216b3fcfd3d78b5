package me.go_gradually.echomind.application.voice.session;

import me.go_gradually.echomind.application.shared.port.MetricsPort;
import me.go_gradually.echomind.application.voice.model.OutboundMessage;
import me.go_gradually.echomind.application.voice.model.VoiceEventSink;

import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.LongSupplier;
import java.util.logging.Logger;

/**
 * Single consumer of the session's outbound queue. Producers block while the queue is full. Fenced
 * messages older than the current generation are dropped at send time.
 */
final class OutboundDispatcher {
    private static final Logger log = Logger.getLogger(OutboundDispatcher.class.getName());
    private static final long POLL_MILLIS = 100L;

    private final BlockingQueue<OutboundMessage> queue;
    private final LongSupplier currentGeneration;
    private final VoiceEventSink sink;
    private final MetricsPort metrics;
    private final Runnable onSinkClosed;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    OutboundDispatcher(int capacity,
                       LongSupplier currentGeneration,
                       VoiceEventSink sink,
                       MetricsPort metrics,
                       Runnable onSinkClosed) {
        this.queue = new ArrayBlockingQueue<>(capacity);
        this.currentGeneration = currentGeneration;
        this.sink = sink;
        this.metrics = metrics;
        this.onSinkClosed = onSinkClosed;
    }

    boolean enqueue(OutboundMessage message) {
        if (closed.get()) {
            return false;
        }
        try {
            queue.put(message);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    void run() {
        while (!closed.get()) {
            OutboundMessage message;
            try {
                message = queue.poll(POLL_MILLIS, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
            if (message == null) {
                continue;
            }
            if (isStale(message)) {
                metrics.incrementStaleMessage();
                continue;
            }
            if (!deliver(message)) {
                close();
                onSinkClosed.run();
                return;
            }
        }
    }

    boolean isStale(OutboundMessage message) {
        return message.isFenced() && message.generation() < currentGeneration.getAsLong();
    }

    int pending() {
        return queue.size();
    }

    void close() {
        if (closed.compareAndSet(false, true)) {
            queue.clear();
        }
    }

    boolean isClosed() {
        return closed.get();
    }

    private boolean deliver(OutboundMessage message) {
        try {
            return sink.send(message);
        } catch (RuntimeException e) {
            log.warning(() -> "voice.outbound.send_failed type=" + message.type().wireName() + " reason=" + e.getMessage());
            return false;
        }
    }
}
