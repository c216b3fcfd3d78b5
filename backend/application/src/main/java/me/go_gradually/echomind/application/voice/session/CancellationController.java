package me.go_gradually.echomind.application.voice.session;

import me.go_gradually.echomind.domain.conversation.GenerationEpoch;
import me.go_gradually.echomind.domain.conversation.SessionPhase;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Owns the generation epoch of one session and every in-flight assistant task.
 * <p>
 * After {@link #cancelAssistantPipeline(boolean, boolean)} returns, no task created under an earlier
 * generation can pass {@link #isCurrent(long)} again, so all of its remaining emissions are dropped.
 */
public final class CancellationController {
    private final GenerationEpoch epoch = new GenerationEpoch();
    private final ReentrantLock lock = new ReentrantLock();
    private final Set<Future<?>> tasks = ConcurrentHashMap.newKeySet();
    private final AtomicReference<SessionPhase> phase = new AtomicReference<>(SessionPhase.IDLE);
    private final AtomicBoolean inputResetRequested = new AtomicBoolean(false);
    private final CancellationListener listener;

    public CancellationController(CancellationListener listener) {
        this.listener = listener;
    }

    public long generation() {
        return epoch.current();
    }

    public boolean isCurrent(long generation) {
        return epoch.isCurrent(generation);
    }

    public long cancelAssistantPipeline(boolean keepListening, boolean sendCancel) {
        lock.lock();
        try {
            long generation = epoch.advance();
            for (Future<?> task : tasks) {
                task.cancel(true);
            }
            tasks.clear();
            phase.set(keepListening ? SessionPhase.LISTENING : SessionPhase.IDLE);
            if (!keepListening) {
                inputResetRequested.set(true);
            }
            listener.onCancelled(generation, sendCancel);
            return generation;
        } finally {
            lock.unlock();
        }
    }

    public void register(Future<?> task) {
        if (task == null) {
            return;
        }
        tasks.removeIf(Future::isDone);
        if (!task.isDone()) {
            tasks.add(task);
        }
    }

    public boolean hasActiveTasks() {
        for (Future<?> task : tasks) {
            if (!task.isDone()) {
                return true;
            }
        }
        return false;
    }

    /** Assistant output is pending or playing; barge-in then needs the longer speech lead. */
    public boolean isAssistantActive() {
        return phase.get().isAssistantActive() || hasActiveTasks();
    }

    public SessionPhase phase() {
        return phase.get();
    }

    /** Moves the phase only while {@code generation} is still current. */
    public boolean setPhaseIfCurrent(long generation, SessionPhase next) {
        lock.lock();
        try {
            if (!epoch.isCurrent(generation)) {
                return false;
            }
            phase.set(next);
            return true;
        } finally {
            lock.unlock();
        }
    }

    /** Returns and clears the pending full input reset, applied by the frame consumer. */
    public boolean consumeInputReset() {
        return inputResetRequested.getAndSet(false);
    }

    @FunctionalInterface
    public interface CancellationListener {
        void onCancelled(long generation, boolean sendCancel);
    }
}
