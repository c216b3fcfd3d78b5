package me.go_gradually.echomind.application.voice.session;

import me.go_gradually.echomind.application.shared.port.MetricsPort;
import me.go_gradually.echomind.application.voice.model.OutboundMessage;
import me.go_gradually.echomind.application.voice.model.OutboundType;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class OutboundDispatcherTest {
    @Mock
    private MetricsPort metrics;

    private final AtomicLong generation = new AtomicLong(0L);
    private final List<OutboundMessage> sent = new CopyOnWriteArrayList<>();
    private final AtomicBoolean sinkClosed = new AtomicBoolean(false);

    @Test
    void run_deliversInOrderAndDropsStaleGenerations() throws Exception {
        OutboundDispatcher dispatcher = new OutboundDispatcher(16, generation::get, sent::add, metrics, () -> sinkClosed.set(true));
        dispatcher.enqueue(message(OutboundType.HELLO, null));
        dispatcher.enqueue(message(OutboundType.AUDIO_OUT, 0L));
        dispatcher.enqueue(message(OutboundType.ASSISTANT_TEXT, 1L));
        dispatcher.enqueue(message(OutboundType.PROFILE_UPDATE, null));
        generation.set(1L);

        drain(dispatcher);

        assertEquals(
                List.of(OutboundType.HELLO, OutboundType.ASSISTANT_TEXT, OutboundType.PROFILE_UPDATE),
                sent.stream().map(OutboundMessage::type).toList()
        );
        verify(metrics, times(1)).incrementStaleMessage();
        assertFalse(sinkClosed.get());
    }

    @Test
    void run_stopsWhenSinkRejects() throws Exception {
        OutboundDispatcher dispatcher = new OutboundDispatcher(16, generation::get, message -> false, metrics, () -> sinkClosed.set(true));
        dispatcher.enqueue(message(OutboundType.HELLO, null));

        Thread worker = new Thread(dispatcher::run);
        worker.start();
        worker.join(2000);

        assertTrue(sinkClosed.get());
        assertTrue(dispatcher.isClosed());
        assertFalse(dispatcher.enqueue(message(OutboundType.HELLO, null)));
        verify(metrics, never()).incrementStaleMessage();
    }

    @Test
    void run_treatsSinkExceptionAsClosedTransport() throws Exception {
        OutboundDispatcher dispatcher = new OutboundDispatcher(16, generation::get, message -> {
            throw new IllegalStateException("socket closed");
        }, metrics, () -> sinkClosed.set(true));
        dispatcher.enqueue(message(OutboundType.HELLO, null));

        Thread worker = new Thread(dispatcher::run);
        worker.start();
        worker.join(2000);

        assertTrue(sinkClosed.get());
    }

    private void drain(OutboundDispatcher dispatcher) throws InterruptedException {
        Thread worker = new Thread(dispatcher::run);
        worker.start();
        long deadline = System.currentTimeMillis() + 2000;
        while (dispatcher.pending() > 0 && System.currentTimeMillis() < deadline) {
            Thread.sleep(5);
        }
        dispatcher.close();
        worker.join(2000);
    }

    private OutboundMessage message(OutboundType type, Long generation) {
        return new OutboundMessage(type, generation, Map.of());
    }
}
