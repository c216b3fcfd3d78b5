package me.go_gradually.echomind.application.voice.usecase;

import me.go_gradually.echomind.application.shared.port.MetricsPort;
import me.go_gradually.echomind.application.voice.model.OutboundMessage;
import me.go_gradually.echomind.application.voice.model.VoiceSession;
import me.go_gradually.echomind.application.voice.model.VoiceSessionOpenCommand;
import me.go_gradually.echomind.application.voice.policy.TestVoicePolicy;
import me.go_gradually.echomind.application.voice.port.LlmClient;
import me.go_gradually.echomind.application.voice.port.SttGateway;
import me.go_gradually.echomind.application.voice.port.TtsGateway;
import me.go_gradually.echomind.application.voice.session.SessionCollaborators;
import me.go_gradually.echomind.domain.command.KeywordCommandRouter;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@ExtendWith(MockitoExtension.class)
class VoiceSessionUseCaseTest {
    @Mock
    private SttGateway stt;
    @Mock
    private LlmClient llm;
    @Mock
    private TtsGateway tts;
    @Mock
    private MetricsPort metrics;

    private final List<OutboundMessage> sent = new CopyOnWriteArrayList<>();
    private ExecutorService executorService;
    private VoiceSessionUseCase useCase;

    @BeforeEach
    void setUp() {
        executorService = Executors.newCachedThreadPool();
        SessionCollaborators collaborators = new SessionCollaborators(
                stt, llm, tts, null, null, null, null,
                new KeywordCommandRouter(), executorService::submit, metrics, Clock.systemUTC()
        );
        useCase = new VoiceSessionUseCase(collaborators, new TestVoicePolicy());
    }

    @AfterEach
    void tearDown() {
        executorService.shutdownNow();
    }

    @Test
    void open_rejectsMissingSessionIdOrSink() {
        assertThrows(IllegalArgumentException.class, () -> useCase.open(null, sent::add));
        assertThrows(IllegalArgumentException.class, () -> useCase.open(new VoiceSessionOpenCommand(" "), sent::add));
        assertThrows(IllegalArgumentException.class, () -> useCase.open(new VoiceSessionOpenCommand("s-1"), null));
        assertEquals(0, useCase.activeSessions());
    }

    @Test
    void open_registersSessionUntilClosed() {
        VoiceSession session = useCase.open(new VoiceSessionOpenCommand("s-1"), sent::add);

        assertEquals("s-1", session.sessionId());
        assertSame(session, useCase.find("s-1").orElseThrow());
        assertEquals(1, useCase.activeSessions());

        useCase.close("s-1");

        assertTrue(useCase.find("s-1").isEmpty());
        assertEquals(0, useCase.activeSessions());
    }

    @Test
    void open_rejectsDuplicateSessionId() {
        useCase.open(new VoiceSessionOpenCommand("s-1"), sent::add);

        IllegalArgumentException error = assertThrows(IllegalArgumentException.class,
                () -> useCase.open(new VoiceSessionOpenCommand("s-1"), sent::add));

        assertEquals("Voice session already open: s-1", error.getMessage());
        useCase.close("s-1");
    }

    @Test
    void closingFromTransportSide_removesSession() {
        VoiceSession session = useCase.open(new VoiceSessionOpenCommand("s-2"), sent::add);

        session.close();

        assertTrue(useCase.find("s-2").isEmpty());
    }

    @Test
    void sessionClosedWhileOpening_leavesNoStaleEntry() {
        for (int i = 0; i < 20; i++) {
            useCase.open(new VoiceSessionOpenCommand("s-3"), message -> false);
            awaitNoActiveSessions();
        }

        VoiceSession reopened = useCase.open(new VoiceSessionOpenCommand("s-3"), sent::add);

        assertSame(reopened, useCase.find("s-3").orElseThrow());
        useCase.close("s-3");
    }

    @Test
    void concurrentOpensOfOneId_registerExactlyOneSession() throws Exception {
        int contenders = 8;
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger opened = new AtomicInteger();
        AtomicInteger rejected = new AtomicInteger();
        List<Future<?>> attempts = new ArrayList<>();
        for (int i = 0; i < contenders; i++) {
            attempts.add(executorService.submit(() -> {
                start.await();
                try {
                    useCase.open(new VoiceSessionOpenCommand("s-4"), sent::add);
                    opened.incrementAndGet();
                } catch (IllegalArgumentException e) {
                    rejected.incrementAndGet();
                }
                return null;
            }));
        }

        start.countDown();
        for (Future<?> attempt : attempts) {
            attempt.get(5, TimeUnit.SECONDS);
        }

        assertEquals(1, opened.get());
        assertEquals(contenders - 1, rejected.get());
        assertEquals(1, useCase.activeSessions());
        useCase.close("s-4");
    }

    private void awaitNoActiveSessions() {
        long deadline = System.currentTimeMillis() + 2000;
        while (useCase.activeSessions() > 0 && System.currentTimeMillis() < deadline) {
            Thread.onSpinWait();
        }
        assertEquals(0, useCase.activeSessions());
    }
}
