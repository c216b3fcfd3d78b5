package me.go_gradually.echomind.application.voice.session;

import me.go_gradually.echomind.application.catalog.port.VoiceCatalogPort;
import me.go_gradually.echomind.application.shared.port.AsyncExecutor;
import me.go_gradually.echomind.application.shared.port.MetricsPort;
import me.go_gradually.echomind.application.voice.port.KnowledgeBaseGateway;
import me.go_gradually.echomind.application.voice.port.LlmClient;
import me.go_gradually.echomind.application.voice.port.SpeechCoreGateway;
import me.go_gradually.echomind.application.voice.port.SttGateway;
import me.go_gradually.echomind.application.voice.port.TranscriptArchivePort;
import me.go_gradually.echomind.application.voice.port.TtsGateway;
import me.go_gradually.echomind.domain.command.CommandRouter;

import java.time.Clock;

/**
 * Process-wide ports shared by every voice session.
 */
public record SessionCollaborators(SttGateway stt,
                                   LlmClient llm,
                                   TtsGateway tts,
                                   KnowledgeBaseGateway knowledgeBase,
                                   TranscriptArchivePort archive,
                                   SpeechCoreGateway speechCore,
                                   VoiceCatalogPort voiceCatalog,
                                   CommandRouter router,
                                   AsyncExecutor executor,
                                   MetricsPort metrics,
                                   Clock clock) {
    public SessionCollaborators {
        if (stt == null || llm == null || tts == null || router == null || executor == null || metrics == null) {
            throw new IllegalArgumentException("stt, llm, tts, router, executor and metrics are required");
        }
        clock = clock == null ? Clock.systemDefaultZone() : clock;
    }
}
