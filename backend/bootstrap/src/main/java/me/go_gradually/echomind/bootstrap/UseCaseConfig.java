package me.go_gradually.echomind.bootstrap;

import me.go_gradually.echomind.application.catalog.port.VoiceCatalogPort;
import me.go_gradually.echomind.application.catalog.usecase.VoiceCatalogUseCase;
import me.go_gradually.echomind.application.shared.port.AsyncExecutor;
import me.go_gradually.echomind.application.shared.port.MetricsPort;
import me.go_gradually.echomind.application.voice.policy.VoicePolicy;
import me.go_gradually.echomind.application.voice.port.KnowledgeBaseGateway;
import me.go_gradually.echomind.application.voice.port.LlmClient;
import me.go_gradually.echomind.application.voice.port.SpeechCoreGateway;
import me.go_gradually.echomind.application.voice.port.SttGateway;
import me.go_gradually.echomind.application.voice.port.TranscriptArchivePort;
import me.go_gradually.echomind.application.voice.port.TtsGateway;
import me.go_gradually.echomind.application.voice.session.SessionCollaborators;
import me.go_gradually.echomind.application.voice.usecase.VoiceSessionUseCase;
import me.go_gradually.echomind.domain.command.CommandRouter;
import me.go_gradually.echomind.domain.command.KeywordCommandRouter;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
public class UseCaseConfig {
    // session workers, turn tasks and archive calls all run here
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService voiceExecutorService() {
        return Executors.newCachedThreadPool();
    }

    @Bean
    public AsyncExecutor asyncExecutor(ExecutorService voiceExecutorService) {
        return voiceExecutorService::submit;
    }

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public CommandRouter commandRouter() {
        return new KeywordCommandRouter();
    }

    @Bean
    public SessionCollaborators sessionCollaborators(SttGateway sttGateway,
                                                     LlmClient llmClient,
                                                     TtsGateway ttsGateway,
                                                     KnowledgeBaseGateway knowledgeBaseGateway,
                                                     TranscriptArchivePort transcriptArchivePort,
                                                     SpeechCoreGateway speechCoreGateway,
                                                     VoiceCatalogPort voiceCatalogPort,
                                                     CommandRouter commandRouter,
                                                     AsyncExecutor asyncExecutor,
                                                     MetricsPort metricsPort,
                                                     Clock clock) {
        return new SessionCollaborators(
                sttGateway,
                llmClient,
                ttsGateway,
                knowledgeBaseGateway,
                transcriptArchivePort,
                speechCoreGateway,
                voiceCatalogPort,
                commandRouter,
                asyncExecutor,
                metricsPort,
                clock
        );
    }

    @Bean
    public VoiceSessionUseCase voiceSessionUseCase(SessionCollaborators sessionCollaborators,
                                                   VoicePolicy voicePolicy) {
        return new VoiceSessionUseCase(sessionCollaborators, voicePolicy);
    }

    @Bean
    public VoiceCatalogUseCase voiceCatalogUseCase(VoiceCatalogPort voiceCatalogPort) {
        return new VoiceCatalogUseCase(voiceCatalogPort);
    }
}
