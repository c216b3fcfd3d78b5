package me.go_gradually.echomind.infrastructure.shared.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;
import reactor.netty.resources.ConnectionProvider;

import java.time.Duration;

@Configuration
public class WebClientConfig {
    @Bean("llmWebClient")
    public WebClient llmWebClient(AppProperties properties) {
        return createWebClient(properties.getIntegrations().getLlm().getStreamTimeoutSeconds(), false);
    }

    @Bean("sttWebClient")
    public WebClient sttWebClient(AppProperties properties) {
        return createWebClient(properties.getIntegrations().getStt().getTimeoutSeconds(), false);
    }

    @Bean("ttsWebClient")
    public WebClient ttsWebClient(AppProperties properties) {
        return createWebClient(properties.getIntegrations().getTts().getTimeoutSeconds(), false);
    }

    @Bean("backendWebClient")
    public WebClient backendWebClient(AppProperties properties) {
        return createWebClient(properties.getIntegrations().getBackend().getTimeoutSeconds(), false);
    }

    /** The voice repository answers with redirects to its file CDN. */
    @Bean("voiceRepositoryWebClient")
    public WebClient voiceRepositoryWebClient(AppProperties properties) {
        return createWebClient(properties.getIntegrations().getVoiceRepository().getDownloadTimeoutSeconds(), true);
    }

    WebClient createWebClient(int responseTimeoutSeconds, boolean followRedirects) {
        ConnectionProvider provider = createConnectionProvider();
        HttpClient httpClient = createHttpClient(provider, responseTimeoutSeconds, followRedirects);
        ExchangeStrategies strategies = createExchangeStrategies();
        return WebClient.builder()
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .exchangeStrategies(strategies)
                .build();
    }

    private ConnectionProvider createConnectionProvider() {
        return ConnectionProvider.builder("echomind-http")
                .maxConnections(50)
                .pendingAcquireTimeout(Duration.ofSeconds(30))
                .build();
    }

    private HttpClient createHttpClient(ConnectionProvider provider, int responseTimeoutSeconds, boolean followRedirects) {
        return HttpClient.create(provider)
                .responseTimeout(Duration.ofSeconds(Math.max(1, responseTimeoutSeconds)))
                .followRedirect(followRedirects);
    }

    private ExchangeStrategies createExchangeStrategies() {
        return ExchangeStrategies.builder()
                .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(20 * 1024 * 1024))
                .build();
    }
}
