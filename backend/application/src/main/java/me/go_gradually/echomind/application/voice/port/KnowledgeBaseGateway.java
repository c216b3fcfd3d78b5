package me.go_gradually.echomind.application.voice.port;

import me.go_gradually.echomind.application.voice.model.KnowledgeBaseQuery;

public interface KnowledgeBaseGateway {
    boolean isConfigured();

    String ask(KnowledgeBaseQuery query) throws Exception;
}
