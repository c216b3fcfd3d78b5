package me.go_gradually.echomind.application.voice.policy;

import java.util.List;

public interface VoicePolicy {
    int voiceSampleRate();

    int voiceFrameMs();

    int voiceVadAggressiveness();

    int voiceEndpointSilenceMs();

    int voiceMinSpeechMs();

    int voiceEndTailMs();

    int voiceMaxUtteranceMs();

    int voiceBargeInLeadIdleFrames();

    int voiceBargeInLeadActiveFrames();

    int voiceInboundQueueFrames();

    int voiceOutboundQueueMessages();

    int phraseMinChars();

    int phraseMaxChars();

    int phraseCommitPauseMs();

    String systemPrompt();

    String introPhrase();

    boolean emotionMode();

    double memoryWindowMinutes();

    int historyMaxTurns();

    int historyMaxTokens();

    String defaultAssistantName();

    String defaultUserName();

    String defaultTimezone();

    String defaultLocation();

    List<String> triggerPhrases();

    String defaultTtsVoice();
}
