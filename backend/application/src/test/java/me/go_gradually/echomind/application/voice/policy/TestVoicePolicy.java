package me.go_gradually.echomind.application.voice.policy;

import java.util.List;

/**
 * Defaults matching the production configuration with 16 kHz, 20 ms frames.
 */
public class TestVoicePolicy implements VoicePolicy {
    private String introPhrase = "";
    private List<String> triggerPhrases = List.of("now you can speak");
    private int inboundQueueFrames = 500;

    public TestVoicePolicy withIntroPhrase(String introPhrase) {
        this.introPhrase = introPhrase;
        return this;
    }

    public TestVoicePolicy withTriggerPhrases(List<String> triggerPhrases) {
        this.triggerPhrases = triggerPhrases;
        return this;
    }

    public TestVoicePolicy withInboundQueueFrames(int inboundQueueFrames) {
        this.inboundQueueFrames = inboundQueueFrames;
        return this;
    }

    @Override
    public int voiceSampleRate() {
        return 16000;
    }

    @Override
    public int voiceFrameMs() {
        return 20;
    }

    @Override
    public int voiceVadAggressiveness() {
        return 2;
    }

    @Override
    public int voiceEndpointSilenceMs() {
        return 100;
    }

    @Override
    public int voiceMinSpeechMs() {
        return 100;
    }

    @Override
    public int voiceEndTailMs() {
        return 0;
    }

    @Override
    public int voiceMaxUtteranceMs() {
        return 30_000;
    }

    @Override
    public int voiceBargeInLeadIdleFrames() {
        return 2;
    }

    @Override
    public int voiceBargeInLeadActiveFrames() {
        return 6;
    }

    @Override
    public int voiceInboundQueueFrames() {
        return inboundQueueFrames;
    }

    @Override
    public int voiceOutboundQueueMessages() {
        return 1800;
    }

    @Override
    public int phraseMinChars() {
        return 28;
    }

    @Override
    public int phraseMaxChars() {
        return 120;
    }

    @Override
    public int phraseCommitPauseMs() {
        return 180;
    }

    @Override
    public String systemPrompt() {
        return "You are a realtime voice assistant.";
    }

    @Override
    public String introPhrase() {
        return introPhrase;
    }

    @Override
    public boolean emotionMode() {
        return false;
    }

    @Override
    public double memoryWindowMinutes() {
        return 30.0;
    }

    @Override
    public int historyMaxTurns() {
        return 12;
    }

    @Override
    public int historyMaxTokens() {
        return 1400;
    }

    @Override
    public String defaultAssistantName() {
        return "EchoMind";
    }

    @Override
    public String defaultUserName() {
        return "";
    }

    @Override
    public String defaultTimezone() {
        return "America/New_York";
    }

    @Override
    public String defaultLocation() {
        return "";
    }

    @Override
    public List<String> triggerPhrases() {
        return triggerPhrases;
    }

    @Override
    public String defaultTtsVoice() {
        return "en_US-lessac-medium";
    }
}
