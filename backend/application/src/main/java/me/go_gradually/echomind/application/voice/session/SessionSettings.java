package me.go_gradually.echomind.application.voice.session;

import me.go_gradually.echomind.application.voice.policy.VoicePolicy;
import me.go_gradually.echomind.domain.audio.AudioFormat;
import me.go_gradually.echomind.domain.conversation.Profile;
import me.go_gradually.echomind.domain.speech.PhraseSettings;
import me.go_gradually.echomind.domain.util.TextUtils;
import me.go_gradually.echomind.domain.vad.VadSettings;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

record SessionSettings(AudioFormat format,
                       VadSettings vad,
                       int vadAggressiveness,
                       int maxUtteranceMs,
                       int inboundQueueFrames,
                       int outboundQueueMessages,
                       PhraseSettings phrase,
                       String systemPrompt,
                       String introPhrase,
                       boolean emotionMode,
                       double memoryWindowMinutes,
                       int historyMaxTurns,
                       int historyMaxTokens,
                       Profile defaultProfile,
                       List<String> triggerPhrases,
                       String defaultTtsVoice) {
    static final String DEFAULT_SYSTEM_PROMPT =
            "You are a realtime voice assistant. Be concise, helpful, and conversational.";

    static SessionSettings from(VoicePolicy policy) {
        AudioFormat format = new AudioFormat(policy.voiceSampleRate(), policy.voiceFrameMs());
        return new SessionSettings(
                format,
                VadSettings.of(
                        format,
                        policy.voiceEndpointSilenceMs(),
                        policy.voiceMinSpeechMs(),
                        policy.voiceEndTailMs(),
                        policy.voiceBargeInLeadIdleFrames(),
                        policy.voiceBargeInLeadActiveFrames()
                ),
                policy.voiceVadAggressiveness(),
                Math.max(policy.voiceFrameMs(), policy.voiceMaxUtteranceMs()),
                Math.max(1, policy.voiceInboundQueueFrames()),
                Math.max(1, policy.voiceOutboundQueueMessages()),
                new PhraseSettings(policy.phraseMinChars(), policy.phraseMaxChars(), policy.phraseCommitPauseMs()),
                TextUtils.firstNonBlank(TextUtils.trimToEmpty(policy.systemPrompt()), DEFAULT_SYSTEM_PROMPT),
                TextUtils.trimToEmpty(policy.introPhrase()),
                policy.emotionMode(),
                policy.memoryWindowMinutes(),
                policy.historyMaxTurns(),
                policy.historyMaxTokens(),
                new Profile(
                        policy.defaultAssistantName(),
                        policy.defaultAssistantName(),
                        policy.defaultUserName(),
                        policy.defaultTimezone(),
                        policy.defaultLocation()
                ),
                normalizeTriggers(policy.triggerPhrases()),
                TextUtils.trimToEmpty(policy.defaultTtsVoice())
        );
    }

    static List<String> normalizeTriggers(List<String> phrases) {
        List<String> normalized = new ArrayList<>();
        if (phrases == null) {
            return normalized;
        }
        for (String phrase : phrases) {
            if (phrase != null && !phrase.isBlank()) {
                normalized.add(phrase.trim().toLowerCase(Locale.ROOT));
            }
        }
        return List.copyOf(normalized);
    }
}
