package me.go_gradually.echomind.infrastructure.shared.config;

import me.go_gradually.echomind.application.voice.policy.VoicePolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

@ConfigurationProperties(prefix = "echomind")
public class AppProperties implements VoicePolicy {
    private String voicesDir = "/voices";
    private Audio audio = new Audio();
    private Vad vad = new Vad();
    private Phrase phrase = new Phrase();
    private Conversation conversation = new Conversation();
    private Profile profile = new Profile();
    private Integrations integrations = new Integrations();

    public String getVoicesDir() {
        return voicesDir;
    }

    public void setVoicesDir(String voicesDir) {
        this.voicesDir = voicesDir;
    }

    public Audio getAudio() {
        return audio;
    }

    public void setAudio(Audio audio) {
        this.audio = audio;
    }

    public Vad getVad() {
        return vad;
    }

    public void setVad(Vad vad) {
        this.vad = vad;
    }

    public Phrase getPhrase() {
        return phrase;
    }

    public void setPhrase(Phrase phrase) {
        this.phrase = phrase;
    }

    public Conversation getConversation() {
        return conversation;
    }

    public void setConversation(Conversation conversation) {
        this.conversation = conversation;
    }

    public Profile getProfile() {
        return profile;
    }

    public void setProfile(Profile profile) {
        this.profile = profile;
    }

    public Integrations getIntegrations() {
        return integrations;
    }

    public void setIntegrations(Integrations integrations) {
        this.integrations = integrations;
    }

    @Override
    public int voiceSampleRate() {
        return audio.getSampleRate();
    }

    @Override
    public int voiceFrameMs() {
        return audio.getFrameMs();
    }

    @Override
    public int voiceVadAggressiveness() {
        return vad.getAggressiveness();
    }

    @Override
    public int voiceEndpointSilenceMs() {
        return vad.getEndpointSilenceMs();
    }

    @Override
    public int voiceMinSpeechMs() {
        return vad.getMinSpeechMs();
    }

    @Override
    public int voiceEndTailMs() {
        return vad.getEndTailMs();
    }

    @Override
    public int voiceMaxUtteranceMs() {
        return vad.getMaxUtteranceMs();
    }

    @Override
    public int voiceBargeInLeadIdleFrames() {
        return vad.getBargeInLeadIdleFrames();
    }

    @Override
    public int voiceBargeInLeadActiveFrames() {
        return vad.getBargeInLeadActiveFrames();
    }

    @Override
    public int voiceInboundQueueFrames() {
        return audio.getInboundQueueFrames();
    }

    @Override
    public int voiceOutboundQueueMessages() {
        return audio.getOutboundQueueMessages();
    }

    @Override
    public int phraseMinChars() {
        return phrase.getMinChars();
    }

    @Override
    public int phraseMaxChars() {
        return phrase.getMaxChars();
    }

    @Override
    public int phraseCommitPauseMs() {
        return phrase.getCommitPauseMs();
    }

    @Override
    public String systemPrompt() {
        return conversation.getSystemPrompt();
    }

    @Override
    public String introPhrase() {
        return conversation.getIntroPhrase();
    }

    @Override
    public boolean emotionMode() {
        return conversation.isEmotionMode();
    }

    @Override
    public double memoryWindowMinutes() {
        return conversation.getMemoryWindowMinutes();
    }

    @Override
    public int historyMaxTurns() {
        return conversation.getHistoryMaxTurns();
    }

    @Override
    public int historyMaxTokens() {
        return conversation.getHistoryMaxTokens();
    }

    @Override
    public String defaultAssistantName() {
        return profile.getAssistantName();
    }

    @Override
    public String defaultUserName() {
        return profile.getUserName();
    }

    @Override
    public String defaultTimezone() {
        return profile.getTimezone();
    }

    @Override
    public String defaultLocation() {
        return profile.getLocation();
    }

    @Override
    public List<String> triggerPhrases() {
        return List.copyOf(conversation.getTriggerPhrases());
    }

    @Override
    public String defaultTtsVoice() {
        return integrations.getTts().getVoice();
    }

    public static class Audio {
        private int sampleRate = 16000;
        private int frameMs = 20;
        private int inboundQueueFrames = 500;
        private int outboundQueueMessages = 1800;

        public int getSampleRate() {
            return sampleRate;
        }

        public void setSampleRate(int sampleRate) {
            this.sampleRate = sampleRate;
        }

        public int getFrameMs() {
            return frameMs;
        }

        public void setFrameMs(int frameMs) {
            this.frameMs = frameMs;
        }

        public int getInboundQueueFrames() {
            return inboundQueueFrames;
        }

        public void setInboundQueueFrames(int inboundQueueFrames) {
            this.inboundQueueFrames = inboundQueueFrames;
        }

        public int getOutboundQueueMessages() {
            return outboundQueueMessages;
        }

        public void setOutboundQueueMessages(int outboundQueueMessages) {
            this.outboundQueueMessages = outboundQueueMessages;
        }
    }

    public static class Vad {
        private int aggressiveness = 2;
        private int endpointSilenceMs = 450;
        private int minSpeechMs = 250;
        private int endTailMs = 120;
        private int maxUtteranceMs = 30000;
        private int bargeInLeadIdleFrames = 2;
        private int bargeInLeadActiveFrames = 6;

        public int getAggressiveness() {
            return aggressiveness;
        }

        public void setAggressiveness(int aggressiveness) {
            this.aggressiveness = aggressiveness;
        }

        public int getEndpointSilenceMs() {
            return endpointSilenceMs;
        }

        public void setEndpointSilenceMs(int endpointSilenceMs) {
            this.endpointSilenceMs = endpointSilenceMs;
        }

        public int getMinSpeechMs() {
            return minSpeechMs;
        }

        public void setMinSpeechMs(int minSpeechMs) {
            this.minSpeechMs = minSpeechMs;
        }

        public int getEndTailMs() {
            return endTailMs;
        }

        public void setEndTailMs(int endTailMs) {
            this.endTailMs = endTailMs;
        }

        public int getMaxUtteranceMs() {
            return maxUtteranceMs;
        }

        public void setMaxUtteranceMs(int maxUtteranceMs) {
            this.maxUtteranceMs = maxUtteranceMs;
        }

        public int getBargeInLeadIdleFrames() {
            return bargeInLeadIdleFrames;
        }

        public void setBargeInLeadIdleFrames(int bargeInLeadIdleFrames) {
            this.bargeInLeadIdleFrames = bargeInLeadIdleFrames;
        }

        public int getBargeInLeadActiveFrames() {
            return bargeInLeadActiveFrames;
        }

        public void setBargeInLeadActiveFrames(int bargeInLeadActiveFrames) {
            this.bargeInLeadActiveFrames = bargeInLeadActiveFrames;
        }
    }

    public static class Phrase {
        private int minChars = 28;
        private int maxChars = 120;
        private int commitPauseMs = 180;

        public int getMinChars() {
            return minChars;
        }

        public void setMinChars(int minChars) {
            this.minChars = minChars;
        }

        public int getMaxChars() {
            return maxChars;
        }

        public void setMaxChars(int maxChars) {
            this.maxChars = maxChars;
        }

        public int getCommitPauseMs() {
            return commitPauseMs;
        }

        public void setCommitPauseMs(int commitPauseMs) {
            this.commitPauseMs = commitPauseMs;
        }
    }

    public static class Conversation {
        private String systemPrompt = "You are a realtime voice assistant. Be concise, helpful, and conversational.";
        private String introPhrase = "Hi! I'm here. What would you like to talk about?";
        private boolean emotionMode = true;
        private double memoryWindowMinutes = 30.0;
        private int historyMaxTurns = 12;
        private int historyMaxTokens = 1400;
        private List<String> triggerPhrases = new ArrayList<>(List.of(
                "now you can speak", "now you can process", "fact check", "fact check it",
                "process that", "speak now", "you can speak"
        ));

        public String getSystemPrompt() {
            return systemPrompt;
        }

        public void setSystemPrompt(String systemPrompt) {
            this.systemPrompt = systemPrompt;
        }

        public String getIntroPhrase() {
            return introPhrase;
        }

        public void setIntroPhrase(String introPhrase) {
            this.introPhrase = introPhrase;
        }

        public boolean isEmotionMode() {
            return emotionMode;
        }

        public void setEmotionMode(boolean emotionMode) {
            this.emotionMode = emotionMode;
        }

        public double getMemoryWindowMinutes() {
            return memoryWindowMinutes;
        }

        public void setMemoryWindowMinutes(double memoryWindowMinutes) {
            this.memoryWindowMinutes = memoryWindowMinutes;
        }

        public int getHistoryMaxTurns() {
            return historyMaxTurns;
        }

        public void setHistoryMaxTurns(int historyMaxTurns) {
            this.historyMaxTurns = historyMaxTurns;
        }

        public int getHistoryMaxTokens() {
            return historyMaxTokens;
        }

        public void setHistoryMaxTokens(int historyMaxTokens) {
            this.historyMaxTokens = historyMaxTokens;
        }

        public List<String> getTriggerPhrases() {
            return triggerPhrases;
        }

        public void setTriggerPhrases(List<String> triggerPhrases) {
            this.triggerPhrases = triggerPhrases;
        }
    }

    public static class Profile {
        private String assistantName = "EchoMind";
        private String userName = "";
        private String timezone = "America/New_York";
        private String location = "";

        public String getAssistantName() {
            return assistantName;
        }

        public void setAssistantName(String assistantName) {
            this.assistantName = assistantName;
        }

        public String getUserName() {
            return userName;
        }

        public void setUserName(String userName) {
            this.userName = userName;
        }

        public String getTimezone() {
            return timezone;
        }

        public void setTimezone(String timezone) {
            this.timezone = timezone;
        }

        public String getLocation() {
            return location;
        }

        public void setLocation(String location) {
            this.location = location;
        }
    }

    public static class Integrations {
        private Llm llm = new Llm();
        private Stt stt = new Stt();
        private Tts tts = new Tts();
        private Backend backend = new Backend();
        private SpeechCore speechCore = new SpeechCore();
        private VoiceRepository voiceRepository = new VoiceRepository();

        public Llm getLlm() {
            return llm;
        }

        public void setLlm(Llm llm) {
            this.llm = llm;
        }

        public Stt getStt() {
            return stt;
        }

        public void setStt(Stt stt) {
            this.stt = stt;
        }

        public Tts getTts() {
            return tts;
        }

        public void setTts(Tts tts) {
            this.tts = tts;
        }

        public Backend getBackend() {
            return backend;
        }

        public void setBackend(Backend backend) {
            this.backend = backend;
        }

        public SpeechCore getSpeechCore() {
            return speechCore;
        }

        public void setSpeechCore(SpeechCore speechCore) {
            this.speechCore = speechCore;
        }

        public VoiceRepository getVoiceRepository() {
            return voiceRepository;
        }

        public void setVoiceRepository(VoiceRepository voiceRepository) {
            this.voiceRepository = voiceRepository;
        }
    }

    /** OpenAI-compatible chat completions endpoint (Ollama by default). */
    public static class Llm {
        private String url = "http://127.0.0.1:11434/v1/chat/completions";
        private String model = "qwen2.5:7b-instruct";
        private String apiKey = "";
        private double temperature = 0.7;
        private int maxTokens = 220;
        private int completionTimeoutSeconds = 60;
        private int streamTimeoutSeconds = 120;
        private boolean logPayloads = false;

        public String getUrl() {
            return url;
        }

        public void setUrl(String url) {
            this.url = url;
        }

        public String getModel() {
            return model;
        }

        public void setModel(String model) {
            this.model = model;
        }

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }

        public double getTemperature() {
            return temperature;
        }

        public void setTemperature(double temperature) {
            this.temperature = temperature;
        }

        public int getMaxTokens() {
            return maxTokens;
        }

        public void setMaxTokens(int maxTokens) {
            this.maxTokens = maxTokens;
        }

        public int getCompletionTimeoutSeconds() {
            return completionTimeoutSeconds;
        }

        public void setCompletionTimeoutSeconds(int completionTimeoutSeconds) {
            this.completionTimeoutSeconds = completionTimeoutSeconds;
        }

        public int getStreamTimeoutSeconds() {
            return streamTimeoutSeconds;
        }

        public void setStreamTimeoutSeconds(int streamTimeoutSeconds) {
            this.streamTimeoutSeconds = streamTimeoutSeconds;
        }

        public boolean isLogPayloads() {
            return logPayloads;
        }

        public void setLogPayloads(boolean logPayloads) {
            this.logPayloads = logPayloads;
        }
    }

    public static class Stt {
        private String baseUrl = "http://127.0.0.1:8000";
        private String model = "base";
        private String language = "";
        private int timeoutSeconds = 60;

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getModel() {
            return model;
        }

        public void setModel(String model) {
            this.model = model;
        }

        public String getLanguage() {
            return language;
        }

        public void setLanguage(String language) {
            this.language = language;
        }

        public int getTimeoutSeconds() {
            return timeoutSeconds;
        }

        public void setTimeoutSeconds(int timeoutSeconds) {
            this.timeoutSeconds = timeoutSeconds;
        }
    }

    public static class Tts {
        private String baseUrl = "http://127.0.0.1:5000";
        private String model = "piper";
        private String voice = "en_US-lessac-medium";
        private double lengthScale = 1.0;
        private int timeoutSeconds = 60;

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getModel() {
            return model;
        }

        public void setModel(String model) {
            this.model = model;
        }

        public String getVoice() {
            return voice;
        }

        public void setVoice(String voice) {
            this.voice = voice;
        }

        public double getLengthScale() {
            return lengthScale;
        }

        public void setLengthScale(double lengthScale) {
            this.lengthScale = lengthScale;
        }

        public int getTimeoutSeconds() {
            return timeoutSeconds;
        }

        public void setTimeoutSeconds(int timeoutSeconds) {
            this.timeoutSeconds = timeoutSeconds;
        }
    }

    /** Knowledge-base and transcript archive back end; blank disables both. */
    public static class Backend {
        private String chatUrl = "";
        private int timeoutSeconds = 60;

        public String getChatUrl() {
            return chatUrl;
        }

        public void setChatUrl(String chatUrl) {
            this.chatUrl = chatUrl;
        }

        public int getTimeoutSeconds() {
            return timeoutSeconds;
        }

        public void setTimeoutSeconds(int timeoutSeconds) {
            this.timeoutSeconds = timeoutSeconds;
        }
    }

    public static class SpeechCore {
        private boolean enabled = false;
        private String url = "ws://127.0.0.1:8080/ws";
        private boolean supportsTextInject = false;
        private int connectTimeoutSeconds = 10;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getUrl() {
            return url;
        }

        public void setUrl(String url) {
            this.url = url;
        }

        public boolean isSupportsTextInject() {
            return supportsTextInject;
        }

        public void setSupportsTextInject(boolean supportsTextInject) {
            this.supportsTextInject = supportsTextInject;
        }

        public int getConnectTimeoutSeconds() {
            return connectTimeoutSeconds;
        }

        public void setConnectTimeoutSeconds(int connectTimeoutSeconds) {
            this.connectTimeoutSeconds = connectTimeoutSeconds;
        }
    }

    public static class VoiceRepository {
        private String baseUrl = "https://huggingface.co/rhasspy/piper-voices/resolve/v1.0.0";
        private String userAgent = "EchoMind-Voice/1.0";
        private int downloadTimeoutSeconds = 120;

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getUserAgent() {
            return userAgent;
        }

        public void setUserAgent(String userAgent) {
            this.userAgent = userAgent;
        }

        public int getDownloadTimeoutSeconds() {
            return downloadTimeoutSeconds;
        }

        public void setDownloadTimeoutSeconds(int downloadTimeoutSeconds) {
            this.downloadTimeoutSeconds = downloadTimeoutSeconds;
        }
    }
}
