package me.go_gradually.echomind.application.voice.model;

import java.util.List;

/**
 * Client {@code set_context} request. A null field means the client did not send it: profile fields
 * then keep their value, the other fields fall back to their defaults.
 */
public class SessionContextUpdate {
    private String systemPrompt;
    private Boolean useKnowledgeBase;
    private String persona;
    private String contextWindow;
    private String assistantName;
    private String wakeWord;
    private String userName;
    private String timezone;
    private String location;
    private Boolean listenOnly;
    private List<String> triggerPhrases;
    private Boolean clearMemory;
    private String piperVoice;

    public String getSystemPrompt() {
        return systemPrompt;
    }

    public void setSystemPrompt(String systemPrompt) {
        this.systemPrompt = systemPrompt;
    }

    public Boolean getUseKnowledgeBase() {
        return useKnowledgeBase;
    }

    public void setUseKnowledgeBase(Boolean useKnowledgeBase) {
        this.useKnowledgeBase = useKnowledgeBase;
    }

    public String getPersona() {
        return persona;
    }

    public void setPersona(String persona) {
        this.persona = persona;
    }

    public String getContextWindow() {
        return contextWindow;
    }

    public void setContextWindow(String contextWindow) {
        this.contextWindow = contextWindow;
    }

    public String getAssistantName() {
        return assistantName;
    }

    public void setAssistantName(String assistantName) {
        this.assistantName = assistantName;
    }

    public String getWakeWord() {
        return wakeWord;
    }

    public void setWakeWord(String wakeWord) {
        this.wakeWord = wakeWord;
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

    public Boolean getListenOnly() {
        return listenOnly;
    }

    public void setListenOnly(Boolean listenOnly) {
        this.listenOnly = listenOnly;
    }

    public List<String> getTriggerPhrases() {
        return triggerPhrases;
    }

    public void setTriggerPhrases(List<String> triggerPhrases) {
        this.triggerPhrases = triggerPhrases;
    }

    public Boolean getClearMemory() {
        return clearMemory;
    }

    public void setClearMemory(Boolean clearMemory) {
        this.clearMemory = clearMemory;
    }

    public String getPiperVoice() {
        return piperVoice;
    }

    public void setPiperVoice(String piperVoice) {
        this.piperVoice = piperVoice;
    }
}
