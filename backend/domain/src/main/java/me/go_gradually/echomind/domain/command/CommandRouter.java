package me.go_gradually.echomind.domain.command;

import me.go_gradually.echomind.domain.conversation.Profile;

import java.util.List;

public interface CommandRouter {
    RouteResult route(String utterance,
                      Profile profile,
                      String memorySummary,
                      boolean listenOnly,
                      List<String> triggerPhrases);
}
