package com.linlay.archinsight.conversation;

import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.UserMessage;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns accumulated by one run of {@link ConversationOrchestrator}. Owned by that run only.
 */
public class ConversationState {

    private final List<Message> turns = new ArrayList<>();
    private final int maxIterations;
    private int iteration;

    public ConversationState(int maxIterations) {
        if (maxIterations < 1) {
            throw new IllegalArgumentException("maxIterations must be >= 1");
        }
        this.maxIterations = maxIterations;
    }

    public int nextIteration() {
        return ++iteration;
    }

    public int iteration() {
        return iteration;
    }

    public int maxIterations() {
        return maxIterations;
    }

    public boolean exhausted() {
        return iteration >= maxIterations;
    }

    public void appendUser(String content) {
        turns.add(new UserMessage(content == null ? "" : content));
    }

    public void appendAssistant(String content) {
        turns.add(new AssistantMessage(content == null ? "" : content));
    }

    public List<Message> turns() {
        return List.copyOf(turns);
    }
}
