package io.github.chirino.conversations.api.dto;

import io.github.chirino.conversations.branch.BranchCoordinate;
import java.util.List;

public class ConversationDto extends ConversationSummaryDto {

    private String systemPrompt;
    private boolean agent;
    private String sessionId;
    private BranchCoordinate currentBranch;
    private List<MessageDto> messages;

    public String getSystemPrompt() {
        return systemPrompt;
    }

    public void setSystemPrompt(String systemPrompt) {
        this.systemPrompt = systemPrompt;
    }

    public boolean isAgent() {
        return agent;
    }

    public void setAgent(boolean agent) {
        this.agent = agent;
    }

    public String getSessionId() {
        return sessionId;
    }

    public void setSessionId(String sessionId) {
        this.sessionId = sessionId;
    }

    public BranchCoordinate getCurrentBranch() {
        return currentBranch;
    }

    public void setCurrentBranch(BranchCoordinate currentBranch) {
        this.currentBranch = currentBranch;
    }

    public List<MessageDto> getMessages() {
        return messages;
    }

    public void setMessages(List<MessageDto> messages) {
        this.messages = messages;
    }
}
