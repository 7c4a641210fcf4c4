package io.github.chirino.conversations.api.dto;

import io.github.chirino.conversations.branch.BranchCoordinate;

public class GenerationDto {

    private String conversationId;
    private String messageId;
    private BranchCoordinate branch;
    private boolean cancelRequested;

    public String getConversationId() {
        return conversationId;
    }

    public void setConversationId(String conversationId) {
        this.conversationId = conversationId;
    }

    public String getMessageId() {
        return messageId;
    }

    public void setMessageId(String messageId) {
        this.messageId = messageId;
    }

    public BranchCoordinate getBranch() {
        return branch;
    }

    public void setBranch(BranchCoordinate branch) {
        this.branch = branch;
    }

    public boolean isCancelRequested() {
        return cancelRequested;
    }

    public void setCancelRequested(boolean cancelRequested) {
        this.cancelRequested = cancelRequested;
    }
}
