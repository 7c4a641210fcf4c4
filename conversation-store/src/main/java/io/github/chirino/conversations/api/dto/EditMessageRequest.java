package io.github.chirino.conversations.api.dto;

import io.github.chirino.conversations.branch.BranchCoordinate;
import io.github.chirino.conversations.model.MessageContent;

public class EditMessageRequest {

    private BranchCoordinate branch;
    private Integer userMessageIndex;
    private MessageContent content;

    public BranchCoordinate getBranch() {
        return branch;
    }

    public void setBranch(BranchCoordinate branch) {
        this.branch = branch;
    }

    public Integer getUserMessageIndex() {
        return userMessageIndex;
    }

    public void setUserMessageIndex(Integer userMessageIndex) {
        this.userMessageIndex = userMessageIndex;
    }

    public MessageContent getContent() {
        return content;
    }

    public void setContent(MessageContent content) {
        this.content = content;
    }
}
