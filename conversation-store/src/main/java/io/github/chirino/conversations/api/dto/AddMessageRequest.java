package io.github.chirino.conversations.api.dto;

import io.github.chirino.conversations.branch.BranchCoordinate;
import io.github.chirino.conversations.model.MessageContent;
import io.github.chirino.conversations.model.MessageRole;
import io.github.chirino.conversations.model.ToolResult;
import java.util.List;

/** A message to append; {@code branch} defaults to the current branch. */
public class AddMessageRequest {

    private BranchCoordinate branch;
    private MessageRole role;
    private MessageContent content;
    private String thinking;
    private List<ToolResult> toolResults;

    public BranchCoordinate getBranch() {
        return branch;
    }

    public void setBranch(BranchCoordinate branch) {
        this.branch = branch;
    }

    public MessageRole getRole() {
        return role;
    }

    public void setRole(MessageRole role) {
        this.role = role;
    }

    public MessageContent getContent() {
        return content;
    }

    public void setContent(MessageContent content) {
        this.content = content;
    }

    public String getThinking() {
        return thinking;
    }

    public void setThinking(String thinking) {
        this.thinking = thinking;
    }

    public List<ToolResult> getToolResults() {
        return toolResults;
    }

    public void setToolResults(List<ToolResult> toolResults) {
        this.toolResults = toolResults;
    }
}
