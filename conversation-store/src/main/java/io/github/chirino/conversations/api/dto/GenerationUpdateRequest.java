package io.github.chirino.conversations.api.dto;

import io.github.chirino.conversations.branch.BranchCoordinate;
import io.github.chirino.conversations.model.MessageContent;
import io.github.chirino.conversations.model.ToolResult;
import java.util.List;

/**
 * Full replacement content of a streaming message. {@code stopped} is only read when the update
 * finishes the generation.
 */
public class GenerationUpdateRequest {

    private BranchCoordinate branch;
    private MessageContent content;
    private String thinking;
    private List<ToolResult> toolResults;
    private boolean stopped;

    public BranchCoordinate getBranch() {
        return branch;
    }

    public void setBranch(BranchCoordinate branch) {
        this.branch = branch;
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

    public boolean isStopped() {
        return stopped;
    }

    public void setStopped(boolean stopped) {
        this.stopped = stopped;
    }
}
