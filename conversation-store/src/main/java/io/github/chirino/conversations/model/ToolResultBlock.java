package io.github.chirino.conversations.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Objects;

public class ToolResultBlock extends ContentBlock {

    @JsonProperty("tool_use_id")
    private String toolUseId;

    private Object content;

    @JsonProperty("is_error")
    private boolean error;

    public ToolResultBlock() {}

    public ToolResultBlock(String toolUseId, Object content, boolean error) {
        this.toolUseId = toolUseId;
        this.content = content;
        this.error = error;
    }

    @Override
    public String getType() {
        return TOOL_RESULT;
    }

    public String getToolUseId() {
        return toolUseId;
    }

    public void setToolUseId(String toolUseId) {
        this.toolUseId = toolUseId;
    }

    public Object getContent() {
        return content;
    }

    public void setContent(Object content) {
        this.content = content;
    }

    public boolean isError() {
        return error;
    }

    public void setError(boolean error) {
        this.error = error;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof ToolResultBlock that
                && error == that.error
                && Objects.equals(toolUseId, that.toolUseId)
                && Objects.equals(content, that.content);
    }

    @Override
    public int hashCode() {
        return Objects.hash(toolUseId, content, error);
    }
}
