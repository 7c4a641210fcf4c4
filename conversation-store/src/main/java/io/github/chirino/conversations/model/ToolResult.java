package io.github.chirino.conversations.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public class ToolResult {

    @JsonProperty("tool_use_id")
    private String toolUseId;

    private Object content;

    @JsonProperty("is_error")
    private boolean error;

    public ToolResult() {}

    public ToolResult(String toolUseId, Object content, boolean error) {
        this.toolUseId = toolUseId;
        this.content = content;
        this.error = error;
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
}
