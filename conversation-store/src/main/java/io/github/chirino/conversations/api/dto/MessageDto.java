package io.github.chirino.conversations.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.github.chirino.conversations.model.MessageContent;
import io.github.chirino.conversations.model.MessageRole;
import io.github.chirino.conversations.model.ToolResult;
import java.time.Instant;
import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public class MessageDto {

    private String id;
    private MessageRole role;
    private MessageContent content;
    private String thinking;
    private List<ToolResult> toolResults;
    private Instant createdAt;
    private boolean streaming;
    private int position;
    private Integer userMessageIndex;
    private int currentVersion;
    private int totalVersions;

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
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

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    public boolean isStreaming() {
        return streaming;
    }

    public void setStreaming(boolean streaming) {
        this.streaming = streaming;
    }

    public int getPosition() {
        return position;
    }

    public void setPosition(int position) {
        this.position = position;
    }

    public Integer getUserMessageIndex() {
        return userMessageIndex;
    }

    public void setUserMessageIndex(Integer userMessageIndex) {
        this.userMessageIndex = userMessageIndex;
    }

    public int getCurrentVersion() {
        return currentVersion;
    }

    public void setCurrentVersion(int currentVersion) {
        this.currentVersion = currentVersion;
    }

    public int getTotalVersions() {
        return totalVersions;
    }

    public void setTotalVersions(int totalVersions) {
        this.totalVersions = totalVersions;
    }
}
