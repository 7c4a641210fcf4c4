package io.github.chirino.conversations.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/** One entry of a branch document. The id never changes once the message is written. */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class Message {

    private String id;
    private MessageRole role;
    private MessageContent content = MessageContent.empty();
    private String thinking;

    @JsonProperty("tool_results")
    private List<ToolResult> toolResults;

    @JsonProperty("created_at")
    private Instant createdAt;

    // Only written while true so finished messages keep the plain document shape.
    private Boolean streaming;

    public static Message create(MessageRole role, MessageContent content) {
        Message message = new Message();
        message.id = UUID.randomUUID().toString();
        message.role = role;
        message.content = content != null ? content : MessageContent.empty();
        message.createdAt = Instant.now();
        return message;
    }

    public Message copy() {
        Message copy = new Message();
        copy.id = id;
        copy.role = role;
        copy.content = content;
        copy.thinking = thinking;
        copy.toolResults = toolResults != null ? new ArrayList<>(toolResults) : null;
        copy.createdAt = createdAt;
        copy.streaming = streaming;
        return copy;
    }

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
        this.content = content != null ? content : MessageContent.empty();
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

    public Boolean getStreaming() {
        return streaming;
    }

    public void setStreaming(Boolean streaming) {
        this.streaming = Boolean.TRUE.equals(streaming) ? Boolean.TRUE : null;
    }

    public boolean streamingInProgress() {
        return Boolean.TRUE.equals(streaming);
    }

    @JsonIgnore
    public boolean isUser() {
        return role == MessageRole.USER;
    }
}
