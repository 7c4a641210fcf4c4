package io.github.chirino.conversations.persistence;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.github.chirino.conversations.branch.BranchCoordinate;
import java.time.Instant;

/** Contents of {@code metadata.json}. */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ConversationMetadata {

    private String id;
    private String title;
    private String model;

    @JsonProperty("system_prompt")
    private String systemPrompt;

    @JsonProperty("is_agent")
    private boolean agent;

    @JsonProperty("created_at")
    private Instant createdAt;

    @JsonProperty("updated_at")
    private Instant updatedAt;

    @JsonProperty("current_branch")
    private BranchCoordinate currentBranch = BranchCoordinate.ROOT;

    @JsonProperty("session_id")
    @JsonInclude(JsonInclude.Include.NON_NULL)
    private String sessionId;

    public ConversationMetadata copy() {
        ConversationMetadata copy = new ConversationMetadata();
        copy.id = id;
        copy.title = title;
        copy.model = model;
        copy.systemPrompt = systemPrompt;
        copy.agent = agent;
        copy.createdAt = createdAt;
        copy.updatedAt = updatedAt;
        copy.currentBranch = currentBranch;
        copy.sessionId = sessionId;
        return copy;
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getTitle() {
        return title;
    }

    public void setTitle(String title) {
        this.title = title;
    }

    public String getModel() {
        return model;
    }

    public void setModel(String model) {
        this.model = model;
    }

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

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(Instant updatedAt) {
        this.updatedAt = updatedAt;
    }

    public BranchCoordinate getCurrentBranch() {
        return currentBranch;
    }

    public void setCurrentBranch(BranchCoordinate currentBranch) {
        this.currentBranch = currentBranch != null ? currentBranch : BranchCoordinate.ROOT;
    }

    public String getSessionId() {
        return sessionId;
    }

    public void setSessionId(String sessionId) {
        this.sessionId = sessionId;
    }
}
