package io.github.chirino.conversations.api.dto;

/** Partial update: null fields are left unchanged. */
public class UpdateConversationRequest {

    private String title;
    private String model;
    private String systemPrompt;

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
}
