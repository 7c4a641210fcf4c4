package io.github.chirino.conversations.api.dto;

public class SessionIdRequest {

    private String sessionId;

    public String getSessionId() {
        return sessionId;
    }

    public void setSessionId(String sessionId) {
        this.sessionId = sessionId;
    }
}
