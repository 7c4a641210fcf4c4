package io.github.chirino.conversations.persistence;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.github.chirino.conversations.model.Message;
import java.util.ArrayList;
import java.util.List;

/** Contents of a {@code <branch-key>.json} file. */
@JsonIgnoreProperties(ignoreUnknown = true)
public class BranchDocument {

    private List<Message> messages = new ArrayList<>();

    public BranchDocument() {}

    public BranchDocument(List<Message> messages) {
        setMessages(messages);
    }

    public List<Message> getMessages() {
        return messages;
    }

    public void setMessages(List<Message> messages) {
        this.messages = messages != null ? new ArrayList<>(messages) : new ArrayList<>();
    }
}
