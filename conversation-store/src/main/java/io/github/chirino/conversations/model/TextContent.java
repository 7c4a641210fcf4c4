package io.github.chirino.conversations.model;

import java.util.Objects;

public final class TextContent extends MessageContent {

    private final String text;

    TextContent(String text) {
        this.text = text != null ? text : "";
    }

    public String getText() {
        return text;
    }

    @Override
    public String plainText() {
        return text;
    }

    @Override
    public boolean hasSpecialBlocks() {
        return false;
    }

    @Override
    public boolean isEmpty() {
        return text.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof TextContent that && text.equals(that.text);
    }

    @Override
    public int hashCode() {
        return Objects.hash(text);
    }

    @Override
    public String toString() {
        return text;
    }
}
