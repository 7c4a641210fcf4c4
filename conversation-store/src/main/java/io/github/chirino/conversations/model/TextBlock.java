package io.github.chirino.conversations.model;

import java.util.Objects;

public class TextBlock extends ContentBlock {

    private String text = "";

    public TextBlock() {}

    public TextBlock(String text) {
        this.text = text != null ? text : "";
    }

    @Override
    public String getType() {
        return TEXT;
    }

    public String getText() {
        return text;
    }

    public void setText(String text) {
        this.text = text != null ? text : "";
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof TextBlock that && text.equals(that.text);
    }

    @Override
    public int hashCode() {
        return Objects.hash(text);
    }

    @Override
    public String toString() {
        return "TextBlock[" + text + "]";
    }
}
