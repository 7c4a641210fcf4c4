package io.github.chirino.conversations.model;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

public class ToolUseBlock extends ContentBlock {

    private String id;
    private String name;
    private Map<String, Object> input = new LinkedHashMap<>();

    public ToolUseBlock() {}

    public ToolUseBlock(String id, String name, Map<String, Object> input) {
        this.id = id;
        this.name = name;
        setInput(input);
    }

    @Override
    public String getType() {
        return TOOL_USE;
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public Map<String, Object> getInput() {
        return input;
    }

    public void setInput(Map<String, Object> input) {
        this.input = input != null ? new LinkedHashMap<>(input) : new LinkedHashMap<>();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof ToolUseBlock that
                && Objects.equals(id, that.id)
                && Objects.equals(name, that.name)
                && Objects.equals(input, that.input);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, name, input);
    }
}
