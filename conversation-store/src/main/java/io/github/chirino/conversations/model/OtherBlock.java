package io.github.chirino.conversations.model;

import com.fasterxml.jackson.annotation.JsonValue;
import com.fasterxml.jackson.databind.node.ObjectNode;

/** A block of a type this service does not interpret; written back exactly as it was read. */
public class OtherBlock extends ContentBlock {

    private final ObjectNode raw;

    public OtherBlock(ObjectNode raw) {
        this.raw = raw;
    }

    @Override
    public String getType() {
        return raw.path("type").asText("");
    }

    @JsonValue
    public ObjectNode getRaw() {
        return raw;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof OtherBlock that && raw.equals(that.raw);
    }

    @Override
    public int hashCode() {
        return raw.hashCode();
    }
}
