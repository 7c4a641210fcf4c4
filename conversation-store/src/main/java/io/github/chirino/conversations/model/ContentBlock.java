package io.github.chirino.conversations.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * One element of a {@link BlockListContent}. The {@code type} discriminator is written first and
 * read by {@link MessageContentDeserializer}, which dispatches to the concrete block class.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({"type"})
public abstract class ContentBlock {

    public static final String TEXT = "text";
    public static final String TOOL_USE = "tool_use";
    public static final String TOOL_RESULT = "tool_result";
    public static final String FILE_REFERENCE = "surface_content";
    public static final String COMPACTION = "compaction";

    @JsonProperty("type")
    public abstract String getType();
}
