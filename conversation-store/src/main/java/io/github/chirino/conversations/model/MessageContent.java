package io.github.chirino.conversations.model;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import java.util.List;

/**
 * Content of a message: either a bare string ({@link TextContent}) or an ordered list of typed
 * blocks ({@link BlockListContent}). On disk the first is a JSON string and the second a JSON
 * array.
 */
@JsonSerialize(using = MessageContentSerializer.class)
@JsonDeserialize(using = MessageContentDeserializer.class)
public abstract class MessageContent {

    private static final TextContent EMPTY = new TextContent("");

    MessageContent() {}

    public static TextContent empty() {
        return EMPTY;
    }

    public static TextContent text(String text) {
        return text == null || text.isEmpty() ? EMPTY : new TextContent(text);
    }

    public static BlockListContent blocks(List<ContentBlock> blocks) {
        return new BlockListContent(blocks);
    }

    /** Text of the message with non-text blocks dropped, used for search and previews. */
    public abstract String plainText();

    /** True when any block is something other than plain text. */
    public abstract boolean hasSpecialBlocks();

    public abstract boolean isEmpty();
}
