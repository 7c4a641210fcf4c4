package io.github.chirino.conversations.model;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.ObjectCodec;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads every content shape found in stored documents: a string, an array of typed blocks (bare
 * strings inside the array count as text blocks) and the legacy {@code {"text": ...}} object.
 */
public class MessageContentDeserializer extends StdDeserializer<MessageContent> {

    public MessageContentDeserializer() {
        super(MessageContent.class);
    }

    @Override
    public MessageContent deserialize(JsonParser p, DeserializationContext ctxt)
            throws IOException {
        ObjectCodec codec = p.getCodec();
        JsonNode node = codec.readTree(p);
        return toContent(node, codec);
    }

    @Override
    public MessageContent getNullValue(DeserializationContext ctxt) {
        return MessageContent.empty();
    }

    static MessageContent toContent(JsonNode node, ObjectCodec codec) throws IOException {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return MessageContent.empty();
        }
        if (node.isTextual()) {
            return MessageContent.text(node.asText());
        }
        if (node.isArray()) {
            List<ContentBlock> blocks = new ArrayList<>();
            for (JsonNode element : node) {
                ContentBlock block = toBlock(element, codec);
                if (block != null) {
                    blocks.add(block);
                }
            }
            return MessageContent.blocks(blocks);
        }
        if (node.isObject()) {
            return MessageContent.text(node.path("text").asText(""));
        }
        return MessageContent.text(node.asText());
    }

    private static ContentBlock toBlock(JsonNode element, ObjectCodec codec) throws IOException {
        if (element.isTextual()) {
            return new TextBlock(element.asText());
        }
        if (!element.isObject()) {
            return null;
        }
        String type = element.path("type").asText("");
        return switch (type) {
            case ContentBlock.TEXT -> new TextBlock(element.path("text").asText(""));
            case ContentBlock.TOOL_USE -> codec.treeToValue(element, ToolUseBlock.class);
            case ContentBlock.TOOL_RESULT -> codec.treeToValue(element, ToolResultBlock.class);
            case ContentBlock.FILE_REFERENCE ->
                    codec.treeToValue(element, FileReferenceBlock.class);
            case ContentBlock.COMPACTION -> codec.treeToValue(element, CompactionMarkerBlock.class);
            default -> new OtherBlock(((ObjectNode) element).deepCopy());
        };
    }
}
