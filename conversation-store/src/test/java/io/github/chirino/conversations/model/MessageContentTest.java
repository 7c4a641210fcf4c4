package io.github.chirino.conversations.model;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.chirino.conversations.TestStores;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class MessageContentTest {

    private final ObjectMapper mapper = TestStores.mapper();

    @Test
    void plain_text_is_stored_as_a_json_string() throws Exception {
        Message message = Message.create(MessageRole.USER, MessageContent.text("hi"));

        JsonNode json = mapper.readTree(mapper.writeValueAsString(message));

        assertTrue(json.get("content").isTextual());
        assertEquals("hi", json.get("content").asText());
        assertEquals("user", json.get("role").asText());
        assertFalse(json.has("streaming"));
        assertFalse(json.has("thinking"));
    }

    @Test
    void block_list_is_stored_as_a_typed_array() throws Exception {
        MessageContent content =
                MessageContent.blocks(
                        List.of(
                                new TextBlock("Let me check."),
                                new ToolUseBlock("tu_1", "search", Map.of("q", "weather")),
                                new FileReferenceBlock("c1", null, "Report", "report.html")));
        Message message = Message.create(MessageRole.ASSISTANT, content);

        JsonNode json = mapper.readTree(mapper.writeValueAsString(message)).get("content");

        assertTrue(json.isArray());
        assertEquals("text", json.get(0).get("type").asText());
        assertEquals("tool_use", json.get(1).get("type").asText());
        assertEquals("weather", json.get(1).get("input").get("q").asText());
        assertEquals("surface_content", json.get(2).get("type").asText());
        assertEquals("html", json.get(2).get("content_type").asText());
        assertEquals("report.html", json.get(2).get("filename").asText());

        Message read = mapper.readValue(mapper.writeValueAsString(message), Message.class);
        assertEquals(content, read.getContent());
    }

    @Test
    void legacy_object_content_reads_as_text() throws Exception {
        Message message =
                mapper.readValue(
                        "{\"id\":\"m1\",\"role\":\"assistant\","
                                + "\"content\":{\"text\":\"answer\",\"web_searches\":[]}}",
                        Message.class);

        assertInstanceOf(TextContent.class, message.getContent());
        assertEquals("answer", message.getContent().plainText());
    }

    @Test
    void null_content_reads_as_empty_text() throws Exception {
        Message message =
                mapper.readValue("{\"id\":\"m1\",\"role\":\"user\",\"content\":null}", Message.class);

        assertTrue(message.getContent().isEmpty());
        assertInstanceOf(TextContent.class, message.getContent());
    }

    @Test
    void unknown_blocks_survive_a_rewrite() throws Exception {
        String stored =
                "{\"id\":\"m1\",\"role\":\"assistant\",\"content\":["
                        + "{\"type\":\"thinking\",\"thinking\":\"hmm\",\"signature\":\"abc\"},"
                        + "\"bare text\","
                        + "{\"type\":\"compaction\",\"summary\":\"earlier turns\"}]}";

        Message message = mapper.readValue(stored, Message.class);
        BlockListContent content = assertInstanceOf(BlockListContent.class, message.getContent());
        assertInstanceOf(OtherBlock.class, content.getBlocks().get(0));
        assertEquals(new TextBlock("bare text"), content.getBlocks().get(1));
        assertEquals(
                "earlier turns",
                assertInstanceOf(CompactionMarkerBlock.class, content.getBlocks().get(2))
                        .getSummary());

        JsonNode rewritten = mapper.readTree(mapper.writeValueAsString(message)).get("content");
        assertEquals("thinking", rewritten.get(0).get("type").asText());
        assertEquals("abc", rewritten.get(0).get("signature").asText());
    }

    @Test
    void plain_text_of_blocks_keeps_only_text() {
        MessageContent content =
                MessageContent.blocks(
                        List.of(
                                new TextBlock("one"),
                                new ToolResultBlock("tu_1", "ignored", false),
                                new TextBlock("two")));

        assertEquals("one\ntwo", content.plainText());
        assertTrue(content.hasSpecialBlocks());
        assertFalse(MessageContent.blocks(List.of(new TextBlock("x"))).hasSpecialBlocks());
    }

    @Test
    void tool_results_use_snake_case_fields() throws Exception {
        Message message = Message.create(MessageRole.ASSISTANT, MessageContent.text("done"));
        message.setToolResults(List.of(new ToolResult("tu_1", "42", true)));
        message.setStreaming(true);

        JsonNode json = mapper.readTree(mapper.writeValueAsString(message));

        assertEquals("tu_1", json.get("tool_results").get(0).get("tool_use_id").asText());
        assertTrue(json.get("tool_results").get(0).get("is_error").asBoolean());
        assertTrue(json.get("streaming").asBoolean());
        assertTrue(json.has("created_at"));

        message.setStreaming(false);
        assertNull(message.getStreaming());
    }
}
