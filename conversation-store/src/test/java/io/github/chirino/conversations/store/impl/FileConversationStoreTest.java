package io.github.chirino.conversations.store.impl;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.chirino.conversations.TestStores;
import io.github.chirino.conversations.api.dto.AddMessageRequest;
import io.github.chirino.conversations.api.dto.ConversationDto;
import io.github.chirino.conversations.api.dto.CreateConversationRequest;
import io.github.chirino.conversations.api.dto.EditResultDto;
import io.github.chirino.conversations.api.dto.MessageDto;
import io.github.chirino.conversations.branch.BranchCoordinate;
import io.github.chirino.conversations.branch.VersionInfo;
import io.github.chirino.conversations.model.Message;
import io.github.chirino.conversations.model.MessageContent;
import io.github.chirino.conversations.model.MessageRole;
import io.github.chirino.conversations.store.ResourceNotFoundException;
import io.github.chirino.conversations.store.StorageException;
import io.github.chirino.conversations.streaming.GenerationRecorder;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FileConversationStoreTest {

    @TempDir Path dataDir;

    private TestStores stores;
    private FileConversationStore store;
    private String conversationId;

    @BeforeEach
    void setUp() {
        stores = TestStores.create(dataDir);
        store = stores.store;
        CreateConversationRequest request = new CreateConversationRequest();
        request.setTitle("Chat");
        conversationId = store.createConversation(request).getId();
    }

    @Test
    void create_writes_metadata_and_an_empty_root_branch() {
        ConversationDto created = store.createConversation(new CreateConversationRequest());

        assertEquals("New Conversation", created.getTitle());
        assertEquals(BranchCoordinate.ROOT, created.getCurrentBranch());
        assertTrue(Files.exists(dataDir.resolve(created.getId()).resolve("metadata.json")));
        assertTrue(Files.exists(dataDir.resolve(created.getId()).resolve("0.json")));
        assertTrue(store.getMessages(created.getId(), null).isEmpty());
    }

    @Test
    void append_then_read_returns_messages_in_order() {
        append(MessageRole.USER, "hi");
        MessageDto reply = append(MessageRole.ASSISTANT, "hello");

        List<MessageDto> messages = store.getMessages(conversationId, null);

        assertEquals(List.of("hi", "hello"), texts(messages));
        assertEquals(MessageRole.USER, messages.get(0).getRole());
        assertEquals(0, messages.get(0).getUserMessageIndex());
        assertNull(messages.get(1).getUserMessageIndex());
        assertEquals(reply.getId(), messages.get(1).getId());
        assertEquals(1, reply.getPosition());
    }

    @Test
    void fork_creates_a_sibling_and_leaves_the_source_untouched() {
        append(MessageRole.USER, "hi");
        append(MessageRole.ASSISTANT, "hello");

        EditResultDto edit =
                store.editMessage(
                        conversationId, null, 0, MessageContent.text("hi again"));

        assertEquals(BranchCoordinate.of(1), edit.getBranch());
        assertEquals(2, edit.getVersion());
        assertEquals(2, edit.getTotalVersions());
        assertEquals("hi again", edit.getMessage().getContent().plainText());
        assertEquals(
                BranchCoordinate.of(1),
                store.getConversation(conversationId, null).getCurrentBranch());

        List<MessageDto> forked = store.getMessages(conversationId, BranchCoordinate.of(1));
        assertEquals(List.of("hi again"), texts(forked));
        assertEquals(2, forked.get(0).getCurrentVersion());
        assertEquals(2, forked.get(0).getTotalVersions());

        VersionInfo info = store.getVersionInfo(conversationId, null, 0);
        assertEquals(2, info.getTotalVersions());
        assertEquals(2, info.getCurrentVersion());

        List<MessageDto> original = store.getMessages(conversationId, BranchCoordinate.ROOT);
        assertEquals(List.of("hi", "hello"), texts(original));
        assertEquals(1, original.get(0).getCurrentVersion());
        assertEquals(2, original.get(0).getTotalVersions());
    }

    @Test
    void fork_copies_the_prefix_and_nests_later_decisions() {
        append(MessageRole.USER, "one");
        append(MessageRole.ASSISTANT, "a1");
        append(MessageRole.USER, "two");
        append(MessageRole.ASSISTANT, "a2");

        EditResultDto edit = store.editMessage(conversationId, null, 1, MessageContent.text("TWO"));

        assertEquals(BranchCoordinate.of(0, 1), edit.getBranch());
        assertEquals(2, edit.getMessage().getPosition());
        assertEquals(
                List.of("one", "a1", "TWO"),
                texts(store.getMessages(conversationId, edit.getBranch())));

        List<MessageDto> source = store.getMessages(conversationId, BranchCoordinate.ROOT);
        List<MessageDto> target = store.getMessages(conversationId, edit.getBranch());
        assertEquals(source.get(0).getId(), target.get(0).getId());

        EditResultDto third =
                store.editMessage(conversationId, BranchCoordinate.ROOT, 1, MessageContent.text("2"));
        assertEquals(BranchCoordinate.of(0, 2), third.getBranch());
        assertEquals(3, third.getVersion());
        assertEquals(3, third.getTotalVersions());
    }

    @Test
    void fork_without_that_user_message_is_rejected() {
        append(MessageRole.USER, "hi");

        assertThrows(
                IllegalArgumentException.class,
                () -> store.editMessage(conversationId, null, 1, MessageContent.text("x")));
        assertEquals(List.of(BranchCoordinate.ROOT), store.listBranches(conversationId));
    }

    @Test
    void retry_replaces_the_tail_in_place() {
        append(MessageRole.USER, "hi");
        append(MessageRole.ASSISTANT, "hello");
        store.editMessage(conversationId, null, 0, MessageContent.text("hi again"));
        List<BranchCoordinate> before = store.listBranches(conversationId);

        MessageDto retried =
                store.retryMessage(
                        conversationId,
                        BranchCoordinate.ROOT,
                        1,
                        MessageContent.text("hello v2"),
                        "pondering",
                        null);

        List<MessageDto> messages = store.getMessages(conversationId, BranchCoordinate.ROOT);
        assertEquals(List.of("hi", "hello v2"), texts(messages));
        assertEquals("pondering", messages.get(1).getThinking());
        assertEquals(MessageRole.ASSISTANT, retried.getRole());
        assertEquals(before, store.listBranches(conversationId));
    }

    @Test
    void retry_out_of_range_is_rejected() {
        append(MessageRole.USER, "hi");

        assertThrows(
                IllegalArgumentException.class,
                () ->
                        store.retryMessage(
                                conversationId, null, 1, MessageContent.text("x"), null, null));
        assertThrows(
                IllegalArgumentException.class,
                () ->
                        store.retryMessage(
                                conversationId, null, -1, MessageContent.text("x"), null, null));
    }

    @Test
    void truncate_reports_when_nothing_was_removed() {
        append(MessageRole.USER, "hi");
        append(MessageRole.ASSISTANT, "hello");

        assertTrue(store.truncateFrom(conversationId, null, 0));
        assertTrue(store.getMessages(conversationId, null).isEmpty());
        assertFalse(store.truncateFrom(conversationId, null, 0));
    }

    @Test
    void messages_up_to_excludes_the_position() {
        append(MessageRole.USER, "hi");
        append(MessageRole.ASSISTANT, "hello");
        append(MessageRole.USER, "bye");

        assertEquals(List.of("hi", "hello"), texts(store.getMessagesUpTo(conversationId, null, 2)));
        assertEquals(3, store.getMessagesUpTo(conversationId, null, 10).size());
    }

    @Test
    void switch_wraps_around_siblings() {
        append(MessageRole.USER, "hi");
        store.editMessage(conversationId, null, 0, MessageContent.text("v2"));
        store.editMessage(conversationId, BranchCoordinate.ROOT, 0, MessageContent.text("v3"));

        assertEquals(
                Optional.of(BranchCoordinate.of(0)),
                store.switchBranch(conversationId, null, 0, 1));
        assertEquals(
                BranchCoordinate.of(0),
                store.getConversation(conversationId, null).getCurrentBranch());
        assertEquals(
                Optional.of(BranchCoordinate.of(2)),
                store.switchBranch(conversationId, null, 0, -1));
        assertEquals(List.of("v3"), texts(store.getMessages(conversationId, null)));
    }

    @Test
    void switch_lands_on_the_smallest_stored_descendant() {
        append(MessageRole.USER, "one");
        List<Message> nested =
                List.of(Message.create(MessageRole.USER, MessageContent.text("ONE")));
        stores.branchStore.writeMessages(conversationId, BranchCoordinate.of(1, 5), nested);
        stores.branchStore.writeMessages(conversationId, BranchCoordinate.of(1, 3), nested);

        Optional<BranchCoordinate> target =
                store.switchBranch(conversationId, BranchCoordinate.ROOT, 0, 1);

        assertEquals(Optional.of(BranchCoordinate.of(1, 3)), target);
        assertEquals(
                BranchCoordinate.of(1, 3),
                store.getConversation(conversationId, null).getCurrentBranch());
    }

    @Test
    void switch_rejects_bad_arguments() {
        assertThrows(
                IllegalArgumentException.class,
                () -> store.switchBranch(conversationId, null, 0, 2));
        assertThrows(
                IllegalArgumentException.class,
                () -> store.switchBranch(conversationId, null, -1, 1));
    }

    @Test
    void set_current_branch_does_not_require_a_document() {
        store.setCurrentBranch(conversationId, BranchCoordinate.of(0, 7));

        ConversationDto conversation = store.getConversation(conversationId, null);
        assertEquals(BranchCoordinate.of(0, 7), conversation.getCurrentBranch());
        assertTrue(conversation.getMessages().isEmpty());
    }

    @Test
    void unknown_conversations_are_not_found() {
        assertThrows(ResourceNotFoundException.class, () -> store.getConversation("nope", null));
        assertThrows(ResourceNotFoundException.class, () -> store.deleteConversation("nope"));
        AddMessageRequest request = new AddMessageRequest();
        request.setRole(MessageRole.USER);
        assertThrows(ResourceNotFoundException.class, () -> store.appendMessage("nope", request));
        assertThrows(
                ResourceNotFoundException.class,
                () -> store.editMessage("nope", null, 0, MessageContent.text("x")));
    }

    @Test
    void delete_then_get_is_not_found() {
        store.deleteConversation(conversationId);

        assertThrows(
                ResourceNotFoundException.class, () -> store.getConversation(conversationId, null));
        assertTrue(store.listConversations().isEmpty());
    }

    @Test
    void duplicate_keeps_every_branch() {
        append(MessageRole.USER, "hi");
        store.editMessage(conversationId, null, 0, MessageContent.text("hi again"));
        store.setSessionId(conversationId, "session-1");

        ConversationDto copy = store.duplicateConversation(conversationId);

        assertEquals("Copy of Chat", copy.getTitle());
        assertEquals(BranchCoordinate.ROOT, copy.getCurrentBranch());
        assertNull(copy.getSessionId());
        assertEquals(store.listBranches(conversationId), store.listBranches(copy.getId()));
        assertEquals(List.of("hi"), texts(store.getMessages(copy.getId(), null)));
        assertEquals(Optional.of("session-1"), store.getSessionId(conversationId));
        assertEquals(Optional.empty(), store.getSessionId(copy.getId()));
    }

    @Test
    void failed_fork_write_leaves_the_current_branch_unchanged() throws Exception {
        append(MessageRole.USER, "hi");
        Path blocked = dataDir.resolve(conversationId).resolve("1.json");
        Files.createDirectories(blocked);
        Files.writeString(blocked.resolve("keep"), "x");

        StorageException failure =
                assertThrows(
                        StorageException.class,
                        () -> store.editMessage(conversationId, null, 0, MessageContent.text("b")));

        assertEquals(StorageException.STORAGE_ERROR, failure.getCode());
        assertEquals(blocked.toString(), failure.getDetails().get("path"));
        assertEquals(
                BranchCoordinate.ROOT,
                store.getConversation(conversationId, null).getCurrentBranch());
        assertEquals(List.of(BranchCoordinate.ROOT), store.listBranches(conversationId));
        try (Stream<Path> leftovers = Files.list(dataDir.resolve(conversationId))) {
            assertTrue(leftovers.noneMatch(p -> p.getFileName().toString().endsWith(".tmp")));
        }
    }

    @Test
    void duplicate_during_a_generation_finishes_the_copied_placeholder() {
        append(MessageRole.USER, "hi");
        GenerationRecorder recorder = stores.coordinator.start(conversationId, null);
        recorder.appendText("partial");
        recorder.flush();

        ConversationDto copy = store.duplicateConversation(conversationId);

        List<MessageDto> copied = store.getMessages(copy.getId(), null);
        assertEquals(List.of("hi", "partial"), texts(copied));
        assertFalse(copied.get(1).isStreaming());
        assertTrue(store.getMessages(conversationId, null).get(1).isStreaming());
        assertTrue(stores.coordinator.inFlight(copy.getId()).isEmpty());
        assertTrue(recorder.complete());
        assertEquals("partial", texts(store.getMessages(conversationId, null)).get(1));
    }

    @Test
    void workspace_and_memories_live_in_the_conversation_directory() {
        Path conversationDir = dataDir.resolve(conversationId);

        assertEquals(conversationDir.resolve("workspace"), store.getWorkspacePath(conversationId));
        assertEquals(conversationDir.resolve("memories"), store.getMemoriesPath(conversationId));
        assertThrows(ResourceNotFoundException.class, () -> store.getWorkspacePath("nope"));
        assertThrows(ResourceNotFoundException.class, () -> store.getMemoriesPath("nope"));
        assertThrows(ResourceNotFoundException.class, () -> store.getWorkspacePath("../etc"));
    }

    @Test
    void settings_are_merged_over_defaults() {
        FileConversationStore withDefaults =
                TestStores.create(dataDir, Map.of("temperature", 1.0, "max-tokens", 8192L)).store;

        Map<String, Object> updated =
                withDefaults.updateSettings(conversationId, Map.of("temperature", 0.2));

        assertEquals(0.2, updated.get("temperature"));
        assertEquals(8192L, updated.get("max-tokens"));
        assertEquals(updated, withDefaults.getSettings(conversationId));
    }

    @Test
    void search_finds_titles_and_message_text() {
        append(MessageRole.USER, "Where is the Eiffel tower?");
        CreateConversationRequest other = new CreateConversationRequest();
        other.setTitle("Eiffel notes");
        String otherId = store.createConversation(other).getId();
        store.createConversation(new CreateConversationRequest());

        Set<String> ids =
                store.searchConversations("eiffel").stream()
                        .map(summary -> summary.getId())
                        .collect(Collectors.toSet());

        assertEquals(Set.of(conversationId, otherId), ids);
        assertEquals(3, store.searchConversations("  ").size());
    }

    @Test
    void concurrent_appends_lose_no_message() throws Exception {
        int threads = 8;
        int perThread = 25;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int t = 0; t < threads; t++) {
                int thread = t;
                futures.add(
                        executor.submit(
                                () -> {
                                    for (int i = 0; i < perThread; i++) {
                                        append(MessageRole.ASSISTANT, thread + "-" + i);
                                    }
                                }));
            }
            for (Future<?> future : futures) {
                future.get();
            }
        } finally {
            executor.shutdownNow();
        }

        List<MessageDto> messages = store.getMessages(conversationId, null);
        assertEquals(threads * perThread, messages.size());
        assertEquals(threads * perThread, new HashSet<>(texts(messages)).size());
    }

    private MessageDto append(MessageRole role, String text) {
        AddMessageRequest request = new AddMessageRequest();
        request.setRole(role);
        request.setContent(MessageContent.text(text));
        return store.appendMessage(conversationId, request);
    }

    private static List<String> texts(List<MessageDto> messages) {
        return messages.stream().map(m -> m.getContent().plainText()).toList();
    }
}
