package io.github.chirino.conversations.streaming;

import io.github.chirino.conversations.branch.BranchCodec;
import io.github.chirino.conversations.branch.BranchCoordinate;
import io.github.chirino.conversations.model.BlockListContent;
import io.github.chirino.conversations.model.ContentBlock;
import io.github.chirino.conversations.model.Message;
import io.github.chirino.conversations.model.MessageContent;
import io.github.chirino.conversations.model.MessageRole;
import io.github.chirino.conversations.model.TextBlock;
import io.github.chirino.conversations.model.ToolResult;
import io.github.chirino.conversations.persistence.BranchStore;
import io.github.chirino.conversations.persistence.ConversationMetadata;
import io.github.chirino.conversations.persistence.ConversationRepository;
import io.github.chirino.conversations.store.ConversationLocks;
import io.github.chirino.conversations.store.ResourceConflictException;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/**
 * Writes assistant messages whose content arrives incrementally.
 *
 * <p>{@link #start} appends an empty placeholder marked {@code streaming}. Each {@link #patch}
 * carries the full content accumulated so far and replaces the placeholder by id, so the latest
 * patch wins. {@link #finish} restructures the content, clears the marker and releases the
 * conversation for the next generation. Readers observe progress by re-reading the branch.
 */
@ApplicationScoped
public class StreamingWriteCoordinator {

    private static final Logger LOG = Logger.getLogger(StreamingWriteCoordinator.class);

    public static final String DEFAULT_STOPPED_NOTICE = "*[Response stopped by user]*";

    @ConfigProperty(
            name = "conversation-store.generation.stopped-notice",
            defaultValue = DEFAULT_STOPPED_NOTICE)
    String stoppedNotice = DEFAULT_STOPPED_NOTICE;

    ConversationRepository repository;
    BranchStore branchStore;
    ConversationLocks locks;

    private final InFlightGenerationRegistry registry = new InFlightGenerationRegistry();

    StreamingWriteCoordinator() {}

    @Inject
    public StreamingWriteCoordinator(
            ConversationRepository repository, BranchStore branchStore, ConversationLocks locks) {
        this.repository = repository;
        this.branchStore = branchStore;
        this.locks = locks;
    }

    /**
     * Appends the placeholder assistant message to {@code branch} (the current branch when null).
     *
     * @throws ResourceConflictException if a generation is already running for the conversation
     */
    public GenerationRecorder start(String conversationId, BranchCoordinate branch) {
        return locks.withLock(
                conversationId,
                () -> {
                    ConversationMetadata metadata = repository.get(conversationId);
                    BranchCoordinate target = branch != null ? branch : metadata.getCurrentBranch();
                    InFlightGeneration existing = registry.get(conversationId);
                    if (existing != null && !existing.isClosed()) {
                        if (isStillStreaming(existing)) {
                            throw alreadyGenerating(conversationId);
                        }
                        LOG.warnf(
                                "Discarding generation whose message is gone: conversationId=%s"
                                        + " messageId=%s",
                                conversationId, existing.messageId());
                        existing.markClosed();
                        registry.remove(existing);
                    }

                    Message placeholder = Message.create(MessageRole.ASSISTANT, null);
                    placeholder.setStreaming(true);
                    List<Message> messages = branchStore.readMessages(conversationId, target);
                    messages.add(placeholder);
                    branchStore.writeMessages(conversationId, target, messages);
                    repository.touch(conversationId);

                    InFlightGeneration generation =
                            new InFlightGeneration(conversationId, target, placeholder.getId());
                    if (!registry.register(generation)) {
                        throw alreadyGenerating(conversationId);
                    }
                    LOG.infof(
                            "Generation started: conversationId=%s branch=%s messageId=%s",
                            conversationId, BranchCodec.encode(target), placeholder.getId());
                    return new GenerationRecorder(this, generation);
                });
    }

    /**
     * Replaces the content of a streaming message. Null {@code thinking} or {@code toolResults}
     * keep the stored values.
     *
     * @return false when no message with {@code messageId} exists on the branch
     * @throws ResourceConflictException if the message has already been finalized
     */
    public boolean patch(
            String conversationId,
            BranchCoordinate branch,
            String messageId,
            MessageContent content,
            String thinking,
            List<ToolResult> toolResults) {
        return locks.withLock(
                conversationId,
                () -> {
                    BranchCoordinate target = targetBranch(conversationId, branch, messageId);
                    List<Message> messages = branchStore.readMessages(conversationId, target);
                    int index = indexOf(messages, messageId);
                    if (index < 0) {
                        return false;
                    }
                    Message updated = requireStreaming(messages.get(index), messageId).copy();
                    apply(updated, content, thinking, toolResults);
                    messages.set(index, updated);
                    branchStore.writeMessages(conversationId, target, messages);
                    return true;
                });
    }

    /**
     * Writes the final content of a streaming message and releases the conversation. When {@code
     * content} is null the last patched content is finalized. A stopped generation ends with the
     * stopped notice. A message that is not on {@code branch} is looked up on the branch its
     * generation was started on. The conversation stays reserved until the write succeeds.
     *
     * @return false when no message with {@code messageId} exists on the branch
     * @throws ResourceConflictException if the message has already been finalized
     */
    public boolean finish(
            String conversationId,
            BranchCoordinate branch,
            String messageId,
            MessageContent content,
            String thinking,
            List<ToolResult> toolResults,
            boolean stopped) {
        return locks.withLock(
                conversationId,
                () -> {
                    BranchCoordinate target = targetBranch(conversationId, branch, messageId);
                    List<Message> messages = branchStore.readMessages(conversationId, target);
                    int index = indexOf(messages, messageId);
                    InFlightGeneration generation = generationOf(conversationId, messageId);
                    if (index < 0
                            && generation != null
                            && !generation.branch().equals(target)) {
                        target = generation.branch();
                        messages = branchStore.readMessages(conversationId, target);
                        index = indexOf(messages, messageId);
                    }
                    if (index < 0) {
                        return false;
                    }
                    Message current = messages.get(index);
                    if (!current.streamingInProgress()) {
                        release(conversationId, messageId);
                    }
                    Message updated = requireStreaming(current, messageId).copy();
                    apply(updated, content, thinking, toolResults);
                    updated.setContent(finalContent(updated.getContent(), stopped, stoppedNotice));
                    updated.setStreaming(false);
                    messages.set(index, updated);
                    branchStore.writeMessages(conversationId, target, messages);
                    release(conversationId, messageId);
                    repository.touch(conversationId);
                    LOG.infof(
                            "Generation %s: conversationId=%s branch=%s messageId=%s",
                            stopped ? "stopped" : "completed",
                            conversationId,
                            BranchCodec.encode(target),
                            messageId);
                    return true;
                });
    }

    /**
     * Asks the running generation of the conversation to stop. The generation loop observes the
     * flag through {@link GenerationRecorder#isCancelRequested()} and finishes as stopped.
     *
     * @return false when nothing is being generated for the conversation
     */
    public boolean requestCancel(String conversationId) {
        return signalCancel(conversationId) != null;
    }

    /**
     * Requests cancellation and waits up to {@code timeout} for the generation loop to finalize the
     * message. When the loop does not react in time the message is finalized as stopped here, so
     * the conversation is never left reserved by a producer that went away.
     */
    public CancelOutcome cancel(String conversationId, Duration timeout) {
        InFlightGeneration generation = signalCancel(conversationId);
        if (generation == null) {
            return new CancelOutcome(false, false, false);
        }
        if (generation.awaitClosed(timeout)) {
            return new CancelOutcome(true, true, false);
        }
        LOG.warnf(
                "Generation did not stop within %s, finalizing it: conversationId=%s messageId=%s",
                timeout, conversationId, generation.messageId());
        boolean forced;
        try {
            forced =
                    finish(
                            conversationId,
                            generation.branch(),
                            generation.messageId(),
                            null,
                            null,
                            null,
                            true);
        } catch (ResourceConflictException e) {
            // the loop finalized it between the wait and the lock
            forced = false;
        }
        if (!forced) {
            release(conversationId, generation.messageId());
        }
        return new CancelOutcome(true, generation.isClosed(), forced);
    }

    /** Result of {@link #cancel}. */
    public record CancelOutcome(boolean requested, boolean completed, boolean forced) {}

    /** Waits for the running generation of the conversation, if any, to be finalized. */
    public boolean awaitCompletion(String conversationId, Duration timeout) {
        InFlightGeneration generation = registry.get(conversationId);
        return generation == null || generation.awaitClosed(timeout);
    }

    public Optional<InFlightGeneration> inFlight(String conversationId) {
        InFlightGeneration generation = registry.get(conversationId);
        if (generation == null || generation.isClosed()) {
            return Optional.empty();
        }
        return Optional.of(generation);
    }

    /** Finalizes every generation still running when the service stops. */
    @PreDestroy
    void shutdown() {
        for (InFlightGeneration generation : registry.snapshot()) {
            if (generation.isClosed()) {
                continue;
            }
            try {
                finish(
                        generation.conversationId(),
                        generation.branch(),
                        generation.messageId(),
                        null,
                        null,
                        null,
                        true);
            } catch (RuntimeException e) {
                LOG.warnf(
                        e,
                        "Failed to finalize generation on shutdown: conversationId=%s messageId=%s",
                        generation.conversationId(),
                        generation.messageId());
            }
        }
    }

    /**
     * Final shape of a message's content. Text is collapsed to a plain string unless the content
     * holds several blocks or any non-text block.
     */
    static MessageContent finalContent(MessageContent content, boolean stopped, String notice) {
        List<ContentBlock> blocks = new ArrayList<>();
        if (content instanceof BlockListContent list) {
            blocks.addAll(list.getBlocks());
        } else if (content != null && !content.isEmpty()) {
            blocks.add(new TextBlock(content.plainText()));
        }
        if (stopped) {
            int last = blocks.size() - 1;
            if (last >= 0 && blocks.get(last) instanceof TextBlock text) {
                String existing = text.getText();
                blocks.set(
                        last,
                        new TextBlock(existing.isEmpty() ? notice : existing + "\n\n" + notice));
            } else {
                blocks.add(new TextBlock(notice));
            }
        }
        return collapse(blocks);
    }

    static MessageContent collapse(List<ContentBlock> blocks) {
        if (blocks.isEmpty()) {
            return MessageContent.empty();
        }
        if (blocks.size() == 1 && blocks.get(0) instanceof TextBlock text) {
            return MessageContent.text(text.getText());
        }
        return MessageContent.blocks(blocks);
    }

    private BranchCoordinate targetBranch(
            String conversationId, BranchCoordinate branch, String messageId) {
        if (branch != null) {
            return branch;
        }
        InFlightGeneration generation = generationOf(conversationId, messageId);
        if (generation != null) {
            return generation.branch();
        }
        return repository.get(conversationId).getCurrentBranch();
    }

    private boolean isStillStreaming(InFlightGeneration generation) {
        List<Message> messages =
                branchStore.readMessages(generation.conversationId(), generation.branch());
        int index = indexOf(messages, generation.messageId());
        return index >= 0 && messages.get(index).streamingInProgress();
    }

    private static ResourceConflictException alreadyGenerating(String conversationId) {
        return new ResourceConflictException(
                "conversation",
                conversationId,
                "A response is already being generated for conversation " + conversationId);
    }

    private InFlightGeneration signalCancel(String conversationId) {
        InFlightGeneration generation = registry.get(conversationId);
        if (generation == null || generation.isClosed()) {
            return null;
        }
        generation.requestCancel();
        LOG.infof(
                "Cancel requested: conversationId=%s messageId=%s",
                conversationId, generation.messageId());
        return generation;
    }

    private InFlightGeneration generationOf(String conversationId, String messageId) {
        InFlightGeneration generation = registry.get(conversationId);
        if (generation != null && generation.messageId().equals(messageId)) {
            return generation;
        }
        return null;
    }

    private void release(String conversationId, String messageId) {
        InFlightGeneration generation = generationOf(conversationId, messageId);
        if (generation != null) {
            generation.markClosed();
            registry.remove(generation);
        }
    }

    private static int indexOf(List<Message> messages, String messageId) {
        for (int i = 0; i < messages.size(); i++) {
            if (messageId.equals(messages.get(i).getId())) {
                return i;
            }
        }
        return -1;
    }

    private static Message requireStreaming(Message message, String messageId) {
        if (!message.streamingInProgress()) {
            throw new ResourceConflictException(
                    "message", messageId, "Message " + messageId + " is no longer streaming");
        }
        return message;
    }

    private static void apply(
            Message message,
            MessageContent content,
            String thinking,
            List<ToolResult> toolResults) {
        if (content != null) {
            message.setContent(content);
        }
        if (thinking != null) {
            message.setThinking(thinking);
        }
        if (toolResults != null) {
            message.setToolResults(toolResults.isEmpty() ? null : new ArrayList<>(toolResults));
        }
    }
}
