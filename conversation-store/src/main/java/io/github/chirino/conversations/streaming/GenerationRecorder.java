package io.github.chirino.conversations.streaming;

import io.github.chirino.conversations.branch.BranchCoordinate;
import io.github.chirino.conversations.model.ContentBlock;
import io.github.chirino.conversations.model.FileReferenceBlock;
import io.github.chirino.conversations.model.MessageContent;
import io.github.chirino.conversations.model.TextBlock;
import io.github.chirino.conversations.model.ToolResult;
import io.github.chirino.conversations.model.ToolUseBlock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Accumulates the events of one generation into message content. Text deltas extend the current
 * text block; a tool use or file reference closes it. {@link #flush()} writes everything gathered
 * so far as a full-content patch. A finish that fails to write can be retried.
 */
public class GenerationRecorder {

    private final StreamingWriteCoordinator coordinator;
    private final InFlightGeneration generation;
    private final List<ContentBlock> blocks = new ArrayList<>();
    private final StringBuilder text = new StringBuilder();
    private final StringBuilder thinking = new StringBuilder();
    private final List<ToolResult> toolResults = new ArrayList<>();
    private boolean finished;

    GenerationRecorder(StreamingWriteCoordinator coordinator, InFlightGeneration generation) {
        this.coordinator = coordinator;
        this.generation = generation;
    }

    public String conversationId() {
        return generation.conversationId();
    }

    public String messageId() {
        return generation.messageId();
    }

    public BranchCoordinate branch() {
        return generation.branch();
    }

    public boolean isCancelRequested() {
        return generation.isCancelRequested();
    }

    public synchronized void appendText(String delta) {
        if (delta != null) {
            text.append(delta);
        }
    }

    public synchronized void appendThinking(String delta) {
        if (delta != null) {
            thinking.append(delta);
        }
    }

    public synchronized void addToolUse(String id, String name, Map<String, Object> input) {
        closeTextBlock();
        blocks.add(new ToolUseBlock(id, name, input));
    }

    public synchronized void addToolResult(String toolUseId, Object content, boolean error) {
        toolResults.add(new ToolResult(toolUseId, content, error));
    }

    public synchronized void addFileReference(FileReferenceBlock reference) {
        closeTextBlock();
        blocks.add(reference);
    }

    /** Content accumulated so far, in the shape it would be stored. */
    public synchronized MessageContent snapshot() {
        List<ContentBlock> current = new ArrayList<>(blocks);
        if (text.length() > 0) {
            current.add(new TextBlock(text.toString()));
        }
        return StreamingWriteCoordinator.collapse(current);
    }

    public boolean flush() {
        MessageContent content;
        String currentThinking;
        List<ToolResult> currentResults;
        synchronized (this) {
            content = snapshot();
            currentThinking = thinkingOrNull();
            currentResults = List.copyOf(toolResults);
        }
        return coordinator.patch(
                conversationId(), branch(), messageId(), content, currentThinking, currentResults);
    }

    /** Finalizes the message normally. */
    public boolean complete() {
        return finish(false);
    }

    /** Finalizes the message as stopped by the user. */
    public boolean stop() {
        return finish(true);
    }

    private boolean finish(boolean stopped) {
        MessageContent content;
        String currentThinking;
        List<ToolResult> currentResults;
        synchronized (this) {
            if (finished) {
                return false;
            }
            content = snapshot();
            currentThinking = thinkingOrNull();
            currentResults = List.copyOf(toolResults);
        }
        boolean written =
                coordinator.finish(
                        conversationId(),
                        branch(),
                        messageId(),
                        content,
                        currentThinking,
                        currentResults,
                        stopped);
        if (written) {
            synchronized (this) {
                finished = true;
            }
        }
        return written;
    }

    private void closeTextBlock() {
        if (text.length() > 0) {
            blocks.add(new TextBlock(text.toString()));
            text.setLength(0);
        }
    }

    private String thinkingOrNull() {
        return thinking.length() > 0 ? thinking.toString() : null;
    }
}
