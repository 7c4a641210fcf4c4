package io.github.chirino.conversations.store;

import io.github.chirino.conversations.api.dto.AddMessageRequest;
import io.github.chirino.conversations.api.dto.ConversationDto;
import io.github.chirino.conversations.api.dto.ConversationSummaryDto;
import io.github.chirino.conversations.api.dto.CreateConversationRequest;
import io.github.chirino.conversations.api.dto.EditResultDto;
import io.github.chirino.conversations.api.dto.MessageDto;
import io.github.chirino.conversations.api.dto.UpdateConversationRequest;
import io.github.chirino.conversations.branch.BranchCoordinate;
import io.github.chirino.conversations.branch.VersionInfo;
import io.github.chirino.conversations.model.MessageContent;
import io.github.chirino.conversations.model.ToolResult;
import io.micrometer.core.instrument.MeterRegistry;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Decorator that wraps a ConversationStore implementation with timing metrics.
 * All operations are recorded using Micrometer timers with the metric name
 * "conversation.store.operation" and an "operation" tag identifying the method.
 */
public class MeteredConversationStore implements ConversationStore {

    static final String METRIC_NAME = "conversation.store.operation";

    private final MeterRegistry registry;
    private final ConversationStore delegate;

    public MeteredConversationStore(MeterRegistry registry, ConversationStore delegate) {
        this.registry = registry;
        this.delegate = delegate;
    }

    public ConversationStore getDelegate() {
        return delegate;
    }

    @Override
    public ConversationDto createConversation(CreateConversationRequest request) {
        return registry.timer(METRIC_NAME, "operation", "createConversation")
                .record(() -> delegate.createConversation(request));
    }

    @Override
    public ConversationDto getConversation(String conversationId, BranchCoordinate branch) {
        return registry.timer(METRIC_NAME, "operation", "getConversation")
                .record(() -> delegate.getConversation(conversationId, branch));
    }

    @Override
    public List<ConversationSummaryDto> listConversations() {
        return registry.timer(METRIC_NAME, "operation", "listConversations")
                .record(() -> delegate.listConversations());
    }

    @Override
    public ConversationDto updateConversation(
            String conversationId, UpdateConversationRequest request) {
        return registry.timer(METRIC_NAME, "operation", "updateConversation")
                .record(() -> delegate.updateConversation(conversationId, request));
    }

    @Override
    public void deleteConversation(String conversationId) {
        registry.timer(METRIC_NAME, "operation", "deleteConversation")
                .record(() -> delegate.deleteConversation(conversationId));
    }

    @Override
    public MessageDto appendMessage(String conversationId, AddMessageRequest request) {
        return registry.timer(METRIC_NAME, "operation", "appendMessage")
                .record(() -> delegate.appendMessage(conversationId, request));
    }

    @Override
    public List<MessageDto> getMessages(String conversationId, BranchCoordinate branch) {
        return registry.timer(METRIC_NAME, "operation", "getMessages")
                .record(() -> delegate.getMessages(conversationId, branch));
    }

    @Override
    public List<MessageDto> getMessagesUpTo(
            String conversationId, BranchCoordinate branch, int position) {
        return registry.timer(METRIC_NAME, "operation", "getMessagesUpTo")
                .record(() -> delegate.getMessagesUpTo(conversationId, branch, position));
    }

    @Override
    public EditResultDto editMessage(
            String conversationId,
            BranchCoordinate branch,
            int userMessageIndex,
            MessageContent content) {
        return registry.timer(METRIC_NAME, "operation", "editMessage")
                .record(
                        () ->
                                delegate.editMessage(
                                        conversationId, branch, userMessageIndex, content));
    }

    @Override
    public MessageDto retryMessage(
            String conversationId,
            BranchCoordinate branch,
            int position,
            MessageContent content,
            String thinking,
            List<ToolResult> toolResults) {
        return registry.timer(METRIC_NAME, "operation", "retryMessage")
                .record(
                        () ->
                                delegate.retryMessage(
                                        conversationId,
                                        branch,
                                        position,
                                        content,
                                        thinking,
                                        toolResults));
    }

    @Override
    public Optional<BranchCoordinate> switchBranch(
            String conversationId, BranchCoordinate branch, int userMessageIndex, int direction) {
        return registry.timer(METRIC_NAME, "operation", "switchBranch")
                .record(
                        () ->
                                delegate.switchBranch(
                                        conversationId, branch, userMessageIndex, direction));
    }

    @Override
    public void setCurrentBranch(String conversationId, BranchCoordinate branch) {
        registry.timer(METRIC_NAME, "operation", "setCurrentBranch")
                .record(() -> delegate.setCurrentBranch(conversationId, branch));
    }

    @Override
    public List<BranchCoordinate> listBranches(String conversationId) {
        return registry.timer(METRIC_NAME, "operation", "listBranches")
                .record(() -> delegate.listBranches(conversationId));
    }

    @Override
    public VersionInfo getVersionInfo(
            String conversationId, BranchCoordinate branch, int userMessageIndex) {
        return registry.timer(METRIC_NAME, "operation", "getVersionInfo")
                .record(() -> delegate.getVersionInfo(conversationId, branch, userMessageIndex));
    }

    @Override
    public boolean truncateFrom(String conversationId, BranchCoordinate branch, int position) {
        return registry.timer(METRIC_NAME, "operation", "truncateFrom")
                .record(() -> delegate.truncateFrom(conversationId, branch, position));
    }

    @Override
    public ConversationDto duplicateConversation(String conversationId) {
        return registry.timer(METRIC_NAME, "operation", "duplicateConversation")
                .record(() -> delegate.duplicateConversation(conversationId));
    }

    @Override
    public List<ConversationSummaryDto> searchConversations(String query) {
        return registry.timer(METRIC_NAME, "operation", "searchConversations")
                .record(() -> delegate.searchConversations(query));
    }

    @Override
    public void setSessionId(String conversationId, String sessionId) {
        registry.timer(METRIC_NAME, "operation", "setSessionId")
                .record(() -> delegate.setSessionId(conversationId, sessionId));
    }

    @Override
    public Optional<String> getSessionId(String conversationId) {
        return registry.timer(METRIC_NAME, "operation", "getSessionId")
                .record(() -> delegate.getSessionId(conversationId));
    }

    @Override
    public Map<String, Object> getSettings(String conversationId) {
        return registry.timer(METRIC_NAME, "operation", "getSettings")
                .record(() -> delegate.getSettings(conversationId));
    }

    @Override
    public Map<String, Object> updateSettings(String conversationId, Map<String, Object> changes) {
        return registry.timer(METRIC_NAME, "operation", "updateSettings")
                .record(() -> delegate.updateSettings(conversationId, changes));
    }

    @Override
    public Path getWorkspacePath(String conversationId) {
        return registry.timer(METRIC_NAME, "operation", "getWorkspacePath")
                .record(() -> delegate.getWorkspacePath(conversationId));
    }

    @Override
    public Path getMemoriesPath(String conversationId) {
        return registry.timer(METRIC_NAME, "operation", "getMemoriesPath")
                .record(() -> delegate.getMemoriesPath(conversationId));
    }
}
