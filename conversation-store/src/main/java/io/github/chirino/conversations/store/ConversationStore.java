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
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Conversation operations exposed to the REST layer. A {@code null} branch argument always means
 * the conversation's current branch.
 *
 * <p>Unknown conversations raise {@link ResourceNotFoundException}; out-of-range positions,
 * decision indexes and directions raise {@link IllegalArgumentException}.
 */
public interface ConversationStore {

    ConversationDto createConversation(CreateConversationRequest request);

    /** The conversation with the messages of {@code branch}, annotated with version info. */
    ConversationDto getConversation(String conversationId, BranchCoordinate branch);

    List<ConversationSummaryDto> listConversations();

    ConversationDto updateConversation(String conversationId, UpdateConversationRequest request);

    void deleteConversation(String conversationId);

    MessageDto appendMessage(String conversationId, AddMessageRequest request);

    List<MessageDto> getMessages(String conversationId, BranchCoordinate branch);

    /** Messages before {@code position}, which is excluded. */
    List<MessageDto> getMessagesUpTo(String conversationId, BranchCoordinate branch, int position);

    /**
     * Replaces the {@code userMessageIndex}-th user message of {@code branch} on a new sibling
     * branch, which becomes the current branch. The original branch is left untouched.
     */
    EditResultDto editMessage(
            String conversationId,
            BranchCoordinate branch,
            int userMessageIndex,
            MessageContent content);

    /**
     * Drops the messages from {@code position} on and appends a new assistant message in their
     * place, on the same branch.
     */
    MessageDto retryMessage(
            String conversationId,
            BranchCoordinate branch,
            int position,
            MessageContent content,
            String thinking,
            List<ToolResult> toolResults);

    /** Moves to the previous or next sibling at {@code userMessageIndex}, wrapping around. */
    Optional<BranchCoordinate> switchBranch(
            String conversationId, BranchCoordinate branch, int userMessageIndex, int direction);

    void setCurrentBranch(String conversationId, BranchCoordinate branch);

    List<BranchCoordinate> listBranches(String conversationId);

    VersionInfo getVersionInfo(
            String conversationId, BranchCoordinate branch, int userMessageIndex);

    /** @return false when {@code position} is past the end and nothing was removed */
    boolean truncateFrom(String conversationId, BranchCoordinate branch, int position);

    ConversationDto duplicateConversation(String conversationId);

    List<ConversationSummaryDto> searchConversations(String query);

    void setSessionId(String conversationId, String sessionId);

    Optional<String> getSessionId(String conversationId);

    Map<String, Object> getSettings(String conversationId);

    Map<String, Object> updateSettings(String conversationId, Map<String, Object> changes);

    /** Working directory of an agent conversation. May not exist yet. */
    Path getWorkspacePath(String conversationId);

    /** Directory of an agent conversation's memory files. May not exist yet. */
    Path getMemoriesPath(String conversationId);
}
