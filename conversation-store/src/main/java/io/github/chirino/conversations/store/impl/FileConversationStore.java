package io.github.chirino.conversations.store.impl;

import io.github.chirino.conversations.api.dto.AddMessageRequest;
import io.github.chirino.conversations.api.dto.ConversationDto;
import io.github.chirino.conversations.api.dto.ConversationSummaryDto;
import io.github.chirino.conversations.api.dto.CreateConversationRequest;
import io.github.chirino.conversations.api.dto.EditResultDto;
import io.github.chirino.conversations.api.dto.MessageDto;
import io.github.chirino.conversations.api.dto.UpdateConversationRequest;
import io.github.chirino.conversations.branch.BranchCodec;
import io.github.chirino.conversations.branch.BranchCoordinate;
import io.github.chirino.conversations.branch.VersionInfo;
import io.github.chirino.conversations.branch.VersionResolver;
import io.github.chirino.conversations.model.Message;
import io.github.chirino.conversations.model.MessageContent;
import io.github.chirino.conversations.model.MessageRole;
import io.github.chirino.conversations.model.ToolResult;
import io.github.chirino.conversations.persistence.BranchStore;
import io.github.chirino.conversations.persistence.ConversationMetadata;
import io.github.chirino.conversations.persistence.ConversationRepository;
import io.github.chirino.conversations.settings.SettingsService;
import io.github.chirino.conversations.store.ConversationLocks;
import io.github.chirino.conversations.store.ConversationStore;
import io.github.chirino.conversations.store.ResourceNotFoundException;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.jboss.logging.Logger;

/**
 * {@link ConversationStore} over a directory of JSON documents. Every mutation of a conversation
 * runs under that conversation's lock for a single read-modify-write cycle.
 */
@ApplicationScoped
public class FileConversationStore implements ConversationStore {

    private static final Logger LOG = Logger.getLogger(FileConversationStore.class);

    ConversationRepository repository;
    BranchStore branchStore;
    VersionResolver versionResolver;
    SettingsService settingsService;
    ConversationLocks locks;

    FileConversationStore() {}

    @Inject
    public FileConversationStore(
            ConversationRepository repository,
            BranchStore branchStore,
            VersionResolver versionResolver,
            SettingsService settingsService,
            ConversationLocks locks) {
        this.repository = repository;
        this.branchStore = branchStore;
        this.versionResolver = versionResolver;
        this.settingsService = settingsService;
        this.locks = locks;
    }

    @Override
    public ConversationDto createConversation(CreateConversationRequest request) {
        ConversationMetadata metadata =
                repository.create(
                        request.getTitle() != null ? request.getTitle() : "New Conversation",
                        request.getModel(),
                        request.getSystemPrompt(),
                        request.isAgent());
        locks.runWithLock(
                metadata.getId(),
                () ->
                        branchStore.writeMessages(
                                metadata.getId(), BranchCoordinate.ROOT, List.of()));
        LOG.infof("Created conversation %s (%s)", metadata.getId(), metadata.getTitle());
        return toConversationDto(metadata, BranchCoordinate.ROOT, List.of());
    }

    @Override
    public ConversationDto getConversation(String conversationId, BranchCoordinate branch) {
        ConversationMetadata metadata = repository.get(conversationId);
        BranchCoordinate target = branchOrCurrent(metadata, branch);
        List<Message> messages = branchStore.readMessages(conversationId, target);
        return toConversationDto(metadata, target, annotate(conversationId, target, messages));
    }

    @Override
    public List<ConversationSummaryDto> listConversations() {
        return repository.list().stream().map(FileConversationStore::toSummaryDto).toList();
    }

    @Override
    public ConversationDto updateConversation(
            String conversationId, UpdateConversationRequest request) {
        ConversationMetadata metadata =
                locks.withLock(
                        conversationId,
                        () ->
                                repository.update(
                                        conversationId,
                                        request.getTitle(),
                                        request.getModel(),
                                        request.getSystemPrompt()));
        return toConversationDto(metadata, metadata.getCurrentBranch(), null);
    }

    @Override
    public void deleteConversation(String conversationId) {
        boolean deleted = locks.withLock(conversationId, () -> repository.delete(conversationId));
        if (!deleted) {
            throw new ResourceNotFoundException("conversation", conversationId);
        }
        LOG.infof("Deleted conversation %s", conversationId);
    }

    @Override
    public MessageDto appendMessage(String conversationId, AddMessageRequest request) {
        if (request.getRole() == null) {
            throw new IllegalArgumentException("role is required");
        }
        return locks.withLock(
                conversationId,
                () -> {
                    ConversationMetadata metadata = repository.get(conversationId);
                    BranchCoordinate target = branchOrCurrent(metadata, request.getBranch());
                    List<Message> messages = branchStore.readMessages(conversationId, target);
                    Message message = Message.create(request.getRole(), request.getContent());
                    message.setThinking(request.getThinking());
                    message.setToolResults(emptyToNull(request.getToolResults()));
                    messages.add(message);
                    branchStore.writeMessages(conversationId, target, messages);
                    repository.touch(conversationId);
                    LOG.debugf(
                            "Appended %s message: conversationId=%s branch=%s position=%d",
                            message.getRole(),
                            conversationId,
                            BranchCodec.encode(target),
                            messages.size() - 1);
                    if (!message.isUser()) {
                        return toMessageDto(message, messages.size() - 1, null, 1, 1);
                    }
                    int userIndex = (int) messages.stream().filter(Message::isUser).count() - 1;
                    VersionInfo info =
                            versionResolver.resolve(conversationId, target, userIndex);
                    return toMessageDto(
                            message,
                            messages.size() - 1,
                            userIndex,
                            info.getCurrentVersion(),
                            info.getTotalVersions());
                });
    }

    @Override
    public List<MessageDto> getMessages(String conversationId, BranchCoordinate branch) {
        ConversationMetadata metadata = repository.get(conversationId);
        BranchCoordinate target = branchOrCurrent(metadata, branch);
        return annotate(conversationId, target, branchStore.readMessages(conversationId, target));
    }

    @Override
    public List<MessageDto> getMessagesUpTo(
            String conversationId, BranchCoordinate branch, int position) {
        if (position < 0) {
            throw new IllegalArgumentException("position must be non-negative: " + position);
        }
        List<MessageDto> messages = getMessages(conversationId, branch);
        return messages.subList(0, Math.min(position, messages.size()));
    }

    @Override
    public EditResultDto editMessage(
            String conversationId,
            BranchCoordinate branch,
            int userMessageIndex,
            MessageContent content) {
        return locks.withLock(
                conversationId,
                () -> {
                    ConversationMetadata metadata = repository.get(conversationId);
                    BranchCoordinate source = branchOrCurrent(metadata, branch);
                    List<Message> messages = branchStore.readMessages(conversationId, source);
                    int position = positionOfUserMessage(messages, userMessageIndex);
                    if (position < 0) {
                        throw new IllegalArgumentException(
                                "Branch "
                                        + BranchCodec.encode(source)
                                        + " has no user message at index "
                                        + userMessageIndex);
                    }

                    List<BranchCoordinate> keys = branchStore.listBranchKeys(conversationId);
                    int used =
                            VersionResolver.siblingValues(keys, source, userMessageIndex).size();
                    int value =
                            VersionResolver.nextSiblingValue(keys, source, userMessageIndex);
                    BranchCoordinate created = source.pad(userMessageIndex).append(value);

                    List<Message> forked = new ArrayList<>();
                    for (Message message : messages.subList(0, position)) {
                        forked.add(message.copy());
                    }
                    Message edited = Message.create(MessageRole.USER, content);
                    forked.add(edited);
                    branchStore.writeMessages(conversationId, created, forked);

                    metadata.setCurrentBranch(created);
                    metadata.setUpdatedAt(edited.getCreatedAt());
                    repository.save(metadata);
                    LOG.infof(
                            "Forked conversation %s at user message %d: %s -> %s",
                            conversationId,
                            userMessageIndex,
                            BranchCodec.encode(source),
                            BranchCodec.encode(created));

                    EditResultDto result = new EditResultDto();
                    result.setBranch(created);
                    result.setVersion(value + 1);
                    result.setTotalVersions(used + 1);
                    result.setMessage(
                            toMessageDto(
                                    edited, position, userMessageIndex, value + 1, used + 1));
                    return result;
                });
    }

    @Override
    public MessageDto retryMessage(
            String conversationId,
            BranchCoordinate branch,
            int position,
            MessageContent content,
            String thinking,
            List<ToolResult> toolResults) {
        return locks.withLock(
                conversationId,
                () -> {
                    ConversationMetadata metadata = repository.get(conversationId);
                    BranchCoordinate target = branchOrCurrent(metadata, branch);
                    List<Message> messages = branchStore.readMessages(conversationId, target);
                    if (position < 0 || position >= messages.size()) {
                        throw new IllegalArgumentException(
                                "Position "
                                        + position
                                        + " is out of range for branch "
                                        + BranchCodec.encode(target)
                                        + " with "
                                        + messages.size()
                                        + " messages");
                    }
                    List<Message> retried = new ArrayList<>(messages.subList(0, position));
                    Message message = Message.create(MessageRole.ASSISTANT, content);
                    message.setThinking(thinking);
                    message.setToolResults(emptyToNull(toolResults));
                    retried.add(message);
                    branchStore.writeMessages(conversationId, target, retried);
                    repository.touch(conversationId);
                    LOG.infof(
                            "Retried message %d of conversation %s on branch %s",
                            position, conversationId, BranchCodec.encode(target));
                    return toMessageDto(message, position, null, 1, 1);
                });
    }

    @Override
    public Optional<BranchCoordinate> switchBranch(
            String conversationId, BranchCoordinate branch, int userMessageIndex, int direction) {
        if (direction != -1 && direction != 1) {
            throw new IllegalArgumentException("direction must be -1 or 1: " + direction);
        }
        if (userMessageIndex < 0) {
            throw new IllegalArgumentException(
                    "user message index must be non-negative: " + userMessageIndex);
        }
        return locks.withLock(
                conversationId,
                () -> {
                    ConversationMetadata metadata = repository.get(conversationId);
                    BranchCoordinate source = branchOrCurrent(metadata, branch);
                    Optional<BranchCoordinate> target =
                            VersionResolver.adjacentBranch(
                                    branchStore.listBranchKeys(conversationId),
                                    source,
                                    userMessageIndex,
                                    direction);
                    target.ifPresent(
                            coordinate -> {
                                metadata.setCurrentBranch(coordinate);
                                repository.save(metadata);
                                LOG.infof(
                                        "Switched conversation %s from %s to %s",
                                        conversationId,
                                        BranchCodec.encode(source),
                                        BranchCodec.encode(coordinate));
                            });
                    return target;
                });
    }

    @Override
    public void setCurrentBranch(String conversationId, BranchCoordinate branch) {
        if (branch == null) {
            throw new IllegalArgumentException("branch is required");
        }
        locks.runWithLock(
                conversationId, () -> repository.setCurrentBranch(conversationId, branch));
    }

    @Override
    public List<BranchCoordinate> listBranches(String conversationId) {
        repository.get(conversationId);
        return branchStore.listBranchKeys(conversationId);
    }

    @Override
    public VersionInfo getVersionInfo(
            String conversationId, BranchCoordinate branch, int userMessageIndex) {
        if (userMessageIndex < 0) {
            throw new IllegalArgumentException(
                    "user message index must be non-negative: " + userMessageIndex);
        }
        ConversationMetadata metadata = repository.get(conversationId);
        return versionResolver.resolve(
                conversationId, branchOrCurrent(metadata, branch), userMessageIndex);
    }

    @Override
    public boolean truncateFrom(String conversationId, BranchCoordinate branch, int position) {
        if (position < 0) {
            throw new IllegalArgumentException("position must be non-negative: " + position);
        }
        return locks.withLock(
                conversationId,
                () -> {
                    ConversationMetadata metadata = repository.get(conversationId);
                    BranchCoordinate target = branchOrCurrent(metadata, branch);
                    List<Message> messages = branchStore.readMessages(conversationId, target);
                    if (position >= messages.size()) {
                        return false;
                    }
                    branchStore.writeMessages(
                            conversationId, target, new ArrayList<>(messages.subList(0, position)));
                    repository.touch(conversationId);
                    LOG.infof(
                            "Truncated conversation %s branch %s from position %d (%d removed)",
                            conversationId,
                            BranchCodec.encode(target),
                            position,
                            messages.size() - position);
                    return true;
                });
    }

    @Override
    public ConversationDto duplicateConversation(String conversationId) {
        ConversationMetadata copy =
                locks.withLock(conversationId, () -> repository.duplicate(conversationId));
        LOG.infof("Duplicated conversation %s as %s", conversationId, copy.getId());
        return toConversationDto(copy, copy.getCurrentBranch(), null);
    }

    @Override
    public List<ConversationSummaryDto> searchConversations(String query) {
        return repository.search(query).stream()
                .map(FileConversationStore::toSummaryDto)
                .toList();
    }

    @Override
    public void setSessionId(String conversationId, String sessionId) {
        locks.runWithLock(conversationId, () -> repository.setSessionId(conversationId, sessionId));
    }

    @Override
    public Optional<String> getSessionId(String conversationId) {
        return repository.findSessionId(conversationId);
    }

    @Override
    public Map<String, Object> getSettings(String conversationId) {
        repository.get(conversationId);
        return settingsService.resolve(conversationId);
    }

    @Override
    public Path getWorkspacePath(String conversationId) {
        return repository.workspaceDir(conversationId);
    }

    @Override
    public Path getMemoriesPath(String conversationId) {
        return repository.memoriesDir(conversationId);
    }

    @Override
    public Map<String, Object> updateSettings(String conversationId, Map<String, Object> changes) {
        if (changes == null) {
            throw new IllegalArgumentException("settings are required");
        }
        return locks.withLock(
                conversationId,
                () -> {
                    repository.get(conversationId);
                    return settingsService.update(conversationId, changes);
                });
    }

    private static BranchCoordinate branchOrCurrent(
            ConversationMetadata metadata, BranchCoordinate branch) {
        return branch != null ? branch : metadata.getCurrentBranch();
    }

    /** Index in {@code messages} of the {@code userMessageIndex}-th user message, or -1. */
    static int positionOfUserMessage(List<Message> messages, int userMessageIndex) {
        if (userMessageIndex < 0) {
            return -1;
        }
        int seen = 0;
        for (int i = 0; i < messages.size(); i++) {
            if (messages.get(i).isUser()) {
                if (seen == userMessageIndex) {
                    return i;
                }
                seen++;
            }
        }
        return -1;
    }

    private List<MessageDto> annotate(
            String conversationId, BranchCoordinate branch, List<Message> messages) {
        List<BranchCoordinate> keys = branchStore.listBranchKeys(conversationId);
        List<MessageDto> result = new ArrayList<>(messages.size());
        int userIndex = 0;
        for (int i = 0; i < messages.size(); i++) {
            Message message = messages.get(i);
            if (message.isUser()) {
                VersionInfo info = VersionResolver.resolve(keys, branch, userIndex);
                result.add(
                        toMessageDto(
                                message,
                                i,
                                userIndex,
                                info.getCurrentVersion(),
                                info.getTotalVersions()));
                userIndex++;
            } else {
                result.add(toMessageDto(message, i, null, 1, 1));
            }
        }
        return result;
    }

    private static List<ToolResult> emptyToNull(List<ToolResult> toolResults) {
        return toolResults == null || toolResults.isEmpty() ? null : new ArrayList<>(toolResults);
    }

    static MessageDto toMessageDto(
            Message message,
            int position,
            Integer userMessageIndex,
            int currentVersion,
            int totalVersions) {
        MessageDto dto = new MessageDto();
        dto.setId(message.getId());
        dto.setRole(message.getRole());
        dto.setContent(message.getContent());
        dto.setThinking(message.getThinking());
        dto.setToolResults(message.getToolResults());
        dto.setCreatedAt(message.getCreatedAt());
        dto.setStreaming(message.streamingInProgress());
        dto.setPosition(position);
        dto.setUserMessageIndex(userMessageIndex);
        dto.setCurrentVersion(currentVersion);
        dto.setTotalVersions(totalVersions);
        return dto;
    }

    static ConversationSummaryDto toSummaryDto(ConversationMetadata metadata) {
        ConversationSummaryDto dto = new ConversationSummaryDto();
        dto.setId(metadata.getId());
        dto.setTitle(metadata.getTitle());
        dto.setModel(metadata.getModel());
        dto.setCreatedAt(metadata.getCreatedAt());
        dto.setUpdatedAt(metadata.getUpdatedAt());
        return dto;
    }

    static ConversationDto toConversationDto(
            ConversationMetadata metadata, BranchCoordinate branch, List<MessageDto> messages) {
        ConversationDto dto = new ConversationDto();
        dto.setId(metadata.getId());
        dto.setTitle(metadata.getTitle());
        dto.setModel(metadata.getModel());
        dto.setCreatedAt(metadata.getCreatedAt());
        dto.setUpdatedAt(metadata.getUpdatedAt());
        dto.setSystemPrompt(metadata.getSystemPrompt());
        dto.setAgent(metadata.isAgent());
        dto.setSessionId(metadata.getSessionId());
        dto.setCurrentBranch(branch);
        dto.setMessages(messages);
        return dto;
    }
}
