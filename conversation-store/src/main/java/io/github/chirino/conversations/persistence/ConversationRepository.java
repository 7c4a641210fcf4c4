package io.github.chirino.conversations.persistence;

import io.github.chirino.conversations.branch.BranchCoordinate;
import io.github.chirino.conversations.model.Message;
import io.github.chirino.conversations.store.ResourceNotFoundException;
import io.github.chirino.conversations.store.StorageException;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;
import org.jboss.logging.Logger;

/**
 * Conversation metadata: creation, lookup, listing, search and deletion of conversation
 * directories. Mutating callers hold the conversation lock.
 */
@ApplicationScoped
public class ConversationRepository {

    private static final Logger LOG = Logger.getLogger(ConversationRepository.class);

    static final String COPY_TITLE_PREFIX = "Copy of ";

    private static final Comparator<ConversationMetadata> MOST_RECENT_FIRST =
            Comparator.comparing(
                            ConversationMetadata::getUpdatedAt,
                            Comparator.nullsFirst(Comparator.<Instant>naturalOrder()))
                    .thenComparing(
                            ConversationMetadata::getCreatedAt,
                            Comparator.nullsFirst(Comparator.<Instant>naturalOrder()))
                    .reversed();

    ConversationFiles files;
    JsonDocuments documents;
    BranchStore branchStore;

    ConversationRepository() {}

    @Inject
    public ConversationRepository(
            ConversationFiles files, JsonDocuments documents, BranchStore branchStore) {
        this.files = files;
        this.documents = documents;
        this.branchStore = branchStore;
    }

    public ConversationMetadata create(
            String title, String model, String systemPrompt, boolean agent) {
        Instant now = Instant.now();
        ConversationMetadata metadata = new ConversationMetadata();
        metadata.setId(UUID.randomUUID().toString());
        metadata.setTitle(title);
        metadata.setModel(model);
        metadata.setSystemPrompt(systemPrompt);
        metadata.setAgent(agent);
        metadata.setCreatedAt(now);
        metadata.setUpdatedAt(now);
        metadata.setCurrentBranch(BranchCoordinate.ROOT);
        save(metadata);
        return metadata;
    }

    public Optional<ConversationMetadata> find(String conversationId) {
        if (!ConversationFiles.isSafeId(conversationId)) {
            return Optional.empty();
        }
        return documents.read(files.metadataFile(conversationId), ConversationMetadata.class);
    }

    public ConversationMetadata get(String conversationId) {
        return find(conversationId)
                .orElseThrow(() -> new ResourceNotFoundException("conversation", conversationId));
    }

    public void save(ConversationMetadata metadata) {
        documents.write(files.metadataFile(metadata.getId()), metadata);
    }

    /** Applies the non-null fields and bumps {@code updated_at}. */
    public ConversationMetadata update(
            String conversationId, String title, String model, String systemPrompt) {
        ConversationMetadata metadata = get(conversationId);
        if (title != null) {
            metadata.setTitle(title);
        }
        if (model != null) {
            metadata.setModel(model);
        }
        if (systemPrompt != null) {
            metadata.setSystemPrompt(systemPrompt);
        }
        metadata.setUpdatedAt(Instant.now());
        save(metadata);
        return metadata;
    }

    public ConversationMetadata touch(String conversationId) {
        ConversationMetadata metadata = get(conversationId);
        metadata.setUpdatedAt(Instant.now());
        save(metadata);
        return metadata;
    }

    /** Moves the current branch pointer. The branch is not required to have a document. */
    public ConversationMetadata setCurrentBranch(
            String conversationId, BranchCoordinate coordinate) {
        ConversationMetadata metadata = get(conversationId);
        metadata.setCurrentBranch(coordinate);
        save(metadata);
        return metadata;
    }

    public ConversationMetadata setSessionId(String conversationId, String sessionId) {
        ConversationMetadata metadata = get(conversationId);
        metadata.setSessionId(sessionId);
        save(metadata);
        return metadata;
    }

    public Optional<String> findSessionId(String conversationId) {
        return find(conversationId).map(ConversationMetadata::getSessionId);
    }

    /**
     * Removes the metadata document, then the rest of the directory. Once the metadata is gone the
     * conversation no longer resolves; a directory left behind by a failed tree removal is ignored
     * by listing and search.
     *
     * @return false when the conversation did not exist
     */
    public boolean delete(String conversationId) {
        if (!ConversationFiles.isSafeId(conversationId)) {
            return false;
        }
        Path metadataFile = files.metadataFile(conversationId);
        try {
            if (!Files.deleteIfExists(metadataFile)) {
                return false;
            }
        } catch (IOException e) {
            throw StorageException.storageError(
                    "Failed to delete conversation " + conversationId, metadataFile.toString(), e);
        }
        Path dir = files.conversationDir(conversationId);
        try {
            deleteTree(dir);
        } catch (IOException e) {
            LOG.warnf(
                    e,
                    "Conversation %s deleted but directory %s was left behind",
                    conversationId,
                    dir);
        }
        return true;
    }

    /** Every conversation with readable metadata, most recently updated first. */
    public List<ConversationMetadata> list() {
        List<ConversationMetadata> result = new ArrayList<>();
        for (Path dir : conversationDirs()) {
            documents
                    .read(dir.resolve(ConversationFiles.METADATA_FILE), ConversationMetadata.class)
                    .ifPresent(result::add);
        }
        result.sort(MOST_RECENT_FIRST);
        return result;
    }

    /**
     * Conversations whose title, or the text of any message on any branch, contains {@code
     * query} ignoring case.
     */
    public List<ConversationMetadata> search(String query) {
        if (query == null || query.isBlank()) {
            return list();
        }
        String needle = query.toLowerCase(Locale.ROOT);
        return list().stream().filter(metadata -> matches(metadata, needle)).toList();
    }

    /**
     * Copies every document of {@code sourceId} into a new conversation. The copy gets a fresh id,
     * a "Copy of" title, new timestamps, the root branch as current branch and no session id.
     * Messages that were still streaming are stored as finished in the copy.
     */
    public ConversationMetadata duplicate(String sourceId) {
        ConversationMetadata source = get(sourceId);
        Instant now = Instant.now();
        ConversationMetadata copy = source.copy();
        copy.setId(UUID.randomUUID().toString());
        copy.setTitle(COPY_TITLE_PREFIX + (source.getTitle() != null ? source.getTitle() : ""));
        copy.setCreatedAt(now);
        copy.setUpdatedAt(now);
        copy.setCurrentBranch(BranchCoordinate.ROOT);
        copy.setSessionId(null);

        Path sourceDir = files.conversationDir(sourceId);
        Path targetDir = files.conversationDir(copy.getId());
        try {
            Files.createDirectories(targetDir);
            try (DirectoryStream<Path> stream =
                    Files.newDirectoryStream(sourceDir, "*" + ConversationFiles.JSON_SUFFIX)) {
                for (Path file : stream) {
                    String name = file.getFileName().toString();
                    if (ConversationFiles.METADATA_FILE.equals(name)
                            || !Files.isRegularFile(file)) {
                        continue;
                    }
                    Files.copy(file, targetDir.resolve(name));
                }
            }
        } catch (IOException e) {
            throw StorageException.storageError(
                    "Failed to duplicate conversation " + sourceId, targetDir.toString(), e);
        }
        finalizeCopiedMessages(copy.getId());
        save(copy);
        return copy;
    }

    /** Directory an agent conversation works in. It is not created here. */
    public Path workspaceDir(String conversationId) {
        get(conversationId);
        return files.workspaceDir(conversationId);
    }

    /** Directory holding an agent conversation's memory files. It is not created here. */
    public Path memoriesDir(String conversationId) {
        get(conversationId);
        return files.memoriesDir(conversationId);
    }

    // No generation is attached to a copy, so nothing would ever finish its placeholders.
    private void finalizeCopiedMessages(String copyId) {
        for (BranchCoordinate key : branchStore.listBranchKeys(copyId)) {
            List<Message> messages = branchStore.readMessages(copyId, key);
            boolean changed = false;
            for (Message message : messages) {
                if (message.streamingInProgress()) {
                    message.setStreaming(false);
                    changed = true;
                }
            }
            if (changed) {
                branchStore.writeMessages(copyId, key, messages);
                LOG.debugf("Cleared streaming marker in copy: conversationId=%s", copyId);
            }
        }
    }

    private boolean matches(ConversationMetadata metadata, String needle) {
        if (metadata.getTitle() != null
                && metadata.getTitle().toLowerCase(Locale.ROOT).contains(needle)) {
            return true;
        }
        for (BranchCoordinate key : branchStore.listBranchKeys(metadata.getId())) {
            for (Message message : branchStore.readMessages(metadata.getId(), key)) {
                String text = message.getContent().plainText();
                if (text.toLowerCase(Locale.ROOT).contains(needle)) {
                    return true;
                }
            }
        }
        return false;
    }

    private List<Path> conversationDirs() {
        Path root = files.root();
        List<Path> dirs = new ArrayList<>();
        if (!Files.isDirectory(root)) {
            return dirs;
        }
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(root, Files::isDirectory)) {
            stream.forEach(dirs::add);
        } catch (IOException e) {
            throw StorageException.storageError(
                    "Failed to list conversations", root.toString(), e);
        }
        return dirs;
    }

    private static void deleteTree(Path dir) throws IOException {
        if (!Files.exists(dir)) {
            return;
        }
        Files.walkFileTree(
                dir,
                new SimpleFileVisitor<>() {
                    @Override
                    public FileVisitResult visitFile(Path file, BasicFileAttributes attrs)
                            throws IOException {
                        Files.delete(file);
                        return FileVisitResult.CONTINUE;
                    }

                    @Override
                    public FileVisitResult postVisitDirectory(Path directory, IOException e)
                            throws IOException {
                        if (e != null) {
                            throw e;
                        }
                        Files.delete(directory);
                        return FileVisitResult.CONTINUE;
                    }
                });
    }
}
