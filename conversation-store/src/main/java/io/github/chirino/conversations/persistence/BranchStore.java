package io.github.chirino.conversations.persistence;

import io.github.chirino.conversations.branch.BranchCodec;
import io.github.chirino.conversations.branch.BranchCoordinate;
import io.github.chirino.conversations.branch.CorruptBranchKeyException;
import io.github.chirino.conversations.model.Message;
import io.github.chirino.conversations.store.StorageException;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import org.jboss.logging.Logger;

/**
 * Message documents of a conversation, one file per branch key. Callers that modify a document
 * must hold the conversation lock; reads need none.
 */
@ApplicationScoped
public class BranchStore {

    private static final Logger LOG = Logger.getLogger(BranchStore.class);

    ConversationFiles files;
    JsonDocuments documents;

    BranchStore() {}

    @Inject
    public BranchStore(ConversationFiles files, JsonDocuments documents) {
        this.files = files;
        this.documents = documents;
    }

    /** Messages of the branch in order; empty when the branch has no document yet. */
    public List<Message> readMessages(String conversationId, BranchCoordinate coordinate) {
        Path file = resolveFile(conversationId, coordinate);
        List<Message> messages =
                documents
                        .read(file, BranchDocument.class)
                        .map(BranchDocument::getMessages)
                        .orElseGet(ArrayList::new);
        LOG.debugf(
                "Read %d messages: conversationId=%s file=%s",
                messages.size(), conversationId, file.getFileName());
        return messages;
    }

    /** Replaces the whole document of the branch. */
    public void writeMessages(
            String conversationId, BranchCoordinate coordinate, List<Message> messages) {
        documents.write(resolveFile(conversationId, coordinate), new BranchDocument(messages));
    }

    public boolean exists(String conversationId, BranchCoordinate coordinate) {
        return Files.isRegularFile(resolveFile(conversationId, coordinate));
    }

    /** Every stored branch, decoded exactly as named on disk and sorted lexicographically. */
    public List<BranchCoordinate> listBranchKeys(String conversationId) {
        return physicalKeys(conversationId).values().stream().sorted().toList();
    }

    /**
     * File backing {@code coordinate}: the canonical key's file, or an existing file whose key
     * names the same branch with extra trailing zeros.
     */
    Path resolveFile(String conversationId, BranchCoordinate coordinate) {
        BranchCoordinate target = coordinate != null ? coordinate : BranchCoordinate.ROOT;
        Path canonical = files.branchFile(conversationId, BranchCodec.encode(target));
        if (Files.isRegularFile(canonical)) {
            return canonical;
        }
        for (Map.Entry<String, BranchCoordinate> entry : physicalKeys(conversationId).entrySet()) {
            if (entry.getValue().isSameBranch(target)) {
                return files.branchFile(conversationId, entry.getKey());
            }
        }
        return canonical;
    }

    private Map<String, BranchCoordinate> physicalKeys(String conversationId) {
        Path dir = files.conversationDir(conversationId);
        Map<String, BranchCoordinate> keys = new TreeMap<>();
        if (!Files.isDirectory(dir)) {
            return keys;
        }
        try (DirectoryStream<Path> stream =
                Files.newDirectoryStream(dir, "*" + ConversationFiles.JSON_SUFFIX)) {
            for (Path path : stream) {
                String name = path.getFileName().toString();
                if (ConversationFiles.isReservedDocument(name) || !Files.isRegularFile(path)) {
                    continue;
                }
                String key =
                        name.substring(0, name.length() - ConversationFiles.JSON_SUFFIX.length());
                try {
                    keys.put(key, BranchCodec.decode(key));
                } catch (CorruptBranchKeyException e) {
                    LOG.warnf(
                            "Skipping malformed branch file %s in conversation %s",
                            name, conversationId);
                }
            }
        } catch (IOException e) {
            throw StorageException.storageError(
                    "Failed to list branches of conversation " + conversationId, dir.toString(), e);
        }
        return keys;
    }
}
