package io.github.chirino.conversations.persistence;

import java.nio.file.Path;
import java.util.regex.Pattern;

/** Path layout of the data directory: one sub-directory per conversation id. */
public class ConversationFiles {

    public static final String METADATA_FILE = "metadata.json";
    public static final String SETTINGS_FILE = "settings.json";
    public static final String JSON_SUFFIX = ".json";
    public static final String WORKSPACE_DIR = "workspace";
    public static final String MEMORIES_DIR = "memories";

    private static final Pattern SAFE_ID = Pattern.compile("[A-Za-z0-9][A-Za-z0-9_-]*");

    private final Path root;

    public ConversationFiles(Path root) {
        this.root = root.toAbsolutePath().normalize();
    }

    /** Conversation ids become directory names, so only plain identifiers are accepted. */
    public static boolean isSafeId(String conversationId) {
        return conversationId != null && SAFE_ID.matcher(conversationId).matches();
    }

    public Path root() {
        return root;
    }

    public Path conversationDir(String conversationId) {
        if (!isSafeId(conversationId)) {
            throw new IllegalArgumentException("Invalid conversation id: " + conversationId);
        }
        return root.resolve(conversationId);
    }

    public Path metadataFile(String conversationId) {
        return conversationDir(conversationId).resolve(METADATA_FILE);
    }

    public Path settingsFile(String conversationId) {
        return conversationDir(conversationId).resolve(SETTINGS_FILE);
    }

    public Path branchFile(String conversationId, String branchKey) {
        return conversationDir(conversationId).resolve(branchKey + JSON_SUFFIX);
    }

    public Path workspaceDir(String conversationId) {
        return conversationDir(conversationId).resolve(WORKSPACE_DIR);
    }

    public Path memoriesDir(String conversationId) {
        return conversationDir(conversationId).resolve(MEMORIES_DIR);
    }

    /** True for the metadata and settings documents, which share the directory with branches. */
    static boolean isReservedDocument(String fileName) {
        return METADATA_FILE.equals(fileName) || SETTINGS_FILE.equals(fileName);
    }
}
