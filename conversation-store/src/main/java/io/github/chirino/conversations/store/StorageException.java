package io.github.chirino.conversations.store;

import java.util.Map;

/**
 * Raised when a conversation document cannot be written or its directory cannot be read. Carries
 * an error code and details so the REST layer can forward the failure without branching on types.
 */
public class StorageException extends RuntimeException {

    /** Generic storage backend error. Suggested HTTP status: 500. */
    public static final String STORAGE_ERROR = "storage_error";

    private final String code;
    private final Map<String, Object> details;

    public StorageException(
            String code, String message, Map<String, Object> details, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.details = details != null ? details : Map.of();
    }

    public static StorageException storageError(String message, Throwable cause) {
        return new StorageException(STORAGE_ERROR, message, Map.of(), cause);
    }

    public static StorageException storageError(String message, String path, Throwable cause) {
        return new StorageException(STORAGE_ERROR, message, Map.of("path", path), cause);
    }

    public String getCode() {
        return code;
    }

    public Map<String, Object> getDetails() {
        return details;
    }
}
