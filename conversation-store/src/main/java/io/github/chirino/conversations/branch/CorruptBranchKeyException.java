package io.github.chirino.conversations.branch;

public class CorruptBranchKeyException extends RuntimeException {

    private final String key;

    public CorruptBranchKeyException(String key) {
        super("Malformed branch key: " + key);
        this.key = key;
    }

    public CorruptBranchKeyException(String key, Throwable cause) {
        super("Malformed branch key: " + key, cause);
        this.key = key;
    }

    public String getKey() {
        return key;
    }
}
