package io.github.chirino.conversations.branch;

/**
 * Maps branch coordinates to the storage keys used as branch file names.
 *
 * <pre>
 * [0]       -&gt; "0"
 * [0, 0, 0] -&gt; "0"
 * [1, 0]    -&gt; "1"
 * [0, 1]    -&gt; "0_1"
 * </pre>
 */
public final class BranchCodec {

    public static final String SEPARATOR = "_";

    private BranchCodec() {}

    public static String encode(BranchCoordinate coordinate) {
        BranchCoordinate canonical =
                coordinate == null ? BranchCoordinate.ROOT : coordinate.canonical();
        StringBuilder key = new StringBuilder();
        for (int i = 0; i < canonical.size(); i++) {
            if (i > 0) {
                key.append(SEPARATOR);
            }
            key.append(canonical.get(i));
        }
        return key.toString();
    }

    /**
     * Parses a key exactly as stored. Non-canonical keys such as {@code "0_1_0"} keep their
     * trailing zeros.
     *
     * @throws CorruptBranchKeyException if the key is not a {@code _}-separated list of
     *     non-negative integers
     */
    public static BranchCoordinate decode(String key) {
        if (key == null || key.isEmpty()) {
            throw new CorruptBranchKeyException(key);
        }
        String[] parts = key.split(SEPARATOR, -1);
        int[] values = new int[parts.length];
        for (int i = 0; i < parts.length; i++) {
            String part = parts[i];
            if (part.isEmpty() || !part.chars().allMatch(c -> c >= '0' && c <= '9')) {
                throw new CorruptBranchKeyException(key);
            }
            try {
                values[i] = Integer.parseInt(part);
            } catch (NumberFormatException e) {
                throw new CorruptBranchKeyException(key, e);
            }
        }
        return BranchCoordinate.of(values);
    }

    public static BranchCoordinate pad(BranchCoordinate coordinate, int length) {
        return coordinate.pad(length);
    }

    public static BranchCoordinate prefix(BranchCoordinate coordinate, int length) {
        return coordinate.pad(length);
    }
}
