package io.github.chirino.conversations.branch;

import java.util.List;

/**
 * Where a coordinate sits among its siblings at one decision index. {@code currentVersion} is
 * 1-based; {@code versions} holds the sorted sibling values.
 */
public class VersionInfo {

    private final int position;
    private final int currentVersion;
    private final int totalVersions;
    private final List<Integer> versions;

    public VersionInfo(
            int position, int currentVersion, int totalVersions, List<Integer> versions) {
        this.position = position;
        this.currentVersion = currentVersion;
        this.totalVersions = totalVersions;
        this.versions = List.copyOf(versions);
    }

    public int getPosition() {
        return position;
    }

    public int getCurrentVersion() {
        return currentVersion;
    }

    public int getTotalVersions() {
        return totalVersions;
    }

    public List<Integer> getVersions() {
        return versions;
    }

    @Override
    public String toString() {
        return "VersionInfo{position="
                + position
                + ", current="
                + currentVersion
                + ", total="
                + totalVersions
                + ", versions="
                + versions
                + "}";
    }
}
