package io.github.chirino.conversations.model;

import java.util.Objects;

/** Marks the point where earlier turns were summarized away. */
public class CompactionMarkerBlock extends ContentBlock {

    private String summary;

    public CompactionMarkerBlock() {}

    public CompactionMarkerBlock(String summary) {
        this.summary = summary;
    }

    @Override
    public String getType() {
        return COMPACTION;
    }

    public String getSummary() {
        return summary;
    }

    public void setSummary(String summary) {
        this.summary = summary;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof CompactionMarkerBlock that && Objects.equals(summary, that.summary);
    }

    @Override
    public int hashCode() {
        return Objects.hash(summary);
    }
}
