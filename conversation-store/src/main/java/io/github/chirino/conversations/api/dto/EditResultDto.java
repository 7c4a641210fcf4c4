package io.github.chirino.conversations.api.dto;

import io.github.chirino.conversations.branch.BranchCoordinate;

/** Outcome of editing a user message: the new branch and its freshly written message. */
public class EditResultDto {

    private BranchCoordinate branch;
    private MessageDto message;
    private int version;
    private int totalVersions;

    public BranchCoordinate getBranch() {
        return branch;
    }

    public void setBranch(BranchCoordinate branch) {
        this.branch = branch;
    }

    public MessageDto getMessage() {
        return message;
    }

    public void setMessage(MessageDto message) {
        this.message = message;
    }

    public int getVersion() {
        return version;
    }

    public void setVersion(int version) {
        this.version = version;
    }

    public int getTotalVersions() {
        return totalVersions;
    }

    public void setTotalVersions(int totalVersions) {
        this.totalVersions = totalVersions;
    }
}
