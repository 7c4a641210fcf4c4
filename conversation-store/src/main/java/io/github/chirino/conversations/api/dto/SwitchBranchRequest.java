package io.github.chirino.conversations.api.dto;

import io.github.chirino.conversations.branch.BranchCoordinate;

public class SwitchBranchRequest {

    private BranchCoordinate branch;
    private Integer userMessageIndex;
    private Integer direction;

    public BranchCoordinate getBranch() {
        return branch;
    }

    public void setBranch(BranchCoordinate branch) {
        this.branch = branch;
    }

    public Integer getUserMessageIndex() {
        return userMessageIndex;
    }

    public void setUserMessageIndex(Integer userMessageIndex) {
        this.userMessageIndex = userMessageIndex;
    }

    public Integer getDirection() {
        return direction;
    }

    public void setDirection(Integer direction) {
        this.direction = direction;
    }
}
