package io.github.chirino.conversations.model;

import java.util.List;
import java.util.stream.Collectors;

public final class BlockListContent extends MessageContent {

    private final List<ContentBlock> blocks;

    BlockListContent(List<ContentBlock> blocks) {
        this.blocks = blocks != null ? List.copyOf(blocks) : List.of();
    }

    public List<ContentBlock> getBlocks() {
        return blocks;
    }

    @Override
    public String plainText() {
        return blocks.stream()
                .filter(TextBlock.class::isInstance)
                .map(block -> ((TextBlock) block).getText())
                .collect(Collectors.joining("\n"));
    }

    @Override
    public boolean hasSpecialBlocks() {
        return blocks.stream().anyMatch(block -> !(block instanceof TextBlock));
    }

    @Override
    public boolean isEmpty() {
        return blocks.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof BlockListContent that && blocks.equals(that.blocks);
    }

    @Override
    public int hashCode() {
        return blocks.hashCode();
    }

    @Override
    public String toString() {
        return "BlockListContent" + blocks;
    }
}
