package org.dxworks.flowframe.model;

import java.util.Objects;

/**
 * One classified line of pseudocode. Blocks are addressed by their index in the
 * sequence that holds them; the index is their only identity.
 */
public final class Block {
    public final String content;
    public final int indentLevel;
    public final BlockType blockType;
    public final boolean isClosing;
    public final boolean isRecursiveCall;

    public Block(String content, int indentLevel, BlockType blockType, boolean isClosing) {
        this(content, indentLevel, blockType, isClosing, false);
    }

    public Block(String content, int indentLevel, BlockType blockType, boolean isClosing, boolean isRecursiveCall) {
        this.content = Objects.requireNonNull(content, "content");
        this.indentLevel = Math.max(0, indentLevel);
        this.blockType = Objects.requireNonNull(blockType, "blockType");
        this.isClosing = isClosing;
        this.isRecursiveCall = isRecursiveCall;
    }

    public Block withRecursiveCall(boolean recursiveCall) {
        if (recursiveCall == isRecursiveCall) return this;
        return new Block(content, indentLevel, blockType, isClosing, recursiveCall);
    }

    /** An {@code if} that starts a decision, as opposed to the {@code else} closing one. */
    public boolean opensConditional() {
        return blockType == BlockType.CONDITION && !isClosing;
    }

    /** A bare {@code else}: classified as a condition, but closing. */
    public boolean closesWithElse() {
        return blockType == BlockType.CONDITION && isClosing;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Block)) return false;
        Block other = (Block) o;
        return indentLevel == other.indentLevel
                && isClosing == other.isClosing
                && isRecursiveCall == other.isRecursiveCall
                && blockType == other.blockType
                && content.equals(other.content);
    }

    @Override
    public int hashCode() {
        return Objects.hash(content, indentLevel, blockType, isClosing, isRecursiveCall);
    }

    @Override
    public String toString() {
        return blockType.getName() + "@" + indentLevel + "[" + content + "]";
    }
}
