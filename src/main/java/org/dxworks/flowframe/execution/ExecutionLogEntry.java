package org.dxworks.flowframe.execution;

import org.dxworks.flowframe.model.BlockType;

/** One executed block, as reported to listeners and kept in the engine's log. */
public final class ExecutionLogEntry {
    public final long timestamp; // epoch millis
    public final int blockIndex;
    public final String blockContent;
    public final BlockType blockType;
    public final ExecutionAction action;
    public final String details;

    public ExecutionLogEntry(long timestamp, int blockIndex, String blockContent, BlockType blockType,
                             ExecutionAction action, String details) {
        this.timestamp = timestamp;
        this.blockIndex = blockIndex;
        this.blockContent = blockContent;
        this.blockType = blockType;
        this.action = action;
        this.details = details;
    }

    @Override
    public String toString() {
        return "#" + blockIndex + " " + action.getName() + (details == null ? "" : " (" + details + ")");
    }
}
