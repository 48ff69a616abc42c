package org.dxworks.flowframe.execution;

import java.util.List;

/** Result of applying one event: the next state and the log entries it produced. */
public final class Transition {
    public final ExecutionState state;
    public final List<ExecutionLogEntry> entries;

    public Transition(ExecutionState state, List<ExecutionLogEntry> entries) {
        this.state = state;
        this.entries = List.copyOf(entries);
    }
}
