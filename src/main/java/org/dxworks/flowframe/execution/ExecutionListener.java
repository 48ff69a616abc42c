package org.dxworks.flowframe.execution;

public interface ExecutionListener {

    default void onStateChange(ExecutionState state) {
    }

    default void onLogEntry(ExecutionLogEntry entry) {
    }
}
