package org.dxworks.flowframe.execution;

public enum ExecutionStatus {
    NOT_STARTED,
    RUNNING,
    PAUSED,
    COMPLETED
}
