package org.dxworks.flowframe.execution;

/** Handle of a pending tick. */
public interface ScheduledTick {

    void cancel();
}
