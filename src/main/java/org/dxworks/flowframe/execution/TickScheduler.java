package org.dxworks.flowframe.execution;

/** Runs a task once after a delay. The engine never has more than one tick pending. */
public interface TickScheduler {

    ScheduledTick schedule(Runnable task, long delayMs);
}
