package org.dxworks.flowframe.execution;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/** Timer thread backed scheduler: one daemon thread, so at most one tick runs at a time. */
public class ExecutorTickScheduler implements TickScheduler, AutoCloseable {

    private final ScheduledExecutorService executor;

    public ExecutorTickScheduler() {
        this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "flowframe-ticks");
            t.setDaemon(true);
            return t;
        });
    }

    @Override
    public ScheduledTick schedule(Runnable task, long delayMs) {
        ScheduledFuture<?> future = executor.schedule(task, delayMs, TimeUnit.MILLISECONDS);
        return () -> future.cancel(false);
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }
}
