package org.dxworks.flowframe.execution;

import org.dxworks.flowframe.model.ControlFlowGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Playback surface of the simulator. Owns the single mutable state cell and the pending
 * tick; every change goes through {@link ExecutionMachine#apply}.
 *
 * <p>All controls synchronize on the engine, so a control call from another thread is
 * applied between ticks. A tick that was cancelled while already waiting for the lock is
 * recognised by its generation and dropped.</p>
 */
public class ExecutionEngine implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(ExecutionEngine.class);

    private final ExecutionMachine machine;
    private final TickScheduler scheduler;
    private final List<ExecutionListener> listeners = new CopyOnWriteArrayList<>();
    private final List<ExecutionLogEntry> log = new ArrayList<>();

    private ExecutionState state;
    private ScheduledTick pending;
    private long generation;
    private boolean closed;

    public ExecutionEngine(ControlFlowGraph graph, DecisionOracle oracle, TickScheduler scheduler) {
        this(new ExecutionMachine(graph, oracle), scheduler, ExecutionState.DEFAULT_SPEED_MS);
    }

    public ExecutionEngine(ExecutionMachine machine, TickScheduler scheduler, int speedMs) {
        this.machine = machine;
        this.scheduler = scheduler;
        this.state = ExecutionState.initial(speedMs);
    }

    public void addListener(ExecutionListener listener) {
        listeners.add(listener);
    }

    public void removeListener(ExecutionListener listener) {
        listeners.remove(listener);
    }

    /**
     * Starts from the start block, restarting if a run is already in progress or done.
     *
     * @throws EngineFaultException when the graph has no start block
     */
    public synchronized void start() {
        ensureOpen();
        if (state.getStatus() != ExecutionStatus.NOT_STARTED) {
            resetInternal();
        }
        apply(ExecutionEvent.start());
        scheduleNext();
    }

    public synchronized void pause() {
        ensureOpen();
        cancelPending();
        apply(ExecutionEvent.pause());
    }

    public synchronized void resume() {
        ensureOpen();
        apply(ExecutionEvent.resume());
        scheduleNext();
    }

    /** Runs exactly one tick whatever the pause state. An engine that was never started starts paused. */
    public synchronized void step() {
        ensureOpen();
        if (state.getStatus() == ExecutionStatus.NOT_STARTED) {
            apply(ExecutionEvent.start());
            apply(ExecutionEvent.pause());
        }
        cancelPending();
        apply(ExecutionEvent.tick());
        scheduleNext();
    }

    public synchronized void reset() {
        ensureOpen();
        resetInternal();
    }

    /** Clamped to [100, 2000] ms; applies from the next scheduled tick on. */
    public synchronized void setSpeed(int speedMs) {
        ensureOpen();
        apply(ExecutionEvent.speed(speedMs));
    }

    public synchronized ExecutionState getState() {
        return state;
    }

    public synchronized ExecutionStatus getStatus() {
        return state.getStatus();
    }

    public synchronized List<ExecutionLogEntry> getLog() {
        return List.copyOf(log);
    }

    @Override
    public synchronized void close() {
        cancelPending();
        closed = true;
    }

    private void runTick(long scheduledGeneration) {
        synchronized (this) {
            if (closed || scheduledGeneration != generation) return;
            pending = null;
            apply(ExecutionEvent.tick());
            scheduleNext();
        }
    }

    private void resetInternal() {
        cancelPending();
        log.clear();
        apply(ExecutionEvent.reset());
    }

    private void apply(ExecutionEvent event) {
        Transition transition = machine.apply(state, event);
        state = transition.state;
        log.addAll(transition.entries);

        for (ExecutionLogEntry entry : transition.entries) {
            for (ExecutionListener listener : listeners) {
                listener.onLogEntry(entry);
            }
        }
        for (ExecutionListener listener : listeners) {
            listener.onStateChange(state);
        }
    }

    private void scheduleNext() {
        if (state.getStatus() != ExecutionStatus.RUNNING || pending != null) return;
        long scheduledGeneration = ++generation;
        pending = scheduler.schedule(() -> runTick(scheduledGeneration), state.speedMs);
    }

    private void cancelPending() {
        generation++;
        if (pending != null) {
            pending.cancel();
            pending = null;
        }
    }

    private void ensureOpen() {
        if (closed) {
            LOG.warn("Control call on a closed execution engine");
            throw new EngineFaultException("Execution engine is closed");
        }
    }
}
