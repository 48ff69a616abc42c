package org.dxworks.flowframe.execution;

import org.dxworks.flowframe.model.BlockType;
import org.dxworks.flowframe.model.ControlFlowGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Collections;
import java.util.List;

/** Steps a graph to completion without a timer and returns the log, for batch output. */
public class ExecutionTracer {

    private static final Logger LOG = LoggerFactory.getLogger(ExecutionTracer.class);

    private static final TickScheduler NO_TIMER = (task, delayMs) -> {
        throw new IllegalStateException("Tracing steps the engine by hand, nothing may be scheduled");
    };

    private final int loopLimit;
    private final int maxTicks;
    private final Clock clock;

    public ExecutionTracer(int loopLimit, int maxTicks) {
        this(loopLimit, maxTicks, Clock.systemUTC());
    }

    public ExecutionTracer(int loopLimit, int maxTicks, Clock clock) {
        this.loopLimit = loopLimit;
        this.maxTicks = maxTicks;
        this.clock = clock;
    }

    /** Empty when the graph has no start block. */
    public List<ExecutionLogEntry> trace(ControlFlowGraph graph, DecisionOracle oracle) {
        if (graph.indexOfFirst(BlockType.START) < 0) {
            return Collections.emptyList();
        }

        ExecutionMachine machine = new ExecutionMachine(graph, oracle, loopLimit, clock);
        try (ExecutionEngine engine = new ExecutionEngine(machine, NO_TIMER, ExecutionState.MIN_SPEED_MS)) {
            int ticks = 0;
            while (engine.getStatus() != ExecutionStatus.COMPLETED && ticks < maxTicks) {
                engine.step();
                ticks++;
            }
            if (engine.getStatus() != ExecutionStatus.COMPLETED) {
                LOG.warn("Trace stopped after {} ticks before reaching the end", maxTicks);
            }
            return engine.getLog();
        }
    }
}
