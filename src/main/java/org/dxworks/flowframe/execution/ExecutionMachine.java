package org.dxworks.flowframe.execution;

import org.dxworks.flowframe.model.Block;
import org.dxworks.flowframe.model.BlockType;
import org.dxworks.flowframe.model.Connection;
import org.dxworks.flowframe.model.ConnectionType;
import org.dxworks.flowframe.model.ControlFlowGraph;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Transition function of the simulator: {@code (state, event) -> (state, log entries)}.
 * Holds no mutable state of its own; the decision oracle is the only source of
 * non-determinism.
 *
 * <p>A tick executes the current block and moves to the next one. Calls are simplified:
 * the callee body is not entered. The call tick pushes a frame and stays on the call
 * block; the following tick on that block pops the frame and continues at the block
 * after the call.</p>
 */
public class ExecutionMachine {

    public static final int DEFAULT_LOOP_LIMIT = 3;

    private static final Pattern KEYWORD_CALL = Pattern.compile("(?i)\\b(?:call|invoke|execute)\\s+(\\w+)");
    private static final Pattern PAREN_CALL = Pattern.compile("(\\w+)\\s*\\(");

    private final ControlFlowGraph graph;
    private final DecisionOracle oracle;
    private final int loopLimit;
    private final Clock clock;

    public ExecutionMachine(ControlFlowGraph graph, DecisionOracle oracle) {
        this(graph, oracle, DEFAULT_LOOP_LIMIT, Clock.systemUTC());
    }

    public ExecutionMachine(ControlFlowGraph graph, DecisionOracle oracle, int loopLimit, Clock clock) {
        this.graph = graph;
        this.oracle = oracle;
        this.loopLimit = Math.max(1, loopLimit);
        this.clock = clock;
    }

    public ControlFlowGraph graph() {
        return graph;
    }

    public Transition apply(ExecutionState state, ExecutionEvent event) {
        switch (event.type) {
            case START:
                return start(state);
            case TICK:
                return tick(state);
            case PAUSE:
                if (state.getStatus() != ExecutionStatus.RUNNING) return unchanged(state);
                return new Transition(state.toBuilder().paused(true).build(), Collections.emptyList());
            case RESUME:
                if (state.getStatus() != ExecutionStatus.PAUSED) return unchanged(state);
                return new Transition(state.toBuilder().paused(false).build(), Collections.emptyList());
            case RESET:
                return new Transition(ExecutionState.initial(state.speedMs), Collections.emptyList());
            case SPEED:
                return new Transition(state.toBuilder().speedMs(ExecutionState.clampSpeed(event.speedMs)).build(),
                        Collections.emptyList());
            default:
                throw new IllegalArgumentException("Unknown event " + event);
        }
    }

    private Transition start(ExecutionState state) {
        int startIndex = graph.indexOfFirst(BlockType.START);
        if (startIndex < 0) {
            throw new EngineFaultException("No start block found");
        }
        ExecutionState started = ExecutionState.initial(state.speedMs).toBuilder()
                .currentBlockIndex(startIndex)
                .build();
        return new Transition(started, List.of(entry(startIndex, ExecutionAction.ENTER, "Execution started")));
    }

    private Transition tick(ExecutionState state) {
        Integer current = state.currentBlockIndex;
        if (current == null || state.isComplete) return unchanged(state);

        if (current < 0 || current >= graph.size()) {
            return new Transition(state.toBuilder().complete().build(), Collections.emptyList());
        }

        int index = current;
        Block block = graph.block(index);
        ExecutionState.Builder next = state.toBuilder().visit(index);
        List<ExecutionLogEntry> entries = new ArrayList<>(1);

        switch (block.blockType) {
            case END:
                returnOrComplete(index, next, entries, "Program complete");
                break;
            case RETURN:
                returnOrComplete(index, next, entries, "Returned from main flow");
                break;
            case CONDITION:
                if (block.isClosing) {
                    sequential(index, next, entries);
                } else {
                    branch(index, block, next, entries);
                }
                break;
            case ELSE_IF:
                branch(index, block, next, entries);
                break;
            case SWITCH:
                selectCase(index, block, next, entries);
                break;
            case LOOP:
                loop(index, next, entries);
                break;
            case FUNCTION:
                call(index, block, next, entries);
                break;
            default:
                sequential(index, next, entries);
        }
        return new Transition(next.build(), entries);
    }

    private void returnOrComplete(int index, ExecutionState.Builder next, List<ExecutionLogEntry> entries,
                                  String completion) {
        CallStackFrame frame = next.popFrame();
        if (frame != null) {
            entries.add(entry(index, ExecutionAction.RETURN, "Returning from " + frame.functionName));
            moveTo(next, frame.returnBlockIndex);
        } else {
            entries.add(entry(index, ExecutionAction.EXIT, completion));
            next.complete();
        }
    }

    private void branch(int index, Block block, ExecutionState.Builder next, List<ExecutionLogEntry> entries) {
        Decision decision = oracle.decide(index, block);
        ConnectionType wanted = decision == Decision.YES ? ConnectionType.YES : ConnectionType.NO;
        entries.add(entry(index, ExecutionAction.BRANCH, "Taking " + decision.name() + " path"));

        Connection edge = graph.firstOutgoing(index, wanted).orElse(null);
        if (edge == null) {
            List<Connection> outgoing = graph.outgoing(index);
            edge = outgoing.isEmpty() ? null : outgoing.get(0);
        }
        moveTo(next, edge == null ? -1 : edge.to);
    }

    private void selectCase(int index, Block block, ExecutionState.Builder next, List<ExecutionLogEntry> entries) {
        List<Connection> cases = new ArrayList<>();
        List<String> labels = new ArrayList<>();
        for (Connection c : graph.outgoing(index)) {
            if (c.type == ConnectionType.CASE) {
                cases.add(c);
                labels.add(c.label == null ? graph.block(c.to).content : c.label);
            }
        }
        if (cases.isEmpty()) {
            sequential(index, next, entries);
            return;
        }

        int chosen = Math.max(0, Math.min(cases.size() - 1, oracle.selectCase(index, block, labels)));
        entries.add(entry(index, ExecutionAction.BRANCH, "Taking case " + labels.get(chosen)));
        moveTo(next, cases.get(chosen).to);
    }

    private void loop(int index, ExecutionState.Builder next, List<ExecutionLogEntry> entries) {
        int count = next.loopCount(index);
        if (count < loopLimit) {
            next.loopCounter(index, count + 1);
            entries.add(entry(index, ExecutionAction.LOOP, "Iteration " + (count + 1)));
            moveTo(next, forwardTarget(index));
        } else {
            next.clearLoopCounter(index);
            entries.add(entry(index, ExecutionAction.LOOP, "Loop complete"));
            moveTo(next, loopExit(index));
        }
    }

    private void call(int index, Block block, ExecutionState.Builder next, List<ExecutionLogEntry> entries) {
        CallStackFrame top = next.peekFrame();
        if (top != null && top.callBlockIndex == index) {
            next.popFrame();
            entries.add(entry(index, ExecutionAction.RETURN, "Returning from " + top.functionName));
            moveTo(next, top.returnBlockIndex);
            return;
        }

        String callee = calleeName(block.content);
        if (callee == null) {
            sequential(index, next, entries);
            return;
        }
        next.pushFrame(new CallStackFrame(callee, sequentialTarget(index), index));
        entries.add(entry(index, ExecutionAction.CALL, "Calling " + callee));
        next.currentBlockIndex(index);
    }

    private void sequential(int index, ExecutionState.Builder next, List<ExecutionLogEntry> entries) {
        entries.add(entry(index, ExecutionAction.ENTER, null));
        moveTo(next, sequentialTarget(index));
    }

    /** Loop-back wins (the innermost loop when several close here), else the first forward edge. */
    private int sequentialTarget(int index) {
        int loopBack = -1;
        for (Connection c : graph.outgoing(index)) {
            if (c.type == ConnectionType.LOOP_BACK && c.to > loopBack) loopBack = c.to;
        }
        return loopBack >= 0 ? loopBack : forwardTarget(index);
    }

    private int forwardTarget(int index) {
        for (Connection c : graph.outgoing(index)) {
            if (c.type != ConnectionType.LOOP_BACK) return c.to;
        }
        return -1;
    }

    /**
     * Where a finished loop continues: the forward edge of the block that closes it, or
     * the next enclosing loop when that block closes several loops at once.
     */
    private int loopExit(int loopIndex) {
        for (Connection back : graph.incoming(loopIndex)) {
            if (back.type != ConnectionType.LOOP_BACK) continue;

            int outer = -1;
            for (Connection c : graph.outgoing(back.from)) {
                if (c.type == ConnectionType.LOOP_BACK && c.to < loopIndex && c.to > outer) outer = c.to;
            }
            return outer >= 0 ? outer : forwardTarget(back.from);
        }
        return forwardTarget(loopIndex);
    }

    static String calleeName(String content) {
        Matcher m = KEYWORD_CALL.matcher(content);
        if (m.find()) return m.group(1);
        m = PAREN_CALL.matcher(content);
        return m.find() ? m.group(1) : null;
    }

    private static void moveTo(ExecutionState.Builder next, int target) {
        if (target < 0) {
            next.complete();
        } else {
            next.currentBlockIndex(target);
        }
    }

    private ExecutionLogEntry entry(int index, ExecutionAction action, String details) {
        Block block = graph.block(index);
        return new ExecutionLogEntry(clock.millis(), index, block.content, block.blockType, action, details);
    }

    private static Transition unchanged(ExecutionState state) {
        return new Transition(state, Collections.emptyList());
    }
}
