package org.dxworks.flowframe.execution;

import org.dxworks.flowframe.TestUtils;
import org.dxworks.flowframe.analyzer.FlowchartPipeline;
import org.dxworks.flowframe.model.ControlFlowGraph;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class ExecutionMachineTest {

    private static final Clock CLOCK = Clock.fixed(Instant.ofEpochMilli(1234), ZoneOffset.UTC);

    private static ControlFlowGraph graphOf(String source) {
        return new FlowchartPipeline().analyze(source).mainFlow;
    }

    private static ExecutionMachine machine(String source, DecisionOracle oracle) {
        return new ExecutionMachine(graphOf(source), oracle, ExecutionMachine.DEFAULT_LOOP_LIMIT, CLOCK);
    }

    /** Starts and ticks until completion, collecting every log entry. */
    private static List<ExecutionLogEntry> run(ExecutionMachine machine) {
        List<ExecutionLogEntry> log = new ArrayList<>();
        Transition t = machine.apply(ExecutionState.initial(ExecutionState.DEFAULT_SPEED_MS), ExecutionEvent.start());
        log.addAll(t.entries);
        int ticks = 0;
        while (!t.state.isComplete) {
            assertTrue(++ticks < 1000, "machine did not terminate");
            t = machine.apply(t.state, ExecutionEvent.tick());
            log.addAll(t.entries);
        }
        return log;
    }

    private static List<Integer> indices(List<ExecutionLogEntry> log) {
        return log.stream().map(e -> e.blockIndex).collect(Collectors.toList());
    }

    @Test
    void startEntersTheStartBlock() {
        ExecutionMachine machine = machine(TestUtils.sample("grades.pseudo"), new FixedDecisionOracle(Decision.YES));

        Transition t = machine.apply(ExecutionState.initial(700), ExecutionEvent.start());

        assertEquals(0, t.state.currentBlockIndex);
        assertEquals(ExecutionStatus.RUNNING, t.state.getStatus());
        assertEquals(700, t.state.speedMs);
        assertEquals(1, t.entries.size());
        ExecutionLogEntry entry = t.entries.get(0);
        assertEquals(ExecutionAction.ENTER, entry.action);
        assertEquals("Execution started", entry.details);
        assertEquals(1234, entry.timestamp);
    }

    @Test
    void startWithoutStartBlockFaults() {
        ExecutionMachine machine = machine("Output x::\nEnd::", new FixedDecisionOracle(Decision.YES));

        assertThrows(EngineFaultException.class,
                () -> machine.apply(ExecutionState.initial(500), ExecutionEvent.start()));
    }

    @Test
    void tickBeforeStartDoesNothing() {
        ExecutionMachine machine = machine(TestUtils.sample("grades.pseudo"), new FixedDecisionOracle(Decision.YES));
        ExecutionState initial = ExecutionState.initial(500);

        Transition t = machine.apply(initial, ExecutionEvent.tick());

        assertSame(initial, t.state);
        assertTrue(t.entries.isEmpty());
    }

    @Test
    void yesPathThroughTheDecision() {
        List<ExecutionLogEntry> log = run(machine(TestUtils.sample("grades.pseudo"), new FixedDecisionOracle(Decision.YES)));

        assertEquals(List.of(0, 0, 1, 2, 3, 5, 6), indices(log));
        assertEquals("Taking YES path", log.get(3).details);
        assertEquals(ExecutionAction.EXIT, log.get(6).action);
        assertEquals("Program complete", log.get(6).details);
    }

    @Test
    void noPathGoesThroughImplicitElse() {
        List<ExecutionLogEntry> log = run(machine(TestUtils.sample("grades.pseudo"), new FixedDecisionOracle(Decision.NO)));

        assertEquals(List.of(0, 0, 1, 2, 4, 5, 6), indices(log));
        assertEquals("Taking NO path", log.get(3).details);
    }

    @Test
    void completionClearsTheCurrentBlock() {
        ExecutionMachine machine = machine(TestUtils.sample("grades.pseudo"), new FixedDecisionOracle(Decision.YES));
        Transition t = machine.apply(ExecutionState.initial(500), ExecutionEvent.start());
        while (!t.state.isComplete) {
            t = machine.apply(t.state, ExecutionEvent.tick());
        }

        assertNull(t.state.currentBlockIndex);
        assertEquals(ExecutionStatus.COMPLETED, t.state.getStatus());
        assertEquals(List.of(0, 1, 2, 3, 5, 6), t.state.executionPath);

        Transition after = machine.apply(t.state, ExecutionEvent.tick());
        assertSame(t.state, after.state);
    }

    @Test
    void loopRunsUpToTheIterationLimit() {
        List<ExecutionLogEntry> log = run(machine(TestUtils.sample("counter.pseudo"), new FixedDecisionOracle(Decision.YES)));

        List<ExecutionLogEntry> loopEntries = log.stream()
                .filter(e -> e.action == ExecutionAction.LOOP)
                .collect(Collectors.toList());
        assertEquals(List.of("Iteration 1", "Iteration 2", "Iteration 3", "Loop complete"),
                loopEntries.stream().map(e -> e.details).collect(Collectors.toList()));
        assertEquals(17, log.size());
        assertEquals(6, log.get(log.size() - 1).blockIndex);
    }

    @Test
    void nestedLoopsRestartTheInnerCounter() {
        List<ExecutionLogEntry> log = run(machine(TestUtils.sample("table.pseudo"), new FixedDecisionOracle(Decision.YES)));

        assertEquals(4, log.stream().filter(e -> e.blockIndex == 1 && e.action == ExecutionAction.LOOP).count());
        assertEquals(12, log.stream().filter(e -> e.blockIndex == 2 && e.action == ExecutionAction.LOOP).count());
        assertEquals(9, log.stream().filter(e -> e.blockIndex == 3).count());
        assertEquals(ExecutionAction.EXIT, log.get(log.size() - 1).action);
    }

    @Test
    void loopLimitIsConfigurable() {
        ExecutionMachine machine = new ExecutionMachine(graphOf(TestUtils.sample("counter.pseudo")),
                new FixedDecisionOracle(Decision.YES), 1, CLOCK);

        List<ExecutionLogEntry> log = run(machine);

        assertEquals(2, log.stream().filter(e -> e.action == ExecutionAction.LOOP).count());
    }

    @Test
    void switchFollowsTheSelectedCase() {
        List<ExecutionLogEntry> yes = run(machine(TestUtils.sample("weekday.pseudo"), new FixedDecisionOracle(Decision.YES)));
        List<ExecutionLogEntry> no = run(machine(TestUtils.sample("weekday.pseudo"), new FixedDecisionOracle(Decision.NO)));

        assertEquals(List.of(0, 0, 1, 2, 3, 4, 9, 10), indices(yes));
        assertEquals("Taking case Case 1", yes.get(3).details);
        assertEquals(List.of(0, 0, 1, 2, 7, 8, 9, 10), indices(no));
        assertEquals("Taking case Default", no.get(3).details);
    }

    @Test
    void callPushesAFrameAndTheNextTickReturns() {
        ExecutionMachine machine = machine(TestUtils.sample("factorial.pseudo"), new FixedDecisionOracle(Decision.YES));
        ExecutionState state = machine.apply(ExecutionState.initial(500), ExecutionEvent.start()).state;
        state = machine.apply(state, ExecutionEvent.tick()).state;
        state = machine.apply(state, ExecutionEvent.tick()).state;

        Transition call = machine.apply(state, ExecutionEvent.tick());
        assertEquals(2, call.state.currentBlockIndex);
        assertEquals(1, call.state.callStack.size());
        CallStackFrame frame = call.state.callStack.get(0);
        assertEquals("factorial", frame.functionName);
        assertEquals(3, frame.returnBlockIndex);
        assertEquals(2, frame.callBlockIndex);
        assertEquals(ExecutionAction.CALL, call.entries.get(0).action);
        assertEquals("Calling factorial", call.entries.get(0).details);

        Transition back = machine.apply(call.state, ExecutionEvent.tick());
        assertEquals(3, back.state.currentBlockIndex);
        assertTrue(back.state.callStack.isEmpty());
        assertEquals(ExecutionAction.RETURN, back.entries.get(0).action);
        assertEquals("Returning from factorial", back.entries.get(0).details);
    }

    @Test
    void callAsLastBlockCompletesOnReturn() {
        List<ExecutionLogEntry> log = run(machine("Start::\nCall helper()::", new FixedDecisionOracle(Decision.YES)));

        assertEquals(List.of(ExecutionAction.ENTER, ExecutionAction.ENTER, ExecutionAction.CALL, ExecutionAction.RETURN),
                log.stream().map(e -> e.action).collect(Collectors.toList()));
    }

    @Test
    void returnWithoutFrameEndsTheProgram() {
        List<ExecutionLogEntry> log = run(machine("Start::\nReturn::\nEnd::", new FixedDecisionOracle(Decision.YES)));

        ExecutionLogEntry last = log.get(log.size() - 1);
        assertEquals(1, last.blockIndex);
        assertEquals(ExecutionAction.EXIT, last.action);
        assertEquals("Returned from main flow", last.details);
    }

    @Test
    void pauseAndResumeOnlyApplyToTheMatchingStatus() {
        ExecutionMachine machine = machine(TestUtils.sample("grades.pseudo"), new FixedDecisionOracle(Decision.YES));
        ExecutionState initial = ExecutionState.initial(500);

        assertSame(initial, machine.apply(initial, ExecutionEvent.pause()).state);
        assertSame(initial, machine.apply(initial, ExecutionEvent.resume()).state);

        ExecutionState running = machine.apply(initial, ExecutionEvent.start()).state;
        ExecutionState paused = machine.apply(running, ExecutionEvent.pause()).state;
        assertEquals(ExecutionStatus.PAUSED, paused.getStatus());
        assertSame(running, machine.apply(running, ExecutionEvent.resume()).state);
        assertEquals(ExecutionStatus.RUNNING, machine.apply(paused, ExecutionEvent.resume()).state.getStatus());
    }

    @Test
    void pausedStateStillTicks() {
        ExecutionMachine machine = machine(TestUtils.sample("grades.pseudo"), new FixedDecisionOracle(Decision.YES));
        ExecutionState running = machine.apply(ExecutionState.initial(500), ExecutionEvent.start()).state;
        ExecutionState paused = machine.apply(running, ExecutionEvent.pause()).state;

        Transition t = machine.apply(paused, ExecutionEvent.tick());

        assertEquals(1, t.state.currentBlockIndex);
        assertTrue(t.state.isPaused);
    }

    @Test
    void speedIsClampedAndSurvivesReset() {
        ExecutionMachine machine = machine(TestUtils.sample("grades.pseudo"), new FixedDecisionOracle(Decision.YES));
        ExecutionState state = machine.apply(ExecutionState.initial(500), ExecutionEvent.start()).state;

        assertEquals(100, machine.apply(state, ExecutionEvent.speed(50)).state.speedMs);
        ExecutionState slow = machine.apply(state, ExecutionEvent.speed(5000)).state;
        assertEquals(2000, slow.speedMs);

        ExecutionState reset = machine.apply(slow, ExecutionEvent.reset()).state;
        assertEquals(2000, reset.speedMs);
        assertEquals(ExecutionStatus.NOT_STARTED, reset.getStatus());
        assertTrue(reset.executionPath.isEmpty());
    }

    @Test
    void applyLeavesItsInputStateAlone() {
        ExecutionMachine machine = machine(TestUtils.sample("counter.pseudo"), new FixedDecisionOracle(Decision.YES));
        ExecutionState state = machine.apply(ExecutionState.initial(500), ExecutionEvent.start()).state;
        for (int i = 0; i < 3; i++) {
            state = machine.apply(state, ExecutionEvent.tick()).state;
        }
        ExecutionState before = state;

        Transition first = machine.apply(before, ExecutionEvent.tick());
        Transition second = machine.apply(before, ExecutionEvent.tick());

        assertEquals(List.of(0, 1, 2), before.executionPath);
        assertEquals(1, before.loopCounters.get(2));
        assertEquals(first.state.currentBlockIndex, second.state.currentBlockIndex);
        assertEquals(first.state.executionPath, second.state.executionPath);
        assertEquals(first.state.loopCounters, second.state.loopCounters);
    }

    @Test
    void calleeNameFromEitherCallStyle() {
        assertEquals("factorial", ExecutionMachine.calleeName("Call factorial(number)"));
        assertEquals("render", ExecutionMachine.calleeName("invoke render"));
        assertEquals("compute", ExecutionMachine.calleeName("Set x = compute(y)"));
        assertNull(ExecutionMachine.calleeName("Call"));
    }
}
