package org.dxworks.flowframe.execution;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Immutable snapshot of a simulation. {@code currentBlockIndex} is {@code null} before
 * the first start and after completion.
 */
public final class ExecutionState {

    public static final int MIN_SPEED_MS = 100;
    public static final int MAX_SPEED_MS = 2000;
    public static final int DEFAULT_SPEED_MS = 500;

    public final Integer currentBlockIndex;
    public final Set<Integer> visitedBlocks;
    public final List<Integer> executionPath;
    public final List<CallStackFrame> callStack; // innermost frame last
    public final Map<Integer, Integer> loopCounters;
    public final boolean isPaused;
    public final boolean isComplete;
    public final int speedMs;

    private ExecutionState(Builder b) {
        this.currentBlockIndex = b.currentBlockIndex;
        this.visitedBlocks = Collections.unmodifiableSet(new LinkedHashSet<>(b.visitedBlocks));
        this.executionPath = List.copyOf(b.executionPath);
        this.callStack = List.copyOf(b.callStack);
        this.loopCounters = Collections.unmodifiableMap(new LinkedHashMap<>(b.loopCounters));
        this.isPaused = b.isPaused;
        this.isComplete = b.isComplete;
        this.speedMs = clampSpeed(b.speedMs);
    }

    public static ExecutionState initial(int speedMs) {
        return new Builder().speedMs(speedMs).build();
    }

    public static int clampSpeed(int speedMs) {
        return Math.max(MIN_SPEED_MS, Math.min(MAX_SPEED_MS, speedMs));
    }

    public ExecutionStatus getStatus() {
        if (isComplete) return ExecutionStatus.COMPLETED;
        if (currentBlockIndex == null) return ExecutionStatus.NOT_STARTED;
        return isPaused ? ExecutionStatus.PAUSED : ExecutionStatus.RUNNING;
    }

    public Builder toBuilder() {
        Builder b = new Builder();
        b.currentBlockIndex = currentBlockIndex;
        b.visitedBlocks.addAll(visitedBlocks);
        b.executionPath.addAll(executionPath);
        b.callStack.addAll(callStack);
        b.loopCounters.putAll(loopCounters);
        b.isPaused = isPaused;
        b.isComplete = isComplete;
        b.speedMs = speedMs;
        return b;
    }

    public static final class Builder {
        private Integer currentBlockIndex;
        private final Set<Integer> visitedBlocks = new LinkedHashSet<>();
        private final List<Integer> executionPath = new ArrayList<>();
        private final List<CallStackFrame> callStack = new ArrayList<>();
        private final Map<Integer, Integer> loopCounters = new LinkedHashMap<>();
        private boolean isPaused;
        private boolean isComplete;
        private int speedMs = DEFAULT_SPEED_MS;

        public Builder currentBlockIndex(Integer index) {
            this.currentBlockIndex = index;
            return this;
        }

        /** Records that {@code index} was executed. */
        public Builder visit(int index) {
            visitedBlocks.add(index);
            executionPath.add(index);
            return this;
        }

        public Builder pushFrame(CallStackFrame frame) {
            callStack.add(frame);
            return this;
        }

        public CallStackFrame popFrame() {
            return callStack.isEmpty() ? null : callStack.remove(callStack.size() - 1);
        }

        public CallStackFrame peekFrame() {
            return callStack.isEmpty() ? null : callStack.get(callStack.size() - 1);
        }

        public Builder loopCounter(int loopIndex, int count) {
            loopCounters.put(loopIndex, count);
            return this;
        }

        public Builder clearLoopCounter(int loopIndex) {
            loopCounters.remove(loopIndex);
            return this;
        }

        public int loopCount(int loopIndex) {
            return loopCounters.getOrDefault(loopIndex, 0);
        }

        public Builder paused(boolean paused) {
            this.isPaused = paused;
            return this;
        }

        public Builder complete() {
            this.isComplete = true;
            this.currentBlockIndex = null;
            return this;
        }

        public Builder speedMs(int speedMs) {
            this.speedMs = speedMs;
            return this;
        }

        public ExecutionState build() {
            return new ExecutionState(this);
        }
    }
}
