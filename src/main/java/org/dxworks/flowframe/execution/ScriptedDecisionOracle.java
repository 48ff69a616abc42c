package org.dxworks.flowframe.execution;

import org.dxworks.flowframe.model.Block;

import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Deque;
import java.util.List;

/** Answers from a fixed script in order, then falls back to a default answer. */
public class ScriptedDecisionOracle implements DecisionOracle {

    private final Deque<Decision> script;
    private final Decision fallback;

    public ScriptedDecisionOracle(Decision... script) {
        this(Arrays.asList(script), Decision.NO);
    }

    public ScriptedDecisionOracle(List<Decision> script, Decision fallback) {
        this.script = new ArrayDeque<>(script);
        this.fallback = fallback;
    }

    @Override
    public synchronized Decision decide(int blockIndex, Block block) {
        Decision next = script.poll();
        return next != null ? next : fallback;
    }

    public synchronized int remaining() {
        return script.size();
    }
}
