package org.dxworks.flowframe.execution;

import org.dxworks.flowframe.model.Block;

/** Always gives the same answer. */
public class FixedDecisionOracle implements DecisionOracle {

    private final Decision decision;

    public FixedDecisionOracle(Decision decision) {
        this.decision = decision;
    }

    @Override
    public Decision decide(int blockIndex, Block block) {
        return decision;
    }
}
