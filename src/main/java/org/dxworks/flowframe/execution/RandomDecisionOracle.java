package org.dxworks.flowframe.execution;

import org.dxworks.flowframe.model.Block;

import java.util.List;
import java.util.Random;

public class RandomDecisionOracle implements DecisionOracle {

    private final Random random;

    public RandomDecisionOracle() {
        this(new Random());
    }

    public RandomDecisionOracle(long seed) {
        this(new Random(seed));
    }

    RandomDecisionOracle(Random random) {
        this.random = random;
    }

    @Override
    public Decision decide(int blockIndex, Block block) {
        return random.nextBoolean() ? Decision.YES : Decision.NO;
    }

    @Override
    public int selectCase(int blockIndex, Block block, List<String> caseLabels) {
        return random.nextInt(caseLabels.size());
    }
}
