package org.dxworks.flowframe.execution;

import org.dxworks.flowframe.model.Block;

import java.util.List;

/**
 * Decides which way a decision goes during simulation. Conditions are not evaluated, so
 * any answer is legal; implementations range from random to scripted.
 */
public interface DecisionOracle {

    Decision decide(int blockIndex, Block block);

    /** Index into {@code caseLabels} of the case a {@code switch} takes. */
    default int selectCase(int blockIndex, Block block, List<String> caseLabels) {
        return decide(blockIndex, block) == Decision.YES ? 0 : caseLabels.size() - 1;
    }
}
