package org.dxworks.flowframe.analyzer.recursion;

import org.dxworks.flowframe.model.recursion.RecursionPattern;

/**
 * Guesses which well-known algorithm a recursive function implements. Implementations
 * may be keyword heuristics or real static analysis; the rest of the pipeline only sees
 * the returned pattern.
 */
public interface PatternScorer {

    RecursionPattern score(String functionName, String bodyText);
}
