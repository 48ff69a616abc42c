package org.dxworks.flowframe.model.recursion;

public class RecursionPattern {
    public PatternType type;
    public double confidence; // 0..1

    public RecursionPattern(PatternType type, double confidence) {
        this.type = type;
        this.confidence = confidence;
    }
}
