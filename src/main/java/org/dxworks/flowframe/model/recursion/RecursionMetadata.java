package org.dxworks.flowframe.model.recursion;

import java.util.ArrayList;
import java.util.List;

public class RecursionMetadata {
    public boolean isRecursive;
    public RecursionType recursionType; // null when the function is not recursive
    public List<RecursiveCallPoint> callPoints = new ArrayList<>();
    public RecursionPattern pattern;
    public List<BaseCase> baseCases = new ArrayList<>();
    public List<RecursiveCase> recursiveCases = new ArrayList<>();
    public Integer maxDepthHint;
    public String depthCalculation; // e.g. "n", "log(n)"
}
