package org.dxworks.flowframe.model.recursion;

import java.util.ArrayList;
import java.util.List;

public class RecursiveCase {
    public String callExpression;
    public List<String> parameters = new ArrayList<>();
    public List<ParameterTransformation> transformations = new ArrayList<>();
    public CaseOperation operation;
    public String operationDescription; // e.g. "Return n * call factorial(n-1)"
}
