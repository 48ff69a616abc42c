package org.dxworks.flowframe.model.recursion;

import java.util.ArrayList;
import java.util.List;

public class RecursiveCallPoint {
    public int lineIndex;
    public String content;
    public String calleeName;
    public List<String> parameters = new ArrayList<>();
    public boolean isBaseCase; // the call sits right under a conditional
    public List<ParameterTransformation> parameterTransformations = new ArrayList<>();
}
