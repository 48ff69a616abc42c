package org.dxworks.flowframe.execution;

import java.util.Collections;
import java.util.Map;

public final class CallStackFrame {
    public final String functionName;
    public final int returnBlockIndex; // -1 when the call is the last block
    public final Map<String, Object> localContext;
    public final int callBlockIndex;

    public CallStackFrame(String functionName, int returnBlockIndex, int callBlockIndex) {
        this(functionName, returnBlockIndex, Collections.emptyMap(), callBlockIndex);
    }

    public CallStackFrame(String functionName, int returnBlockIndex, Map<String, Object> localContext,
                          int callBlockIndex) {
        this.functionName = functionName;
        this.returnBlockIndex = returnBlockIndex;
        this.localContext = Map.copyOf(localContext);
        this.callBlockIndex = callBlockIndex;
    }
}
