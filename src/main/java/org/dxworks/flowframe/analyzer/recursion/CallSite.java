package org.dxworks.flowframe.analyzer.recursion;

import java.util.List;

/** One invocation found in a line of text. */
public final class CallSite {
    public final String calleeName;
    public final String expression; // e.g. "factorial(n-1)"
    public final List<String> arguments;
    public final int start;
    public final int end; // exclusive

    CallSite(String calleeName, String expression, List<String> arguments, int start, int end) {
        this.calleeName = calleeName;
        this.expression = expression;
        this.arguments = List.copyOf(arguments);
        this.start = start;
        this.end = end;
    }
}
