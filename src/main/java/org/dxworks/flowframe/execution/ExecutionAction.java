package org.dxworks.flowframe.execution;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ExecutionAction {
    ENTER("enter"),
    EXIT("exit"),
    BRANCH("branch"),
    LOOP("loop"),
    CALL("call"),
    RETURN("return");

    private final String name;

    ExecutionAction(String name) {
        this.name = name;
    }

    @JsonValue
    public String getName() {
        return name;
    }
}
