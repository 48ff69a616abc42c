package org.dxworks.flowframe.model.recursion;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ExitType {
    RETURN("return"),
    BREAK("break"),
    CONTINUE("continue"),
    EMPTY("empty");

    private final String name;

    ExitType(String name) {
        this.name = name;
    }

    @JsonValue
    public String getName() {
        return name;
    }
}
