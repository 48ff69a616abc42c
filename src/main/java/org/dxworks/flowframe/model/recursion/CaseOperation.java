package org.dxworks.flowframe.model.recursion;

import com.fasterxml.jackson.annotation.JsonValue;

public enum CaseOperation {
    SINGLE("single"),
    ADD("add"),
    MULTIPLY("multiply"),
    COMBINE("combine"),
    OTHER("other");

    private final String name;

    CaseOperation(String name) {
        this.name = name;
    }

    @JsonValue
    public String getName() {
        return name;
    }
}
