package org.dxworks.flowframe.model.recursion;

import com.fasterxml.jackson.annotation.JsonValue;

public enum RecursionType {
    LINEAR("linear"),
    TREE("tree"),
    TAIL("tail"),
    MUTUAL("mutual"),
    NESTED("nested"),
    MULTIPLE("multiple");

    private final String name;

    RecursionType(String name) {
        this.name = name;
    }

    @JsonValue
    public String getName() {
        return name;
    }
}
