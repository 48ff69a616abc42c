package org.dxworks.flowframe.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ConnectionType {
    DEFAULT("default"),
    YES("yes"),
    NO("no"),
    LOOP_BACK("loop-back"),
    CASE("case"),
    RECURSIVE("recursive");

    private final String name;

    ConnectionType(String name) {
        this.name = name;
    }

    @JsonValue
    public String getName() {
        return name;
    }
}
