package org.dxworks.flowframe.model.recursion;

import com.fasterxml.jackson.annotation.JsonValue;

public enum TransformationType {
    DECREMENT("decrement"),
    INCREMENT("increment"),
    DIVIDE("divide"),
    MULTIPLY("multiply"),
    PROPERTY_ACCESS("property-access"),
    OTHER("other");

    private final String name;

    TransformationType(String name) {
        this.name = name;
    }

    @JsonValue
    public String getName() {
        return name;
    }
}
