package org.dxworks.flowframe.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Optional;

public enum BlockType {
    START("start"),
    END("end"),
    PROCESS("process"),
    CONDITION("condition"),
    ELSE_IF("else-if"),
    SWITCH("switch"),
    CASE("case"),
    LOOP("loop"),
    INPUT("input"),
    OUTPUT("output"),
    FUNCTION("function"),
    FUNCTION_DEF("function-def"),
    RETURN("return"),
    COMMENT("comment"),
    CONNECTOR("connector"),
    IMPLICIT_ELSE("implicit-else");

    private final String name;

    BlockType(String name) {
        this.name = name;
    }

    @JsonValue
    public String getName() {
        return name;
    }

    public static Optional<BlockType> fromName(String name) {
        for (BlockType type : values()) {
            if (type.name.equalsIgnoreCase(name)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
