package org.dxworks.flowframe.model;

import org.dxworks.flowframe.model.recursion.RecursionMetadata;

import java.util.List;

public final class FunctionDefinition {
    public final String name;
    public final List<String> parameters;
    public final List<Block> body; // parameter blocks first, then the classified body
    public final RecursionMetadata recursion;

    public FunctionDefinition(String name, List<String> parameters, List<Block> body, RecursionMetadata recursion) {
        this.name = name;
        this.parameters = List.copyOf(parameters);
        this.body = List.copyOf(body);
        this.recursion = recursion;
    }

    public boolean recursive() {
        return recursion != null && recursion.isRecursive;
    }
}
