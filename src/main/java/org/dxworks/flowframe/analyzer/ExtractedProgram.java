package org.dxworks.flowframe.analyzer;

import org.dxworks.flowframe.model.FunctionDefinition;

import java.util.List;

/** A program split into the lines of its main flow and its function definitions. */
public final class ExtractedProgram {
    public final List<String> mainFlow;
    public final List<FunctionDefinition> functions;

    public ExtractedProgram(List<String> mainFlow, List<FunctionDefinition> functions) {
        this.mainFlow = List.copyOf(mainFlow);
        this.functions = List.copyOf(functions);
    }
}
