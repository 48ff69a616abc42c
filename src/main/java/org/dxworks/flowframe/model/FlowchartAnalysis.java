package org.dxworks.flowframe.model;

import org.dxworks.flowframe.execution.ExecutionLogEntry;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Everything derived from one pseudocode source: the main flow graph, the extracted
 * functions with their own graphs, and the diagnostics.
 */
public class FlowchartAnalysis {
    public String kind = "analysis";
    public String filePath;
    public ControlFlowGraph mainFlow;
    public List<FunctionDefinition> functions = new ArrayList<>();
    public Map<String, ControlFlowGraph> functionGraphs = new LinkedHashMap<>();
    public ValidationResult validation;
    public List<ExecutionLogEntry> trace; // only when tracing is enabled
}
