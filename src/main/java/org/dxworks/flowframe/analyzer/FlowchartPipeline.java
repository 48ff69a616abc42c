package org.dxworks.flowframe.analyzer;

import org.dxworks.flowframe.analyzer.graph.ControlFlowGraphBuilder;
import org.dxworks.flowframe.analyzer.recursion.RecursionAnalyzer;
import org.dxworks.flowframe.analyzer.validation.Validator;
import org.dxworks.flowframe.model.Block;
import org.dxworks.flowframe.model.FlowchartAnalysis;
import org.dxworks.flowframe.model.FunctionDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Full batch analysis of one pseudocode source:
 * extract, classify, synthesize, analyze recursion, build graphs, validate.
 * Every run starts from scratch and shares no state with earlier runs.
 */
public class FlowchartPipeline {

    private static final Logger LOG = LoggerFactory.getLogger(FlowchartPipeline.class);

    private final FunctionExtractor extractor;
    private final ControlFlowGraphBuilder graphBuilder;
    private final Validator validator;

    public FlowchartPipeline() {
        this(new FunctionExtractor(), new ControlFlowGraphBuilder(), new Validator());
    }

    public FlowchartPipeline(FunctionExtractor extractor, ControlFlowGraphBuilder graphBuilder, Validator validator) {
        this.extractor = extractor;
        this.graphBuilder = graphBuilder;
        this.validator = validator;
    }

    public FlowchartAnalysis analyze(String source) {
        return analyze(null, source);
    }

    public FlowchartAnalysis analyze(String filePath, String source) {
        ExtractedProgram program = extractor.extract(source);

        List<Block> mainFlow = ImplicitElseSynthesizer.synthesize(LineClassifier.parse(program.mainFlow));
        mainFlow = RecursionAnalyzer.markRecursiveCalls(mainFlow, program.functions);

        FlowchartAnalysis analysis = new FlowchartAnalysis();
        analysis.filePath = filePath;
        analysis.mainFlow = graphBuilder.build(mainFlow);
        analysis.functions.addAll(program.functions);
        for (FunctionDefinition function : program.functions) {
            analysis.functionGraphs.put(function.name, graphBuilder.build(function.body, function.name));
        }
        analysis.validation = validator.validate(mainFlow, program.functions);

        LOG.debug("Analyzed {}: {} main flow block(s), {} function(s), {} error(s), {} warning(s)",
                filePath == null ? "<source>" : filePath, mainFlow.size(), program.functions.size(),
                analysis.validation.errors.size(), analysis.validation.warnings.size());
        return analysis;
    }
}
