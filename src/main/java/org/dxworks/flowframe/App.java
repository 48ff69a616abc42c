package org.dxworks.flowframe;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.dxworks.flowframe.analyzer.FlowchartPipeline;
import org.dxworks.flowframe.analyzer.FunctionExtractor;
import org.dxworks.flowframe.analyzer.graph.ControlFlowGraphBuilder;
import org.dxworks.flowframe.analyzer.validation.Validator;
import org.dxworks.flowframe.execution.DecisionOracle;
import org.dxworks.flowframe.execution.ExecutionEngine;
import org.dxworks.flowframe.execution.ExecutionMachine;
import org.dxworks.flowframe.execution.ExecutionTracer;
import org.dxworks.flowframe.execution.RandomDecisionOracle;
import org.dxworks.flowframe.execution.TickScheduler;
import org.dxworks.flowframe.model.ControlFlowGraph;
import org.dxworks.flowframe.model.FlowchartAnalysis;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Stream;

public class App {
    static final ObjectMapper MAPPER = new ObjectMapper()
            .setSerializationInclusion(JsonInclude.Include.NON_NULL);

    public static void main(String[] args) throws Exception {
        if (args.length < 2) {
            System.err.println("Usage: java -jar flowframe.jar <input-folder> <output-file>");
            System.err.println("  <input-folder>: Path to a pseudocode file or a directory of them");
            System.err.println("  <output-file>:  Path to output JSONL file");
            System.err.println("Supported extensions: " + String.join(", ", SourceFileDetector.EXTENSIONS));
            System.exit(2);
        }

        Path input = Paths.get(args[0]);
        if (!Files.exists(input)) {
            System.err.println("Error: Input path does not exist: " + input);
            System.exit(1);
        }

        Path jsonlOutput = Paths.get(args[1]);
        if (jsonlOutput.getParent() != null) {
            Files.createDirectories(jsonlOutput.getParent());
        }

        System.out.println("Starting flowchart analysis...");
        System.out.println("Input: " + input.toAbsolutePath());

        FlowframeConfig config = FlowframeConfig.load();
        List<Path> files = collectSourceFiles(input, config.getMaxFileLines());
        System.out.println("Found " + files.size() + " pseudocode files");

        Instant startTime = Instant.now();
        AtomicInteger successCount = new AtomicInteger(0);
        AtomicInteger errorCount = new AtomicInteger(0);
        AtomicInteger progressCounter = new AtomicInteger(0);

        try (BufferedWriter writer = Files.newBufferedWriter(jsonlOutput, StandardCharsets.UTF_8)) {
            Map<String, Object> runInfo = new LinkedHashMap<>();
            runInfo.put("kind", "run");
            runInfo.put("started_at", startTime.toString());
            runInfo.put("input_path", input.toString());
            runInfo.put("total_files", files.size());
            writer.write(MAPPER.writeValueAsString(runInfo));
            writer.newLine();

            files.parallelStream().forEach(file -> {
                int current = progressCounter.incrementAndGet();
                synchronized (System.out) {
                    System.out.println("[" + current + "/" + files.size() + "] Analyzing " + file.getFileName());
                }

                try {
                    FlowchartAnalysis analysis = analyzeFile(file, config);
                    synchronized (writer) {
                        writer.write(MAPPER.writeValueAsString(analysis));
                        writer.newLine();
                        writer.flush();
                    }
                    successCount.incrementAndGet();
                } catch (Exception e) {
                    Map<String, String> error = new LinkedHashMap<>();
                    error.put("kind", "error");
                    error.put("file", file.toString());
                    error.put("error", e.getMessage());

                    try {
                        synchronized (writer) {
                            writer.write(MAPPER.writeValueAsString(error));
                            writer.newLine();
                            writer.flush();
                        }
                    } catch (IOException ioException) {
                        System.err.println("Failed to write error for " + file + ": " + ioException.getMessage());
                    }

                    errorCount.incrementAndGet();
                    synchronized (System.err) {
                        System.err.println("  Error analyzing " + file.getFileName() + ": " + e.getMessage());
                    }
                }
            });

            Instant endTime = Instant.now();
            Map<String, Object> doneInfo = new LinkedHashMap<>();
            doneInfo.put("kind", "done");
            doneInfo.put("ended_at", endTime.toString());
            doneInfo.put("files_analyzed", successCount.get());
            doneInfo.put("files_with_errors", errorCount.get());
            doneInfo.put("duration_seconds", Duration.between(startTime, endTime).getSeconds());
            writer.write(MAPPER.writeValueAsString(doneInfo));
            writer.newLine();
        }

        System.out.println("\n" + "=".repeat(60));
        System.out.println("Analysis complete!");
        System.out.println("Successfully analyzed: " + successCount.get() + " files");
        if (errorCount.get() > 0) {
            System.out.println("Errors: " + errorCount.get());
        }
        System.out.println("Output written to: " + jsonlOutput.toAbsolutePath());
        System.out.println("=".repeat(60));
    }

    static List<Path> collectSourceFiles(Path input, int maxFileLines) throws IOException {
        List<Path> files = new ArrayList<>();

        if (Files.isDirectory(input)) {
            try (Stream<Path> stream = Files.walk(input)) {
                stream.filter(Files::isRegularFile)
                      .filter(SourceFileDetector::isPseudocode)
                      .filter(p -> withinMaxLines(p, maxFileLines))
                      .sorted()
                      .forEach(files::add);
            }
        } else if (Files.isRegularFile(input)) {
            if (SourceFileDetector.isPseudocode(input) && withinMaxLines(input, maxFileLines)) {
                files.add(input);
            }
        }

        return files;
    }

    private static boolean withinMaxLines(Path path, int maxFileLines) {
        try (Stream<String> lines = Files.lines(path)) {
            long count = lines.limit((long) maxFileLines + 1L).count();
            return count <= maxFileLines;
        } catch (IOException e) {
            return true;
        }
    }

    public static FlowchartAnalysis analyzeFile(Path filePath, FlowframeConfig config) throws IOException {
        String source = Files.readString(filePath, StandardCharsets.UTF_8);

        // Remove BOM if present
        if (source.startsWith("\uFEFF")) {
            source = source.substring(1);
        }

        FlowchartPipeline pipeline = new FlowchartPipeline(new FunctionExtractor(), new ControlFlowGraphBuilder(),
                new Validator(config.getLoopExitWindow()));
        FlowchartAnalysis analysis = pipeline.analyze(filePath.toString(), source);

        if (config.isTraceExecution()) {
            analysis.trace = new ExecutionTracer(config.getLoopIterationLimit(), config.getMaxTraceTicks())
                    .trace(analysis.mainFlow, decisionOracle(config));
        }
        return analysis;
    }

    /**
     * Playback engine for a graph, set up from the configuration: tick interval, loop
     * bound and decision seed. The caller owns the scheduler.
     */
    public static ExecutionEngine playbackEngine(ControlFlowGraph graph, FlowframeConfig config,
                                                 TickScheduler scheduler) {
        ExecutionMachine machine = new ExecutionMachine(graph, decisionOracle(config),
                config.getLoopIterationLimit(), Clock.systemUTC());
        return new ExecutionEngine(machine, scheduler, config.getExecutionSpeedMs());
    }

    static DecisionOracle decisionOracle(FlowframeConfig config) {
        return config.getDecisionSeed() != null
                ? new RandomDecisionOracle(config.getDecisionSeed())
                : new RandomDecisionOracle();
    }
}
