package org.dxworks.flowframe;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.dxworks.flowframe.analyzer.validation.Validator;
import org.dxworks.flowframe.execution.ExecutionMachine;
import org.dxworks.flowframe.execution.ExecutionState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

public class FlowframeConfig {

    private static final Logger LOG = LoggerFactory.getLogger(FlowframeConfig.class);

    static final String CONFIG_FILE_NAME = "flowframe-config.yml";

    private static final int DEFAULT_MAX_FILE_LINES = 20000;
    private static final int DEFAULT_MAX_TRACE_TICKS = 500;

    private final int maxFileLines;
    private final int executionSpeedMs;
    private final int loopIterationLimit;
    private final int loopExitWindow;
    private final boolean traceExecution;
    private final int maxTraceTicks;
    private final Long decisionSeed;

    private FlowframeConfig(int maxFileLines, int executionSpeedMs, int loopIterationLimit, int loopExitWindow,
                            boolean traceExecution, int maxTraceTicks, Long decisionSeed) {
        this.maxFileLines = maxFileLines;
        this.executionSpeedMs = executionSpeedMs;
        this.loopIterationLimit = loopIterationLimit;
        this.loopExitWindow = loopExitWindow;
        this.traceExecution = traceExecution;
        this.maxTraceTicks = maxTraceTicks;
        this.decisionSeed = decisionSeed;
    }

    public int getMaxFileLines() {
        return maxFileLines;
    }

    public int getExecutionSpeedMs() {
        return executionSpeedMs;
    }

    public int getLoopIterationLimit() {
        return loopIterationLimit;
    }

    public int getLoopExitWindow() {
        return loopExitWindow;
    }

    public boolean isTraceExecution() {
        return traceExecution;
    }

    public int getMaxTraceTicks() {
        return maxTraceTicks;
    }

    /** Seed for the random decision oracle; {@code null} means unseeded. */
    public Long getDecisionSeed() {
        return decisionSeed;
    }

    public static FlowframeConfig defaults() {
        return with(DEFAULT_MAX_FILE_LINES, ExecutionState.DEFAULT_SPEED_MS, ExecutionMachine.DEFAULT_LOOP_LIMIT,
                Validator.DEFAULT_LOOP_EXIT_WINDOW, false, DEFAULT_MAX_TRACE_TICKS, null);
    }

    public static FlowframeConfig load() {
        return load(Paths.get(CONFIG_FILE_NAME));
    }

    public static FlowframeConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            return defaults();
        }

        try {
            ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
            YamlConfig yaml = yamlMapper.readValue(configPath.toFile(), YamlConfig.class);
            if (yaml != null) {
                FlowframeConfig d = defaults();
                return with(
                        positiveOr(yaml.maxFileLines, d.maxFileLines),
                        positiveOr(yaml.executionSpeedMs, d.executionSpeedMs),
                        positiveOr(yaml.loopIterationLimit, d.loopIterationLimit),
                        positiveOr(yaml.loopExitWindow, d.loopExitWindow),
                        yaml.traceExecution != null ? yaml.traceExecution : d.traceExecution,
                        positiveOr(yaml.maxTraceTicks, d.maxTraceTicks),
                        yaml.decisionSeed);
            }
        } catch (IOException e) {
            LOG.warn("Could not read {}, using defaults: {}", configPath, e.getMessage());
        }

        return defaults();
    }

    public static FlowframeConfig with(int maxFileLines, int executionSpeedMs, int loopIterationLimit,
                                       int loopExitWindow, boolean traceExecution, int maxTraceTicks,
                                       Long decisionSeed) {
        return new FlowframeConfig(
                maxFileLines > 0 ? maxFileLines : DEFAULT_MAX_FILE_LINES,
                ExecutionState.clampSpeed(executionSpeedMs),
                loopIterationLimit > 0 ? loopIterationLimit : ExecutionMachine.DEFAULT_LOOP_LIMIT,
                loopExitWindow > 0 ? loopExitWindow : Validator.DEFAULT_LOOP_EXIT_WINDOW,
                traceExecution,
                maxTraceTicks > 0 ? maxTraceTicks : DEFAULT_MAX_TRACE_TICKS,
                decisionSeed);
    }

    private static int positiveOr(Integer value, int fallback) {
        return value != null && value > 0 ? value : fallback;
    }

    private static class YamlConfig {
        public Integer maxFileLines;
        public Integer executionSpeedMs;
        public Integer loopIterationLimit;
        public Integer loopExitWindow;
        public Boolean traceExecution;
        public Integer maxTraceTicks;
        public Long decisionSeed;
    }
}
