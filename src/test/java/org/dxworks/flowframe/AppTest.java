package org.dxworks.flowframe;

import com.fasterxml.jackson.databind.JsonNode;
import org.dxworks.flowframe.analyzer.FlowchartPipeline;
import org.dxworks.flowframe.execution.ExecutionAction;
import org.dxworks.flowframe.execution.ExecutionEngine;
import org.dxworks.flowframe.execution.ExecutionLogEntry;
import org.dxworks.flowframe.execution.ExecutionStatus;
import org.dxworks.flowframe.execution.TickScheduler;
import org.dxworks.flowframe.model.FlowchartAnalysis;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class AppTest {

    @TempDir
    Path tempDir;

    @Test
    void analyzesAFileWithoutTracingByDefault() throws IOException {
        FlowchartAnalysis analysis = App.analyzeFile(TestUtils.samplePath("grades.pseudo"), FlowframeConfig.defaults());

        assertEquals(7, analysis.mainFlow.size());
        assertNull(analysis.trace);

        JsonNode json = App.MAPPER.readTree(App.MAPPER.writeValueAsString(analysis));
        assertEquals("analysis", json.get("kind").asText());
        assertFalse(json.has("trace"));
        assertEquals("implicit-else", json.get("mainFlow").get("blocks").get(4).get("blockType").asText());
        assertTrue(json.get("validation").get("isValid").asBoolean());
    }

    @Test
    void tracesWhenConfigured() throws IOException {
        FlowframeConfig config = FlowframeConfig.with(20000, 500, 3, 10, true, 500, 11L);

        FlowchartAnalysis analysis = App.analyzeFile(TestUtils.samplePath("counter.pseudo"), config);

        assertNotNull(analysis.trace);
        assertEquals("Execution started", analysis.trace.get(0).details);
        assertEquals(ExecutionAction.EXIT, analysis.trace.get(analysis.trace.size() - 1).action);
        String json = App.MAPPER.writeValueAsString(analysis);
        assertTrue(json.contains("\"trace\""));
    }

    @Test
    void byteOrderMarkIsIgnored() throws IOException {
        Path file = tempDir.resolve("bom.pseudo");
        Files.writeString(file, "\uFEFFStart::\nEnd::\n", StandardCharsets.UTF_8);

        FlowchartAnalysis analysis = App.analyzeFile(file, FlowframeConfig.defaults());

        assertEquals("Start", analysis.mainFlow.block(0).content);
        assertTrue(analysis.validation.isValid);
    }

    @Test
    void collectsPseudocodeFilesSortedAndWithinTheLineLimit() throws IOException {
        Files.createDirectories(tempDir.resolve("nested"));
        Files.writeString(tempDir.resolve("b.pseudo"), "Start::\nEnd::\n");
        Files.writeString(tempDir.resolve("nested/a.flow"), "Start::\nEnd::\n");
        Files.writeString(tempDir.resolve("readme.md"), "# not pseudocode\n");
        Files.writeString(tempDir.resolve("long.pcode"), "Start::\nOutput 1::\nOutput 2::\nEnd::\n");

        List<Path> files = App.collectSourceFiles(tempDir, 3);

        assertEquals(List.of(tempDir.resolve("b.pseudo"), tempDir.resolve("nested/a.flow")), files);
    }

    @Test
    void singleFileInputIsCollectedWhenSupported() throws IOException {
        Path file = tempDir.resolve("one.pseudo");
        Files.writeString(file, "Start::\nEnd::\n");
        Path other = tempDir.resolve("one.txt");
        Files.writeString(other, "Start::\n");

        assertEquals(List.of(file), App.collectSourceFiles(file, 100));
        assertTrue(App.collectSourceFiles(other, 100).isEmpty());
    }

    @Test
    void playbackEngineTicksAtTheConfiguredSpeedAndLoopBound() {
        FlowframeConfig config = FlowframeConfig.with(20000, 750, 1, 10, false, 500, 5L);
        FlowchartAnalysis analysis = new FlowchartPipeline().analyze("counter.pseudo", TestUtils.sample("counter.pseudo"));
        List<Long> delays = new ArrayList<>();
        Deque<Runnable> pending = new ArrayDeque<>();
        TickScheduler scheduler = (task, delayMs) -> {
            delays.add(delayMs);
            pending.add(task);
            return () -> pending.remove(task);
        };

        try (ExecutionEngine engine = App.playbackEngine(analysis.mainFlow, config, scheduler)) {
            engine.start();
            assertEquals(750, engine.getState().speedMs);
            for (int i = 0; i < 50 && !pending.isEmpty(); i++) {
                pending.poll().run();
            }

            assertEquals(ExecutionStatus.COMPLETED, engine.getStatus());
            assertTrue(delays.stream().allMatch(d -> d == 750L));
            long iterations = engine.getLog().stream()
                    .map((ExecutionLogEntry e) -> e.details)
                    .filter(d -> d != null && d.startsWith("Iteration"))
                    .count();
            assertEquals(1, iterations);
        }
    }
}
