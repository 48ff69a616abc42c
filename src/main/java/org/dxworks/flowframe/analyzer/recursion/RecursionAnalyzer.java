package org.dxworks.flowframe.analyzer.recursion;

import org.dxworks.flowframe.analyzer.LineClassifier;
import org.dxworks.flowframe.analyzer.StructureScanner;
import org.dxworks.flowframe.model.Block;
import org.dxworks.flowframe.model.BlockType;
import org.dxworks.flowframe.model.FunctionDefinition;
import org.dxworks.flowframe.model.recursion.BaseCase;
import org.dxworks.flowframe.model.recursion.CaseOperation;
import org.dxworks.flowframe.model.recursion.PatternType;
import org.dxworks.flowframe.model.recursion.RecursionMetadata;
import org.dxworks.flowframe.model.recursion.RecursionType;
import org.dxworks.flowframe.model.recursion.RecursiveCallPoint;
import org.dxworks.flowframe.model.recursion.TransformationType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Derives {@link RecursionMetadata} for one function from its raw body lines.
 *
 * <p>Self calls and calls to functions in the same call cycle are call points. The
 * function is recursive exactly when it has at least one.</p>
 */
public class RecursionAnalyzer {

    private static final Logger LOG = LoggerFactory.getLogger(RecursionAnalyzer.class);

    static final int CONDITION_LOOKBEHIND = 3;
    static final int LINEAR_DEPTH_MARGIN = 5;
    static final int LOGARITHMIC_DEPTH = 10;

    private static final Set<PatternType> TREE_PATTERNS = EnumSet.of(
            PatternType.TREE_TRAVERSAL, PatternType.FIBONACCI, PatternType.MERGE_SORT, PatternType.QUICK_SORT);

    private final PatternScorer scorer;

    public RecursionAnalyzer() {
        this(new KeywordPatternScorer());
    }

    public RecursionAnalyzer(PatternScorer scorer) {
        this.scorer = scorer;
    }

    public RecursionMetadata analyze(String name, List<String> parameters, List<String> bodyLines) {
        return analyze(name, parameters, bodyLines, Collections.emptySet());
    }

    /**
     * @param cycleMembers other functions that can call back into {@code name}; calls to
     *                     them count as (mutual) recursion
     */
    public RecursionMetadata analyze(String name, List<String> parameters, List<String> bodyLines,
                                     Set<String> cycleMembers) {
        RecursionMetadata metadata = new RecursionMetadata();
        metadata.callPoints.addAll(findCallPoints(name, parameters, bodyLines, cycleMembers));
        metadata.isRecursive = !metadata.callPoints.isEmpty();
        if (!metadata.isRecursive) {
            return metadata;
        }

        metadata.pattern = scorer.score(name, String.join("\n", bodyLines));

        CaseExtractor cases = CaseExtractor.extract(bodyLines, metadata.callPoints);
        metadata.baseCases.addAll(cases.baseCases());
        metadata.recursiveCases.addAll(cases.recursiveCases());

        metadata.recursionType = classify(name, bodyLines, metadata);
        estimateDepth(metadata);

        LOG.debug("Function '{}' is {} recursive ({} call point(s), pattern {})", name,
                metadata.recursionType.getName(), metadata.callPoints.size(), metadata.pattern.type.getName());
        return metadata;
    }

    /** For every function, the other functions it reaches that also reach it back. */
    public static Map<String, Set<String>> callCycles(Map<String, List<String>> bodies) {
        Map<String, Set<String>> callees = new LinkedHashMap<>();
        for (Map.Entry<String, List<String>> entry : bodies.entrySet()) {
            Set<String> direct = new LinkedHashSet<>();
            for (String other : bodies.keySet()) {
                if (other.equals(entry.getKey())) continue;
                for (String line : entry.getValue()) {
                    if (CallSiteParser.invokes(line, other)) {
                        direct.add(other);
                        break;
                    }
                }
            }
            callees.put(entry.getKey(), direct);
        }

        Map<String, Set<String>> cycles = new LinkedHashMap<>();
        for (String function : bodies.keySet()) {
            Set<String> members = new LinkedHashSet<>();
            for (String other : reachable(function, callees)) {
                if (!other.equals(function) && reachable(other, callees).contains(function)) {
                    members.add(other);
                }
            }
            cycles.put(function, members);
        }
        return cycles;
    }

    /** Tags the blocks that invoke one of the recursive functions. */
    public static List<Block> markRecursiveCalls(List<Block> blocks, List<FunctionDefinition> functions) {
        List<String> recursive = new ArrayList<>();
        for (FunctionDefinition f : functions) {
            if (f.recursive()) recursive.add(f.name);
        }
        if (recursive.isEmpty()) return blocks;

        List<Block> result = new ArrayList<>(blocks.size());
        for (Block block : blocks) {
            boolean calls = block.blockType != BlockType.COMMENT
                    && block.blockType != BlockType.FUNCTION_DEF
                    && recursive.stream().anyMatch(name -> CallSiteParser.invokes(block.content, name));
            result.add(calls ? block.withRecursiveCall(true) : block);
        }
        return Collections.unmodifiableList(result);
    }

    private List<RecursiveCallPoint> findCallPoints(String name, List<String> parameters, List<String> lines,
                                                    Set<String> cycleMembers) {
        List<String> targets = new ArrayList<>();
        targets.add(name);
        targets.addAll(cycleMembers);

        List<RecursiveCallPoint> points = new ArrayList<>();
        for (int i = 0; i < lines.size(); i++) {
            String content = LineClassifier.stripTerminator(lines.get(i));
            if (content.isEmpty() || LineClassifier.detectBlockType(content) == BlockType.COMMENT) continue;

            List<CallSite> sites = new ArrayList<>();
            for (String target : targets) {
                sites.addAll(CallSiteParser.findCalls(content, target));
            }
            sites.sort((a, b) -> Integer.compare(a.start, b.start));

            for (CallSite site : sites) {
                RecursiveCallPoint point = new RecursiveCallPoint();
                point.lineIndex = i;
                point.content = site.expression;
                point.calleeName = site.calleeName;
                point.parameters.addAll(site.arguments);
                point.isBaseCase = nearCondition(lines, i);
                point.parameterTransformations.addAll(TransformationClassifier.classifyAll(site.arguments, parameters));
                points.add(point);
            }
        }
        return points;
    }

    private RecursionType classify(String name, List<String> lines, RecursionMetadata metadata) {
        List<RecursiveCallPoint> selfCalls = new ArrayList<>();
        for (RecursiveCallPoint point : metadata.callPoints) {
            if (!point.calleeName.equalsIgnoreCase(name)) return RecursionType.MUTUAL;
            selfCalls.add(point);
        }

        for (RecursiveCallPoint point : selfCalls) {
            if (hasNestedSelfCall(LineClassifier.stripTerminator(lines.get(point.lineIndex)), name)) {
                return RecursionType.NESTED;
            }
        }

        if (selfCalls.size() > 1) {
            boolean treeSignal = TREE_PATTERNS.contains(metadata.pattern.type)
                    || selfCalls.stream()
                    .flatMap(p -> p.parameterTransformations.stream())
                    .map(t -> t.transformationType)
                    .anyMatch(t -> t == TransformationType.PROPERTY_ACCESS);
            return treeSignal ? RecursionType.TREE : RecursionType.MULTIPLE;
        }

        RecursiveCallPoint only = selfCalls.get(0);
        int last = lastStatement(lines);
        if (only.lineIndex == last
                && CaseExtractor.inferOperation(LineClassifier.stripTerminator(lines.get(last)), 1) == CaseOperation.SINGLE) {
            return RecursionType.TAIL;
        }
        return RecursionType.LINEAR;
    }

    private static void estimateDepth(RecursionMetadata metadata) {
        switch (metadata.pattern.type) {
            case FACTORIAL:
            case FIBONACCI:
                metadata.depthCalculation = "n";
                for (BaseCase bc : metadata.baseCases) {
                    Integer value = parseInt(bc.comparisonValue);
                    if (value != null) {
                        metadata.maxDepthHint = value + LINEAR_DEPTH_MARGIN;
                        break;
                    }
                }
                break;
            case TREE_TRAVERSAL:
            case BINARY_SEARCH:
                metadata.maxDepthHint = LOGARITHMIC_DEPTH;
                metadata.depthCalculation = "log(n)";
                break;
            default:
                break;
        }
    }

    /** A self call passed as an argument of another self call, as in {@code f(f(n-1))}. */
    private static boolean hasNestedSelfCall(String content, String self) {
        List<CallSite> sites = CallSiteParser.findCalls(content, self);
        for (CallSite inner : sites) {
            for (CallSite outer : sites) {
                if (outer != inner && outer.start < inner.start && inner.end <= outer.end) {
                    return true;
                }
            }
        }
        return false;
    }

    private static boolean nearCondition(List<String> lines, int index) {
        for (int j = index; j >= 0 && j >= index - CONDITION_LOOKBEHIND; j--) {
            String content = LineClassifier.stripTerminator(lines.get(j));
            if (content.isEmpty()) continue;
            BlockType type = LineClassifier.detectBlockType(content);
            if ((type == BlockType.CONDITION && !LineClassifier.isClosing(content)) || type == BlockType.ELSE_IF) {
                return true;
            }
        }
        return false;
    }

    private static int lastStatement(List<String> lines) {
        for (int i = lines.size() - 1; i >= 0; i--) {
            String content = LineClassifier.stripTerminator(lines.get(i));
            if (content.isEmpty()) continue;
            Block block = new Block(content, 0, LineClassifier.detectBlockType(content), LineClassifier.isClosing(content));
            if (block.blockType == BlockType.COMMENT || StructureScanner.closesConstruct(block)
                    || StructureScanner.closesLoop(block)) {
                continue;
            }
            return i;
        }
        return -1;
    }

    private static Set<String> reachable(String from, Map<String, Set<String>> callees) {
        Set<String> seen = new LinkedHashSet<>();
        Deque<String> queue = new ArrayDeque<>(callees.getOrDefault(from, Collections.emptySet()));
        while (!queue.isEmpty()) {
            String next = queue.poll();
            if (seen.add(next)) {
                queue.addAll(callees.getOrDefault(next, Collections.emptySet()));
            }
        }
        return seen;
    }

    private static Integer parseInt(String value) {
        if (value == null) return null;
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
