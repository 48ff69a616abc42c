package org.dxworks.flowframe.analyzer.recursion;

import org.dxworks.flowframe.analyzer.LineClassifier;
import org.dxworks.flowframe.analyzer.StructureScanner;
import org.dxworks.flowframe.model.Block;
import org.dxworks.flowframe.model.BlockType;
import org.dxworks.flowframe.model.recursion.BaseCase;
import org.dxworks.flowframe.model.recursion.CaseOperation;
import org.dxworks.flowframe.model.recursion.ExitType;
import org.dxworks.flowframe.model.recursion.RecursiveCallPoint;
import org.dxworks.flowframe.model.recursion.RecursiveCase;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits a function body into base cases and recursive cases by walking its conditional
 * branches. A branch that holds a call point is a recursive case; otherwise a branch that
 * exits (return, break, continue) is a base case.
 */
final class CaseExtractor {

    private static final Pattern IF_PREFIX = Pattern.compile("(?i)^(?:else\\s*if|elif|if)\\s+");
    private static final Pattern THEN_SUFFIX = Pattern.compile("(?i)\\s+then$");
    private static final Pattern COMPARISON = Pattern.compile(
            "(?i)^(.*?)\\s*(==|!=|<=|>=|<|>|\\bis\\s+not\\b|\\bis\\b|=)\\s*(.+)$");
    private static final Pattern RETURN_VALUE = Pattern.compile("(?i)^return\\b\\s*(.*)$");
    private static final Pattern BREAK = Pattern.compile("(?i)^break\\b");
    private static final Pattern CONTINUE = Pattern.compile("(?i)^continue\\b");

    private final List<String> contents;
    private final List<BlockType> types;
    private final List<Integer> widths;
    private final Set<Integer> unmarkedOpeners = new HashSet<>();
    private final Map<Integer, List<RecursiveCallPoint>> callsByLine = new TreeMap<>();
    private final List<BaseCase> baseCases = new ArrayList<>();
    private final List<RecursiveCase> recursiveCases = new ArrayList<>();

    private CaseExtractor(List<String> lines, List<RecursiveCallPoint> callPoints) {
        this.contents = new ArrayList<>();
        this.types = new ArrayList<>();
        this.widths = new ArrayList<>();
        List<String> kept = new ArrayList<>();
        List<Integer> keptLines = new ArrayList<>();
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i) == null ? "" : lines.get(i);
            String content = LineClassifier.stripTerminator(line);
            contents.add(content);
            types.add(content.isEmpty() ? BlockType.COMMENT : LineClassifier.detectBlockType(content));
            widths.add(LineClassifier.indentWidth(line));
            if (!content.isEmpty()) {
                kept.add(line);
                keptLines.add(i);
            }
        }
        findUnmarkedOpeners(kept, keptLines);
        for (RecursiveCallPoint point : callPoints) {
            callsByLine.computeIfAbsent(point.lineIndex, k -> new ArrayList<>()).add(point);
        }
    }

    static CaseExtractor extract(List<String> lines, List<RecursiveCallPoint> callPoints) {
        CaseExtractor extractor = new CaseExtractor(lines, callPoints);
        extractor.scan();
        return extractor;
    }

    List<BaseCase> baseCases() {
        return baseCases;
    }

    List<RecursiveCase> recursiveCases() {
        return recursiveCases;
    }

    private void scan() {
        Deque<Branch> open = new ArrayDeque<>();

        for (int i = 0; i < contents.size(); i++) {
            String content = contents.get(i);
            if (content.isEmpty()) continue;
            BlockType type = types.get(i);
            boolean closing = LineClassifier.isClosing(content);
            boolean continuation = type == BlockType.ELSE_IF
                    || (type == BlockType.CONDITION && closing)
                    || isConditionalEnd(content, type);

            // branches without an end marker stop where indentation leaves them
            while (!open.isEmpty() && open.peek().closesByIndent) {
                Branch top = open.peek();
                int width = widths.get(i);
                if (width > top.width || (width == top.width && continuation)) break;
                flush(open.pop());
            }

            if (type == BlockType.CONDITION && !closing) {
                open.push(new Branch(conditionText(content), widths.get(i), unmarkedOpeners.contains(i)));
            } else if (type == BlockType.ELSE_IF && !open.isEmpty()) {
                Branch previous = open.pop();
                flush(previous);
                open.push(previous.sibling(conditionText(content)));
            } else if (type == BlockType.CONDITION && !open.isEmpty()) {
                Branch previous = open.pop();
                flush(previous);
                open.push(previous.sibling("NOT (" + previous.condition + ")"));
            } else if (isConditionalEnd(content, type) && !open.isEmpty()) {
                flush(open.pop());
            } else if (open.isEmpty()) {
                standalone(i);
            } else {
                open.peek().lines.add(i);
            }
        }

        while (!open.isEmpty()) {
            flush(open.pop());
        }
    }

    /** Raw line indices of the {@code if}s whose decision has no end marker of its own. */
    private void findUnmarkedOpeners(List<String> kept, List<Integer> keptLines) {
        List<Block> blocks = LineClassifier.parse(kept);
        for (int k = 0; k < blocks.size(); k++) {
            if (blocks.get(k).opensConditional()
                    && StructureScanner.findEnd(blocks, k).kind != StructureScanner.BoundaryKind.END_MARKER) {
                unmarkedOpeners.add(keptLines.get(k));
            }
        }
    }

    private void flush(Branch branch) {
        List<RecursiveCallPoint> calls = new ArrayList<>();
        int callLine = -1;
        for (int line : branch.lines) {
            List<RecursiveCallPoint> onLine = callsByLine.get(line);
            if (onLine != null) {
                if (callLine < 0) callLine = line;
                calls.addAll(onLine);
            }
        }

        if (!calls.isEmpty()) {
            recursiveCases.add(recursiveCase(callLine, calls));
            return;
        }

        for (int line : branch.lines) {
            ExitType exit = exitType(contents.get(line));
            if (exit != null) {
                baseCases.add(baseCase(branch.condition, line, exit));
                return;
            }
        }
    }

    private void standalone(int line) {
        List<RecursiveCallPoint> calls = callsByLine.get(line);
        if (calls != null) {
            recursiveCases.add(recursiveCase(line, calls));
        } else if (types.get(line) == BlockType.RETURN) {
            baseCases.add(baseCase("", line, exitType(contents.get(line))));
        }
    }

    private RecursiveCase recursiveCase(int line, List<RecursiveCallPoint> calls) {
        RecursiveCallPoint first = calls.get(0);
        RecursiveCase rc = new RecursiveCase();
        rc.callExpression = first.content;
        rc.parameters.addAll(first.parameters);
        for (RecursiveCallPoint call : calls) {
            rc.transformations.addAll(call.parameterTransformations);
        }
        rc.operation = inferOperation(contents.get(line), calls.size());
        rc.operationDescription = contents.get(line);
        return rc;
    }

    private BaseCase baseCase(String condition, int line, ExitType exit) {
        BaseCase bc = new BaseCase();
        bc.condition = condition;
        bc.exitType = exit;

        Matcher rv = RETURN_VALUE.matcher(contents.get(line));
        if (rv.matches() && !rv.group(1).trim().isEmpty()) {
            bc.returnValue = rv.group(1).trim();
        }

        Matcher cmp = COMPARISON.matcher(condition);
        if (!condition.startsWith("NOT (") && cmp.matches()) {
            String operator = cmp.group(2).toLowerCase(Locale.ROOT).replaceAll("\\s+", " ");
            bc.comparisonOperator = "=".equals(operator) ? "==" : operator;
            bc.comparisonValue = cmp.group(3).trim();
        }
        return bc;
    }

    /**
     * The arithmetic left on a call line once the calls themselves are removed decides how
     * the recursive results are combined.
     */
    static CaseOperation inferOperation(String content, int callCount) {
        String residue = RETURN_VALUE.matcher(content).replaceFirst("$1");
        residue = residue.replaceAll("(?i)\\b(?:call|invoke|execute)\\s+\\w+\\s*(\\([^()]*(\\([^()]*\\)[^()]*)*\\))?", " ")
                .replaceAll("\\w+\\s*\\([^()]*(\\([^()]*\\)[^()]*)*\\)", " ");
        if (residue.contains("*")) return CaseOperation.MULTIPLY;
        if (residue.contains("+")) return CaseOperation.ADD;
        if (callCount > 1) return CaseOperation.COMBINE;
        if (residue.matches(".*[-/%].*")) return CaseOperation.OTHER;
        return CaseOperation.SINGLE;
    }

    static ExitType exitType(String content) {
        Matcher rv = RETURN_VALUE.matcher(content);
        if (rv.matches()) {
            return rv.group(1).trim().isEmpty() ? ExitType.EMPTY : ExitType.RETURN;
        }
        if (BREAK.matcher(content).find()) return ExitType.BREAK;
        if (CONTINUE.matcher(content).find()) return ExitType.CONTINUE;
        return null;
    }

    static String conditionText(String content) {
        String text = IF_PREFIX.matcher(content.trim()).replaceFirst("");
        return THEN_SUFFIX.matcher(text).replaceFirst("").trim();
    }

    private static boolean isConditionalEnd(String content, BlockType type) {
        return StructureScanner.closesConstruct(new Block(content, 0, type, true));
    }

    private static final class Branch {
        final String condition;
        final int width;
        final boolean closesByIndent;
        final List<Integer> lines = new ArrayList<>();

        Branch(String condition, int width, boolean closesByIndent) {
            this.condition = condition;
            this.width = width;
            this.closesByIndent = closesByIndent;
        }

        Branch sibling(String siblingCondition) {
            return new Branch(siblingCondition, width, closesByIndent);
        }
    }
}
