package org.dxworks.flowframe.analyzer;

import org.dxworks.flowframe.analyzer.recursion.CallTextUtils;
import org.dxworks.flowframe.analyzer.recursion.RecursionAnalyzer;
import org.dxworks.flowframe.model.Block;
import org.dxworks.flowframe.model.BlockType;
import org.dxworks.flowframe.model.FunctionDefinition;
import org.dxworks.flowframe.model.recursion.RecursionMetadata;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits a program into its main flow and its function definitions.
 *
 * <p>A function starts at a header such as {@code Function factorial(n)::} and owns every
 * following line indented at least as deep as its first body line. Functions do not nest.
 * An {@code End function} marker at the header's indentation is consumed with the body.
 * All headers are collected before any body is analyzed so calls between functions can
 * be resolved.</p>
 */
public class FunctionExtractor {

    private static final Logger LOG = LoggerFactory.getLogger(FunctionExtractor.class);

    static final Pattern HEADER = Pattern.compile("(?i)^(function|procedure|def)\\s+(\\w+)\\s*\\(([^)]*)\\)\\s*::$");
    private static final Pattern END_FUNCTION = Pattern.compile("(?i)^end\\s*(?:function|procedure)\\b.*$");

    public static final String PARAMETER_PREFIX = "Parameter: ";

    private final RecursionAnalyzer recursionAnalyzer;

    public FunctionExtractor() {
        this(new RecursionAnalyzer());
    }

    public FunctionExtractor(RecursionAnalyzer recursionAnalyzer) {
        this.recursionAnalyzer = recursionAnalyzer;
    }

    public ExtractedProgram extract(String source) {
        if (source == null || source.isEmpty()) {
            return new ExtractedProgram(Collections.emptyList(), Collections.emptyList());
        }
        return extract(Arrays.asList(source.split("\r?\n")));
    }

    public ExtractedProgram extract(List<String> lines) {
        List<String> mainFlow = new ArrayList<>();
        List<RawFunction> raw = new ArrayList<>();

        int i = 0;
        while (i < lines.size()) {
            String line = lines.get(i);
            Matcher m = HEADER.matcher(line.trim());
            if (!m.matches()) {
                mainFlow.add(line);
                i++;
                continue;
            }

            RawFunction function = new RawFunction(m.group(2), parseParameters(m.group(3)));
            i = captureBody(lines, i, function.body);
            raw.add(function);
        }

        Map<String, List<String>> bodies = new LinkedHashMap<>();
        for (RawFunction f : raw) {
            bodies.put(f.name, f.body);
        }
        Map<String, Set<String>> cycles = RecursionAnalyzer.callCycles(bodies);

        List<FunctionDefinition> functions = new ArrayList<>();
        for (RawFunction f : raw) {
            functions.add(analyze(f, cycles.getOrDefault(f.name, Collections.emptySet())));
        }

        LOG.debug("Extracted {} function(s), {} main flow line(s)", functions.size(), mainFlow.size());
        return new ExtractedProgram(mainFlow, functions);
    }

    private FunctionDefinition analyze(RawFunction f, Set<String> cycleMembers) {
        List<Block> body = new ArrayList<>();
        for (String parameter : f.parameters) {
            body.add(new Block(PARAMETER_PREFIX + parameter, 0, BlockType.INPUT, false));
        }
        body.addAll(ImplicitElseSynthesizer.synthesize(LineClassifier.parse(f.body)));

        RecursionMetadata recursion = recursionAnalyzer.analyze(f.name, f.parameters, f.body, cycleMembers);
        return new FunctionDefinition(f.name, f.parameters, body, recursion);
    }

    /** Collects the body after the header at {@code headerIndex}; returns the index of the first line after it. */
    private static int captureBody(List<String> lines, int headerIndex, List<String> body) {
        int headerIndent = LineClassifier.indentWidth(lines.get(headerIndex));
        int i = headerIndex + 1;

        int baseIndent = -1;
        while (i < lines.size()) {
            String line = lines.get(i);
            if (line.trim().isEmpty()) {
                i++;
                continue;
            }
            int indent = LineClassifier.indentWidth(line);
            if (baseIndent < 0) {
                if (indent <= headerIndent) break;
                baseIndent = indent;
            }
            if (indent < baseIndent) break;
            body.add(dedent(line, baseIndent));
            i++;
        }

        if (i < lines.size()
                && LineClassifier.indentWidth(lines.get(i)) <= headerIndent
                && END_FUNCTION.matcher(LineClassifier.stripTerminator(lines.get(i))).matches()) {
            i++;
        }
        return i;
    }

    private static String dedent(String line, int width) {
        int removed = 0;
        int pos = 0;
        while (pos < line.length() && removed < width) {
            char c = line.charAt(pos);
            if (c == ' ') {
                removed++;
            } else if (c == '\t') {
                removed += 4;
            } else {
                break;
            }
            pos++;
        }
        return line.substring(pos);
    }

    static List<String> parseParameters(String text) {
        List<String> parameters = new ArrayList<>();
        for (String part : CallTextUtils.splitArguments(text)) {
            // "int n" or "n: int" both name the parameter n
            String name = part.split(":")[0].trim();
            String[] words = name.split("\\s+");
            parameters.add(words[words.length - 1]);
        }
        return parameters;
    }

    private static final class RawFunction {
        final String name;
        final List<String> parameters;
        final List<String> body = new ArrayList<>();

        RawFunction(String name, List<String> parameters) {
            this.name = name;
            this.parameters = parameters;
        }
    }
}
