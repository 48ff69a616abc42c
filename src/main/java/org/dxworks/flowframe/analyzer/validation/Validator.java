package org.dxworks.flowframe.analyzer.validation;

import org.dxworks.flowframe.analyzer.StructureScanner;
import org.dxworks.flowframe.analyzer.recursion.TransformationClassifier;
import org.dxworks.flowframe.model.Block;
import org.dxworks.flowframe.model.BlockType;
import org.dxworks.flowframe.model.FunctionDefinition;
import org.dxworks.flowframe.model.ValidationResult;
import org.dxworks.flowframe.model.recursion.BaseCase;
import org.dxworks.flowframe.model.recursion.ExitType;
import org.dxworks.flowframe.model.recursion.ParameterTransformation;
import org.dxworks.flowframe.model.recursion.RecursionMetadata;
import org.dxworks.flowframe.model.recursion.RecursionType;
import org.dxworks.flowframe.model.recursion.RecursiveCase;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Structural and recursion-soundness checks. Problems are reported, never thrown: errors
 * make the result invalid, warnings are advisory.
 */
public class Validator {

    public static final int DEFAULT_LOOP_EXIT_WINDOW = 10;

    private static final List<String> LOOP_EXIT_TOKENS = List.of(
            "break", "continue", "increment", "decrement", "+=", "-=", "++", "--", "+1", "-1", "+ 1", "- 1");

    // loops that terminate on their own
    private static final List<Pattern> COUNTED_LOOPS = List.of(
            Pattern.compile("^for\\s+.*\\b(?:to|in)\\b"),
            Pattern.compile("^foreach\\b"),
            Pattern.compile("^repeat\\s+\\d+"));

    private final int loopExitWindow;

    public Validator() {
        this(DEFAULT_LOOP_EXIT_WINDOW);
    }

    public Validator(int loopExitWindow) {
        this.loopExitWindow = Math.max(1, loopExitWindow);
    }

    public ValidationResult validate(List<Block> mainFlow) {
        return validate(mainFlow, Collections.emptyList());
    }

    public ValidationResult validate(List<Block> mainFlow, List<FunctionDefinition> functions) {
        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();

        checkStartAndEnd(mainFlow, errors);
        checkStructure(mainFlow, "", errors, warnings);

        for (FunctionDefinition function : functions) {
            String prefix = "Function '" + function.name + "': ";
            checkStructure(function.body, prefix, errors, warnings);
            checkRecursion(function.recursion, prefix, errors, warnings);
        }
        return new ValidationResult(errors, warnings);
    }

    private static void checkStartAndEnd(List<Block> blocks, List<String> errors) {
        long starts = blocks.stream().filter(b -> b.blockType == BlockType.START).count();
        long ends = blocks.stream().filter(b -> b.blockType == BlockType.END).count();

        if (starts == 0) {
            errors.add("Missing START block");
        } else if (starts > 1) {
            errors.add("Multiple START blocks (" + starts + ")");
        }
        if (ends == 0) {
            errors.add("Missing END block");
        } else if (ends > 1) {
            errors.add("Multiple END blocks (" + ends + ")");
        }
    }

    private void checkStructure(List<Block> blocks, String prefix, List<String> errors, List<String> warnings) {
        int openConditions = 0;
        int openLoops = 0;

        for (int i = 0; i < blocks.size(); i++) {
            Block block = blocks.get(i);
            if (StructureScanner.opensConstruct(block)) {
                openConditions++;
            } else if (StructureScanner.closesConstruct(block)) {
                openConditions--;
            }

            if (block.blockType == BlockType.LOOP) {
                openLoops++;
                if (StructureScanner.findLoopClose(blocks, i) < blocks.size()) {
                    openLoops--;
                }
                if (!hasExit(blocks, i)) {
                    warnings.add(prefix + "Potential infinite loop detected at line " + (i + 1));
                }
            }
        }

        if (openConditions > 0) {
            errors.add(prefix + openConditions + " unclosed condition block(s)");
        } else if (openConditions < 0) {
            errors.add(prefix + (-openConditions) + " unmatched end marker(s)");
        }
        if (openLoops > 0) {
            warnings.add(prefix + openLoops + " unclosed loop(s) - ensure proper loop termination");
        }
    }

    private boolean hasExit(List<Block> blocks, int loopIndex) {
        String header = normalize(blocks.get(loopIndex).content);
        for (Pattern counted : COUNTED_LOOPS) {
            if (counted.matcher(header).find()) return true;
        }

        int last = Math.min(blocks.size(), loopIndex + loopExitWindow);
        for (int j = loopIndex; j < last; j++) {
            String content = normalize(blocks.get(j).content);
            for (String token : LOOP_EXIT_TOKENS) {
                if (content.contains(token)) return true;
            }
        }
        return false;
    }

    private static void checkRecursion(RecursionMetadata recursion, String prefix,
                                       List<String> errors, List<String> warnings) {
        if (recursion == null || !recursion.isRecursive) return;

        if (recursion.baseCases.isEmpty()) {
            errors.add(prefix + "recursive function has no base case");
        }
        if (recursion.callPoints.isEmpty()) {
            errors.add(prefix + "recursive function has no recursive call");
        }

        for (BaseCase bc : recursion.baseCases) {
            if (bc.condition == null || bc.condition.isEmpty()) {
                warnings.add(prefix + "base case without a condition");
            }
            if (bc.exitType == ExitType.EMPTY && bc.returnValue == null) {
                warnings.add(prefix + "base case returns no value");
            }
        }

        for (RecursiveCase rc : recursion.recursiveCases) {
            if (rc.transformations.isEmpty()) {
                warnings.add(prefix + "recursive call '" + rc.callExpression
                        + "' does not change its arguments (possible infinite recursion)");
            } else if (rc.transformations.stream()
                    .map((ParameterTransformation t) -> t.transformationType)
                    .noneMatch(TransformationClassifier::converges)) {
                warnings.add(prefix + "recursive call '" + rc.callExpression
                        + "' may not converge toward a base case");
            }
        }

        if (recursion.recursionType == RecursionType.TAIL) {
            warnings.add(prefix + "tail recursion can be rewritten as a loop");
        } else if (recursion.recursionType == RecursionType.MUTUAL) {
            warnings.add(prefix + "mutual recursion, make sure every function in the cycle has a base case");
        }
    }

    private static String normalize(String content) {
        return content.trim().toLowerCase(Locale.ROOT);
    }
}
