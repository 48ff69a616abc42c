package org.dxworks.flowframe.analyzer.validation;

import org.dxworks.flowframe.TestUtils;
import org.dxworks.flowframe.analyzer.FlowchartPipeline;
import org.dxworks.flowframe.analyzer.LineClassifier;
import org.dxworks.flowframe.model.ValidationResult;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ValidatorTest {

    private final Validator validator = new Validator();

    private ValidationResult validate(String source) {
        return new FlowchartPipeline().analyze(source).validation;
    }

    @Test
    void wellFormedSamplesHaveNoErrors() {
        for (String sample : TestUtils.SAMPLES) {
            ValidationResult result = validate(TestUtils.sample(sample));
            assertTrue(result.isValid, sample + ": " + result.errors);
        }
    }

    @Test
    void missingStartAndEnd() {
        ValidationResult result = validator.validate(LineClassifier.parse("Output x::"));

        assertFalse(result.isValid);
        assertEquals(List.of("Missing START block", "Missing END block"), result.errors);
    }

    @Test
    void duplicatedStartAndEnd() {
        ValidationResult result = validator.validate(LineClassifier.parse("Start::\nBegin::\nEnd::\nStop::\nExit::"));

        assertEquals(List.of("Multiple START blocks (2)", "Multiple END blocks (3)"), result.errors);
    }

    @Test
    void unclosedCondition() {
        ValidationResult result = validator.validate(LineClassifier.parse("Start::\nIf x > 0::\n    Output x::\nEnd::"));

        assertEquals(List.of("1 unclosed condition block(s)"), result.errors);
    }

    @Test
    void strayEndMarker() {
        ValidationResult result = validator.validate(LineClassifier.parse("Start::\nEnd if::\nEnd::"));

        assertEquals(List.of("1 unmatched end marker(s)"), result.errors);
    }

    @Test
    void loopWithoutVisibleExit() {
        ValidationResult result = validator.validate(LineClassifier.parse(
                "Start::\nWhile true::\n    Output x::\nEnd while::\nEnd::"));

        assertTrue(result.isValid);
        assertEquals(List.of("Potential infinite loop detected at line 2"), result.warnings);
    }

    @Test
    void countedLoopsNeedNoExit() {
        ValidationResult result = validator.validate(LineClassifier.parse(String.join("\n",
                "Start::",
                "For i = 1 to 3::",
                "    Output i::",
                "Foreach item in items::",
                "    Output item::",
                "Repeat 3 times::",
                "    Output x::",
                "End::")));

        assertTrue(result.warnings.isEmpty(), result.warnings.toString());
    }

    @Test
    void exitMustBeWithinTheWindow() {
        List<String> lines = new ArrayList<>();
        lines.add("Start::");
        lines.add("While running::");
        for (int k = 0; k < 11; k++) {
            lines.add("    Output row::");
        }
        lines.add("    Set i = i + 1::");
        lines.add("End while::");
        lines.add("End::");

        assertEquals(List.of("Potential infinite loop detected at line 2"),
                new Validator(10).validate(LineClassifier.parse(lines)).warnings);
        assertTrue(new Validator(20).validate(LineClassifier.parse(lines)).warnings.isEmpty());
    }

    @Test
    void unclosedLoopInAFunction() {
        ValidationResult result = validate(String.join("\n",
                "Function spin(n)::",
                "    While n > 0::",
                "        Output n::",
                "Start::",
                "Call spin(3)::",
                "End::"));

        assertTrue(result.isValid);
        assertTrue(result.warnings.contains("Function 'spin': 1 unclosed loop(s) - ensure proper loop termination"),
                result.warnings.toString());
        assertTrue(result.warnings.contains("Function 'spin': Potential infinite loop detected at line 2"),
                result.warnings.toString());
    }

    @Test
    void recursionWithoutBaseCase() {
        ValidationResult result = validate(String.join("\n",
                "Function forever(n)::",
                "    Return forever(n - 1)::",
                "Start::",
                "Call forever(1)::",
                "End::"));

        assertEquals(List.of("Function 'forever': recursive function has no base case"), result.errors);
        assertEquals(List.of("Function 'forever': tail recursion can be rewritten as a loop"), result.warnings);
    }

    @Test
    void unchangedArgumentMayNotConverge() {
        ValidationResult result = validate(String.join("\n",
                "Function walk(x)::",
                "    If x > 0::",
                "        Return walk(x)::",
                "    End if::",
                "Start::",
                "Call walk(1)::",
                "End::"));

        assertTrue(result.warnings.contains("Function 'walk': recursive call 'walk(x)' may not converge toward a base case"),
                result.warnings.toString());
    }

    @Test
    void callWithoutArgumentsChangesNothing() {
        ValidationResult result = validate(String.join("\n",
                "Function again()::",
                "    If done::",
                "        Return 0::",
                "    End if::",
                "    Call again()::",
                "Start::",
                "Call again()::",
                "End::"));

        assertTrue(result.warnings.contains(
                "Function 'again': recursive call 'again()' does not change its arguments (possible infinite recursion)"),
                result.warnings.toString());
    }

    @Test
    void bareReturnBaseCase() {
        ValidationResult result = validate(TestUtils.sample("tree.pseudo"));

        assertEquals(List.of("Function 'traverse': base case returns no value"), result.warnings);
    }

    @Test
    void unconditionalBaseCase() {
        ValidationResult result = validate(String.join("\n",
                "Function down(n)::",
                "    Output n::",
                "    Call down(n - 1)::",
                "    Return 0::",
                "Start::",
                "Call down(3)::",
                "End::"));

        assertTrue(result.warnings.contains("Function 'down': base case without a condition"), result.warnings.toString());
    }

    @Test
    void mutualRecursionIsFlaggedOnBothSides() {
        ValidationResult result = validate(TestUtils.sample("parity.pseudo"));

        assertTrue(result.isValid);
        assertEquals(List.of(
                "Function 'isEven': mutual recursion, make sure every function in the cycle has a base case",
                "Function 'isOdd': mutual recursion, make sure every function in the cycle has a base case"),
                result.warnings);
    }
}
