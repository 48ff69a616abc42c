package org.dxworks.flowframe.analyzer;

import org.dxworks.flowframe.model.Block;
import org.dxworks.flowframe.model.BlockType;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class LineClassifierTest {

    private static final String SIGN = String.join("\n",
            "Start::",
            "Input x::",
            "If x > 0::",
            "    Output x::",
            "Else if x < 0::",
            "    Output -x::",
            "Else::",
            "    Output 0::",
            "End if::",
            "End::");

    @Test
    void classifiesEachLineByKeyword() {
        List<Block> blocks = LineClassifier.parse(SIGN);

        assertEquals(List.of(BlockType.START, BlockType.INPUT, BlockType.CONDITION, BlockType.OUTPUT,
                BlockType.ELSE_IF, BlockType.OUTPUT, BlockType.CONDITION, BlockType.OUTPUT,
                BlockType.CONNECTOR, BlockType.END), types(blocks));
    }

    @Test
    void alternativesShareTheLevelOfTheirCondition() {
        List<Block> blocks = LineClassifier.parse(SIGN);

        assertEquals(List.of(0, 0, 0, 1, 0, 1, 0, 1, 0, 0), levels(blocks));
    }

    @Test
    void closingFlagFollowsLeadingKeyword() {
        List<Block> blocks = LineClassifier.parse(SIGN);

        assertFalse(blocks.get(2).isClosing);
        assertTrue(blocks.get(4).isClosing);
        assertTrue(blocks.get(6).isClosing);
        assertTrue(blocks.get(8).isClosing);
        assertTrue(blocks.get(9).isClosing);
    }

    @Test
    void stripsTerminatorAndSkipsBlankLines() {
        List<Block> blocks = LineClassifier.parse("Start::\n\n   \nOutput \"hi\"::\nEnd::\n");

        assertEquals(3, blocks.size());
        assertEquals("Output \"hi\"", blocks.get(1).content);
    }

    @Test
    void nestedElseStaysWithItsOwnIf() {
        List<Block> blocks = LineClassifier.parse(String.join("\n",
                "If a::",
                "    If b::",
                "        Output 1::",
                "    Else::",
                "        Output 2::",
                "    End if::",
                "Else::",
                "    Output 3::",
                "End if::"));

        assertEquals(List.of(0, 1, 2, 1, 2, 1, 0, 1, 0), levels(blocks));
    }

    @Test
    void casesSitAtTheSwitchLevel() {
        List<Block> blocks = LineClassifier.parse(String.join("\n",
                "Switch day::",
                "    Case 1::",
                "        Output \"Mon\"::",
                "    Default::",
                "        Output \"Other\"::",
                "End switch::"));

        assertEquals(List.of(BlockType.SWITCH, BlockType.CASE, BlockType.OUTPUT, BlockType.CASE,
                BlockType.OUTPUT, BlockType.CONNECTOR), types(blocks));
        assertEquals(List.of(0, 0, 1, 0, 1, 0), levels(blocks));
    }

    @Test
    void tabCountsAsFourColumns() {
        assertEquals(4, LineClassifier.indentWidth("\tOutput x"));
        assertEquals(6, LineClassifier.indentWidth("  \tOutput x"));

        List<Block> blocks = LineClassifier.parse("If x > 1::\n\tOutput x::\nEnd if::");
        assertEquals(List.of(0, 1, 0), levels(blocks));
    }

    @Test
    void detectsKeywordsCaseInsensitively() {
        assertEquals(BlockType.START, LineClassifier.detectBlockType("BEGIN"));
        assertEquals(BlockType.END, LineClassifier.detectBlockType("Stop"));
        assertEquals(BlockType.LOOP, LineClassifier.detectBlockType("While i < 10"));
        assertEquals(BlockType.LOOP, LineClassifier.detectBlockType("For i = 1 to 10"));
        assertEquals(BlockType.RETURN, LineClassifier.detectBlockType("Return x"));
        assertEquals(BlockType.FUNCTION, LineClassifier.detectBlockType("Call foo()"));
        assertEquals(BlockType.FUNCTION_DEF, LineClassifier.detectBlockType("Function foo(a)"));
        assertEquals(BlockType.SWITCH, LineClassifier.detectBlockType("switch day"));
        assertEquals(BlockType.CASE, LineClassifier.detectBlockType("Default"));
        assertEquals(BlockType.COMMENT, LineClassifier.detectBlockType("// note"));
        assertEquals(BlockType.CONNECTOR, LineClassifier.detectBlockType("End while"));
        assertEquals(BlockType.CONNECTOR, LineClassifier.detectBlockType("Next"));
        assertEquals(BlockType.CONNECTOR, LineClassifier.detectBlockType("Endif"));
    }

    @Test
    void unknownLinesBecomeProcess() {
        assertEquals(BlockType.PROCESS, LineClassifier.detectBlockType("Set x = 5"));
        assertEquals(BlockType.PROCESS, LineClassifier.detectBlockType("Next step of the plan"));
    }

    @Test
    void oddIndentationNeverGoesNegative() {
        List<Block> blocks = LineClassifier.parse(String.join("\n",
                "      Output a::",
                "Output b::",
                "  Else::",
                "    Case 3::",
                "Default::"));

        assertTrue(blocks.stream().allMatch(b -> b.indentLevel >= 0));
    }

    @Test
    void parsingIsRepeatable() {
        assertEquals(LineClassifier.parse(SIGN), LineClassifier.parse(SIGN));
    }

    private static List<BlockType> types(List<Block> blocks) {
        return blocks.stream().map(b -> b.blockType).collect(Collectors.toList());
    }

    private static List<Integer> levels(List<Block> blocks) {
        return blocks.stream().map(b -> b.indentLevel).collect(Collectors.toList());
    }
}
