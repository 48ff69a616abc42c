package org.dxworks.flowframe.analyzer;

import org.dxworks.flowframe.model.Block;
import org.dxworks.flowframe.model.BlockType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Gives every decision two outcomes. An {@code if} with no {@code else}/{@code else if}
 * of its own gets an {@code implicit-else} block right before its end marker, at the
 * level of the {@code if}. The input sequence is left untouched.
 */
public final class ImplicitElseSynthesizer {

    public static final String IMPLICIT_ELSE_LABEL = "Else (implicit)";

    private ImplicitElseSynthesizer() {
        // utility class
    }

    public static List<Block> synthesize(List<Block> blocks) {
        // insertion point -> blocks to insert, innermost decision first
        Map<Integer, List<Block>> insertions = new TreeMap<>();

        for (int i = 0; i < blocks.size(); i++) {
            Block block = blocks.get(i);
            if (!block.opensConditional()) continue;

            StructureScanner.Boundary boundary = StructureScanner.nextBoundary(blocks, i);
            if (boundary.kind == StructureScanner.BoundaryKind.ALTERNATIVE) continue;

            insertions.computeIfAbsent(boundary.index, k -> new ArrayList<>())
                    .add(0, implicitElse(block.indentLevel));
        }

        if (insertions.isEmpty()) return blocks;

        List<Block> result = new ArrayList<>(blocks.size() + insertions.size());
        for (int i = 0; i <= blocks.size(); i++) {
            List<Block> pending = insertions.get(i);
            if (pending != null) result.addAll(pending);
            if (i < blocks.size()) result.add(blocks.get(i));
        }
        return Collections.unmodifiableList(result);
    }

    static Block implicitElse(int indentLevel) {
        return new Block(IMPLICIT_ELSE_LABEL, indentLevel, BlockType.IMPLICIT_ELSE, true);
    }
}
