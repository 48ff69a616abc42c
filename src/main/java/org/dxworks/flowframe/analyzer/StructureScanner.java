package org.dxworks.flowframe.analyzer;

import org.dxworks.flowframe.model.Block;
import org.dxworks.flowframe.model.BlockType;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Locates the boundaries of decisions and loops inside a classified block sequence.
 *
 * <p>A decision ends at its explicit end marker ({@code End if}, {@code End switch});
 * indentation is only the fallback for sources that leave the marker out. Both the
 * implicit-else synthesizer and the graph builder go through this class so they always
 * agree on where a construct stops.</p>
 */
public final class StructureScanner {

    public enum BoundaryKind {
        /** An {@code else}, {@code else if}, implicit else or {@code case} of the same construct. */
        ALTERNATIVE,
        /** An explicit end marker. */
        END_MARKER,
        /** The first block that leaves the construct by indentation. */
        FALLBACK,
        /** The construct runs to the end of the sequence. */
        NONE
    }

    public static final class Boundary {
        public final int index;
        public final BoundaryKind kind;

        Boundary(int index, BoundaryKind kind) {
            this.index = index;
            this.kind = kind;
        }

        public boolean found() {
            return kind != BoundaryKind.NONE;
        }
    }

    private StructureScanner() {
        // utility class
    }

    /** First alternative or end of the decision (or switch) that block {@code from} opens or continues. */
    public static Boundary nextBoundary(List<Block> blocks, int from) {
        return scan(blocks, from, true);
    }

    /** End of the decision (or switch) that block {@code from} opens or continues, skipping alternatives. */
    public static Boundary findEnd(List<Block> blocks, int from) {
        return scan(blocks, from, false);
    }

    /** Every alternative ({@code else}, {@code case}, ...) of the construct opened at {@code from}. */
    public static List<Integer> alternatives(List<Block> blocks, int from) {
        List<Integer> result = new ArrayList<>();
        Boundary boundary = nextBoundary(blocks, from);
        while (boundary.kind == BoundaryKind.ALTERNATIVE) {
            result.add(boundary.index);
            boundary = nextBoundary(blocks, boundary.index);
        }
        return result;
    }

    /**
     * Index of the first block after the loop body, that is the first later block whose
     * level is not deeper than the loop's own. Returns {@code blocks.size()} when the body
     * runs to the end.
     */
    public static int findLoopClose(List<Block> blocks, int loopIndex) {
        int level = blocks.get(loopIndex).indentLevel;
        for (int j = loopIndex + 1; j < blocks.size(); j++) {
            if (blocks.get(j).indentLevel <= level) return j;
        }
        return blocks.size();
    }

    public static boolean opensConstruct(Block block) {
        return block.opensConditional() || block.blockType == BlockType.SWITCH;
    }

    public static boolean continuesConstruct(Block block) {
        return block.closesWithElse()
                || block.blockType == BlockType.ELSE_IF
                || block.blockType == BlockType.IMPLICIT_ELSE
                || block.blockType == BlockType.CASE;
    }

    public static boolean closesConstruct(Block block) {
        return block.blockType == BlockType.CONNECTOR
                && KeywordPatterns.CONDITIONAL_END_MARKER.matcher(LineClassifier.normalize(block.content)).find();
    }

    public static boolean closesLoop(Block block) {
        return block.blockType == BlockType.CONNECTOR
                && KeywordPatterns.LOOP_END_MARKER.matcher(LineClassifier.normalize(block.content)).find();
    }

    private static Boundary scan(List<Block> blocks, int from, boolean stopAtAlternative) {
        Boundary marked = scanMarkers(blocks, from, stopAtAlternative);
        return marked != null ? marked : scanIndentation(blocks, from, stopAtAlternative);
    }

    /**
     * Pairs end markers with openers by nesting depth, so bodies written at the opener's
     * own indentation still reach their marker. Returns {@code null} when the construct is
     * left (a shallower line) or the input ends before its marker shows up.
     */
    private static Boundary scanMarkers(List<Block> blocks, int from, boolean stopAtAlternative) {
        int level = blocks.get(from).indentLevel;
        Deque<Integer> nested = new ArrayDeque<>();

        for (int j = from + 1; j < blocks.size(); j++) {
            Block b = blocks.get(j);
            if (b.indentLevel < level) return null;

            // a shallower line leaves nested decisions that never got a marker
            while (!nested.isEmpty() && b.indentLevel < nested.peek()) {
                nested.pop();
            }

            if (!nested.isEmpty()) {
                if (closesConstruct(b)) {
                    nested.pop();
                } else if (opensConstruct(b)) {
                    nested.push(b.indentLevel);
                }
                continue;
            }

            if (closesConstruct(b)) {
                return new Boundary(j, BoundaryKind.END_MARKER);
            }
            if (continuesConstruct(b) && b.indentLevel == level) {
                if (stopAtAlternative) return new Boundary(j, BoundaryKind.ALTERNATIVE);
                continue;
            }
            if (opensConstruct(b)) {
                nested.push(b.indentLevel);
            }
        }
        return null;
    }

    private static Boundary scanIndentation(List<Block> blocks, int from, boolean stopAtAlternative) {
        int level = blocks.get(from).indentLevel;
        Deque<Integer> nested = new ArrayDeque<>();

        for (int j = from + 1; j < blocks.size(); j++) {
            Block b = blocks.get(j);
            boolean belongs = continuesConstruct(b) || closesConstruct(b);

            // nested decisions without an end marker close when indentation leaves them
            while (!nested.isEmpty()
                    && (b.indentLevel < nested.peek() || (b.indentLevel == nested.peek() && !belongs))) {
                nested.pop();
            }

            if (!nested.isEmpty()) {
                if (closesConstruct(b) && b.indentLevel == nested.peek()) {
                    nested.pop();
                } else if (opensConstruct(b)) {
                    nested.push(b.indentLevel);
                }
                continue;
            }

            if (closesConstruct(b) && b.indentLevel <= level) {
                return new Boundary(j, BoundaryKind.END_MARKER);
            }
            if (continuesConstruct(b) && b.indentLevel == level) {
                if (stopAtAlternative) return new Boundary(j, BoundaryKind.ALTERNATIVE);
                continue;
            }
            if (b.indentLevel <= level) {
                return new Boundary(j, BoundaryKind.FALLBACK);
            }
            if (opensConstruct(b)) {
                nested.push(b.indentLevel);
            }
        }
        return new Boundary(blocks.size(), BoundaryKind.NONE);
    }
}
