package org.dxworks.flowframe.analyzer.graph;

import org.dxworks.flowframe.analyzer.StructureScanner;
import org.dxworks.flowframe.analyzer.StructureScanner.Boundary;
import org.dxworks.flowframe.analyzer.StructureScanner.BoundaryKind;
import org.dxworks.flowframe.analyzer.recursion.CallSiteParser;
import org.dxworks.flowframe.model.Block;
import org.dxworks.flowframe.model.BlockType;
import org.dxworks.flowframe.model.Connection;
import org.dxworks.flowframe.model.ConnectionType;
import org.dxworks.flowframe.model.ControlFlowGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Connects a classified block sequence into a {@link ControlFlowGraph}.
 *
 * <p>One forward pass keeps a stack of open contexts (the current branch of an
 * {@code if} or {@code switch}, or a loop body). Each block gets its outgoing edges from
 * its type and from the innermost decision it sits in; loop-back edges are collected on
 * the way and appended after the forward edges of the block that closes the loop.</p>
 *
 * <p>Construct boundaries come from {@link StructureScanner}, so the graph agrees with
 * the implicit-else synthesizer about where every decision ends.</p>
 */
public class ControlFlowGraphBuilder {

    private static final Logger LOG = LoggerFactory.getLogger(ControlFlowGraphBuilder.class);

    public ControlFlowGraph build(List<Block> blocks) {
        return build(blocks, null);
    }

    /**
     * @param functionName name of the function whose body this is, or {@code null} for the
     *                     main flow; returns calling it get a {@code recursive} edge
     */
    public ControlFlowGraph build(List<Block> blocks, String functionName) {
        return new Pass(blocks, functionName).run();
    }

    private enum Kind { IF, SWITCH, LOOP }

    private static final class FlowContext {
        final Kind kind;
        final int startIndex;
        final int level;
        final int branchEnd;    // first index past this branch (or past the loop body)
        final Boundary end;     // end of the whole decision; unused for loops
        final FlowContext parent;

        FlowContext(Kind kind, int startIndex, int level, int branchEnd, Boundary end, FlowContext parent) {
            this.kind = kind;
            this.startIndex = startIndex;
            this.level = level;
            this.branchEnd = branchEnd;
            this.end = end;
            this.parent = parent;
        }

        boolean isDecision() {
            return kind != Kind.LOOP;
        }
    }

    private static final class Pass {
        private final List<Block> blocks;
        private final String functionName;
        private final List<Connection> connections = new ArrayList<>();
        private final Map<Integer, List<Connection>> loopBacks = new TreeMap<>();
        private final Deque<FlowContext> stack = new ArrayDeque<>();
        private final int firstCondition;

        Pass(List<Block> blocks, String functionName) {
            this.blocks = blocks;
            this.functionName = functionName;
            int first = -1;
            for (int i = 0; i < blocks.size(); i++) {
                if (blocks.get(i).opensConditional()) {
                    first = i;
                    break;
                }
            }
            this.firstCondition = first;
        }

        ControlFlowGraph run() {
            for (int i = 0; i < blocks.size(); i++) {
                enter(i);
                emit(i);
                List<Connection> back = loopBacks.remove(i);
                if (back != null) connections.addAll(back);
            }
            LOG.debug("Built graph{} with {} block(s) and {} connection(s)",
                    functionName == null ? "" : " for function '" + functionName + "'",
                    blocks.size(), connections.size());
            return new ControlFlowGraph(blocks, connections);
        }

        /** Leaves finished contexts and opens the ones block {@code i} starts. */
        private void enter(int i) {
            Block block = blocks.get(i);

            FlowContext finishedBranch = null;
            while (!stack.isEmpty() && i >= stack.peek().branchEnd) {
                FlowContext popped = stack.pop();
                if (popped.isDecision() && popped.branchEnd == i && popped.level == block.indentLevel) {
                    finishedBranch = popped;
                }
            }

            if (finishedBranch != null && StructureScanner.continuesConstruct(block)) {
                // next branch of the same decision
                stack.push(new FlowContext(finishedBranch.kind, i, finishedBranch.level,
                        branchEnd(i, finishedBranch.end), finishedBranch.end, finishedBranch.parent));
                return;
            }

            if (block.opensConditional() || block.blockType == BlockType.SWITCH) {
                Kind kind = block.opensConditional() ? Kind.IF : Kind.SWITCH;
                Boundary end = StructureScanner.findEnd(blocks, i);
                stack.push(new FlowContext(kind, i, block.indentLevel, branchEnd(i, end), end, stack.peek()));
            } else if (block.blockType == BlockType.LOOP) {
                int close = StructureScanner.findLoopClose(blocks, i);
                int depth = enclosingLoops();
                int loopEnd = close < blocks.size() && StructureScanner.closesLoop(blocks.get(close)) ? close : close - 1;
                if (loopEnd > i) {
                    loopBacks.computeIfAbsent(loopEnd, k -> new ArrayList<>()).add(Connection.loopBack(loopEnd, i, depth));
                }
                // an end marker belongs to the loop, so the body context covers it too
                int bodyEnd = loopEnd > i ? loopEnd + 1 : i + 1;
                stack.push(new FlowContext(Kind.LOOP, i, block.indentLevel, bodyEnd, null, stack.peek()));
            }
        }

        private void emit(int i) {
            Block block = blocks.get(i);
            switch (block.blockType) {
                case END:
                    return;
                case ELSE_IF:
                    connect(i, i + 1, ConnectionType.YES);
                    connect(i, noTarget(i), ConnectionType.NO);
                    return;
                case CONDITION:
                    if (block.isClosing) {
                        connect(i, i + 1, ConnectionType.DEFAULT);
                    } else {
                        connect(i, i + 1, ConnectionType.YES);
                        connect(i, noTarget(i), ConnectionType.NO);
                    }
                    return;
                case IMPLICIT_ELSE:
                    connect(i, joinFrom(i, currentDecision()), ConnectionType.NO);
                    return;
                case SWITCH:
                    emitSwitch(i);
                    return;
                case LOOP:
                    connect(i, i + 1, ConnectionType.DEFAULT);
                    return;
                case RETURN:
                    emitReturn(i, block);
                    return;
                default:
                    emitSequential(i);
            }
        }

        private void emitSwitch(int i) {
            List<Integer> cases = StructureScanner.alternatives(blocks, i);
            if (cases.isEmpty()) {
                connect(i, i + 1, ConnectionType.DEFAULT);
                return;
            }
            for (int c : cases) {
                if (blocks.get(c).blockType == BlockType.CASE) {
                    connections.add(Connection.labelled(i, c, ConnectionType.CASE, blocks.get(c).content));
                }
            }
        }

        private void emitReturn(int i, Block block) {
            FlowContext decision = currentDecision();
            if (decision == null) {
                connect(i, i + 1, ConnectionType.DEFAULT);
                return;
            }
            connect(i, joinFrom(i, decision), ConnectionType.DEFAULT);
            if (functionName != null && firstCondition >= 0 && CallSiteParser.invokes(block.content, functionName)) {
                connect(i, firstCondition, ConnectionType.RECURSIVE);
            }
        }

        private void emitSequential(int i) {
            FlowContext decision = currentDecision();
            if (decision != null && i + 1 == decision.branchEnd) {
                connect(i, joinFrom(i, decision), ConnectionType.DEFAULT);
            } else {
                connect(i, i + 1, ConnectionType.DEFAULT);
            }
        }

        /** Target of the "no" edge of the condition or else-if at {@code i}. */
        private int noTarget(int i) {
            Boundary next = StructureScanner.nextBoundary(blocks, i);
            switch (next.kind) {
                case ALTERNATIVE:
                    return next.index;
                case END_MARKER:
                    return next.index + 1 < blocks.size() ? next.index + 1 : next.index;
                case FALLBACK:
                    return joinFrom(i, currentDecision());
                default:
                    return -1;
            }
        }

        /**
         * Where control continues once a branch of {@code decision} is done: its end marker,
         * or, without one, the block that leaves it. When that block is itself an
         * alternative of an enclosing decision the enclosing decision's join is used.
         */
        private int join(FlowContext decision) {
            if (decision == null) return -1;
            Boundary end = decision.end;
            if (end.kind == BoundaryKind.NONE) return -1;
            if (end.kind == BoundaryKind.FALLBACK && StructureScanner.continuesConstruct(blocks.get(end.index))) {
                FlowContext outer = enclosingDecision(decision.parent);
                if (outer != null && blocks.get(end.index).indentLevel == outer.level) {
                    return join(outer);
                }
            }
            return end.index;
        }

        /**
         * {@link #join} seen from block {@code from}: a decision inside a loop body never
         * joins past the block carrying the loop-back, so its branches stay in the loop.
         * The loop-back block itself keeps the forward edge that leaves the loop.
         */
        private int joinFrom(int from, FlowContext decision) {
            int target = join(decision);
            FlowContext loop = enclosingLoop(decision);
            if (loop == null) return target;
            int loopEnd = loop.branchEnd - 1;
            if (loopEnd > loop.startIndex && from < loopEnd && (target < 0 || target > loopEnd)) {
                return loopEnd;
            }
            return target;
        }

        private int branchEnd(int from, Boundary end) {
            Boundary next = StructureScanner.nextBoundary(blocks, from);
            return next.kind == BoundaryKind.ALTERNATIVE ? next.index : end.index;
        }

        private FlowContext currentDecision() {
            return enclosingDecision(stack.peek());
        }

        private static FlowContext enclosingDecision(FlowContext context) {
            FlowContext c = context;
            while (c != null && !c.isDecision()) {
                c = c.parent;
            }
            return c;
        }

        private static FlowContext enclosingLoop(FlowContext decision) {
            FlowContext c = decision == null ? null : decision.parent;
            while (c != null && c.kind != Kind.LOOP) {
                c = c.parent;
            }
            return c;
        }

        private int enclosingLoops() {
            int loops = 0;
            Iterator<FlowContext> it = stack.iterator();
            while (it.hasNext()) {
                if (it.next().kind == Kind.LOOP) loops++;
            }
            return loops;
        }

        private void connect(int from, int to, ConnectionType type) {
            if (to < 0 || to >= blocks.size()) return;
            connections.add(new Connection(from, to, type));
        }
    }
}
