package org.dxworks.flowframe.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Block sequence together with the directed edges between its blocks. Carries no
 * geometry; layout is left to whoever renders the graph.
 */
public final class ControlFlowGraph {
    public final List<Block> blocks;
    public final List<Connection> connections;

    public ControlFlowGraph(List<Block> blocks, List<Connection> connections) {
        this.blocks = List.copyOf(blocks);
        this.connections = List.copyOf(connections);
        for (Connection c : this.connections) {
            if (c.from < 0 || c.from >= this.blocks.size() || c.to < 0 || c.to >= this.blocks.size()) {
                throw new IllegalArgumentException("Connection " + c + " points outside of "
                        + this.blocks.size() + " blocks");
            }
        }
    }

    public int size() {
        return blocks.size();
    }

    public Block block(int index) {
        return blocks.get(index);
    }

    public List<Connection> outgoing(int index) {
        List<Connection> result = new ArrayList<>();
        for (Connection c : connections) {
            if (c.from == index) result.add(c);
        }
        return Collections.unmodifiableList(result);
    }

    public List<Connection> incoming(int index) {
        List<Connection> result = new ArrayList<>();
        for (Connection c : connections) {
            if (c.to == index) result.add(c);
        }
        return Collections.unmodifiableList(result);
    }

    public Optional<Connection> firstOutgoing(int index, ConnectionType type) {
        for (Connection c : connections) {
            if (c.from == index && c.type == type) return Optional.of(c);
        }
        return Optional.empty();
    }

    public int indexOfFirst(BlockType type) {
        for (int i = 0; i < blocks.size(); i++) {
            if (blocks.get(i).blockType == type) return i;
        }
        return -1;
    }
}
