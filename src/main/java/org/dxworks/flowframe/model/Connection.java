package org.dxworks.flowframe.model;

import java.util.Objects;

public final class Connection {
    public final int from;
    public final int to;
    public final ConnectionType type;
    public final Integer depth; // loop nesting of a loop-back edge
    public final String label;  // case labels

    public Connection(int from, int to, ConnectionType type) {
        this(from, to, type, null, null);
    }

    public Connection(int from, int to, ConnectionType type, Integer depth, String label) {
        this.from = from;
        this.to = to;
        this.type = Objects.requireNonNull(type, "type");
        this.depth = depth;
        this.label = label;
    }

    public static Connection loopBack(int from, int to, int depth) {
        return new Connection(from, to, ConnectionType.LOOP_BACK, depth, null);
    }

    public static Connection labelled(int from, int to, ConnectionType type, String label) {
        return new Connection(from, to, type, null, label);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Connection)) return false;
        Connection other = (Connection) o;
        return from == other.from && to == other.to && type == other.type
                && Objects.equals(depth, other.depth) && Objects.equals(label, other.label);
    }

    @Override
    public int hashCode() {
        return Objects.hash(from, to, type, depth, label);
    }

    @Override
    public String toString() {
        return from + " -" + type.getName() + "-> " + to;
    }
}
