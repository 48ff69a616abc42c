package org.dxworks.flowframe.execution;

/** Input of {@link ExecutionMachine#apply}. */
public final class ExecutionEvent {

    public enum Type { START, TICK, PAUSE, RESUME, RESET, SPEED }

    public final Type type;
    public final int speedMs; // only for SPEED

    private ExecutionEvent(Type type, int speedMs) {
        this.type = type;
        this.speedMs = speedMs;
    }

    public static ExecutionEvent start() {
        return new ExecutionEvent(Type.START, 0);
    }

    public static ExecutionEvent tick() {
        return new ExecutionEvent(Type.TICK, 0);
    }

    public static ExecutionEvent pause() {
        return new ExecutionEvent(Type.PAUSE, 0);
    }

    public static ExecutionEvent resume() {
        return new ExecutionEvent(Type.RESUME, 0);
    }

    public static ExecutionEvent reset() {
        return new ExecutionEvent(Type.RESET, 0);
    }

    public static ExecutionEvent speed(int speedMs) {
        return new ExecutionEvent(Type.SPEED, speedMs);
    }

    @Override
    public String toString() {
        return type == Type.SPEED ? "SPEED(" + speedMs + ")" : type.name();
    }
}
