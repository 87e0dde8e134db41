package org.pragmatica.fmt.split;

/**
 * Layout state after a boundary's split has been applied.
 *
 * @param indentation indentation of the current line
 * @param column      column right after the boundary's right token, without alignment padding
 */
public record State(int indentation, int column) {
    private static final State START = new State(0, 0);

    public static State start() {
        return START;
    }

    public static State state(int indentation, int column) {
        return new State(indentation, column);
    }
}
