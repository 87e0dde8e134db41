package org.pragmatica.fmt.writer;

import java.util.Arrays;

/**
 * Growable output text that remembers where the left token of every location was emitted.
 *
 * Retroactive comma edits use those offsets instead of searching the emitted text.
 */
final class OutputBuffer {
    private final StringBuilder sb = new StringBuilder();
    private final int[] tokenStart;
    private final int[] tokenEnd;
    private int emitted;

    OutputBuffer(int locations) {
        this.tokenStart = new int[locations];
        this.tokenEnd = new int[locations];
        Arrays.fill(tokenStart, -1);
        Arrays.fill(tokenEnd, -1);
    }

    /**
     * Append the rendered left token of location {@code index}.
     */
    void appendToken(int index, String text) {
        tokenStart[index] = sb.length();
        sb.append(text);
        tokenEnd[index] = sb.length();
        emitted = index + 1;
    }

    void append(String text) {
        sb.append(text);
    }

    int length() {
        return sb.length();
    }

    /**
     * Start offset of the left token of location {@code index}, or -1 if not emitted.
     */
    int tokenStart(int index) {
        return tokenStart[index];
    }

    /**
     * Offset right after the left token of location {@code index}, or -1 if not emitted.
     */
    int tokenEnd(int index) {
        return tokenEnd[index];
    }

    /**
     * Column of the next character to append.
     */
    int currentColumn() {
        return sb.length() - (sb.lastIndexOf("\n") + 1);
    }

    void insert(int offset, char c) {
        sb.insert(offset, c);
        shiftFrom(offset, 1);
    }

    void deleteCharAt(int offset) {
        sb.deleteCharAt(offset);
        shiftFrom(offset + 1, -1);
    }

    void deleteLastChar() {
        deleteCharAt(sb.length() - 1);
    }

    void setCharAt(int offset, char c) {
        sb.setCharAt(offset, c);
    }

    // offsets grow with the index, so only the tail past the edit needs fixing
    private void shiftFrom(int offset, int delta) {
        for (int i = emitted - 1; i >= 0 && tokenEnd[i] >= offset; i--) {
            if (tokenStart[i] >= offset) {
                tokenStart[i] += delta;
            }
            tokenEnd[i] += delta;
        }
    }

    @Override
    public String toString() {
        return sb.toString();
    }
}
