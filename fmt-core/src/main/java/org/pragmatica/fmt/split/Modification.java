package org.pragmatica.fmt.split;

import java.util.Objects;

/**
 * Decision for the separator text of one boundary.
 */
public sealed interface Modification permits Modification.NoSplit, Modification.Space, Modification.Newline, Modification.Provided {

    /**
     * Number of line breaks this modification introduces.
     */
    int newlines();

    default boolean isNewline() {
        return newlines() > 0;
    }

    NoSplit NO_SPLIT = new NoSplit();
    Space SPACE = new Space();
    Newline NEWLINE = new Newline(false, false, false, false);
    Newline DOUBLE_NEWLINE = new Newline(true, false, false, false);

    static NoSplit noSplit() {
        return NO_SPLIT;
    }

    static Space space() {
        return SPACE;
    }

    static Newline newline() {
        return NEWLINE;
    }

    static Newline doubleNewline() {
        return DOUBLE_NEWLINE;
    }

    static Provided provided(String literal) {
        return new Provided(literal);
    }

    /** Tokens are joined with nothing in between. */
    record NoSplit() implements Modification {
        @Override
        public int newlines() {
            return 0;
        }

        @Override
        public String toString() {
            return "NoSplit";
        }
    }

    /** One space, widened by alignment padding. */
    record Space() implements Modification {
        @Override
        public int newlines() {
            return 0;
        }

        @Override
        public String toString() {
            return "Space";
        }
    }

    /**
     * Line break.
     *
     * @param isDouble      leave a blank line
     * @param noIndent      do not indent the following line
     * @param acceptSpace   may collapse to a single space when the next line would start at or before the current column
     * @param acceptNoSplit may collapse to nothing under the same condition
     */
    record Newline(boolean isDouble, boolean noIndent, boolean acceptSpace, boolean acceptNoSplit) implements Modification {
        @Override
        public int newlines() {
            return isDouble ? 2 : 1;
        }

        public Newline withNoIndent() {
            return new Newline(isDouble, true, acceptSpace, acceptNoSplit);
        }

        public Newline withAcceptSpace() {
            return new Newline(isDouble, noIndent, true, acceptNoSplit);
        }

        public Newline withAcceptNoSplit() {
            return new Newline(isDouble, noIndent, acceptSpace, true);
        }
    }

    /** Externally fixed whitespace emitted verbatim. */
    record Provided(String literal) implements Modification {
        public Provided {
            Objects.requireNonNull(literal, "literal");
        }

        @Override
        public int newlines() {
            return (int) literal.chars()
                                .filter(c -> c == '\n')
                                .count();
        }
    }
}
