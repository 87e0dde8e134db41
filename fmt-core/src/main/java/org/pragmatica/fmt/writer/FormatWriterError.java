package org.pragmatica.fmt.writer;

/**
 * Failures raised by the writer. They signal a broken caller contract and abort rendering before any output.
 */
public abstract sealed class FormatWriterError extends RuntimeException permits FormatWriterError.PreconditionViolation {

    private FormatWriterError(String message) {
        super(message);
    }

    /**
     * The decision sequence does not fit the token stream it claims to describe.
     */
    public static final class PreconditionViolation extends FormatWriterError {
        private PreconditionViolation(String message) {
            super(message);
        }
    }

    public static PreconditionViolation tooManySplits(int splits, int formatTokens) {
        return new PreconditionViolation("Got " + splits + " splits for " + formatTokens + " format tokens");
    }

    public static PreconditionViolation stateCountMismatch(int splits, int states) {
        return new PreconditionViolation("Got " + states + " layout states for " + splits + " splits");
    }

    public static PreconditionViolation treeMismatch(int treeTokens, int formatTokens) {
        return new PreconditionViolation("Syntax tree covers " + treeTokens + " tokens, but " + formatTokens
                                         + " format tokens need " + (formatTokens + 1));
    }
}
