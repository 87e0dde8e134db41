package org.pragmatica.fmt.writer;

import org.pragmatica.fmt.split.Modification;
import org.pragmatica.fmt.split.Split;
import org.pragmatica.fmt.split.State;
import org.pragmatica.fmt.token.FormatToken;

/**
 * A boundary together with the split chosen for it and the layout state that split produced.
 */
public record FormatLocation(FormatToken formatToken, Split split, State state) {

    public static FormatLocation formatLocation(FormatToken formatToken, Split split, State state) {
        return new FormatLocation(formatToken, split, state);
    }

    public Modification modification() {
        return split.modification();
    }

    public boolean isNewline() {
        return split.isNewline();
    }

    public int newlines() {
        return split.modification()
                    .newlines();
    }
}
