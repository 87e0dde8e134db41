package org.pragmatica.fmt.token;

import java.util.ArrayList;
import java.util.List;

/**
 * Join point between two adjacent tokens. Boundary {@code i} joins tokens {@code i} and {@code i + 1}.
 */
public record FormatToken(Token left, Token right, int index) {

    /**
     * Build the boundary sequence for a token stream. The result has one entry fewer than the stream.
     */
    public static List<FormatToken> formatTokens(List<Token> tokens) {
        var result = new ArrayList<FormatToken>(Math.max(tokens.size() - 1, 0));
        for (int i = 0; i + 1 < tokens.size(); i++) {
            result.add(new FormatToken(tokens.get(i), tokens.get(i + 1), i));
        }
        return List.copyOf(result);
    }

    @Override
    public String toString() {
        return "[" + index + "] " + left.text() + "∙" + right.text();
    }
}
