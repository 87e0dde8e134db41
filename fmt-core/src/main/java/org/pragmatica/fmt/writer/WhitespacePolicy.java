package org.pragmatica.fmt.writer;

import org.pragmatica.fmt.split.Modification;
import org.pragmatica.fmt.token.FormatToken;
import org.pragmatica.fmt.token.TokenKind;

import java.util.Map;

/**
 * Computes the separator text emitted after the left token of a location.
 */
final class WhitespacePolicy {
    // keeps end-of-line comments before a chain's first dot aligned with the chain
    private static final int CHAIN_COMMENT_INDENT = 2;

    private final Map<FormatToken, Integer> tokenAligns;
    private final TopLevelStatements topLevelStatements;

    private WhitespacePolicy(Map<FormatToken, Integer> tokenAligns, TopLevelStatements topLevelStatements) {
        this.tokenAligns = tokenAligns;
        this.topLevelStatements = topLevelStatements;
    }

    static WhitespacePolicy whitespacePolicy(Map<FormatToken, Integer> tokenAligns, TopLevelStatements topLevelStatements) {
        return new WhitespacePolicy(tokenAligns, topLevelStatements);
    }

    /**
     * Separator for location {@code index}.
     */
    String whitespace(FormatLocations locations, int index) {
        var current = locations.get(index);
        var previous = locations.get(Math.max(index - 1, 0));
        var formatToken = current.formatToken();
        var modification = current.modification();

        if (modification instanceof Modification.Space) {
            int previousAlign = previous.modification() instanceof Modification.NoSplit
                                ? padding(previous.formatToken())
                                : 0;
            return " " + " ".repeat(padding(formatToken) + previousAlign);
        }
        if (modification instanceof Modification.Newline newline) {
            return newline(locations, index, newline);
        }
        if (modification instanceof Modification.Provided provided) {
            return provided.literal();
        }
        return "";
    }

    private String newline(FormatLocations locations, int index, Modification.Newline newline) {
        var current = locations.get(index);
        var previous = locations.get(Math.max(index - 1, 0));
        var formatToken = current.formatToken();
        var state = current.state();
        boolean fitsOnPreviousLine = state.indentation() >= previous.state().column();

        if (newline.acceptNoSplit()
            && !formatToken.left().isComment()
            && !formatToken.right().isComment()
            && fitsOnPreviousLine) {
            return "";
        }
        if (newline.acceptSpace() && fitsOnPreviousLine) {
            return " ";
        }
        if (formatToken.right().isComment() && isFollowedByDot(locations, index)) {
            int prevDotIdx = locations.lastIndexWhere(location -> location.formatToken().right().is(TokenKind.DOT),
                                                      index - 1);
            int extraIndent = prevDotIdx >= 0 ? 0 : CHAIN_COMMENT_INDENT;
            return "\n" + " ".repeat(state.indentation() + extraIndent);
        }

        var lineBreak = newline.isDouble() || topLevelStatements.isMultilineTopLevelStatement(locations, index)
                        ? "\n\n"
                        : "\n";
        var indentation = newline.noIndent()
                          ? ""
                          : " ".repeat(state.indentation());
        return lineBreak + indentation;
    }

    private static boolean isFollowedByDot(FormatLocations locations, int index) {
        int nonComment = locations.indexWhere(location -> !location.formatToken().right().isComment(), index + 1);
        return nonComment >= 0 && locations.get(nonComment)
                                           .formatToken()
                                           .right()
                                           .is(TokenKind.DOT);
    }

    int padding(FormatToken formatToken) {
        return tokenAligns.getOrDefault(formatToken, 0);
    }

    boolean isAligned(FormatToken formatToken) {
        return tokenAligns.containsKey(formatToken);
    }
}
