package org.pragmatica.fmt.writer;

import org.pragmatica.fmt.config.FormatterConfig;
import org.pragmatica.fmt.token.Token;
import org.pragmatica.fmt.token.TokenKind;
import org.pragmatica.fmt.tree.TreeOracle;

import java.util.function.IntSupplier;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Renders the text of a single token: comments, margin strings, numeric literals and configured rewrites.
 *
 * Never fails; any token shape it does not recognize is emitted as written.
 */
final class LiteralFormatter {
    private static final Pattern TRAILING_SPACE = Pattern.compile("[ \t]+$", Pattern.MULTILINE);
    private static final Pattern LEADING_ASTERISK_SPACE = Pattern.compile("\n *\\*(?!\\*)", Pattern.MULTILINE);
    private static final Pattern LEADING_PIPE_SPACE = Pattern.compile("\n *\\|", Pattern.MULTILINE);
    private static final Pattern MARGIN_LINE = Pattern.compile("\n *\\|");
    private static final String HEX_PREFIX = "0x";

    private final FormatterConfig config;
    private final TreeOracle tree;

    private LiteralFormatter(FormatterConfig config, TreeOracle tree) {
        this.config = config;
        this.tree = tree;
    }

    static LiteralFormatter literalFormatter(FormatterConfig config, TreeOracle tree) {
        return new LiteralFormatter(config, tree);
    }

    /**
     * Render a token.
     *
     * @param token       token to render
     * @param indentation indentation of the current line
     * @param column      column the token starts at; evaluated only for margin strings
     */
    String format(Token token, int indentation, IntSupplier column) {
        return switch (token.kind()) {
            case COMMENT -> formatComment(token, indentation);
            case INTERPOLATION_PART -> formatMarginizedString(token, () -> indentation);
            case STRING -> formatMarginizedString(token, () -> 2 + column.getAsInt());
            case LONG -> formatLong(token.text());
            case FLOAT -> config.floatLiteralCase()
                                .process(token.text());
            case DOUBLE -> config.doubleLiteralCase()
                                 .process(token.text());
            default -> config.rewrite(token.text());
        };
    }

    String formatComment(Token comment, int indent) {
        var text = comment.text();
        var aligned = text;

        if (text.startsWith("/*") && config.reformatDocstrings()) {
            boolean isDocstring = text.startsWith("/**");
            var spaces = isDocstring && config.scalaDocIndentStyle()
                         ? " ".repeat(indent + 2)
                         : " ".repeat(indent + 1);
            aligned = LEADING_ASTERISK_SPACE.matcher(text)
                                            .replaceAll(Matcher.quoteReplacement("\n" + spaces + "*"));
        }
        return TRAILING_SPACE.matcher(aligned)
                             .replaceAll("");
    }

    String formatMarginizedString(Token token, IntSupplier indent) {
        if (!shouldMarginize(token)) {
            return token.text();
        }
        int extraIndent = firstChar(token) == '|' ? 1 : 0;
        var spaces = " ".repeat(indent.getAsInt() + extraIndent);

        return LEADING_PIPE_SPACE.matcher(token.text())
                                 .replaceAll(Matcher.quoteReplacement("\n" + spaces + "|"));
    }

    private boolean shouldMarginize(Token token) {
        return config.marginStripEnabled()
               && (token.is(TokenKind.INTERPOLATION_PART) || isMarginizedString(token));
    }

    private static boolean isMarginizedString(Token token) {
        return token.is(TokenKind.STRING)
               && token.text().startsWith("\"\"\"")
               && MARGIN_LINE.matcher(token.text()).find();
    }

    private char firstChar(Token token) {
        if (token.is(TokenKind.INTERPOLATION_PART)) {
            return tree.parent(tree.owner(token))
                       .flatMap(parent -> tree.tokens(parent)
                                              .stream()
                                              .filter(t -> t.is(TokenKind.INTERPOLATION_PART))
                                              .findFirst())
                       .filter(part -> !part.text().isEmpty())
                       .map(part -> part.text().charAt(0))
                       .orElse(' ');
        }
        var text = token.text();
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) != '"') {
                return text.charAt(i);
            }
        }
        return ' ';
    }

    // hex longs like 0xFF123L keep their lowercase x
    private String formatLong(String text) {
        if (text.startsWith(HEX_PREFIX)) {
            return HEX_PREFIX + config.longLiteralCase()
                                      .process(text.substring(HEX_PREFIX.length()));
        }
        return config.longLiteralCase()
                     .process(text);
    }
}
