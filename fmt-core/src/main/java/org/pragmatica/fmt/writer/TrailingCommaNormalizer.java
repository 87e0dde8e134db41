package org.pragmatica.fmt.writer;

import org.pragmatica.fmt.config.FormatterConfig;
import org.pragmatica.fmt.config.TrailingCommas;
import org.pragmatica.fmt.token.TokenKind;
import org.pragmatica.fmt.tree.NodeRole;
import org.pragmatica.fmt.tree.SyntaxNode;
import org.pragmatica.fmt.tree.TreeOracle;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Appends the separator of a location, adding or removing a trailing comma in argument, parameter
 * and import lists first.
 *
 * Commas before closing braces elsewhere, as in constructor bodies
 * <pre>
 * def this() = {
 *   this(1),
 * }
 * </pre>
 * are not trailing commas and are left alone.
 */
final class TrailingCommaNormalizer {
    private static final Logger log = LoggerFactory.getLogger(TrailingCommaNormalizer.class);

    private final FormatterConfig config;
    private final TreeOracle tree;
    private final WhitespacePolicy whitespacePolicy;

    private TrailingCommaNormalizer(FormatterConfig config, TreeOracle tree, WhitespacePolicy whitespacePolicy) {
        this.config = config;
        this.tree = tree;
        this.whitespacePolicy = whitespacePolicy;
    }

    static TrailingCommaNormalizer trailingCommaNormalizer(FormatterConfig config,
                                                           TreeOracle tree,
                                                           WhitespacePolicy whitespacePolicy) {
        return new TrailingCommaNormalizer(config, tree, whitespacePolicy);
    }

    /**
     * Append the whitespace of location {@code index} to the output, fixing the trailing comma before it.
     */
    void formatWhitespace(FormatLocations locations, int index, OutputBuffer sb) {
        var whitespace = whitespacePolicy.whitespace(locations, index);
        var current = locations.get(index);
        var formatToken = current.formatToken();
        var owner = tree.owner(formatToken.right());

        if (!config.allowTrailingCommas() || !isImporterOrDefnOrCallSite(owner)) {
            sb.append(whitespace);
            return;
        }

        boolean isImport = owner.is(NodeRole.IMPORTER);
        var left = formatToken.left();
        var right = locations.nextNonComment(formatToken)
                             .right();
        boolean isNewline = current.isNewline();
        boolean rightIsComment = formatToken.right().isComment();
        boolean rightIsCloseDelim = right.kind().isCloseParenOrBracket() || (right.is(TokenKind.RIGHT_BRACE) && isImport);
        var prevFormatToken = locations.get(Math.max(index - 1, 0))
                                       .formatToken();
        var policy = config.trailingCommas();

        // foo(
        //   a,
        //   b
        // )
        if (policy == TrailingCommas.ALWAYS
            && !left.is(TokenKind.COMMA)
            && !left.isComment()
            && !left.is(TokenKind.LEFT_PAREN)
            && !rightIsComment
            && rightIsCloseDelim
            && isNewline) {
            log.debug("Adding trailing comma after {}", left);
            sb.append(",");
            sb.append(whitespace);
            return;
        }

        // foo(
        //   a,
        //   b // comment
        // )
        if (policy == TrailingCommas.ALWAYS
            && left.isComment()
            && index > 0
            && !prevFormatToken.left().is(TokenKind.COMMA)
            && !prevFormatToken.left().isComment()
            && !locations.prevNonComment(formatToken).left().is(TokenKind.LEFT_PAREN)
            && rightIsCloseDelim
            && isNewline) {
            int insertAt = sb.tokenEnd(index - 1);
            log.debug("Adding trailing comma after {} before comment", prevFormatToken.left());

            // keep an aligned comment in its column
            if (whitespacePolicy.isAligned(prevFormatToken)) {
                sb.setCharAt(insertAt, ',');
            } else {
                sb.insert(insertAt, ',');
            }
            sb.append(whitespace);
            return;
        }

        // foo(
        //   a,
        //   b,
        // )
        if (policy == TrailingCommas.NEVER
            && left.is(TokenKind.COMMA)
            && rightIsCloseDelim
            && !rightIsComment
            && isNewline) {
            log.debug("Removing trailing comma before {}", right);
            sb.deleteLastChar();
            sb.append(whitespace);
            return;
        }

        // foo(
        //   a,
        //   b, // comment
        // )
        if (policy == TrailingCommas.NEVER
            && left.isComment()
            && index > 0
            && prevFormatToken.left().is(TokenKind.COMMA)
            && rightIsCloseDelim
            && isNewline) {
            int indexOfComma = sb.tokenStart(index - 1);
            log.debug("Removing trailing comma before comment {}", left);

            if (whitespacePolicy.isAligned(prevFormatToken)) {
                sb.setCharAt(indexOfComma, ' ');
            } else {
                sb.deleteCharAt(indexOfComma);
            }
            sb.append(whitespace);
            return;
        }

        // foo(a, b,)
        if (left.is(TokenKind.COMMA)
            && rightIsCloseDelim
            && !rightIsComment
            && !isNewline) {
            log.debug("Removing single-line trailing comma before {}", right);
            sb.deleteLastChar();
            return;
        }

        sb.append(whitespace);
    }

    private static boolean isImporterOrDefnOrCallSite(SyntaxNode owner) {
        return owner.is(NodeRole.IMPORTER) || owner.is(NodeRole.CALL_SITE) || owner.is(NodeRole.DEFINITION);
    }
}
