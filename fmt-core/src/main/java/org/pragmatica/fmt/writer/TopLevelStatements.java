package org.pragmatica.fmt.writer;

import org.pragmatica.fmt.config.FormatterConfig;
import org.pragmatica.fmt.token.FormatToken;
import org.pragmatica.fmt.token.Token;
import org.pragmatica.fmt.token.TokenKind;
import org.pragmatica.fmt.tree.NodeRole;
import org.pragmatica.fmt.tree.SyntaxNode;
import org.pragmatica.fmt.tree.TreeOracle;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;

/**
 * Decides whether a line break should become a blank line because it precedes a top-level statement
 * and that statement's rendering spans several lines.
 */
final class TopLevelStatements {
    private final FormatterConfig config;
    private final TreeOracle tree;
    private Set<Integer> topLevelTokens;

    private TopLevelStatements(FormatterConfig config, TreeOracle tree) {
        this.config = config;
        this.tree = tree;
    }

    static TopLevelStatements topLevelStatements(FormatterConfig config, TreeOracle tree) {
        return new TopLevelStatements(config, tree);
    }

    /**
     * Stream indices of the first token, leading comment included, of every top-level statement.
     * Computed on first use.
     */
    Set<Integer> topLevelTokens(FormatLocations locations) {
        if (topLevelTokens == null) {
            topLevelTokens = Collections.unmodifiableSet(collectTopLevelTokens(locations));
        }
        return topLevelTokens;
    }

    private Set<Integer> collectTopLevelTokens(FormatLocations locations) {
        var marks = new LinkedHashSet<Integer>();
        var stack = new ArrayDeque<SyntaxNode>();
        stack.push(tree.root());

        while (!stack.isEmpty()) {
            var node = stack.pop();
            if (node.is(NodeRole.BLOCK)) {
                continue;
            }
            if (node.is(NodeRole.TOP_LEVEL_STATEMENT)) {
                marks.add(leadingComment(locations, tree.firstToken(node)).index());
            }
            var children = node.children();
            for (int i = children.size() - 1; i >= 0; i--) {
                stack.push(children.get(i));
            }
        }
        return marks;
    }

    // walks back over comments placed right before the statement
    private static Token leadingComment(FormatLocations locations, Token first) {
        var current = locations.before(first);
        while (current.isPresent() && current.get().left().isComment()) {
            var previous = locations.before(current.get().left());
            if (previous.isEmpty()) {
                return current.get().left();
            }
            current = previous;
        }
        return current.map(FormatToken::right)
                      .orElse(first);
    }

    /**
     * Line break at location {@code index} is owed a blank line.
     */
    boolean isMultilineTopLevelStatement(FormatLocations locations, int index) {
        if (!config.blankLineBeforeTopLevelStatements()) {
            return false;
        }
        var formatToken = locations.get(index)
                                   .formatToken();
        return checkPackage(locations, formatToken)
                   .orElseGet(() -> checkTopLevelStatement(locations, formatToken, index));
    }

    private boolean checkTopLevelStatement(FormatLocations locations, FormatToken formatToken, int index) {
        if (!topLevelTokens(locations).contains(formatToken.right().index())) {
            return false;
        }
        int distance = locations.distanceToNextNonComment(formatToken);
        var nextNonComment = locations.nextNonComment(formatToken)
                                      .right();
        var end = tree.lastToken(actualOwner(nextNonComment));

        return isMultiline(locations, end, index + distance + 1);
    }

    private static boolean isMultiline(FormatLocations locations, Token end, int from) {
        for (int i = from; i < locations.size(); i++) {
            var location = locations.get(i);
            if (location.formatToken().left().equals(end)) {
                return false;
            }
            if (location.isNewline()) {
                return true;
            }
        }
        return false;
    }

    private SyntaxNode actualOwner(Token token) {
        var owner = tree.owner(token);
        if (owner.is(NodeRole.MODIFIER)) {
            return tree.parent(owner)
                       .orElse(owner);
        }
        return owner;
    }

    /**
     * Package clauses answer on their own under the legacy rule: a blank line follows the clause
     * unless its first statement is a nested package without braces.
     */
    private Optional<Boolean> checkPackage(FormatLocations locations, FormatToken formatToken) {
        if (!config.legacyPackageBlankLineRule()) {
            return Optional.empty();
        }
        var owner = tree.owner(formatToken.left());
        if (!owner.is(NodeRole.NAME)) {
            return Optional.empty();
        }
        return tree.parent(owner)
                   .flatMap(this::enclosingPackage)
                   .flatMap(TopLevelStatements::firstStatement)
                   .map(stat -> stat.is(NodeRole.PACKAGE)
                                ? isFollowedByBrace(locations, stat)
                                : true);
    }

    private Optional<SyntaxNode> enclosingPackage(SyntaxNode parent) {
        if (parent.is(NodeRole.PACKAGE)) {
            return Optional.of(parent);
        }
        if (parent.is(NodeRole.SELECT)) {
            return tree.parent(parent)
                       .filter(grandParent -> grandParent.is(NodeRole.PACKAGE));
        }
        return Optional.empty();
    }

    private static Optional<SyntaxNode> firstStatement(SyntaxNode pkg) {
        var children = pkg.children();
        return children.size() > 1
               ? Optional.of(children.get(1))
               : Optional.empty();
    }

    private boolean isFollowedByBrace(FormatLocations locations, SyntaxNode pkg) {
        var ref = pkg.children()
                     .get(0);
        return locations.after(tree.lastToken(ref))
                        .map(after -> after.right().is(TokenKind.LEFT_BRACE))
                        .orElse(false);
    }
}
