package org.pragmatica.fmt.tree;

import org.pragmatica.fmt.token.Token;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Read-only view of the parsed syntax tree, supplied by the parser.
 */
public interface TreeOracle {

    /**
     * Root of the tree.
     */
    SyntaxNode root();

    /**
     * The token stream the tree was parsed from.
     */
    List<Token> tokens();

    /**
     * Node that owns the given token.
     */
    SyntaxNode owner(Token token);

    default Optional<SyntaxNode> parent(SyntaxNode node) {
        return node.parent();
    }

    /**
     * Ancestors of a node, nearest first, excluding the node itself.
     */
    default List<SyntaxNode> ancestors(SyntaxNode node) {
        var result = new ArrayList<SyntaxNode>();
        var current = node.parent();
        while (current.isPresent()) {
            result.add(current.get());
            current = current.get().parent();
        }
        return result;
    }

    default Token firstToken(SyntaxNode node) {
        return tokens().get(node.firstToken());
    }

    default Token lastToken(SyntaxNode node) {
        return tokens().get(node.lastToken());
    }

    default List<Token> tokens(SyntaxNode node) {
        return tokens().subList(node.firstToken(), node.lastToken() + 1);
    }
}
