package org.pragmatica.fmt.tree;

import org.pragmatica.fmt.token.Token;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * In-memory syntax tree over a token stream.
 *
 * Unless assigned explicitly, a token is owned by the deepest node whose range covers it.
 */
public final class SyntaxTree implements TreeOracle {
    private final List<Token> tokens;
    private final SyntaxNode root;
    private final SyntaxNode[] owners;

    private SyntaxTree(List<Token> tokens, SyntaxNode root, SyntaxNode[] owners) {
        this.tokens = tokens;
        this.root = root;
        this.owners = owners;
    }

    /**
     * Start building a tree over the given tokens. The root covers the whole stream.
     */
    public static Builder syntaxTree(List<Token> tokens, String rootKind) {
        return new Builder(tokens, rootKind);
    }

    @Override
    public SyntaxNode root() {
        return root;
    }

    @Override
    public List<Token> tokens() {
        return tokens;
    }

    @Override
    public SyntaxNode owner(Token token) {
        return owners[token.index()];
    }

    public static final class Builder {
        private final List<Token> tokens;
        private final SyntaxNode root;
        private final List<SyntaxNode> nodes = new ArrayList<>();
        private final Map<Integer, SyntaxNode> explicitOwners = new HashMap<>();

        private Builder(List<Token> tokens, String rootKind) {
            this.tokens = List.copyOf(tokens);
            this.root = new SyntaxNode(rootKind, rootKind, EnumSet.noneOf(NodeRole.class), 0, Math.max(tokens.size() - 1, 0), null);
            nodes.add(root);
        }

        public SyntaxNode root() {
            return root;
        }

        /**
         * Add a node covering tokens {@code first..last} (inclusive) under the given parent.
         * Siblings may be added in any order; {@link #build()} puts them in source order.
         */
        public SyntaxNode node(SyntaxNode parent, String kind, int first, int last, NodeRole... roles) {
            return node(parent, kind, kind, first, last, roles);
        }

        public SyntaxNode node(SyntaxNode parent, String kind, String className, int first, int last, NodeRole... roles) {
            if (first > last || !parent.contains(first) || !parent.contains(last)) {
                throw new IllegalArgumentException("Node " + kind + "[" + first + ".." + last + "] is not inside " + parent);
            }
            var roleSet = EnumSet.noneOf(NodeRole.class);
            roleSet.addAll(List.of(roles));
            var node = new SyntaxNode(kind, className, roleSet, first, last, parent);
            nodes.add(node);
            return node;
        }

        /**
         * Assign ownership of the given tokens to a node, overriding the deepest-node default.
         */
        public Builder own(SyntaxNode node, int... tokenIndices) {
            for (var index : tokenIndices) {
                explicitOwners.put(index, node);
            }
            return this;
        }

        public SyntaxTree build() {
            var owners = new SyntaxNode[tokens.size()];
            var depths = new int[tokens.size()];
            for (var node : nodes) {
                node.sortChildren();
                int depth = node.depth();
                for (int i = node.firstToken(); i <= node.lastToken() && i < owners.length; i++) {
                    if (owners[i] == null || depth >= depths[i]) {
                        owners[i] = node;
                        depths[i] = depth;
                    }
                }
            }
            explicitOwners.forEach((index, node) -> owners[index] = node);
            return new SyntaxTree(tokens, root, owners);
        }
    }
}
