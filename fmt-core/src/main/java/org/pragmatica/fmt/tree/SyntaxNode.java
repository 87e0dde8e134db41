package org.pragmatica.fmt.tree;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Node of the syntax tree covering a contiguous range of the token stream.
 *
 * Nodes compare by identity: two structurally equal subtrees are still distinct owners.
 */
public final class SyntaxNode {
    private final String kind;
    private final String className;
    private final Set<NodeRole> roles;
    private final int firstToken;
    private final int lastToken;
    private final SyntaxNode parent;
    private final List<SyntaxNode> children = new ArrayList<>();

    SyntaxNode(String kind, String className, Set<NodeRole> roles, int firstToken, int lastToken, SyntaxNode parent) {
        this.kind = kind;
        this.className = className;
        this.roles = roles.isEmpty()
                     ? Collections.unmodifiableSet(EnumSet.noneOf(NodeRole.class))
                     : Collections.unmodifiableSet(EnumSet.copyOf(roles));
        this.firstToken = firstToken;
        this.lastToken = lastToken;
        this.parent = parent;
        if (parent != null) {
            parent.children.add(this);
        }
    }

    /**
     * Tree kind name, e.g. {@code Defn.Val} or {@code Term.ApplyInfix}.
     */
    public String kind() {
        return kind;
    }

    /**
     * Fully qualified class name of the node, matched against alignment owner patterns.
     */
    public String className() {
        return className;
    }

    public boolean is(NodeRole role) {
        return roles.contains(role);
    }

    public int firstToken() {
        return firstToken;
    }

    public int lastToken() {
        return lastToken;
    }

    public Optional<SyntaxNode> parent() {
        return Optional.ofNullable(parent);
    }

    /**
     * Child nodes in source order.
     */
    public List<SyntaxNode> children() {
        return Collections.unmodifiableList(children);
    }

    void sortChildren() {
        children.sort(Comparator.comparingInt(SyntaxNode::firstToken));
    }

    public boolean contains(int tokenIndex) {
        return firstToken <= tokenIndex && tokenIndex <= lastToken;
    }

    /**
     * Number of ancestors between this node and the root.
     */
    public int depth() {
        int depth = 0;
        for (var current = parent; current != null; current = current.parent) {
            depth++;
        }
        return depth;
    }

    @Override
    public String toString() {
        return kind + "[" + firstToken + ".." + lastToken + "]";
    }
}
