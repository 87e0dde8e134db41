package org.pragmatica.fmt.tree;

/**
 * Classification the parser attaches to syntax nodes. A node may carry several roles.
 */
public enum NodeRole {
    /** Import clause member, e.g. {@code a.b.{c, d}}. */
    IMPORTER,
    /** Application with an argument list. */
    CALL_SITE,
    /** Definition with a parameter list. */
    DEFINITION,
    /** Infix operator application, e.g. {@code a + b}. */
    INFIX_APPLY,
    /** Plain term name. */
    NAME,
    /** Dotted selection, e.g. {@code a.b}. */
    SELECT,
    /** Modifier such as {@code private} or an annotation. */
    MODIFIER,
    /** Package clause. First child is the package reference, the rest are its statements. */
    PACKAGE,
    /** Block expression; its contents never count as top-level. */
    BLOCK,
    /** Candidate top-level statement. */
    TOP_LEVEL_STATEMENT
}
