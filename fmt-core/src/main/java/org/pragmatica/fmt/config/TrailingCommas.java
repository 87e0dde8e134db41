package org.pragmatica.fmt.config;

/**
 * Trailing comma policy for multi-line argument, parameter and import lists.
 */
public enum TrailingCommas {
    /** Add a comma after the last element when the closing delimiter is on its own line. */
    ALWAYS,
    /** Remove the comma after the last element. */
    NEVER,
    /** Keep commas as written. */
    PRESERVE
}
