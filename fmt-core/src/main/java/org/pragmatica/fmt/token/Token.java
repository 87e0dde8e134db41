package org.pragmatica.fmt.token;

import java.util.Objects;

/**
 * Immutable syntactic terminal produced by the tokenizer.
 *
 * @param kind  kind tag
 * @param text  literal source text
 * @param index position in the token stream, unique per stream
 */
public record Token(TokenKind kind, String text, int index) {

    public Token {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(text, "text");
    }

    /**
     * Factory method.
     */
    public static Token token(TokenKind kind, String text, int index) {
        return new Token(kind, text, index);
    }

    public boolean is(TokenKind other) {
        return kind == other;
    }

    public boolean isComment() {
        return kind == TokenKind.COMMENT;
    }

    public boolean isSingleLineComment() {
        return kind == TokenKind.COMMENT && text.startsWith("//");
    }

    /**
     * Name of the token class used when comparing alignment candidates.
     * Keywords are told apart by their text ({@code KwVal}, {@code KwDef}).
     */
    public String typeName() {
        if (kind == TokenKind.KEYWORD && !text.isEmpty()) {
            return kind.typeName() + Character.toUpperCase(text.charAt(0)) + text.substring(1);
        }
        return kind.typeName();
    }

    public int length() {
        return text.length();
    }

    @Override
    public String toString() {
        return kind.typeName() + "(" + text + ")@" + index;
    }
}
