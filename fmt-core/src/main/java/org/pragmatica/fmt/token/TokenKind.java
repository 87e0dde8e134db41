package org.pragmatica.fmt.token;

/**
 * Kind tag of a syntactic terminal.
 *
 * The renderer dispatches on this tag instead of on token subclasses.
 */
public enum TokenKind {
    BOF("BOF"),
    EOF("EOF"),
    COMMENT("Comment"),
    STRING("Constant.String"),
    INTERPOLATION_START("Interpolation.Start"),
    INTERPOLATION_PART("Interpolation.Part"),
    INTERPOLATION_END("Interpolation.End"),
    INT("Constant.Int"),
    LONG("Constant.Long"),
    FLOAT("Constant.Float"),
    DOUBLE("Constant.Double"),
    CHAR("Constant.Char"),
    IDENTIFIER("Ident"),
    KEYWORD("Kw"),
    COMMA("Comma"),
    DOT("Dot"),
    SEMICOLON("Semicolon"),
    COLON("Colon"),
    EQUALS("Equals"),
    RIGHT_ARROW("RightArrow"),
    LEFT_ARROW("LeftArrow"),
    LEFT_PAREN("LeftParen"),
    RIGHT_PAREN("RightParen"),
    LEFT_BRACKET("LeftBracket"),
    RIGHT_BRACKET("RightBracket"),
    LEFT_BRACE("LeftBrace"),
    RIGHT_BRACE("RightBrace"),
    OTHER("Other");

    private final String typeName;

    TokenKind(String typeName) {
        this.typeName = typeName;
    }

    public String typeName() {
        return typeName;
    }

    public boolean isCloseParenOrBracket() {
        return this == RIGHT_PAREN || this == RIGHT_BRACKET;
    }
}
