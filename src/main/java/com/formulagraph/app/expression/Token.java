package com.formulagraph.app.expression;

/**
 * One lexical token. For references, 'sheet' holds the qualifier (null when unqualified)
 * and 'text' the cell or "start:end" part.
 */
final class Token {

    final TokenType type;
    final String text;
    final String sheet;
    final int position;

    Token(TokenType type, String text, String sheet, int position) {
        this.type = type;
        this.text = text;
        this.sheet = sheet;
        this.position = position;
    }

    Token(TokenType type, String text, int position) {
        this(type, text, null, position);
    }

    boolean is(TokenType expected, String expectedText) {
        return type == expected && text.equals(expectedText);
    }

    @Override
    public String toString() {
        return type + "(" + (sheet == null ? "" : sheet + "!") + text + ")@" + position;
    }
}
