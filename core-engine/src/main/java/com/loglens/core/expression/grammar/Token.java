package com.loglens.core.expression.grammar;

public final class Token {

    private final TokenType type;
    private final String content;
    private final int position;

    public Token(TokenType type, String content, int position) {
        this.type = type;
        this.content = content;
        this.position = position;
    }

    public TokenType getType() {
        return type;
    }

    public String getContent() {
        return content;
    }

    /**
     * @return zero-based offset of the token in the source expression
     */
    public int getPosition() {
        return position;
    }

    public boolean is(TokenType type, String content) {
        return this.type == type && this.content.equals(content);
    }

    @Override
    public String toString() {
        return type + "(" + content + ")@" + position;
    }
}
