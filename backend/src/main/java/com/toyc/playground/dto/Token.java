package com.toyc.playground.dto;

public record Token(
    TokenType type,
    String value,
    int line,
    int column
) {
    public enum TokenType {
        KEYWORD,
        IDENTIFIER,
        STRING,
        NUMBER,
        OPERATOR,
        PUNCTUATION,
        ERROR
    }

    public boolean isKeyword(String keyword) {
        return type == TokenType.KEYWORD && value.equals(keyword);
    }

    public boolean isPunctuation(String symbol) {
        return type == TokenType.PUNCTUATION && value.equals(symbol);
    }
}
