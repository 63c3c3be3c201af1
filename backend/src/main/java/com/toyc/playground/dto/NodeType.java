package com.toyc.playground.dto;

import com.toyc.playground.dto.Token.TokenType;

public enum NodeType {
    PROGRAM,
    STATEMENT,

    FOR_STATEMENT,
    FOR_INIT,
    FOR_CONDITION,
    FOR_INCREMENT,
    FOR_BODY,

    WHILE_STATEMENT,
    WHILE_CONDITION,
    WHILE_BODY,

    IF_STATEMENT,
    IF_CONDITION,
    IF_BODY,
    ELSE_BODY,

    KEYWORD,
    IDENTIFIER,
    STRING,
    NUMBER,
    OPERATOR,
    PUNCTUATION,
    ERROR;

    public static NodeType of(TokenType tokenType) {
        return switch (tokenType) {
            case KEYWORD -> KEYWORD;
            case IDENTIFIER -> IDENTIFIER;
            case STRING -> STRING;
            case NUMBER -> NUMBER;
            case OPERATOR -> OPERATOR;
            case PUNCTUATION -> PUNCTUATION;
            case ERROR -> ERROR;
        };
    }

    public boolean isLoop() {
        return this == FOR_STATEMENT || this == WHILE_STATEMENT;
    }

    public boolean isBranch() {
        return this == IF_STATEMENT;
    }

    public NodeType conditionType() {
        return switch (this) {
            case FOR_STATEMENT -> FOR_CONDITION;
            case WHILE_STATEMENT -> WHILE_CONDITION;
            case IF_STATEMENT -> IF_CONDITION;
            default -> null;
        };
    }
}
