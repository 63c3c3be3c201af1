package com.toyc.playground.dto;

public record Variable(
    String name,
    String type,
    int line,
    boolean initialized,
    boolean used
) {

    public Variable markUsed() {
        return used ? this : new Variable(name, type, line, initialized, true);
    }
}
