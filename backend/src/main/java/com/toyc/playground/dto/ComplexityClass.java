package com.toyc.playground.dto;

public enum ComplexityClass {
    CONSTANT("O(1)"),
    LOGARITHMIC("O(log n)"),
    LINEAR("O(n)"),
    QUADRATIC("O(n²)"),
    CUBIC("O(n³)");

    private final String notation;

    ComplexityClass(String notation) {
        this.notation = notation;
    }

    public String notation() {
        return notation;
    }
}
