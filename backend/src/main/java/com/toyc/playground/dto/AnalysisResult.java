package com.toyc.playground.dto;

import java.util.List;

public record AnalysisResult(
        List<Token> tokens,
        ParseTreeNode parseTree,
        List<VariableScope> scopes,
        ControlFlowNode controlFlow,
        ComplexityInfo complexity,
        List<Diagnostic> errors) {

    private static final List<String> FAILURE_SUGGESTIONS = List.of(
            "Check the code for unsupported constructs",
            "Try analyzing a smaller fragment");

    public AnalysisResult {
        tokens = List.copyOf(tokens);
        scopes = List.copyOf(scopes);
        errors = List.copyOf(errors);
    }

    public static AnalysisResult failure(String message) {
        return new AnalysisResult(
                List.of(),
                null,
                List.of(),
                null,
                null,
                List.of(Diagnostic.error(message, 1, 1, null, FAILURE_SUGGESTIONS)));
    }

    public static AnalysisResult fatal(Throwable cause) {
        String description = cause.getMessage() != null ? cause.getMessage() : "Unknown error";
        return failure("Fatal error: " + description);
    }
}
