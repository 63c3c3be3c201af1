package com.toyc.playground.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record AnalysisRequest(
    @NotNull(message = "Source code cannot be null")
    @Size(max = 10_000, message = "Source code cannot exceed 10,000 characters")
    String sourceCode
) {

    public String sanitizedSourceCode() {
        if (sourceCode == null) {
            return "";
        }

        return sourceCode
            .replace("\0", "")
            .replace("\r\n", "\n")
            .replace("\r", "\n");
    }
}
