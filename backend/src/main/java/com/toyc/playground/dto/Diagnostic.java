package com.toyc.playground.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record Diagnostic(
        String message,
        int line,
        int column,
        Severity severity,
        String context,
        List<String> suggestions
) {

    public enum Severity {
        ERROR,
        WARNING;

        @JsonValue
        public String jsonValue() {
            return name().toLowerCase();
        }
    }

    public Diagnostic {
        suggestions = suggestions == null ? null : List.copyOf(suggestions);
    }

    public static Diagnostic error(String message, int line, int column, String context, List<String> suggestions) {
        return new Diagnostic(message, line, column, Severity.ERROR, context, suggestions);
    }

    public static Diagnostic warning(String message, int line, int column, List<String> suggestions) {
        return new Diagnostic(message, line, column, Severity.WARNING, null, suggestions);
    }
}
