package com.toyc.playground.dto;

import java.util.List;

public record ComplexityInfo(
        TimeComplexity time,
        SpaceComplexity space,
        List<Suggestion> suggestions
) {

    public record TimeComplexity(int bigO, String notation, List<String> factors) {

        public static TimeComplexity of(ComplexityClass complexityClass, List<String> factors) {
            return new TimeComplexity(complexityClass.ordinal(), complexityClass.notation(), List.copyOf(factors));
        }
    }

    public record SpaceComplexity(int bigO, String notation, List<String> details) {

        public static SpaceComplexity of(ComplexityClass complexityClass, List<String> details) {
            return new SpaceComplexity(complexityClass.ordinal(), complexityClass.notation(), List.copyOf(details));
        }
    }

    public record Suggestion(String title, String description) {
    }

    public ComplexityInfo {
        suggestions = List.copyOf(suggestions);
    }
}
