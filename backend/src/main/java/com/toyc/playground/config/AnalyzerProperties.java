package com.toyc.playground.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

import java.time.Duration;

@ConfigurationProperties(prefix = "toyc.analyzer")
@Validated
public record AnalyzerProperties(
    @NotNull
    @DefaultValue("0ms")
    Duration processingDelay,

    @Positive
    @DefaultValue("10000")
    int maxSourceLength,

    @Positive
    @DefaultValue("5")
    int contextRadius,

    @Positive
    @DefaultValue("100")
    int maxNestingDepth
) {

    public static AnalyzerProperties defaults() {
        return new AnalyzerProperties(Duration.ZERO, 10_000, 5, 100);
    }
}
