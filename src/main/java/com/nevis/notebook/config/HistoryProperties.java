package com.nevis.notebook.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "app.history")
public record HistoryProperties(
    @NotNull @Min(0) Integer maxTurns,
    @NotNull @Min(0) Integer maxChars,
    @NotNull @Min(0) Integer minTruncationBudget
) {}
