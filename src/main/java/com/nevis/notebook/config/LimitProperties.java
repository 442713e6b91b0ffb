package com.nevis.notebook.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "app.limits")
public record LimitProperties(
    @Valid @NotNull Limit embedding,
    @Valid @NotNull Limit generation
) {

    public record Limit(
        @NotNull @Min(1) Integer requestsPerMinute,
        @NotNull @Min(1) Integer tokensPerMinute
    ) {}
}
