package com.nevis.notebook.config;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "app.chunking")
public record ChunkingProperties(
    @NotNull @Min(1) Integer size,
    @NotNull @Min(0) Integer overlap
) {

    @AssertTrue(message = "app.chunking.overlap must be smaller than app.chunking.size")
    public boolean isOverlapSmallerThanSize() {
        return size == null || overlap == null || overlap < size;
    }
}
