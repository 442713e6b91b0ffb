package com.nevis.notebook.config;

import com.nevis.notebook.model.ContentType;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.Map;

@Validated
@ConfigurationProperties(prefix = "app.pipeline")
public record PipelineProperties(
    @NotNull Boolean enabled,
    @NotNull @Min(1) Integer workers,
    @NotNull @Min(10) Long pollIntervalMs,
    @NotNull Duration lease,
    @NotNull @Min(1) Integer formatMaxChars,
    @NotNull @Min(1) Integer summaryMaxChars,
    @NotNull @DecimalMin("0.0") Double summaryTemperature,
    @NotNull Boolean retainRawInput,
    @Valid @NotNull Retry retry,
    @NotNull Map<ContentType, Recovery> recovery
) {

    private static final Recovery NEVER_RESUME = new Recovery(false, null);

    public Recovery recoveryFor(ContentType type) {
        return recovery.getOrDefault(type, NEVER_RESUME);
    }

    public record Retry(
        @NotNull @Min(1) Integer maxAttempts,
        @NotNull Duration initialInterval,
        @NotNull @DecimalMin("1.0") Double multiplier,
        @NotNull Duration maxInterval
    ) {}

    /**
     * Restart policy for one content type. {@code maxAge} is the staleness cutoff,
     * counted from when the job last entered {@code PENDING}, past which a job is
     * failed instead of run or resumed; {@code null} means no cutoff.
     */
    public record Recovery(boolean resume, Duration maxAge) {

        public boolean isExpired(OffsetDateTime queuedAt, OffsetDateTime now) {
            return maxAge != null && queuedAt != null && queuedAt.plus(maxAge).isBefore(now);
        }
    }
}
