package com.nevis.notebook.config;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "app.rag")
public record RagProperties(
    @NotNull @Min(1) @Max(100) Integer topK,
    @NotNull @DecimalMin("0.0") @DecimalMax("1.0") Double similarityThreshold,
    @NotNull DistanceMetric distanceMetric,
    @NotNull String contextSeparator,
    @NotNull @Min(1) Integer maxQuestionLength
) {

    public enum DistanceMetric {
        COSINE("<=>"),
        EUCLIDEAN("<->");

        private final String operator;

        DistanceMetric(String operator) {
            this.operator = operator;
        }

        public String operator() {
            return operator;
        }
    }
}
