package com.nevis.notebook.config;

import com.nevis.notebook.exception.BackendUnavailableException.Backend;
import com.nevis.notebook.infra.BucketRateLimiter;
import com.nevis.notebook.infra.RateLimiter;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class LimiterConfig {

    @Bean("generationLimiter")
    public RateLimiter generationLimiter(LimitProperties limits) {
        return new BucketRateLimiter(Backend.GENERATION, limits.generation());
    }

    @Bean("embeddingLimiter")
    public RateLimiter embeddingLimiter(LimitProperties limits) {
        return new BucketRateLimiter(Backend.EMBEDDING, limits.embedding());
    }
}
