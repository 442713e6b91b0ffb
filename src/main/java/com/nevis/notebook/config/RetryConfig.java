package com.nevis.notebook.config;

import com.nevis.notebook.exception.BackendUnavailableException;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.retry.support.RetryTemplate;

/**
 * Retry policy of the content pipeline: only backend outages are retried, with
 * exponential backoff and random jitter, a bounded number of times.
 */
@Configuration
public class RetryConfig {

    @Bean("pipelineRetryTemplate")
    public RetryTemplate pipelineRetryTemplate(PipelineProperties props) {
        PipelineProperties.Retry retry = props.retry();
        return RetryTemplate.builder()
            .maxAttempts(retry.maxAttempts())
            .exponentialBackoff(
                retry.initialInterval().toMillis(),
                retry.multiplier(),
                retry.maxInterval().toMillis(),
                true)
            .retryOn(BackendUnavailableException.class)
            .traversingCauses()
            .build();
    }
}
