package com.nevis.notebook.infra;

import com.nevis.notebook.config.LimitProperties;
import com.nevis.notebook.exception.BackendUnavailableException;
import com.nevis.notebook.exception.BackendUnavailableException.Backend;
import io.github.bucket4j.Bandwidth;
import io.github.bucket4j.Bucket;
import io.github.bucket4j.Refill;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-model quota for one backend: a requests-per-minute bucket and a
 * tokens-per-minute bucket, both refilled greedily over a minute.
 */
@Slf4j
public class BucketRateLimiter implements RateLimiter {

    private record ModelQuota(Bucket requests, Bucket tokens) {}

    private final Backend backend;
    private final LimitProperties.Limit limit;
    private final ConcurrentHashMap<String, ModelQuota> quotas = new ConcurrentHashMap<>();

    public BucketRateLimiter(Backend backend, LimitProperties.Limit limit) {
        this.backend = backend;
        this.limit = limit;
    }

    @Override
    public void admit(String model, int estimatedTokens) {
        ModelQuota quota = quotas.computeIfAbsent(model, m -> new ModelQuota(
            perMinute(limit.requestsPerMinute()),
            perMinute(limit.tokensPerMinute())));
        // a prompt larger than the whole token bucket would wait forever
        long tokens = Math.max(1, Math.min(estimatedTokens, limit.tokensPerMinute()));

        try {
            if (!quota.requests().tryConsume(1)) {
                log.debug("{} model {} is over {} requests/min, waiting", backend, model, limit.requestsPerMinute());
                quota.requests().asBlocking().consume(1);
            }
            if (!quota.tokens().tryConsume(tokens)) {
                log.debug("{} model {} is over {} tokens/min, waiting", backend, model, limit.tokensPerMinute());
                quota.tokens().asBlocking().consume(tokens);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BackendUnavailableException(backend, "Interrupted while waiting for " + model + " quota", e);
        }
    }

    private static Bucket perMinute(int capacity) {
        return Bucket.builder()
            .addLimit(Bandwidth.classic(capacity, Refill.greedy(capacity, Duration.ofMinutes(1))))
            .build();
    }
}
