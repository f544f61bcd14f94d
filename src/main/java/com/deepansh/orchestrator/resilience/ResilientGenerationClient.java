package com.deepansh.orchestrator.resilience;

import com.deepansh.orchestrator.exception.GenerationException;
import com.deepansh.orchestrator.generation.GenerationClient;
import com.deepansh.orchestrator.generation.SamplingParameters;
import com.deepansh.orchestrator.model.Message;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Decorator around the provider client that adds retry and circuit breaker.
 *
 * Retry config (application.yml, instance "generationClient"):
 * - 3 attempts, exponential backoff from 1s
 * - retries only TransientGenerationException
 *
 * Circuit breaker config:
 * - Opens after 50% failures in a sliding window of 10 calls
 * - Waits 30s before allowing probe calls
 *
 * Fallbacks rethrow as GenerationException so the calling step applies its own
 * failure rule instead of treating an apology as generated text.
 */
@Component
@Primary
@Slf4j
public class ResilientGenerationClient implements GenerationClient {

    private final GenerationClient delegate;

    public ResilientGenerationClient(@Qualifier("providerGenerationClient") GenerationClient delegate) {
        this.delegate = delegate;
    }

    @Override
    public String generate(String prompt, List<Message> context) {
        return delegate.generate(prompt, context);
    }

    @Override
    @Retry(name = "generationClient", fallbackMethod = "retryFallback")
    @CircuitBreaker(name = "generationClient", fallbackMethod = "circuitBreakerFallback")
    public String generate(String prompt, List<Message> context, SamplingParameters sampling) {
        return delegate.generate(prompt, context, sampling);
    }

    public String retryFallback(String prompt, List<Message> context, SamplingParameters sampling, Exception ex) {
        log.error("Generation failed after all retries: {}", ex.getMessage());
        throw asGenerationException("Generation failed after retries: ", ex);
    }

    public String circuitBreakerFallback(String prompt, List<Message> context, SamplingParameters sampling,
                                         Exception ex) {
        log.error("Generation circuit breaker is OPEN, rejecting call: {}", ex.getMessage());
        throw asGenerationException("Generation service unavailable: ", ex);
    }

    private static GenerationException asGenerationException(String prefix, Exception ex) {
        if (ex instanceof GenerationException ge) {
            return ge;
        }
        return new GenerationException(prefix + ex.getMessage(), ex);
    }
}
