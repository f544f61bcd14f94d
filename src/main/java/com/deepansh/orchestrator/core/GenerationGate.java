package com.deepansh.orchestrator.core;

import com.deepansh.orchestrator.exception.GenerationException;
import com.deepansh.orchestrator.generation.GenerationClient;
import com.deepansh.orchestrator.generation.SamplingParameters;
import com.deepansh.orchestrator.model.Message;
import com.deepansh.orchestrator.observability.RunContext;
import com.deepansh.orchestrator.resilience.BoundedExecution;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeoutException;

/**
 * Timeout-bounded access to the generation client. Every failure, timeout and
 * interruption included, surfaces as {@link GenerationException}.
 */
@Slf4j
public class GenerationGate {

    private final GenerationClient client;
    private final BoundedExecution boundedExecution;
    private final Duration timeout;
    private final SamplingParameters sampling;

    public GenerationGate(GenerationClient client,
                          BoundedExecution boundedExecution,
                          Duration timeout,
                          SamplingParameters sampling) {
        this.client = client;
        this.boundedExecution = boundedExecution;
        this.timeout = timeout;
        this.sampling = sampling;
    }

    public String generate(String prompt, List<Message> context, RunContext runCtx) {
        List<Message> snapshot = List.copyOf(context);
        try {
            String text = boundedExecution.call("generation",
                    () -> client.generate(prompt, snapshot, sampling), timeout);
            if (text == null) {
                throw new GenerationException("Generation returned no text");
            }
            runCtx.recordGeneration(true);
            return text;
        } catch (GenerationException e) {
            runCtx.recordGeneration(false);
            throw e;
        } catch (TimeoutException e) {
            runCtx.recordGeneration(false);
            throw new GenerationException("Generation timed out after " + timeout.toMillis() + "ms", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            runCtx.recordGeneration(false);
            throw new GenerationException("Generation interrupted", e);
        } catch (Exception e) {
            runCtx.recordGeneration(false);
            log.warn("Generation failed: {}", e.getMessage());
            throw new GenerationException("Generation failed: " + e.getMessage(), e);
        }
    }
}
