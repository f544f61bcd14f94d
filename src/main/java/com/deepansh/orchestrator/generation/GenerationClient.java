package com.deepansh.orchestrator.generation;

import com.deepansh.orchestrator.model.Message;

import java.util.List;

/**
 * The text-generation capability the state machines consume.
 *
 * Implementations throw {@link com.deepansh.orchestrator.exception.GenerationException}
 * on any failure; the calling step decides what a failure means for the run.
 */
@FunctionalInterface
public interface GenerationClient {

    /**
     * @param prompt  the step's instruction
     * @param context conversation so far, oldest first
     */
    String generate(String prompt, List<Message> context);

    default String generate(String prompt, List<Message> context, SamplingParameters sampling) {
        return generate(prompt, context);
    }
}
