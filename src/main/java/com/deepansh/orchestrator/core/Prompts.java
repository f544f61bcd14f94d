package com.deepansh.orchestrator.core;

import com.deepansh.orchestrator.core.state.PlanStepResult;

import java.util.Collection;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Prompt templates for every generating step.
 */
final class Prompts {

    private Prompts() {
    }

    // ─── Reflection ───────────────────────────────────────────────────────────

    static String initialResponse(String input) {
        return """
                Respond to the following request as well as you can.

                Request: %s
                """.formatted(input);
    }

    static String reflect(String input, String response) {
        return """
                Critique the response below to the given request. Point out errors, gaps and \
                unclear parts, and say concretely how to improve it.
                If the response cannot be meaningfully improved, reply with exactly: %s

                Request: %s

                Response:
                %s
                """.formatted(Markers.NO_FURTHER_IMPROVEMENT, input, response);
    }

    static String refine(String input, String response, String critique) {
        return """
                Improve the response to the request using the critique. Reply with the improved \
                response only.

                Request: %s

                Response:
                %s

                Critique:
                %s
                """.formatted(input, response, critique);
    }

    // ─── ReAct ────────────────────────────────────────────────────────────────

    static String think(String input, String toolDescriptions) {
        return """
                Answer the request. You can use these tools:
                %s

                Use exactly this format when you need a tool:
                Thought: <your reasoning>
                Action: <tool name>
                Action Input: <JSON object with the tool arguments>

                When you know the answer, reply with:
                Thought: <your reasoning>
                Final Answer: <the answer>

                Tool observations from earlier steps are in the conversation.
                If a tool returned an ERROR, do not call it again with the same input.

                Request: %s
                """.formatted(toolDescriptions, input);
    }

    // ─── Planning ─────────────────────────────────────────────────────────────

    static String createPlan(String goal, int maxSteps) {
        return """
                Break the goal into at most %d concrete steps. Reply with a numbered list, \
                one step per line, and nothing else.

                Goal: %s
                """.formatted(maxSteps, goal);
    }

    static String executeStep(String goal, int stepNumber, String step, String toolDescriptions,
                              Collection<PlanStepResult> done) {
        return """
                You are executing step %d of a plan for the goal: %s

                Step: %s

                Results so far:
                %s

                You can use these tools:
                %s

                To use a tool reply with:
                Action: <tool name>
                Action Input: <JSON object with the tool arguments>
                Otherwise reply with the result of the step.
                If the step cannot be done because the plan is wrong, include %s in your reply.
                """.formatted(stepNumber, goal, step, summarize(done), toolDescriptions, Markers.PLAN_INVALID);
    }

    static String replan(String goal, List<String> remaining, Collection<PlanStepResult> done, int maxSteps) {
        return """
                The plan for the goal below ran into trouble. Given the results so far, write \
                new steps to replace the remaining ones (at most %d). Reply with a numbered list \
                only; reply with nothing if no further steps are needed.

                Goal: %s

                Results so far:
                %s

                Remaining steps:
                %s
                """.formatted(maxSteps, goal, summarize(done),
                remaining.isEmpty() ? "(none)" : String.join("\n", remaining));
    }

    static String summarize(Collection<PlanStepResult> results) {
        if (results.isEmpty()) {
            return "(none)";
        }
        return results.stream()
                .map(r -> String.format("Step %d [%s] %s: %s",
                        r.getIndex() + 1,
                        r.isSuccess() ? "OK" : "FAILED",
                        r.getDescription(),
                        r.isSuccess() ? r.getResult() : r.getError()))
                .collect(Collectors.joining("\n"));
    }
}
