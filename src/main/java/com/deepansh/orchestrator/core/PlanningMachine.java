package com.deepansh.orchestrator.core;

import com.deepansh.orchestrator.core.state.AgentState;
import com.deepansh.orchestrator.core.state.PlanStepResult;
import com.deepansh.orchestrator.core.state.PlanningState;
import com.deepansh.orchestrator.core.state.StrategyType;
import com.deepansh.orchestrator.core.state.TerminationReason;
import com.deepansh.orchestrator.exception.GenerationException;
import com.deepansh.orchestrator.model.Message;
import com.deepansh.orchestrator.tool.ToolOutcome;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Plan, execute step by step, evaluate, replan when a step fails.
 *
 * <pre>
 * UNDERSTAND_GOAL → CREATE_PLAN → EXECUTE_STEP → EVALUATE → (EXECUTE_STEP | REPLAN | TERMINATE)
 * REPLAN → (EXECUTE_STEP | TERMINATE)
 * </pre>
 *
 * Failed steps are recorded and never abort the plan. Total executed steps are
 * bounded by maxSteps and replans by maxReplans.
 */
@Slf4j
public class PlanningMachine extends AbstractStateMachine<PlanningState> {

    static final String UNDERSTAND_GOAL = "UNDERSTAND_GOAL";
    static final String CREATE_PLAN = "CREATE_PLAN";
    static final String EXECUTE_STEP = "EXECUTE_STEP";
    static final String EVALUATE = "EVALUATE";
    static final String REPLAN = "REPLAN";

    private static final StepGraph GRAPH = StepGraph.startingAt(UNDERSTAND_GOAL)
            .edge(UNDERSTAND_GOAL, CREATE_PLAN)
            .edge(CREATE_PLAN, EXECUTE_STEP, AgentState.TERMINATE)
            .edge(EXECUTE_STEP, EVALUATE)
            .edge(EVALUATE, EXECUTE_STEP, REPLAN, AgentState.TERMINATE)
            .edge(REPLAN, EXECUTE_STEP, AgentState.TERMINATE)
            .build();

    private final ReActOutputParser parser;

    public PlanningMachine() {
        this(new ReActOutputParser(new ObjectMapper()));
    }

    public PlanningMachine(ReActOutputParser parser) {
        super(PlanningState.class, GRAPH);
        this.parser = parser;
    }

    @Override
    public StrategyType getStrategy() {
        return StrategyType.PLANNING;
    }

    @Override
    public AgentState newState(String input, StepContext ctx) {
        return new PlanningState(input, ctx.getMaxSteps(), ctx.getMaxReplans());
    }

    @Override
    protected void executeStep(String step, PlanningState state, StepContext ctx) {
        switch (step) {
            case UNDERSTAND_GOAL -> understandGoal(state);
            case CREATE_PLAN -> createPlan(state, ctx);
            case EXECUTE_STEP -> executePlanStep(state, ctx);
            case EVALUATE -> evaluate(state);
            case REPLAN -> replan(state, ctx);
            default -> throw new IllegalStateException("Unhandled step " + step);
        }
    }

    private void understandGoal(PlanningState state) {
        String input = state.getInput();
        state.setGoal(input != null ? input.trim() : "");
        state.setCurrentStep(CREATE_PLAN);
    }

    private void createPlan(PlanningState state, StepContext ctx) {
        String text;
        try {
            text = ctx.getGeneration().generate(
                    Prompts.createPlan(state.getGoal(), state.getMaxSteps()),
                    state.getMessages(), ctx.getRunContext());
        } catch (GenerationException e) {
            log.warn("CREATE_PLAN failed: {}", e.getMessage());
            state.setOutput("Unable to create a plan: " + e.getMessage());
            state.terminate(TerminationReason.FAILED);
            return;
        }

        List<String> steps = PlanParser.parse(text, state.getMaxSteps());
        state.addMessage(Message.agent(text, Map.of("step", CREATE_PLAN)));
        if (steps.isEmpty()) {
            log.warn("Generated plan has no steps for goal '{}'", state.getGoal());
            state.setOutput("Unable to create a plan for: " + state.getGoal());
            state.terminate(TerminationReason.FAILED);
            return;
        }

        log.info("Plan created with {} steps", steps.size());
        state.startPlan(steps);
        state.setCurrentStep(EXECUTE_STEP);
    }

    private void executePlanStep(PlanningState state, StepContext ctx) {
        int index = state.getCurrentStepIndex();
        String description = state.getCurrentStepDescription();
        log.debug("Executing plan step {}/{}: {}", index + 1, state.getPlan().size(), description);

        PlanStepResult result;
        try {
            String text = ctx.getGeneration().generate(
                    Prompts.executeStep(state.getGoal(), index + 1, description, ctx.describeTools(),
                            state.getCompletedSteps().values()),
                    state.getMessages(), ctx.getRunContext());
            state.addMessage(Message.agent(text, Map.of("step", EXECUTE_STEP, "planStep", index)));

            ReActOutputParser.Parsed parsed = parser.parse(text);
            if (parsed.action() != null) {
                ToolOutcome outcome = ctx.getToolInvoker().invoke(parsed.action(), ctx.getRunContext());
                String output = outcome.output() != null ? outcome.output() : "";
                Map<String, Object> meta = new HashMap<>();
                meta.put("step", EXECUTE_STEP);
                meta.put("planStep", index);
                meta.put("status", outcome.status().name());
                state.addMessage(Message.tool(outcome.toolName(), output, meta));
                result = outcome.isSuccess()
                        ? PlanStepResult.succeeded(index, description, output)
                        : PlanStepResult.failed(index, description, output);
            } else {
                result = PlanStepResult.succeeded(index, description, parsed.finalAnswer());
            }
        } catch (GenerationException e) {
            log.warn("Plan step {} failed: {}", index + 1, e.getMessage());
            result = PlanStepResult.failed(index, description, "Generation failed: " + e.getMessage());
        }

        state.recordStepResult(result);
        state.setCurrentStep(EVALUATE);
    }

    private void evaluate(PlanningState state) {
        PlanStepResult last = state.getLastResult();
        boolean invalid = !last.isSuccess() || Markers.contains(last.getResult(), Markers.PLAN_INVALID);
        boolean budgetLeft = state.getStepsExecuted() < state.getMaxSteps();

        if (invalid && budgetLeft && state.getReplanCount() < state.getMaxReplans()) {
            state.setEvaluation("Step " + (last.getIndex() + 1) + " invalidated the plan; replanning");
            state.setCurrentStep(REPLAN);
            return;
        }
        if (state.hasNextStep() && budgetLeft) {
            state.setEvaluation(invalid
                    ? "Step " + (last.getIndex() + 1) + " failed; no replans left, continuing"
                    : "Step " + (last.getIndex() + 1) + " done");
            state.advance();
            state.setCurrentStep(EXECUTE_STEP);
            return;
        }

        TerminationReason reason;
        if (!budgetLeft && (state.hasNextStep() || invalid)) {
            reason = TerminationReason.STEP_LIMIT;
        } else if (invalid) {
            reason = TerminationReason.REPLAN_EXHAUSTED;
        } else {
            reason = TerminationReason.COMPLETED;
        }
        state.setEvaluation("Finished: " + reason);
        finish(state, reason);
    }

    private void replan(PlanningState state, StepContext ctx) {
        List<String> plan = state.getPlan();
        List<String> remaining = plan.subList(Math.min(state.getCurrentStepIndex() + 1, plan.size()), plan.size());
        int budget = state.getMaxSteps() - state.getStepsExecuted();

        String text;
        try {
            text = ctx.getGeneration().generate(
                    Prompts.replan(state.getGoal(), remaining, state.getCompletedSteps().values(), budget),
                    state.getMessages(), ctx.getRunContext());
        } catch (GenerationException e) {
            log.warn("REPLAN failed, keeping the current plan: {}", e.getMessage());
            state.setReplanCount(state.getReplanCount() + 1);
            if (state.hasNextStep()) {
                state.advance();
                state.setCurrentStep(EXECUTE_STEP);
            } else {
                finish(state, TerminationReason.REPLAN_EXHAUSTED);
            }
            return;
        }

        List<String> newSteps = PlanParser.parse(text, budget);
        state.addMessage(Message.agent(text, Map.of("step", REPLAN)));
        if (newSteps.isEmpty()) {
            log.info("Replan produced no further steps");
            finish(state, TerminationReason.COMPLETED);
            return;
        }

        log.info("Replanned: {} new steps (replan {}/{})",
                newSteps.size(), state.getReplanCount() + 1, state.getMaxReplans());
        state.replaceRemainingSteps(newSteps);
        state.setCurrentStep(EXECUTE_STEP);
    }

    private void finish(PlanningState state, TerminationReason reason) {
        StringBuilder sb = new StringBuilder();
        if (reason == TerminationReason.STEP_LIMIT) {
            sb.append("[Step limit of ").append(state.getMaxSteps()).append(" reached]\n");
        }
        sb.append("Goal: ").append(state.getGoal()).append("\n");
        sb.append(Prompts.summarize(state.getCompletedSteps().values()));
        state.setOutput(sb.toString());
        state.terminate(reason);
    }
}
