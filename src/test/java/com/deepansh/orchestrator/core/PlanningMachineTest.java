package com.deepansh.orchestrator.core;

import com.deepansh.orchestrator.core.state.PlanStepResult;
import com.deepansh.orchestrator.core.state.PlanningState;
import com.deepansh.orchestrator.core.state.TerminationReason;
import com.deepansh.orchestrator.policy.PolicyChain;
import com.deepansh.orchestrator.tool.ToolRegistry;
import com.deepansh.orchestrator.tool.impl.CalculatorTool;
import org.junit.jupiter.api.Test;

import static com.deepansh.orchestrator.core.ScriptedGenerationClient.FAIL;
import static org.assertj.core.api.Assertions.assertThat;

class PlanningMachineTest {

    private final PlanningMachine machine = new PlanningMachine();

    private PlanningState run(int maxSteps, int maxReplans, ScriptedGenerationClient client) {
        ToolRegistry tools = new ToolRegistry();
        tools.register(new CalculatorTool());
        StepContext ctx = MachineTestSupport.context(client, tools, PolicyChain.defaults())
                .maxSteps(maxSteps)
                .maxReplans(maxReplans)
                .build();
        PlanningState state = (PlanningState) machine.newState("Organize a team offsite", ctx);
        machine.run(state, ctx);
        return state;
    }

    @Test
    void executesEveryStepInOrder() {
        PlanningState state = run(10, 2, new ScriptedGenerationClient(
                "1. Pick a date\n2. Book a venue", "March 3rd", "Lakeside hall booked"));

        assertThat(state.getTerminationReason()).isEqualTo(TerminationReason.COMPLETED);
        assertThat(state.getGoal()).isEqualTo("Organize a team offsite");
        assertThat(state.getPlan()).containsExactly("Pick a date", "Book a venue");
        assertThat(state.getCompletedSteps()).hasSize(2);
        assertThat(state.getOutput())
                .startsWith("Goal: Organize a team offsite")
                .contains("Step 1 [OK] Pick a date: March 3rd")
                .contains("Step 2 [OK] Book a venue: Lakeside hall booked");
        assertThat(state.getStepHistory()).containsExactly(
                "UNDERSTAND_GOAL", "CREATE_PLAN", "EXECUTE_STEP", "EVALUATE", "EXECUTE_STEP", "EVALUATE");
    }

    @Test
    void stepWithAction_runsTheTool() {
        PlanningState state = run(10, 2, new ScriptedGenerationClient(
                "1. Compute the budget",
                "Action: calculator\nAction Input: {\"expression\": \"6 * 7\"}"));

        PlanStepResult result = state.getCompletedSteps().get(0);
        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getResult()).isEqualTo("42");
    }

    @Test
    void toolThatCannotBeCreated_recordsFailedStep_andPlanContinues() {
        ToolRegistry tools = new ToolRegistry();
        tools.register("inventory", () -> {
            throw new IllegalStateException("backing service down");
        });
        tools.register(new CalculatorTool());
        ScriptedGenerationClient client = new ScriptedGenerationClient(
                "1. Check stock\n2. Compute the order",
                "Action: inventory\nAction Input: {}",
                "Action: calculator\nAction Input: {\"expression\": \"6 * 7\"}");
        StepContext ctx = MachineTestSupport.context(client, tools, new PolicyChain())
                .maxReplans(0)
                .build();
        PlanningState state = (PlanningState) machine.newState("Restock the shop", ctx);

        machine.run(state, ctx);

        assertThat(state.getCompletedSteps().get(0).isSuccess()).isFalse();
        assertThat(state.getCompletedSteps().get(0).getError())
                .isEqualTo("ERROR: Tool 'inventory' could not be created: backing service down");
        assertThat(state.getCompletedSteps().get(1).getResult()).isEqualTo("42");
        assertThat(state.getTerminationReason()).isEqualTo(TerminationReason.COMPLETED);
    }

    @Test
    void failedStep_triggersReplan() {
        PlanningState state = run(10, 1, new ScriptedGenerationClient(
                "1. Call the venue\n2. Confirm by email", FAIL, "1. Book online instead", "Booked online"));

        assertThat(state.getTerminationReason()).isEqualTo(TerminationReason.COMPLETED);
        assertThat(state.getReplanCount()).isEqualTo(1);
        assertThat(state.getPlan()).containsExactly("Call the venue", "Book online instead");
        assertThat(state.getCompletedSteps().get(0).isSuccess()).isFalse();
        assertThat(state.getCompletedSteps().get(1).getResult()).isEqualTo("Booked online");
        assertThat(state.getOutput()).contains("Step 1 [FAILED] Call the venue");
    }

    @Test
    void failedMiddleStep_keepsEarlierResultsAcrossReplan() {
        PlanningState state = run(10, 2, new ScriptedGenerationClient(
                "1. design\n2. implement\n3. test", "API sketched", FAIL, "1. implement in smaller parts", "done"));

        assertThat(state.getStepHistory()).containsSubsequence("EVALUATE", "REPLAN", "EXECUTE_STEP");
        assertThat(state.getCompletedSteps().get(0).isSuccess()).isTrue();
        assertThat(state.getCompletedSteps().get(0).getResult()).isEqualTo("API sketched");
        assertThat(state.getCompletedSteps().get(1).isSuccess()).isFalse();
        assertThat(state.getCompletedSteps().get(1).getDescription()).isEqualTo("implement");
        assertThat(state.getPlan()).containsExactly("design", "implement", "implement in smaller parts");
    }

    @Test
    void planInvalidMarker_withoutReplans_isExhausted() {
        PlanningState state = run(10, 0, new ScriptedGenerationClient(
                "1. Reserve the moon", "PLAN INVALID: the moon is not available"));

        assertThat(state.getTerminationReason()).isEqualTo(TerminationReason.REPLAN_EXHAUSTED);
    }

    @Test
    void replanFailure_continuesWithOldSteps() {
        PlanningState state = run(10, 2, new ScriptedGenerationClient(
                "1. a\n2. b", FAIL, FAIL, "b done"));

        assertThat(state.getTerminationReason()).isEqualTo(TerminationReason.COMPLETED);
        assertThat(state.getPlan()).containsExactly("a", "b");
        assertThat(state.getCompletedSteps().get(1).getResult()).isEqualTo("b done");
    }

    @Test
    void stepBudget_isEnforcedAcrossReplans() {
        PlanningState state = run(2, 2, new ScriptedGenerationClient(
                "1. a\n2. b", FAIL, "1. x\n2. y", FAIL));

        assertThat(state.getTerminationReason()).isEqualTo(TerminationReason.STEP_LIMIT);
        assertThat(state.getStepsExecuted()).isEqualTo(2);
        assertThat(state.getPlan()).containsExactly("a", "x");
        assertThat(state.getOutput()).startsWith("[Step limit of 2 reached]");
    }

    @Test
    void emptyPlan_fails() {
        PlanningState state = run(10, 2, new ScriptedGenerationClient("   "));

        assertThat(state.getTerminationReason()).isEqualTo(TerminationReason.FAILED);
        assertThat(state.getOutput()).startsWith("Unable to create a plan");
    }
}
