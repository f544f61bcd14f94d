package com.deepansh.orchestrator.core;

import com.deepansh.orchestrator.core.state.ReflectionState;
import com.deepansh.orchestrator.core.state.TerminationReason;
import com.deepansh.orchestrator.policy.PolicyChain;
import com.deepansh.orchestrator.tool.ToolRegistry;
import org.junit.jupiter.api.Test;

import static com.deepansh.orchestrator.core.ScriptedGenerationClient.FAIL;
import static org.assertj.core.api.Assertions.assertThat;

class ReflectionMachineTest {

    private final ReflectionMachine machine = new ReflectionMachine();

    private ReflectionState run(int maxReflections, ScriptedGenerationClient client) {
        StepContext ctx = MachineTestSupport.context(client, new ToolRegistry(), new PolicyChain())
                .maxReflections(maxReflections)
                .build();
        ReflectionState state = (ReflectionState) machine.newState("Explain recursion", ctx);
        machine.run(state, ctx);
        return state;
    }

    @Test
    void zeroReflections_returnsInitialDraft() {
        ScriptedGenerationClient client = new ScriptedGenerationClient("draft");

        ReflectionState state = run(0, client);

        assertThat(state.getOutput()).isEqualTo("draft");
        assertThat(state.getTerminationReason()).isEqualTo(TerminationReason.COMPLETED);
        assertThat(state.getStepHistory()).containsExactly("GENERATE_INITIAL");
        assertThat(state.getRefinedResponse()).isNull();
        assertThat(client.calls()).isEqualTo(1);
    }

    @Test
    void runsUntilReflectionLimit() {
        ScriptedGenerationClient client = new ScriptedGenerationClient(
                "draft", "critique 1", "refined 1", "critique 2", "refined 2");

        ReflectionState state = run(2, client);

        assertThat(state.getOutput()).isEqualTo("refined 2");
        assertThat(state.getReflectionCount()).isEqualTo(2);
        assertThat(state.getTerminationReason()).isEqualTo(TerminationReason.COMPLETED);
        assertThat(state.getStepHistory())
                .containsExactly("GENERATE_INITIAL", "REFLECT", "REFINE", "REFLECT", "REFINE");
        assertThat(client.prompts().get(3)).contains("refined 1");
    }

    @Test
    void stopMarker_endsTheLoopEarly() {
        ScriptedGenerationClient client = new ScriptedGenerationClient(
                "draft", "Looks right. No further improvement.", "polished");

        ReflectionState state = run(3, client);

        assertThat(state.getOutput()).isEqualTo("polished");
        assertThat(state.getReflectionCount()).isEqualTo(1);
        assertThat(state.getTerminationReason()).isEqualTo(TerminationReason.NO_FURTHER_IMPROVEMENT);
    }

    @Test
    void failedReflection_keepsBestResponse() {
        ReflectionState state = run(2, new ScriptedGenerationClient("draft", FAIL));

        assertThat(state.getOutput()).isEqualTo("draft");
        assertThat(state.getTerminationReason()).isEqualTo(TerminationReason.FAILED);
    }

    @Test
    void failedInitialGeneration_explainsTheFailure() {
        ReflectionState state = run(2, new ScriptedGenerationClient(FAIL));

        assertThat(state.getOutput()).startsWith("Unable to generate a response");
        assertThat(state.getTerminationReason()).isEqualTo(TerminationReason.FAILED);
        assertThat(state.isTerminated()).isTrue();
    }
}
