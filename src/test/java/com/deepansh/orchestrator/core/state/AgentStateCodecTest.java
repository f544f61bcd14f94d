package com.deepansh.orchestrator.core.state;

import com.deepansh.orchestrator.model.Message;
import com.deepansh.orchestrator.model.ToolCall;
import com.deepansh.orchestrator.tool.ToolOutcome;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AgentStateCodecTest {

    private final AgentStateCodec codec = new AgentStateCodec(new ObjectMapper());

    @Test
    void reactState_survivesMidRun() {
        ReActState state = new ReActState("Calculate 2 + 2", 5);
        state.addMessage(Message.user("Calculate 2 + 2"));
        state.recordStep("THINK");
        state.recordThought("add them", ToolCall.builder()
                .toolName("calculator")
                .arguments(Map.of("expression", "2 + 2"))
                .build());
        state.recordStep("ACT");
        state.recordActOutcome(ToolOutcome.success("calculator", "4"));
        state.recordStep("OBSERVE");
        state.recordObservation("4");
        state.setCurrentStep("THINK");

        Map<String, Object> record = codec.toRecord(state);
        assertThat(record).containsEntry("strategy", "react");

        AgentState restored = codec.fromRecord(record);

        assertThat(restored).isInstanceOf(ReActState.class);
        ReActState react = (ReActState) restored;
        assertThat(react.getStepCount()).isEqualTo(1);
        assertThat(react.getObservation()).isEqualTo("4");
        assertThat(react.getAction().getToolName()).isEqualTo("calculator");
        assertThat(react.getCurrentStep()).isEqualTo("THINK");
        assertThat(react.getStepHistory()).containsExactly("THINK", "ACT", "OBSERVE");
        assertThat(react.getMessages()).extracting(Message::getContent).containsExactly("Calculate 2 + 2");
    }

    @Test
    void planningState_keepsCompletedSteps() {
        PlanningState state = new PlanningState("Ship it", 10, 2);
        state.setGoal("Ship it");
        state.startPlan(List.of("build", "deploy"));
        state.recordStepResult(PlanStepResult.succeeded(0, "build", "green"));
        state.advance();

        PlanningState restored = (PlanningState) codec.fromRecord(codec.toRecord(state));

        assertThat(restored.getPlan()).containsExactly("build", "deploy");
        assertThat(restored.getCurrentStepIndex()).isEqualTo(1);
        assertThat(restored.getCompletedSteps().get(0).getResult()).isEqualTo("green");
        assertThat(restored.getStepsExecuted()).isEqualTo(1);
    }

    @Test
    void unknownStrategy_isRejected() {
        Map<String, Object> record = Map.of("strategy", "telepathy", "input", "hi");

        assertThatThrownBy(() -> codec.fromRecord(record))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Not a valid agent state record");
    }

    @Test
    void recordBreakingInvariants_isRejected() {
        ReflectionState state = new ReflectionState("q", 1);
        Map<String, Object> record = new HashMap<>(codec.toRecord(state));
        record.put("reflectionCount", 5);

        assertThatThrownBy(() -> codec.fromRecord(record))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("reflectionCount");
    }
}
