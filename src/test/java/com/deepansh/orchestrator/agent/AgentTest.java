package com.deepansh.orchestrator.agent;

import com.deepansh.orchestrator.core.ScriptedGenerationClient;
import com.deepansh.orchestrator.core.state.AgentState;
import com.deepansh.orchestrator.core.state.ReActState;
import com.deepansh.orchestrator.core.state.ReflectionState;
import com.deepansh.orchestrator.core.state.StrategyType;
import com.deepansh.orchestrator.core.state.TerminationReason;
import com.deepansh.orchestrator.exception.DuplicateToolException;
import com.deepansh.orchestrator.memory.ConversationMemory;
import com.deepansh.orchestrator.memory.SimpleMemory;
import com.deepansh.orchestrator.model.AgentResult;
import com.deepansh.orchestrator.model.Message;
import com.deepansh.orchestrator.policy.ContentFilterPolicy;
import com.deepansh.orchestrator.tool.impl.CalculatorTool;
import org.junit.jupiter.api.Test;
import org.springframework.core.task.SimpleAsyncTaskExecutor;

import java.util.Map;

import static com.deepansh.orchestrator.core.ScriptedGenerationClient.FAIL;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AgentTest {

    private static AgentBuilder reflectionAgent(ScriptedGenerationClient client) {
        return Agent.builder()
                .strategy(StrategyType.REFLECTION)
                .generationClient(client)
                .maxReflections(0)
                .executor(new SimpleAsyncTaskExecutor("agent-test-"));
    }

    @Test
    void build_withoutGenerationClient_fails() {
        assertThatThrownBy(() -> Agent.builder().build())
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("generation client");
    }

    @Test
    void build_withInvalidLimit_fails() {
        AgentBuilder builder = reflectionAgent(new ScriptedGenerationClient()).maxSteps(0);

        assertThatThrownBy(builder::build)
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("maxSteps");
    }

    @Test
    void build_withDuplicateTools_fails() {
        AgentBuilder builder = reflectionAgent(new ScriptedGenerationClient())
                .tool(new CalculatorTool())
                .tool(new CalculatorTool());

        assertThatThrownBy(builder::build).isInstanceOf(DuplicateToolException.class);
    }

    @Test
    void process_recordsInteraction_andFeedsItBackAsContext() {
        Agent agent = reflectionAgent(new ScriptedGenerationClient("Paris", "Berlin")).build();

        assertThat(agent.process("Capital of France?")).isEqualTo("Paris");
        assertThat(agent.getMemory()).isInstanceOf(ConversationMemory.class);
        assertThat(((ConversationMemory) agent.getMemory()).size()).isEqualTo(1);

        agent.process("And of Germany?");

        assertThat(agent.getState().getMessages())
                .extracting(Message::getContent)
                .startsWith("Capital of France?", "Paris", "And of Germany?");
        assertThat(agent.getState().getMessages().get(0).getMetadata()).containsEntry("source", "memory");
    }

    @Test
    void process_twiceWithClearedMemory_runsAreIndependent() {
        Agent agent = reflectionAgent(new ScriptedGenerationClient("first", "second")).build();

        agent.process("same question");
        AgentState firstState = agent.getState();
        agent.getMemory().clear();
        agent.process("same question");

        assertThat(agent.getState()).isNotSameAs(firstState);
        assertThat(agent.getState().getMessages())
                .extracting(Message::getContent)
                .containsExactly("same question", "second");
        assertThat(firstState.getOutput()).isEqualTo("first");
    }

    @Test
    void reactAgent_usesTools() {
        Agent agent = Agent.builder()
                .strategy("react")
                .generationClient(new ScriptedGenerationClient(
                        "Action: calculator\nAction Input: {\"expression\": \"2 + 2\"}",
                        "Final Answer: 4"))
                .tool(new CalculatorTool())
                .executor(new SimpleAsyncTaskExecutor("agent-test-"))
                .build();

        AgentResult result = agent.run("Calculate 2 + 2");

        assertThat(result.getOutput()).isEqualTo("4");
        assertThat(result.getToolsUsed()).containsExactly("calculator");
        assertThat(result.getTerminationReason()).isEqualTo(TerminationReason.FINAL_ANSWER);
        assertThat(result.getState()).isInstanceOf(ReActState.class);
        assertThat(agent.getGraph().getStart()).isEqualTo("THINK");
    }

    @Test
    void responsePolicies_filterTheReturnedOutputOnly() {
        Agent agent = reflectionAgent(new ScriptedGenerationClient("abcdefghij"))
                .policy(new ContentFilterPolicy(5))
                .build();

        AgentResult result = agent.run("say something long");

        assertThat(result.getOutput()).isEqualTo("abcde...[truncated]");
        assertThat(result.getState().getOutput()).isEqualTo("abcdefghij");
    }

    @Test
    void generationFailure_comesBackAsText() {
        Agent agent = reflectionAgent(new ScriptedGenerationClient(FAIL)).build();

        AgentResult result = agent.run("anything");

        assertThat(result.getOutput()).startsWith("Unable to generate a response");
        assertThat(result.getTerminationReason()).isEqualTo(TerminationReason.FAILED);
    }

    @Test
    void unexpectedFailure_errorTextPassesResponsePolicies() {
        Agent agent = reflectionAgent(new ScriptedGenerationClient())
                .policy(new ContentFilterPolicy(10))
                .build();
        ReflectionState corrupted = new ReflectionState("question", 0);
        corrupted.setCurrentStep("NOT_A_STEP");

        AgentResult result = agent.resume(corrupted);

        assertThat(result.getOutput()).isEqualTo("An error o...[truncated]");
        assertThat(result.getTerminationReason()).isEqualTo(TerminationReason.FAILED);
        assertThat(result.getState().getOutput()).startsWith("An error occurred: Unknown step 'NOT_A_STEP'");
    }

    @Test
    void resume_continuesAFreshState() {
        ScriptedGenerationClient client = new ScriptedGenerationClient("resumed draft");
        Agent agent = reflectionAgent(client).memory(new SimpleMemory()).build();

        AgentResult result = agent.resume(new ReflectionState("Explain recursion", 0));

        assertThat(result.getOutput()).isEqualTo("resumed draft");
        assertThat(agent.getMemory().retrieve("last_output")).contains("resumed draft");
    }

    @Test
    void resume_ofTerminatedRecord_doesNotRunAgain() {
        ScriptedGenerationClient client = new ScriptedGenerationClient("only answer");
        Agent agent = reflectionAgent(client).build();
        agent.process("question");

        Map<String, Object> record = agent.getStateRecord();
        AgentResult resumed = agent.resume(record);

        assertThat(resumed.getOutput()).isEqualTo("only answer");
        assertThat(client.calls()).isEqualTo(1);
        assertThat(((ConversationMemory) agent.getMemory()).size()).isEqualTo(1);
    }

    @Test
    void resume_withOtherStrategyState_fails() {
        Agent agent = reflectionAgent(new ScriptedGenerationClient()).build();

        assertThatThrownBy(() -> agent.resume(new ReActState("q", 3)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("react");
    }

    @Test
    void getConfig_returnsACopy() {
        Agent agent = reflectionAgent(new ScriptedGenerationClient()).build();

        agent.getConfig().setMaxReflections(9);

        assertThat(agent.getConfig().getMaxReflections()).isZero();
    }
}
