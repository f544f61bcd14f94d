package com.deepansh.orchestrator.memory;

import com.deepansh.orchestrator.model.Interaction;
import com.deepansh.orchestrator.model.Message;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConversationMemoryTest {

    @Test
    void evictsOldestFirst_whenFull() {
        ConversationMemory memory = new ConversationMemory(3, 5);
        for (int i = 1; i <= 5; i++) {
            memory.addConversationTurn("q" + i, "a" + i, Map.of());
        }

        assertThat(memory.size()).isEqualTo(3);
        assertThat(memory.getRecentContext(10)).extracting(ConversationTurn::getUserInput)
                .containsExactly("q3", "q4", "q5");
    }

    @Test
    void getRecentContext_neverFails() {
        ConversationMemory memory = new ConversationMemory();
        memory.addConversationTurn("q1", "a1", null);
        memory.addConversationTurn("q2", "a2", Map.of("k", "v"));

        assertThat(memory.getRecentContext(1)).extracting(ConversationTurn::getUserInput).containsExactly("q2");
        assertThat(memory.getRecentContext(50)).hasSize(2);
        assertThat(memory.getRecentContext(0)).isEmpty();
        assertThat(memory.getRecentContext(-3)).isEmpty();
    }

    @Test
    void contextFor_replaysRecentTurnsAsMessages() {
        ConversationMemory memory = new ConversationMemory(10, 2);
        memory.record(Interaction.builder().input("q1").output("a1").strategy("react").outcome("FINAL_ANSWER").build());
        memory.record(Interaction.builder().input("q2").output("a2").build());
        memory.record(Interaction.builder().input("q3").output("a3").build());

        List<Message> context = memory.contextFor("next");

        assertThat(context).extracting(Message::getContent).containsExactly("q2", "a2", "q3", "a3");
        assertThat(context).allSatisfy(m -> assertThat(m.getMetadata()).containsEntry("source", "memory"));
    }

    @Test
    void record_keepsStrategyAndOutcome() {
        ConversationMemory memory = new ConversationMemory();
        memory.record(Interaction.builder().input("q").output("a").strategy("react").outcome("FINAL_ANSWER").build());

        assertThat(memory.getRecentContext(1).get(0).getMetadata())
                .containsEntry("strategy", "react")
                .containsEntry("outcome", "FINAL_ANSWER");
    }

    @Test
    void concurrentAdds_respectCapacity() throws Exception {
        ConversationMemory memory = new ConversationMemory(50, 5);
        ExecutorService pool = Executors.newFixedThreadPool(8);
        for (int i = 0; i < 400; i++) {
            int n = i;
            pool.submit(() -> memory.addConversationTurn("q" + n, "a" + n, Map.of()));
        }
        pool.shutdown();
        assertThat(pool.awaitTermination(5, TimeUnit.SECONDS)).isTrue();

        assertThat(memory.size()).isEqualTo(50);
    }

    @Test
    void zeroCapacity_isRejected() {
        assertThatThrownBy(() -> new ConversationMemory(0, 1)).isInstanceOf(IllegalArgumentException.class);
    }
}
