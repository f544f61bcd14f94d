package com.deepansh.orchestrator.memory;

import com.deepansh.orchestrator.exception.NotFoundException;
import com.deepansh.orchestrator.model.Interaction;
import com.deepansh.orchestrator.model.Message;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EpisodicMemoryTest {

    @Test
    void addEpisode_assignsIdAndStoresIt() {
        EpisodicMemory memory = new EpisodicMemory();

        String id = memory.addEpisode(episode("booked flight to berlin", "confirmed"));

        Episode stored = memory.getEpisode(id);
        assertThat(stored.getId()).isEqualTo(id);
        assertThat(stored.getContent()).isEqualTo("booked flight to berlin");
    }

    @Test
    void addEpisode_storesItsOwnCopyOfToolsUsed() {
        EpisodicMemory memory = new EpisodicMemory();
        List<String> tools = new ArrayList<>(List.of("web"));

        String id = memory.addEpisode(Episode.builder()
                .content("fetched the release notes")
                .outcome("summarized")
                .toolsUsed(tools)
                .build());
        tools.add("filesystem");

        assertThat(memory.getEpisode(id).getToolsUsed()).containsExactly("web");
    }

    @Test
    void search_ordersByRelevanceAndDropsUnrelated() {
        EpisodicMemory memory = new EpisodicMemory();
        memory.addEpisode(episode("weather report for paris", "sunny"));
        memory.addEpisode(episode("flight booking to paris in march", "booked"));
        memory.addEpisode(episode("recipe for pancakes", "made"));

        List<Episode> results = memory.searchEpisodes("book flight paris", 5);

        assertThat(results).extracting(Episode::getContent)
                .containsExactly("flight booking to paris in march", "weather report for paris");
    }

    @Test
    void search_respectsLimit() {
        EpisodicMemory memory = new EpisodicMemory();
        for (int i = 0; i < 5; i++) {
            memory.addEpisode(episode("deploy service " + i, "ok"));
        }
        assertThat(memory.searchEpisodes("deploy service", 2)).hasSize(2);
        assertThat(memory.searchEpisodes("deploy service", 0)).isEmpty();
    }

    @Test
    void customScorer_isUsed() {
        EpisodicMemory memory = new EpisodicMemory((q, e) -> e.getContent().length(), 3);
        memory.addEpisode(episode("short", "x"));
        memory.addEpisode(episode("much longer content", "x"));

        assertThat(memory.searchEpisodes("anything", 1)).extracting(Episode::getContent)
                .containsExactly("much longer content");
    }

    @Test
    void getEpisode_unknownId_throws() {
        assertThatThrownBy(() -> new EpisodicMemory().getEpisode("nope"))
                .isInstanceOf(NotFoundException.class);
    }

    @Test
    void contextFor_recallsRelevantEpisodes() {
        EpisodicMemory memory = new EpisodicMemory(new TokenOverlapScorer(), 1);
        memory.record(Interaction.builder().input("convert 100 usd to eur").output("92 EUR")
                .toolsUsed(List.of("calculator")).build());
        memory.record(Interaction.builder().input("write a haiku").output("...").build());

        List<Message> context = memory.contextFor("convert 50 usd");

        assertThat(context).hasSize(1);
        assertThat(context.get(0).getContent()).contains("convert 100 usd to eur").contains("92 EUR");
    }

    @Test
    void concurrentInserts_getUniqueIds() throws Exception {
        EpisodicMemory memory = new EpisodicMemory();
        Set<String> ids = ConcurrentHashMap.newKeySet();
        ExecutorService pool = Executors.newFixedThreadPool(8);
        for (int i = 0; i < 500; i++) {
            int n = i;
            pool.submit(() -> ids.add(memory.addEpisode(episode("task " + n, "done"))));
        }
        pool.shutdown();
        assertThat(pool.awaitTermination(5, TimeUnit.SECONDS)).isTrue();

        assertThat(ids).hasSize(500);
        assertThat(memory.size()).isEqualTo(500);
    }

    private static Episode episode(String content, String outcome) {
        return Episode.builder().content(content).outcome(outcome).build();
    }
}
