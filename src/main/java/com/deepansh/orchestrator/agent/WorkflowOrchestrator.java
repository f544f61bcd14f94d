package com.deepansh.orchestrator.agent;

import com.deepansh.orchestrator.exception.NotFoundException;
import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Named agents chained into named workflows. Each agent's output is the next
 * agent's input.
 */
@Slf4j
public class WorkflowOrchestrator {

    private final Map<String, Agent> agents = new ConcurrentHashMap<>();
    private final Map<String, List<String>> workflows = new ConcurrentHashMap<>();

    public void addAgent(String name, Agent agent) {
        agents.put(name, agent);
    }

    /**
     * Agent names are checked when the workflow runs, not here.
     */
    public void createWorkflow(String name, List<String> agentNames) {
        if (agentNames == null || agentNames.isEmpty()) {
            throw new IllegalArgumentException("Workflow '" + name + "' needs at least one agent");
        }
        workflows.put(name, List.copyOf(agentNames));
    }

    public Agent getAgent(String name) {
        Agent agent = agents.get(name);
        if (agent == null) {
            throw new NotFoundException("Agent '" + name + "' not found");
        }
        return agent;
    }

    public List<String> getWorkflow(String name) {
        List<String> workflow = workflows.get(name);
        if (workflow == null) {
            throw new NotFoundException("Workflow '" + name + "' not found");
        }
        return workflow;
    }

    /**
     * @return agent name → output, in execution order
     * @throws NotFoundException for an unknown workflow, or an unknown agent in it
     */
    public Map<String, String> executeWorkflow(String workflowName, String input) {
        List<String> steps = getWorkflow(workflowName);
        steps.forEach(this::getAgent);

        log.info("Workflow [{}] started with {} agents", workflowName, steps.size());
        Map<String, String> results = new LinkedHashMap<>();
        String current = input;
        for (String agentName : steps) {
            current = getAgent(agentName).process(current);
            results.put(agentName, current);
            log.debug("Workflow [{}] agent [{}] done", workflowName, agentName);
        }
        return Collections.unmodifiableMap(results);
    }
}
