package com.deepansh.orchestrator.agent;

import com.deepansh.orchestrator.config.AgentProperties;
import com.deepansh.orchestrator.core.state.StrategyType;
import com.deepansh.orchestrator.exception.NotFoundException;
import lombok.extern.slf4j.Slf4j;

import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Picks a strategy for an input and hands it to the agent registered for that strategy.
 *
 * Rules, first match wins:
 * 1. arithmetic expressions or tool vocabulary → react
 * 2. planning vocabulary → planning
 * 3. anything else → reflection
 */
@Slf4j
public class AgentRouter {

    private static final Pattern ARITHMETIC = Pattern.compile("\\d\\s*[-+*/^%]\\s*\\d");

    private final Map<StrategyType, Agent> agents = new EnumMap<>(StrategyType.class);
    private final List<String> reactKeywords;
    private final List<String> planningKeywords;

    public AgentRouter() {
        this(new AgentProperties.Router());
    }

    public AgentRouter(AgentProperties.Router rules) {
        this.reactKeywords = List.copyOf(rules.getReactKeywords());
        this.planningKeywords = List.copyOf(rules.getPlanningKeywords());
    }

    public synchronized AgentRouter register(Agent agent) {
        agents.put(agent.getStrategy(), agent);
        return this;
    }

    public StrategyType route(String input) {
        String text = input == null ? "" : input.toLowerCase(Locale.ROOT);
        if (ARITHMETIC.matcher(text).find() || containsAny(text, reactKeywords)) {
            return StrategyType.REACT;
        }
        if (containsAny(text, planningKeywords)) {
            return StrategyType.PLANNING;
        }
        return StrategyType.REFLECTION;
    }

    /**
     * @throws NotFoundException if no agent is registered for the routed strategy
     */
    public String process(String input) {
        StrategyType strategy = route(input);
        Agent agent;
        synchronized (this) {
            agent = agents.get(strategy);
        }
        if (agent == null) {
            throw new NotFoundException("No agent registered for strategy '" + strategy.strategyName() + "'");
        }
        log.info("Routing input to {} agent", strategy.strategyName());
        return agent.process(input);
    }

    /** Keywords match at the start of a word: "plan" matches "planning" but not "explanation" */
    private static boolean containsAny(String text, List<String> keywords) {
        return keywords.stream()
                .map(k -> Pattern.compile("\\b" + Pattern.quote(k.toLowerCase(Locale.ROOT))))
                .anyMatch(p -> p.matcher(text).find());
    }
}
