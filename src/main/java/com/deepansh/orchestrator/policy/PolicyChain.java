package com.deepansh.orchestrator.policy;

import com.deepansh.orchestrator.model.ToolCall;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Ordered, append-only list of policies.
 *
 * Actions: policies run in registration order; the first REJECT stops the chain,
 * a REWRITE hands the rewritten action to the next policy and to execution.
 * Responses: each policy's output feeds the next.
 */
@Slf4j
public class PolicyChain {

    private final List<AgentPolicy> policies = new CopyOnWriteArrayList<>();

    public PolicyChain() {
    }

    public PolicyChain(List<? extends AgentPolicy> initial) {
        policies.addAll(initial);
    }

    /** Safety checks followed by the default response length cap */
    public static PolicyChain defaults() {
        return new PolicyChain(List.of(new SafetyPolicy(), new ContentFilterPolicy()));
    }

    public void add(AgentPolicy policy) {
        policies.add(policy);
        log.debug("Policy added: [{}] (chain size {})", policy.getName(), policies.size());
    }

    public List<AgentPolicy> getPolicies() {
        return List.copyOf(policies);
    }

    public int size() {
        return policies.size();
    }

    public ActionVerdict evaluate(ToolCall action) {
        ToolCall current = action;
        for (AgentPolicy policy : policies) {
            PolicyDecision decision;
            try {
                decision = policy.validateAction(current);
            } catch (Exception e) {
                // a broken gate must not let the action through
                log.error("Policy [{}] failed while validating [{}]", policy.getName(), current.getToolName(), e);
                return ActionVerdict.rejected(current, policy.getName(), "policy check failed: " + e.getMessage());
            }

            if (decision == null) {
                continue;
            }
            switch (decision.getVerdict()) {
                case REJECT -> {
                    log.warn("Policy [{}] rejected action [{}]: {}",
                            policy.getName(), current.getToolName(), decision.getReason());
                    return ActionVerdict.rejected(current, policy.getName(), decision.getReason());
                }
                case REWRITE -> {
                    if (decision.getRewrittenAction() == null) {
                        log.warn("Policy [{}] rewrote action [{}] to nothing, rejecting it",
                                policy.getName(), current.getToolName());
                        return ActionVerdict.rejected(current, policy.getName(), "rewrite produced no action");
                    }
                    log.info("Policy [{}] rewrote action [{}]: {}",
                            policy.getName(), current.getToolName(), decision.getReason());
                    current = decision.getRewrittenAction();
                }
                default -> { }
            }
        }
        return ActionVerdict.allowed(current);
    }

    public String filterResponse(String response) {
        String current = response;
        for (AgentPolicy policy : policies) {
            try {
                current = policy.filterResponse(current);
            } catch (Exception e) {
                log.error("Policy [{}] failed while filtering the response, skipping it", policy.getName(), e);
            }
        }
        return current;
    }

    /**
     * Outcome of running the whole chain against one action.
     */
    public record ActionVerdict(boolean allowed, ToolCall action, String policyName, String reason) {

        static ActionVerdict allowed(ToolCall action) {
            return new ActionVerdict(true, action, null, null);
        }

        static ActionVerdict rejected(ToolCall action, String policyName, String reason) {
            return new ActionVerdict(false, action, policyName, reason);
        }
    }
}
