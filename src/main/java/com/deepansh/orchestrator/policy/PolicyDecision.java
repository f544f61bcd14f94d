package com.deepansh.orchestrator.policy;

import com.deepansh.orchestrator.model.ToolCall;
import lombok.Value;

import java.util.Objects;

@Value
public class PolicyDecision {

    public enum Verdict {
        ALLOW, REJECT, REWRITE
    }

    private static final PolicyDecision ALLOW = new PolicyDecision(Verdict.ALLOW, null, null);

    Verdict verdict;
    String reason;

    /** Replacement action, present only for {@link Verdict#REWRITE} */
    ToolCall rewrittenAction;

    public static PolicyDecision allow() {
        return ALLOW;
    }

    public static PolicyDecision reject(String reason) {
        return new PolicyDecision(Verdict.REJECT, reason, null);
    }

    /**
     * @throws NullPointerException if no replacement action is given; use {@link #reject} to drop an action
     */
    public static PolicyDecision rewrite(ToolCall rewrittenAction, String reason) {
        Objects.requireNonNull(rewrittenAction, "rewrittenAction");
        return new PolicyDecision(Verdict.REWRITE, reason, rewrittenAction);
    }

    public boolean isRejected() {
        return verdict == Verdict.REJECT;
    }
}
