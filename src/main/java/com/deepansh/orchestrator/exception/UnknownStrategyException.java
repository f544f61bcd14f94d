package com.deepansh.orchestrator.exception;

import lombok.Getter;

@Getter
public class UnknownStrategyException extends AgentException {

    private final String strategyName;

    public UnknownStrategyException(String strategyName) {
        super("Unknown agent strategy '" + strategyName + "'. Supported: reflection, react, planning");
        this.strategyName = strategyName;
    }
}
