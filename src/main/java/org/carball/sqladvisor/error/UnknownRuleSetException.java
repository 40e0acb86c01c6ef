package org.carball.sqladvisor.error;

import lombok.Getter;

@Getter
public class UnknownRuleSetException extends AdvisorException {

    private final String ruleSetId;

    public UnknownRuleSetException(String ruleSetId) {
        super("Unknown rule set: " + ruleSetId);
        this.ruleSetId = ruleSetId;
    }
}
