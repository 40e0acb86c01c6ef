package org.carball.sqladvisor.error;

import lombok.Getter;

@Getter
public class DuplicateRuleOrderException extends RuleDataException {

    private final String ruleSetId;
    private final int order;

    public DuplicateRuleOrderException(String ruleSetId, int order) {
        super(String.format("Rule set '%s' declares order %d more than once", ruleSetId, order));
        this.ruleSetId = ruleSetId;
        this.order = order;
    }
}
