package org.carball.sqladvisor.error;

import lombok.Getter;
import org.carball.sqladvisor.model.fact.AdvisoryFact;

/**
 * Raised when every rule of a set rejects the fact. This is a gap in the rule
 * data and is reported, never replaced by a default outcome.
 */
@Getter
public class NoRuleMatchedException extends AdvisorException {

    private final String ruleSetId;
    private final AdvisoryFact fact;

    public NoRuleMatchedException(String ruleSetId, AdvisoryFact fact) {
        super(String.format("No rule in '%s' matched %s", ruleSetId, fact));
        this.ruleSetId = ruleSetId;
        this.fact = fact;
    }
}
