package org.carball.sqladvisor.rules;

import lombok.Value;

import java.util.List;

/**
 * Rules of one advisory domain in ascending declared order.
 */
@Value
public class RuleSet<O extends Enum<O>> {
    AdvisoryDomain domain;
    Class<O> outcomeType;
    List<Rule<O>> rules;

    public String getId() {
        return domain.getRuleSetId();
    }
}
