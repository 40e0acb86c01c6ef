package org.carball.sqladvisor.rules;

import lombok.Value;
import org.carball.sqladvisor.model.fact.AdvisoryFact;

import java.util.List;

@Value
public class Rule<O extends Enum<O>> {
    int order;
    String description;
    List<Condition> conditions;
    O outcome;
    List<String> rationale;

    /**
     * A rule with no conditions matches every fact.
     */
    public boolean matches(AdvisoryFact fact) {
        for (Condition condition : conditions) {
            if (!condition.test(fact)) {
                return false;
            }
        }
        return true;
    }
}
