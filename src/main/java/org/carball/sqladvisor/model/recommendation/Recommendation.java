package org.carball.sqladvisor.model.recommendation;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.util.List;

/**
 * Outcome of evaluating one rule set against a fact: exactly one outcome and
 * the rationale of the rule that produced it.
 */
@Value
@Builder
public class Recommendation<O extends Enum<O>> {
    @NonNull
    String ruleSetId;
    @NonNull
    O outcome;
    int matchedRuleOrder;
    String ruleDescription;
    List<String> rationale;

    public String getOutcomeName() {
        return outcome.name();
    }

    public String getDisplayName() {
        return outcome instanceof AdvisoryOutcome ? ((AdvisoryOutcome) outcome).getDisplayName() : outcome.name();
    }

    public String getSqlSketch() {
        return outcome instanceof AdvisoryOutcome ? ((AdvisoryOutcome) outcome).getSqlSketch() : null;
    }
}
