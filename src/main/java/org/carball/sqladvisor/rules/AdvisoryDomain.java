package org.carball.sqladvisor.rules;

import org.carball.sqladvisor.model.fact.FactType;
import org.carball.sqladvisor.model.recommendation.FragmentationAction;
import org.carball.sqladvisor.model.recommendation.MergeStrategy;
import org.carball.sqladvisor.model.recommendation.QueryConstruct;

import java.util.Optional;

/**
 * The advisory rule sets the engine knows how to host: each binds a rule set
 * id to the fact kind it reads and the outcome enum it produces.
 */
public enum AdvisoryDomain {
    CONSTRUCT_SELECTION("construct-selection", FactType.QUERY_SHAPE, QueryConstruct.class),
    FRAGMENTATION_ACTION("fragmentation-action", FactType.FRAGMENTATION, FragmentationAction.class),
    MERGE_VS_SPLIT("merge-vs-split", FactType.MERGE_DECISION, MergeStrategy.class);

    private final String ruleSetId;
    private final FactType factType;
    private final Class<? extends Enum<?>> outcomeType;

    AdvisoryDomain(String ruleSetId, FactType factType, Class<? extends Enum<?>> outcomeType) {
        this.ruleSetId = ruleSetId;
        this.factType = factType;
        this.outcomeType = outcomeType;
    }

    public String getRuleSetId() {
        return ruleSetId;
    }

    public FactType getFactType() {
        return factType;
    }

    public Class<? extends Enum<?>> getOutcomeType() {
        return outcomeType;
    }

    public static Optional<AdvisoryDomain> fromRuleSetId(String ruleSetId) {
        for (AdvisoryDomain domain : values()) {
            if (domain.ruleSetId.equals(ruleSetId)) {
                return Optional.of(domain);
            }
        }
        return Optional.empty();
    }
}
