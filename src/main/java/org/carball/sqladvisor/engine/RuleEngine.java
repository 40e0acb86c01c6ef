package org.carball.sqladvisor.engine;

import lombok.extern.slf4j.Slf4j;
import org.carball.sqladvisor.error.InvalidFactException;
import org.carball.sqladvisor.error.NoRuleMatchedException;
import org.carball.sqladvisor.error.UnknownRuleSetException;
import org.carball.sqladvisor.model.fact.AdvisoryFact;
import org.carball.sqladvisor.model.recommendation.Recommendation;
import org.carball.sqladvisor.rules.Rule;
import org.carball.sqladvisor.rules.RuleRepository;
import org.carball.sqladvisor.rules.RuleSet;

/**
 * Evaluates a fact against one rule set. Rules are tried in declared order and
 * the first one whose conditions all hold decides the outcome; later rules are
 * never consulted.
 */
@Slf4j
public class RuleEngine {

    private final RuleRepository repository;

    public RuleEngine(RuleRepository repository) {
        this.repository = repository;
    }

    public Recommendation<?> evaluate(String ruleSetId, AdvisoryFact fact) {
        RuleSet<?> ruleSet = repository.find(ruleSetId)
                .orElseThrow(() -> new UnknownRuleSetException(ruleSetId));
        return evaluate(ruleSet, fact);
    }

    /**
     * Typed variant for callers that know the outcome enum of the rule set.
     */
    @SuppressWarnings("unchecked")
    public <O extends Enum<O>> Recommendation<O> evaluate(String ruleSetId, Class<O> outcomeType, AdvisoryFact fact) {
        RuleSet<?> ruleSet = repository.find(ruleSetId)
                .orElseThrow(() -> new UnknownRuleSetException(ruleSetId));
        if (!outcomeType.equals(ruleSet.getOutcomeType())) {
            throw new IllegalArgumentException(String.format("Rule set '%s' produces %s, not %s",
                    ruleSetId, ruleSet.getOutcomeType().getSimpleName(), outcomeType.getSimpleName()));
        }
        return evaluate((RuleSet<O>) ruleSet, fact);
    }

    private <O extends Enum<O>> Recommendation<O> evaluate(RuleSet<O> ruleSet, AdvisoryFact fact) {
        if (fact == null) {
            throw new IllegalArgumentException("fact must not be null");
        }
        if (fact.getFactType() != ruleSet.getDomain().getFactType()) {
            throw new InvalidFactException(fact, String.format("Rule set '%s' expects %s facts",
                    ruleSet.getId(), ruleSet.getDomain().getFactType()));
        }
        fact.validate();

        for (Rule<O> rule : ruleSet.getRules()) {
            if (rule.matches(fact)) {
                log.debug("Rule set '{}': rule {} ({}) matched -> {}",
                        ruleSet.getId(), rule.getOrder(), rule.getDescription(), rule.getOutcome());
                return Recommendation.<O>builder()
                        .ruleSetId(ruleSet.getId())
                        .outcome(rule.getOutcome())
                        .matchedRuleOrder(rule.getOrder())
                        .ruleDescription(rule.getDescription())
                        .rationale(rule.getRationale())
                        .build();
            }
        }

        log.warn("Rule set '{}' has no rule for {}", ruleSet.getId(), fact);
        throw new NoRuleMatchedException(ruleSet.getId(), fact);
    }
}
