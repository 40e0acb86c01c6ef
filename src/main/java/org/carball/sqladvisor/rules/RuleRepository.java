package org.carball.sqladvisor.rules;

import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable snapshot of the loaded rule sets, keyed by rule set id.
 */
public final class RuleRepository {

    private final Map<String, RuleSet<?>> ruleSets;

    public RuleRepository(Map<String, RuleSet<?>> ruleSets) {
        this.ruleSets = Map.copyOf(ruleSets);
    }

    public Optional<RuleSet<?>> find(String ruleSetId) {
        return Optional.ofNullable(ruleSetId == null ? null : ruleSets.get(ruleSetId));
    }

    public Set<String> getRuleSetIds() {
        return ruleSets.keySet();
    }

    public int size() {
        return ruleSets.size();
    }
}
