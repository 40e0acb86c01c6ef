package org.carball.sqladvisor.advisor;

import lombok.Getter;
import org.carball.sqladvisor.capability.CapabilityMatrix;
import org.carball.sqladvisor.capability.CapabilityMatrixLoader;
import org.carball.sqladvisor.capability.CapabilityResolver;
import org.carball.sqladvisor.config.AdvisorConfig;
import org.carball.sqladvisor.engine.RuleEngine;
import org.carball.sqladvisor.rules.AdvisoryDomain;
import org.carball.sqladvisor.rules.RuleRepository;
import org.carball.sqladvisor.rules.RuleRepositoryLoader;
import org.carball.sqladvisor.error.RuleDataException;

import java.time.Instant;

/**
 * One consistent snapshot of rules and capability matrix. Never mutated after
 * construction; reloads build a new instance.
 */
@Getter
public final class KnowledgeBase {

    private final RuleRepository rules;
    private final CapabilityMatrix capabilities;
    private final RuleEngine ruleEngine;
    private final CapabilityResolver capabilityResolver;
    private final Instant loadedAt;

    public KnowledgeBase(RuleRepository rules, CapabilityMatrix capabilities) {
        for (AdvisoryDomain domain : AdvisoryDomain.values()) {
            if (rules.find(domain.getRuleSetId()).isEmpty()) {
                throw new RuleDataException("Rule source does not define rule set '" + domain.getRuleSetId() + "'");
            }
        }
        this.rules = rules;
        this.capabilities = capabilities;
        this.ruleEngine = new RuleEngine(rules);
        this.capabilityResolver = new CapabilityResolver(capabilities);
        this.loadedAt = Instant.now();
    }

    public static KnowledgeBase loadDefault() {
        return new KnowledgeBase(new RuleRepositoryLoader().loadDefault(), new CapabilityMatrixLoader().loadDefault());
    }

    /**
     * Loads from the configured files, falling back to the bundled resources
     * for any location left unset.
     */
    public static KnowledgeBase load(AdvisorConfig config) {
        RuleRepositoryLoader ruleLoader = new RuleRepositoryLoader();
        CapabilityMatrixLoader matrixLoader = new CapabilityMatrixLoader();

        RuleRepository rules = config.getRulesFile() != null
                ? ruleLoader.loadFromFile(config.getRulesFile())
                : ruleLoader.loadDefault();
        CapabilityMatrix matrix = config.getCapabilitiesFile() != null
                ? matrixLoader.loadFromFile(config.getCapabilitiesFile())
                : matrixLoader.loadDefault();

        return new KnowledgeBase(rules, matrix);
    }
}
