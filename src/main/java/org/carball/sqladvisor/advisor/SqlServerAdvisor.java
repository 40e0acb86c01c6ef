package org.carball.sqladvisor.advisor;

import lombok.extern.slf4j.Slf4j;
import org.carball.sqladvisor.config.AdvisorConfig;
import org.carball.sqladvisor.model.capability.CapabilityCategory;
import org.carball.sqladvisor.model.capability.CapabilityEntry;
import org.carball.sqladvisor.model.capability.CapabilityResolution;
import org.carball.sqladvisor.model.capability.CapabilityStatus;
import org.carball.sqladvisor.model.capability.DeploymentEnvironment;
import org.carball.sqladvisor.model.fact.FragmentationFact;
import org.carball.sqladvisor.model.fact.MergeDecisionFact;
import org.carball.sqladvisor.model.fact.QueryShapeFact;
import org.carball.sqladvisor.model.recommendation.FragmentationAction;
import org.carball.sqladvisor.model.recommendation.MergeStrategy;
import org.carball.sqladvisor.model.recommendation.QueryConstruct;
import org.carball.sqladvisor.model.recommendation.Recommendation;
import org.carball.sqladvisor.rules.AdvisoryDomain;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Entry point for callers. Each call reads the current {@link KnowledgeBase}
 * once, so a concurrent {@link #reload(KnowledgeBase)} is never observed half way.
 */
@Slf4j
public class SqlServerAdvisor {

    private final AtomicReference<KnowledgeBase> knowledgeBase;

    public SqlServerAdvisor(KnowledgeBase knowledgeBase) {
        this.knowledgeBase = new AtomicReference<>(Objects.requireNonNull(knowledgeBase, "knowledgeBase"));
    }

    public static SqlServerAdvisor create(AdvisorConfig config) {
        return new SqlServerAdvisor(KnowledgeBase.load(config));
    }

    public static SqlServerAdvisor createDefault() {
        return new SqlServerAdvisor(KnowledgeBase.loadDefault());
    }

    public Recommendation<QueryConstruct> recommendConstruct(QueryShapeFact fact) {
        return knowledgeBase.get().getRuleEngine()
                .evaluate(AdvisoryDomain.CONSTRUCT_SELECTION.getRuleSetId(), QueryConstruct.class, fact);
    }

    public Recommendation<FragmentationAction> recommendFragmentationAction(FragmentationFact fact) {
        return knowledgeBase.get().getRuleEngine()
                .evaluate(AdvisoryDomain.FRAGMENTATION_ACTION.getRuleSetId(), FragmentationAction.class, fact);
    }

    public Recommendation<FragmentationAction> recommendFragmentationAction(double fragmentationPercent) {
        return recommendFragmentationAction(FragmentationFact.of(fragmentationPercent));
    }

    public Recommendation<MergeStrategy> recommendMergeStrategy(MergeDecisionFact fact) {
        return knowledgeBase.get().getRuleEngine()
                .evaluate(AdvisoryDomain.MERGE_VS_SPLIT.getRuleSetId(), MergeStrategy.class, fact);
    }

    public CapabilityResolution resolveCapability(String name, String environment) {
        return toResolution(knowledgeBase.get().getCapabilityResolver().lookup(name, environment));
    }

    public CapabilityResolution resolveCapability(String name, DeploymentEnvironment environment) {
        return toResolution(knowledgeBase.get().getCapabilityResolver().lookup(name, environment));
    }

    public Map<DeploymentEnvironment, CapabilityStatus> compareCapability(String name) {
        return knowledgeBase.get().getCapabilityResolver().compare(name);
    }

    public List<CapabilityEntry> listCapabilities(DeploymentEnvironment environment) {
        return knowledgeBase.get().getCapabilityResolver().listCapabilities(environment);
    }

    public List<CapabilityEntry> listCapabilities(CapabilityCategory category) {
        return knowledgeBase.get().getCapabilityResolver().listByCategory(category);
    }

    public KnowledgeBase currentKnowledgeBase() {
        return knowledgeBase.get();
    }

    /**
     * Replaces the whole snapshot. Calls already running keep the one they read.
     */
    public void reload(KnowledgeBase replacement) {
        KnowledgeBase previous = knowledgeBase.getAndSet(Objects.requireNonNull(replacement, "replacement"));
        log.info("Knowledge base replaced (previous loaded at {}, new loaded at {})",
                previous.getLoadedAt(), replacement.getLoadedAt());
    }

    private static CapabilityResolution toResolution(CapabilityEntry entry) {
        List<String> rationale = new ArrayList<>();
        rationale.add(String.format("%s on %s: %s", entry.getName(),
                entry.getEnvironment().getDisplayName(), entry.getStatus().getAvailability()));
        entry.getStatus().note().ifPresent(rationale::add);

        return CapabilityResolution.builder()
                .capabilityName(entry.getName())
                .category(entry.getCategory())
                .environment(entry.getEnvironment())
                .status(entry.getStatus())
                .rationale(List.copyOf(rationale))
                .build();
    }
}
