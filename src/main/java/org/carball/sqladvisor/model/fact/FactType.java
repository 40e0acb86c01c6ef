package org.carball.sqladvisor.model.fact;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Attribute schema of each fact kind. Rule conditions are checked against it
 * when the rule source is loaded.
 */
public enum FactType {
    QUERY_SHAPE(
            AttributeSpec.bool(QueryShapeFact.NEEDS_RECURSION),
            AttributeSpec.bool(QueryShapeFact.IS_CORRELATED),
            AttributeSpec.bool(QueryShapeFact.INVOKES_TVF),
            AttributeSpec.number(QueryShapeFact.REUSE_COUNT),
            AttributeSpec.enumerated(QueryShapeFact.CARDINALITY_HINT, CardinalityHint.class),
            AttributeSpec.bool(QueryShapeFact.RELATION_OPTIONAL)),

    FRAGMENTATION(
            AttributeSpec.number(FragmentationFact.FRAGMENTATION_PERCENT)),

    MERGE_DECISION(
            AttributeSpec.number(MergeDecisionFact.BRANCH_COUNT),
            AttributeSpec.bool(MergeDecisionFact.ROW_LEVEL_AUDIT),
            AttributeSpec.enumerated(MergeDecisionFact.ROW_COUNT, RowCountEstimate.class));

    private final Map<String, AttributeSpec> attributes;

    FactType(AttributeSpec... specs) {
        Map<String, AttributeSpec> map = new LinkedHashMap<>();
        for (AttributeSpec spec : specs) {
            map.put(spec.getName(), spec);
        }
        this.attributes = Map.copyOf(map);
    }

    public Optional<AttributeSpec> attribute(String name) {
        return Optional.ofNullable(attributes.get(name));
    }

    public Map<String, AttributeSpec> getAttributes() {
        return attributes;
    }
}
