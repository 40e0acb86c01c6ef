package org.carball.sqladvisor.model.fact;

import lombok.Builder;
import lombok.Value;
import org.carball.sqladvisor.error.InvalidFactException;

@Value
@Builder(toBuilder = true)
public class MergeDecisionFact implements AdvisoryFact {

    public static final String BRANCH_COUNT = "conditionalBranchCount";
    public static final String ROW_LEVEL_AUDIT = "needsRowLevelAudit";
    public static final String ROW_COUNT = "estimatedRowCount";

    int conditionalBranchCount;
    boolean needsRowLevelAudit;
    @Builder.Default
    RowCountEstimate estimatedRowCount = RowCountEstimate.SMALL;

    @Override
    public FactType getFactType() {
        return FactType.MERGE_DECISION;
    }

    @Override
    public Object attribute(String name) {
        switch (name) {
            case BRANCH_COUNT:
                return conditionalBranchCount;
            case ROW_LEVEL_AUDIT:
                return needsRowLevelAudit;
            case ROW_COUNT:
                return estimatedRowCount == null ? null : estimatedRowCount.name();
            default:
                throw new IllegalArgumentException("Unknown merge decision attribute: " + name);
        }
    }

    @Override
    public void validate() {
        if (conditionalBranchCount < 0) {
            throw new InvalidFactException(this, "conditionalBranchCount must not be negative");
        }
        if (estimatedRowCount == null) {
            throw new InvalidFactException(this, "estimatedRowCount is required");
        }
    }
}
