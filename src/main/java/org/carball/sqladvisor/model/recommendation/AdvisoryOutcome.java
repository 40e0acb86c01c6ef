package org.carball.sqladvisor.model.recommendation;

/**
 * Human-facing description of an outcome constant.
 */
public interface AdvisoryOutcome {

    String getDisplayName();

    /**
     * Shape of the T-SQL the outcome implies, or {@code null} if it implies none.
     */
    String getSqlSketch();
}
