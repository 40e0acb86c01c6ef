package org.carball.sqladvisor.model.recommendation;

public enum QueryConstruct implements AdvisoryOutcome {
    CTE("Common table expression", "WITH cte AS (...) SELECT ... FROM cte"),
    SUBQUERY_INLINE("Inline subquery", "SELECT ... FROM (SELECT ...) AS d"),
    SUBQUERY_CORRELATED("Correlated subquery", "SELECT ..., (SELECT ... WHERE i.key = o.key) FROM o"),
    CROSS_APPLY("CROSS APPLY", "SELECT ... FROM o CROSS APPLY fn(o.key) AS a"),
    OUTER_APPLY("OUTER APPLY", "SELECT ... FROM o OUTER APPLY fn(o.key) AS a");

    private final String displayName;
    private final String sqlSketch;

    QueryConstruct(String displayName, String sqlSketch) {
        this.displayName = displayName;
        this.sqlSketch = sqlSketch;
    }

    @Override
    public String getDisplayName() {
        return displayName;
    }

    @Override
    public String getSqlSketch() {
        return sqlSketch;
    }
}
