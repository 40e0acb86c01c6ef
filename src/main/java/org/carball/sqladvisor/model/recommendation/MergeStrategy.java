package org.carball.sqladvisor.model.recommendation;

public enum MergeStrategy implements AdvisoryOutcome {
    MERGE("Single MERGE statement",
            "MERGE INTO t USING s ON t.key = s.key WHEN MATCHED THEN UPDATE ... WHEN NOT MATCHED THEN INSERT ...;"),
    UPDATE_THEN_INSERT("UPDATE followed by INSERT ... WHERE NOT EXISTS",
            "UPDATE t SET ... FROM t JOIN s ON t.key = s.key; "
                    + "INSERT INTO t SELECT ... FROM s WHERE NOT EXISTS (SELECT 1 FROM t WHERE t.key = s.key);");

    private final String displayName;
    private final String sqlSketch;

    MergeStrategy(String displayName, String sqlSketch) {
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
