package org.carball.sqladvisor.model.recommendation;

public enum FragmentationAction implements AdvisoryOutcome {
    NO_ACTION("No action", null),
    REORGANIZE("Reorganize index", "ALTER INDEX %s ON %s REORGANIZE;"),
    REBUILD("Rebuild index", "ALTER INDEX %s ON %s REBUILD;");

    private final String displayName;
    private final String statementTemplate;

    FragmentationAction(String displayName, String statementTemplate) {
        this.displayName = displayName;
        this.statementTemplate = statementTemplate;
    }

    @Override
    public String getDisplayName() {
        return displayName;
    }

    @Override
    public String getSqlSketch() {
        return toStatement("<index>", "<table>");
    }

    /**
     * Renders the maintenance statement for an index, or {@code null} when no
     * action is needed.
     */
    public String toStatement(String indexName, String tableName) {
        if (statementTemplate == null) {
            return null;
        }
        return String.format(statementTemplate, indexName, tableName);
    }
}
