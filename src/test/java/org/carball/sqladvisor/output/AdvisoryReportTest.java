package org.carball.sqladvisor.output;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.carball.sqladvisor.config.OutputFormat;
import org.carball.sqladvisor.model.capability.Availability;
import org.carball.sqladvisor.model.capability.CapabilityCategory;
import org.carball.sqladvisor.model.capability.CapabilityEntry;
import org.carball.sqladvisor.model.capability.CapabilityResolution;
import org.carball.sqladvisor.model.capability.CapabilityStatus;
import org.carball.sqladvisor.model.capability.DeploymentEnvironment;
import org.carball.sqladvisor.model.recommendation.FragmentationAction;
import org.carball.sqladvisor.model.recommendation.MergeStrategy;
import org.carball.sqladvisor.model.recommendation.QueryConstruct;
import org.carball.sqladvisor.model.recommendation.Recommendation;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class AdvisoryReportTest {

    private Recommendation<QueryConstruct> recommendation;
    private CapabilityResolution resolution;

    @BeforeEach
    void setUp() {
        recommendation = Recommendation.<QueryConstruct>builder()
                .ruleSetId("construct-selection")
                .outcome(QueryConstruct.CROSS_APPLY)
                .matchedRuleOrder(3)
                .ruleDescription("table-valued function returning a set")
                .rationale(List.of("APPLY passes outer columns to the function.", "Inner form assumed."))
                .build();

        resolution = CapabilityResolution.builder()
                .capabilityName("Query Store")
                .category(CapabilityCategory.PERFORMANCE)
                .environment(DeploymentEnvironment.MANAGED_INSTANCE)
                .status(new CapabilityStatus(Availability.FULL, "always enabled"))
                .rationale(List.of("Query Store on Azure SQL Managed Instance: FULL", "always enabled"))
                .build();
    }

    @Test
    void shouldRenderRecommendationAsText() {
        String text = new AdvisoryReport(OutputFormat.TEXT).render(recommendation);

        assertThat(text).startsWith("Recommendation: CROSS_APPLY\n");
        assertThat(text).contains("construct-selection #3");
        assertThat(text).contains("  - Inner form assumed.");
    }

    @Test
    void shouldRenderRecommendationAsJson() throws Exception {
        // When
        String json = new AdvisoryReport(OutputFormat.JSON).render(recommendation);

        // Then
        JsonNode node = new ObjectMapper().readTree(json);
        assertThat(node.get("outcome").asText()).isEqualTo("CROSS_APPLY");
        assertThat(node.get("matchedRule").asInt()).isEqualTo(3);
        assertThat(node.get("rationale")).hasSize(2);
    }

    @Test
    void shouldRenderRecommendationAsMarkdown() {
        String md = new AdvisoryReport(OutputFormat.MARKDOWN).render(recommendation);

        assertThat(md).contains("## construct-selection");
        assertThat(md).contains("**Recommendation:** `CROSS_APPLY`");
        assertThat(md).contains("- APPLY passes outer columns to the function.");
    }

    @Test
    void shouldDescribeOutcomeWithDisplayNameAndSketch() throws Exception {
        // When
        String text = new AdvisoryReport(OutputFormat.TEXT).render(recommendation);
        String md = new AdvisoryReport(OutputFormat.MARKDOWN).render(recommendation);
        JsonNode json = new ObjectMapper().readTree(new AdvisoryReport(OutputFormat.JSON).render(recommendation));

        // Then
        assertThat(text).contains("  CROSS APPLY\n")
                .contains("  Sketch: SELECT ... FROM o CROSS APPLY fn(o.key) AS a\n");
        assertThat(md).contains("```sql\nSELECT ... FROM o CROSS APPLY fn(o.key) AS a\n```");
        assertThat(json.get("displayName").asText()).isEqualTo("CROSS APPLY");
        assertThat(json.get("sqlSketch").asText()).isEqualTo(QueryConstruct.CROSS_APPLY.getSqlSketch());
    }

    @Test
    void shouldRenderMaintenanceStatementOnlyWhenActionNeeded() throws Exception {
        // Given
        Recommendation<FragmentationAction> rebuild = Recommendation.<FragmentationAction>builder()
                .ruleSetId("fragmentation-action")
                .outcome(FragmentationAction.REBUILD)
                .matchedRuleOrder(3)
                .rationale(List.of("Heavy fragmentation."))
                .build();
        Recommendation<FragmentationAction> none = Recommendation.<FragmentationAction>builder()
                .ruleSetId("fragmentation-action")
                .outcome(FragmentationAction.NO_ACTION)
                .matchedRuleOrder(1)
                .rationale(List.of("Negligible fragmentation."))
                .build();
        AdvisoryReport report = new AdvisoryReport(OutputFormat.JSON);

        // When
        JsonNode rebuildJson = new ObjectMapper().readTree(report.render(rebuild));
        JsonNode noneJson = new ObjectMapper().readTree(report.render(none));

        // Then
        assertThat(rebuildJson.get("displayName").asText()).isEqualTo("Rebuild index");
        assertThat(rebuildJson.get("sqlSketch").asText()).isEqualTo("ALTER INDEX <index> ON <table> REBUILD;");
        assertThat(noneJson.get("displayName").asText()).isEqualTo("No action");
        assertThat(noneJson.has("sqlSketch")).isFalse();
        assertThat(new AdvisoryReport(OutputFormat.TEXT).render(none)).doesNotContain("Sketch:");
    }

    @Test
    void shouldDescribeMergeStrategy() {
        Recommendation<MergeStrategy> split = Recommendation.<MergeStrategy>builder()
                .ruleSetId("merge-vs-split")
                .outcome(MergeStrategy.UPDATE_THEN_INSERT)
                .matchedRuleOrder(2)
                .rationale(List.of("Many branches."))
                .build();

        String text = new AdvisoryReport(OutputFormat.TEXT).render(split);

        assertThat(text).contains("UPDATE followed by INSERT ... WHERE NOT EXISTS")
                .contains("Sketch: UPDATE t SET");
    }

    @Test
    void shouldRenderCapabilityResolution() throws Exception {
        String text = new AdvisoryReport(OutputFormat.TEXT).render(resolution);
        JsonNode json = new ObjectMapper().readTree(new AdvisoryReport(OutputFormat.JSON).render(resolution));

        assertThat(text).isEqualTo("Query Store on Azure SQL Managed Instance: FULL\n  Note: always enabled\n");
        assertThat(json.get("status").asText()).isEqualTo("FULL");
        assertThat(json.get("environment").asText()).isEqualTo("MANAGED_INSTANCE");
        assertThat(json.get("note").asText()).isEqualTo("always enabled");
    }

    @Test
    void shouldOmitNullNotesFromJson() throws Exception {
        CapabilityResolution withoutNote = resolution.toBuilder()
                .status(CapabilityStatus.of(Availability.NOT_AVAILABLE))
                .build();

        JsonNode json = new ObjectMapper().readTree(new AdvisoryReport(OutputFormat.JSON).render(withoutNote));

        assertThat(json.has("note")).isFalse();
    }

    @Test
    void shouldRenderComparisonTable() {
        Map<DeploymentEnvironment, CapabilityStatus> statuses = new EnumMap<>(DeploymentEnvironment.class);
        statuses.put(DeploymentEnvironment.ON_PREM, CapabilityStatus.of(Availability.FULL));
        statuses.put(DeploymentEnvironment.MANAGED_INSTANCE, CapabilityStatus.of(Availability.NOT_AVAILABLE));

        String md = new AdvisoryReport(OutputFormat.MARKDOWN).renderComparison("OS Access", statuses);

        assertThat(md).contains("| On-premises SQL Server | FULL |  |");
        assertThat(md).contains("| Azure SQL Managed Instance | NOT_AVAILABLE |  |");
    }

    @Test
    void shouldRenderCapabilityList() {
        List<CapabilityEntry> entries = List.of(
                new CapabilityEntry("Log Shipping", CapabilityCategory.HIGH_AVAILABILITY,
                        DeploymentEnvironment.MANAGED_INSTANCE,
                        new CapabilityStatus(Availability.NOT_AVAILABLE, "use auto-failover groups")));

        String text = new AdvisoryReport(OutputFormat.TEXT)
                .renderCapabilityList(DeploymentEnvironment.MANAGED_INSTANCE, entries);

        assertThat(text).startsWith("Azure SQL Managed Instance\n");
        assertThat(text).contains("Log Shipping").contains("NOT_AVAILABLE (use auto-failover groups)");
    }
}
