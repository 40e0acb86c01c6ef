package org.carball.sqladvisor.output;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.extern.slf4j.Slf4j;
import org.carball.sqladvisor.config.OutputFormat;
import org.carball.sqladvisor.model.capability.CapabilityEntry;
import org.carball.sqladvisor.model.capability.CapabilityResolution;
import org.carball.sqladvisor.model.capability.CapabilityStatus;
import org.carball.sqladvisor.model.capability.DeploymentEnvironment;
import org.carball.sqladvisor.model.recommendation.Recommendation;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Renders advisor results for people (text, Markdown) and for tools (JSON).
 */
@Slf4j
public class AdvisoryReport {

    private final OutputFormat format;
    private final ObjectMapper objectMapper;

    public AdvisoryReport(OutputFormat format) {
        this.format = format;
        this.objectMapper = new ObjectMapper();
        this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
        this.objectMapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);
    }

    public String render(Recommendation<?> recommendation) {
        switch (format) {
            case JSON:
                Map<String, Object> data = new LinkedHashMap<>();
                data.put("ruleSet", recommendation.getRuleSetId());
                data.put("outcome", recommendation.getOutcomeName());
                data.put("displayName", recommendation.getDisplayName());
                data.put("sqlSketch", recommendation.getSqlSketch());
                data.put("matchedRule", recommendation.getMatchedRuleOrder());
                data.put("condition", recommendation.getRuleDescription());
                data.put("rationale", recommendation.getRationale());
                return toJson(data);
            case MARKDOWN:
                StringBuilder md = new StringBuilder();
                md.append("## ").append(recommendation.getRuleSetId()).append("\n\n");
                md.append("**Recommendation:** `").append(recommendation.getOutcomeName()).append("` ")
                        .append(recommendation.getDisplayName()).append("  \n");
                md.append("**Matched rule:** ").append(recommendation.getMatchedRuleOrder())
                        .append(" (").append(recommendation.getRuleDescription()).append(")\n\n");
                if (recommendation.getSqlSketch() != null) {
                    md.append("```sql\n").append(recommendation.getSqlSketch()).append("\n```\n\n");
                }
                md.append("### Rationale\n\n");
                recommendation.getRationale().forEach(line -> md.append("- ").append(line).append("\n"));
                return md.toString();
            case TEXT:
            default:
                StringBuilder text = new StringBuilder();
                text.append("Recommendation: ").append(recommendation.getOutcomeName()).append("\n");
                text.append("  ").append(recommendation.getDisplayName()).append("\n");
                if (recommendation.getSqlSketch() != null) {
                    text.append("  Sketch: ").append(recommendation.getSqlSketch()).append("\n");
                }
                text.append("Rule: ").append(recommendation.getRuleSetId())
                        .append(" #").append(recommendation.getMatchedRuleOrder())
                        .append(" [").append(recommendation.getRuleDescription()).append("]\n");
                recommendation.getRationale().forEach(line -> text.append("  - ").append(line).append("\n"));
                return text.toString();
        }
    }

    public String render(CapabilityResolution resolution) {
        switch (format) {
            case JSON:
                Map<String, Object> data = new LinkedHashMap<>();
                data.put("capability", resolution.getCapabilityName());
                data.put("category", resolution.getCategory());
                data.put("environment", resolution.getEnvironment());
                data.put("status", resolution.getStatus().getAvailability());
                data.put("note", resolution.getStatus().getConstraintNote());
                data.put("rationale", resolution.getRationale());
                return toJson(data);
            case MARKDOWN:
                StringBuilder md = new StringBuilder();
                md.append("## ").append(resolution.getCapabilityName()).append("\n\n");
                md.append("| Environment | Status | Note |\n");
                md.append("|-------------|--------|------|\n");
                md.append(markdownRow(resolution.getEnvironment(), resolution.getStatus()));
                return md.toString();
            case TEXT:
            default:
                StringBuilder text = new StringBuilder();
                text.append(resolution.getCapabilityName()).append(" on ")
                        .append(resolution.getEnvironment().getDisplayName()).append(": ")
                        .append(resolution.getStatus().getAvailability()).append("\n");
                resolution.getStatus().note().ifPresent(note -> text.append("  Note: ").append(note).append("\n"));
                return text.toString();
        }
    }

    public String renderComparison(String capabilityName, Map<DeploymentEnvironment, CapabilityStatus> statuses) {
        switch (format) {
            case JSON:
                Map<String, Object> data = new LinkedHashMap<>();
                data.put("capability", capabilityName);
                Map<String, Object> byEnvironment = new LinkedHashMap<>();
                statuses.forEach((environment, status) -> byEnvironment.put(environment.name(), status));
                data.put("environments", byEnvironment);
                return toJson(data);
            case MARKDOWN:
                StringBuilder md = new StringBuilder();
                md.append("## ").append(capabilityName).append("\n\n");
                md.append("| Environment | Status | Note |\n");
                md.append("|-------------|--------|------|\n");
                statuses.forEach((environment, status) -> md.append(markdownRow(environment, status)));
                return md.toString();
            case TEXT:
            default:
                StringBuilder text = new StringBuilder(capabilityName).append("\n");
                statuses.forEach((environment, status) -> text.append(String.format("  %-28s %s%n",
                        environment.getDisplayName(), status)));
                return text.toString();
        }
    }

    public String renderCapabilityList(DeploymentEnvironment environment, List<CapabilityEntry> entries) {
        switch (format) {
            case JSON:
                Map<String, Object> data = new LinkedHashMap<>();
                data.put("environment", environment);
                data.put("capabilities", entries.stream().map(entry -> {
                    Map<String, Object> item = new LinkedHashMap<>();
                    item.put("name", entry.getName());
                    item.put("category", entry.getCategory());
                    item.put("status", entry.getStatus().getAvailability());
                    item.put("note", entry.getStatus().getConstraintNote());
                    return item;
                }).collect(Collectors.toList()));
                return toJson(data);
            case MARKDOWN:
                StringBuilder md = new StringBuilder();
                md.append("## ").append(environment.getDisplayName()).append("\n\n");
                md.append("| Capability | Category | Status | Note |\n");
                md.append("|------------|----------|--------|------|\n");
                for (CapabilityEntry entry : entries) {
                    md.append("| ").append(entry.getName())
                            .append(" | ").append(entry.getCategory())
                            .append(" | ").append(entry.getStatus().getAvailability())
                            .append(" | ").append(entry.getStatus().note().orElse(""))
                            .append(" |\n");
                }
                return md.toString();
            case TEXT:
            default:
                StringBuilder text = new StringBuilder(environment.getDisplayName()).append("\n");
                for (CapabilityEntry entry : entries) {
                    text.append(String.format("  %-36s %s%n", entry.getName(), entry.getStatus()));
                }
                return text.toString();
        }
    }

    private static String markdownRow(DeploymentEnvironment environment, CapabilityStatus status) {
        return "| " + environment.getDisplayName()
                + " | " + status.getAvailability()
                + " | " + status.note().orElse("")
                + " |\n";
    }

    private String toJson(Object data) {
        try {
            return objectMapper.writeValueAsString(data);
        } catch (JsonProcessingException e) {
            log.error("Error generating JSON report", e);
            throw new IllegalStateException("Failed to generate JSON report", e);
        }
    }
}
