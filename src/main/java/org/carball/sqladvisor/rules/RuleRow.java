package org.carball.sqladvisor.rules;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * One row of the rule source as written in YAML.
 */
@Data
public class RuleRow {
    private String ruleSet;
    private Integer order;
    private String description;
    private List<String> when = new ArrayList<>();
    private String outcome;
    private List<String> rationale = new ArrayList<>();
}
