package org.carball.sqladvisor.rules;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
public class RuleDocument {
    private String version;
    private List<RuleRow> rules = new ArrayList<>();
}
