package org.carball.sqladvisor.rules;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.extern.slf4j.Slf4j;
import org.carball.sqladvisor.error.DuplicateRuleOrderException;
import org.carball.sqladvisor.error.RuleDataException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Reads the YAML rule source and builds a validated {@link RuleRepository}.
 * Any malformed row aborts the load.
 */
@Slf4j
public class RuleRepositoryLoader {

    public static final String DEFAULT_RESOURCE = "rules/advisor-rules.yml";

    private final ObjectMapper mapper;

    public RuleRepositoryLoader() {
        this.mapper = new ObjectMapper(new YAMLFactory());
    }

    public RuleRepository loadDefault() {
        return loadFromClasspath(DEFAULT_RESOURCE);
    }

    public RuleRepository loadFromClasspath(String resource) {
        try (InputStream in = RuleRepositoryLoader.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                throw new RuleDataException("Rule resource not found on classpath: " + resource);
            }
            return load(in, "classpath:" + resource);
        } catch (IOException e) {
            throw new RuleDataException("Failed to read rule resource " + resource, e);
        }
    }

    public RuleRepository loadFromFile(Path file) {
        if (!Files.exists(file)) {
            throw new RuleDataException("Rule file not found: " + file);
        }
        try (InputStream in = Files.newInputStream(file)) {
            return load(in, file.toString());
        } catch (IOException e) {
            throw new RuleDataException("Failed to read rule file " + file, e);
        }
    }

    public RuleRepository load(InputStream in, String sourceName) {
        RuleDocument document;
        try {
            document = mapper.readValue(in, RuleDocument.class);
        } catch (IOException e) {
            throw new RuleDataException("Invalid rule source " + sourceName + ": " + e.getMessage(), e);
        }
        if (document == null || document.getRules() == null || document.getRules().isEmpty()) {
            throw new RuleDataException("Rule source " + sourceName + " declares no rules");
        }

        RuleRepository repository = build(document.getRules());
        log.info("Loaded {} rules in {} rule sets from {}",
                document.getRules().size(), repository.size(), sourceName);
        return repository;
    }

    public RuleRepository build(List<RuleRow> rows) {
        Map<AdvisoryDomain, List<RuleRow>> byDomain = new LinkedHashMap<>();
        for (RuleRow row : rows) {
            if (row.getRuleSet() == null) {
                throw new RuleDataException("Rule row without ruleSet: " + row);
            }
            AdvisoryDomain domain = AdvisoryDomain.fromRuleSetId(row.getRuleSet())
                    .orElseThrow(() -> new RuleDataException("Unknown rule set id in rule row: " + row.getRuleSet()));
            byDomain.computeIfAbsent(domain, d -> new ArrayList<>()).add(row);
        }

        Map<String, RuleSet<?>> ruleSets = new LinkedHashMap<>();
        for (Map.Entry<AdvisoryDomain, List<RuleRow>> entry : byDomain.entrySet()) {
            RuleSet<?> ruleSet = buildRuleSet(entry.getKey(), entry.getValue());
            ruleSets.put(ruleSet.getId(), ruleSet);
            log.debug("Rule set '{}' has {} rules", ruleSet.getId(), ruleSet.getRules().size());
        }
        return new RuleRepository(ruleSets);
    }

    @SuppressWarnings("unchecked")
    private <O extends Enum<O>> RuleSet<O> buildRuleSet(AdvisoryDomain domain, List<RuleRow> rows) {
        Class<O> outcomeType = (Class<O>) domain.getOutcomeType();
        Set<Integer> seenOrders = new HashSet<>();
        List<Rule<O>> rules = new ArrayList<>();

        for (RuleRow row : rows) {
            if (row.getOrder() == null) {
                throw new RuleDataException("Rule in '" + domain.getRuleSetId() + "' has no order index");
            }
            if (!seenOrders.add(row.getOrder())) {
                throw new DuplicateRuleOrderException(domain.getRuleSetId(), row.getOrder());
            }
            rules.add(toRule(domain, outcomeType, row));
        }

        rules.sort(Comparator.comparingInt(Rule::getOrder));
        return new RuleSet<>(domain, outcomeType, List.copyOf(rules));
    }

    private <O extends Enum<O>> Rule<O> toRule(AdvisoryDomain domain, Class<O> outcomeType, RuleRow row) {
        String location = domain.getRuleSetId() + "#" + row.getOrder();

        O outcome = parseOutcome(outcomeType, row.getOutcome(), location);

        List<String> rationale = row.getRationale() == null ? List.of() : row.getRationale().stream()
                .filter(line -> line != null && !line.isBlank())
                .collect(Collectors.toList());
        if (rationale.isEmpty()) {
            throw new RuleDataException("Rule " + location + " has no rationale");
        }

        List<Condition> conditions = new ArrayList<>();
        if (row.getWhen() != null) {
            for (String expression : row.getWhen()) {
                try {
                    conditions.add(Condition.parse(expression, domain.getFactType()));
                } catch (RuleDataException e) {
                    throw new RuleDataException("Rule " + location + ": " + e.getMessage(), e);
                }
            }
        }

        String description = row.getDescription() != null ? row.getDescription()
                : conditions.stream().map(Condition::toString).collect(Collectors.joining(" AND "));

        return new Rule<>(row.getOrder(), description, List.copyOf(conditions), outcome, List.copyOf(rationale));
    }

    private static <O extends Enum<O>> O parseOutcome(Class<O> outcomeType, String value, String location) {
        if (value == null) {
            throw new RuleDataException("Rule " + location + " has no outcome");
        }
        try {
            return Enum.valueOf(outcomeType, value.trim());
        } catch (IllegalArgumentException e) {
            throw new RuleDataException(String.format("Rule %s: '%s' is not a %s outcome",
                    location, value, outcomeType.getSimpleName()), e);
        }
    }
}
