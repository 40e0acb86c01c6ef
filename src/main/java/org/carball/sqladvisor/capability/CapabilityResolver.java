package org.carball.sqladvisor.capability;

import lombok.extern.slf4j.Slf4j;
import org.carball.sqladvisor.error.UnknownCapabilityException;
import org.carball.sqladvisor.error.UnknownEnvironmentException;
import org.carball.sqladvisor.model.capability.CapabilityCategory;
import org.carball.sqladvisor.model.capability.CapabilityEntry;
import org.carball.sqladvisor.model.capability.CapabilityStatus;
import org.carball.sqladvisor.model.capability.DeploymentEnvironment;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Answers availability questions against the three-environment matrix. A
 * missing (name, environment) pair is reported, never read as NOT_AVAILABLE.
 */
@Slf4j
public class CapabilityResolver {

    private final CapabilityMatrix matrix;

    public CapabilityResolver(CapabilityMatrix matrix) {
        this.matrix = matrix;
    }

    public CapabilityStatus resolve(String name, String environment) {
        return lookup(name, environment).getStatus();
    }

    public CapabilityStatus resolve(String name, DeploymentEnvironment environment) {
        return lookup(name, environment).getStatus();
    }

    public CapabilityEntry lookup(String name, String environment) {
        return lookup(name, parseEnvironment(name, environment));
    }

    /**
     * The full matrix entry, including the canonical name and category.
     */
    public CapabilityEntry lookup(String name, DeploymentEnvironment environment) {
        Map<DeploymentEnvironment, CapabilityEntry> row = matrix.row(name)
                .orElseThrow(() -> new UnknownCapabilityException(name));
        CapabilityEntry entry = row.get(environment);
        if (entry == null) {
            log.warn("Capability matrix has no {} entry for '{}'", environment, name);
            throw new UnknownEnvironmentException(name, String.valueOf(environment));
        }
        log.debug("Resolved '{}' on {} -> {}", name, environment, entry.getStatus());
        return entry;
    }

    /**
     * Status of a capability in every environment the matrix lists for it.
     */
    public Map<DeploymentEnvironment, CapabilityStatus> compare(String name) {
        Map<DeploymentEnvironment, CapabilityEntry> row = matrix.row(name)
                .orElseThrow(() -> new UnknownCapabilityException(name));
        return row.entrySet().stream()
                .collect(Collectors.toMap(Map.Entry::getKey, e -> e.getValue().getStatus(),
                        (a, b) -> a, () -> new EnumMap<>(DeploymentEnvironment.class)));
    }

    public List<CapabilityEntry> listCapabilities(DeploymentEnvironment environment) {
        return matrix.entries().stream()
                .filter(entry -> entry.getEnvironment() == environment)
                .collect(Collectors.toList());
    }

    public List<CapabilityEntry> listByCategory(CapabilityCategory category) {
        return matrix.entries().stream()
                .filter(entry -> entry.getCategory() == category)
                .collect(Collectors.toList());
    }

    public List<String> capabilityNames() {
        return matrix.capabilityNames();
    }

    private DeploymentEnvironment parseEnvironment(String name, String environment) {
        // unknown name takes precedence over an unparseable environment
        if (!matrix.contains(name)) {
            throw new UnknownCapabilityException(name);
        }
        return DeploymentEnvironment.fromName(environment);
    }
}
