package org.carball.sqladvisor.capability;

import org.carball.sqladvisor.error.DuplicateCapabilityEntryException;
import org.carball.sqladvisor.error.RuleDataException;
import org.carball.sqladvisor.model.capability.CapabilityEntry;
import org.carball.sqladvisor.model.capability.DeploymentEnvironment;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only (capability, environment) table. Names are matched ignoring case
 * and surrounding whitespace.
 */
public final class CapabilityMatrix {

    private final Map<String, Map<DeploymentEnvironment, CapabilityEntry>> entries;
    private final int size;

    private CapabilityMatrix(Map<String, Map<DeploymentEnvironment, CapabilityEntry>> entries, int size) {
        this.entries = entries;
        this.size = size;
    }

    /**
     * @throws DuplicateCapabilityEntryException if two entries share name and environment
     * @throws RuleDataException if rows of one capability disagree on its category
     */
    public static CapabilityMatrix of(List<CapabilityEntry> entries) {
        Map<String, Map<DeploymentEnvironment, CapabilityEntry>> index = new LinkedHashMap<>();
        for (CapabilityEntry entry : entries) {
            Map<DeploymentEnvironment, CapabilityEntry> row =
                    index.computeIfAbsent(key(entry.getName()), k -> new EnumMap<>(DeploymentEnvironment.class));
            if (!row.isEmpty()) {
                CapabilityEntry first = row.values().iterator().next();
                if (first.getCategory() != entry.getCategory()) {
                    throw new RuleDataException(String.format(
                            "Capability '%s' is listed under both %s and %s",
                            entry.getName(), first.getCategory(), entry.getCategory()));
                }
            }
            if (row.putIfAbsent(entry.getEnvironment(), entry) != null) {
                throw new DuplicateCapabilityEntryException(entry.getName(), entry.getEnvironment());
            }
        }

        Map<String, Map<DeploymentEnvironment, CapabilityEntry>> frozen = new LinkedHashMap<>();
        index.forEach((name, row) -> frozen.put(name, Collections.unmodifiableMap(row)));
        return new CapabilityMatrix(Collections.unmodifiableMap(frozen), entries.size());
    }

    public boolean contains(String name) {
        return name != null && entries.containsKey(key(name));
    }

    /**
     * All environments listed for a capability, or empty if the name is unknown.
     */
    public Optional<Map<DeploymentEnvironment, CapabilityEntry>> row(String name) {
        return Optional.ofNullable(name == null ? null : entries.get(key(name)));
    }

    public List<CapabilityEntry> entries() {
        List<CapabilityEntry> all = new ArrayList<>(size);
        entries.values().forEach(row -> all.addAll(row.values()));
        return all;
    }

    public List<String> capabilityNames() {
        List<String> names = new ArrayList<>();
        for (Map<DeploymentEnvironment, CapabilityEntry> row : entries.values()) {
            names.add(row.values().iterator().next().getName());
        }
        return names;
    }

    public int size() {
        return size;
    }

    private static String key(String name) {
        return name.trim().toLowerCase(Locale.ROOT);
    }
}
