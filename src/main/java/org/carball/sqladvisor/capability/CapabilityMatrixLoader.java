package org.carball.sqladvisor.capability;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.extern.slf4j.Slf4j;
import org.carball.sqladvisor.error.RuleDataException;
import org.carball.sqladvisor.error.UnknownEnvironmentException;
import org.carball.sqladvisor.model.capability.Availability;
import org.carball.sqladvisor.model.capability.CapabilityCategory;
import org.carball.sqladvisor.model.capability.CapabilityEntry;
import org.carball.sqladvisor.model.capability.CapabilityStatus;
import org.carball.sqladvisor.model.capability.DeploymentEnvironment;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Loads the capability matrix from YAML. Duplicate (name, environment) pairs
 * and malformed rows abort the load.
 */
@Slf4j
public class CapabilityMatrixLoader {

    public static final String DEFAULT_RESOURCE = "capabilities/capability-matrix.yml";

    private final ObjectMapper mapper;

    public CapabilityMatrixLoader() {
        this.mapper = new ObjectMapper(new YAMLFactory());
    }

    public CapabilityMatrix loadDefault() {
        return loadFromClasspath(DEFAULT_RESOURCE);
    }

    public CapabilityMatrix loadFromClasspath(String resource) {
        try (InputStream in = CapabilityMatrixLoader.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                throw new RuleDataException("Capability resource not found on classpath: " + resource);
            }
            return load(in, "classpath:" + resource);
        } catch (IOException e) {
            throw new RuleDataException("Failed to read capability resource " + resource, e);
        }
    }

    public CapabilityMatrix loadFromFile(Path file) {
        if (!Files.exists(file)) {
            throw new RuleDataException("Capability file not found: " + file);
        }
        try (InputStream in = Files.newInputStream(file)) {
            return load(in, file.toString());
        } catch (IOException e) {
            throw new RuleDataException("Failed to read capability file " + file, e);
        }
    }

    public CapabilityMatrix load(InputStream in, String sourceName) {
        CapabilityDocument document;
        try {
            document = mapper.readValue(in, CapabilityDocument.class);
        } catch (IOException e) {
            throw new RuleDataException("Invalid capability source " + sourceName + ": " + e.getMessage(), e);
        }
        if (document == null || document.getCapabilities() == null || document.getCapabilities().isEmpty()) {
            throw new RuleDataException("Capability source " + sourceName + " declares no capabilities");
        }

        List<CapabilityEntry> entries = new ArrayList<>();
        int rowNumber = 0;
        for (CapabilityRow row : document.getCapabilities()) {
            rowNumber++;
            entries.add(toEntry(row, rowNumber));
        }

        CapabilityMatrix matrix = CapabilityMatrix.of(entries);
        log.info("Loaded {} capability entries for {} capabilities from {}",
                matrix.size(), matrix.capabilityNames().size(), sourceName);
        return matrix;
    }

    private CapabilityEntry toEntry(CapabilityRow row, int rowNumber) {
        if (row.getName() == null || row.getName().isBlank()) {
            throw new RuleDataException("Capability row " + rowNumber + " has no name");
        }
        String location = "'" + row.getName() + "' (row " + rowNumber + ")";

        DeploymentEnvironment environment;
        try {
            environment = DeploymentEnvironment.fromName(row.getEnvironment());
        } catch (UnknownEnvironmentException e) {
            throw new RuleDataException("Capability " + location + " has invalid environment: " + row.getEnvironment(), e);
        }

        Availability availability = parseEnum(Availability.class, row.getStatus(), "status", location);
        CapabilityCategory category = parseEnum(CapabilityCategory.class, row.getCategory(), "category", location);
        String note = row.getNote() == null || row.getNote().isBlank() ? null : row.getNote().trim();

        return new CapabilityEntry(row.getName().trim(), category, environment, new CapabilityStatus(availability, note));
    }

    private static <E extends Enum<E>> E parseEnum(Class<E> type, String value, String field, String location) {
        if (value == null) {
            throw new RuleDataException("Capability " + location + " has no " + field);
        }
        try {
            return Enum.valueOf(type, value.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
        } catch (IllegalArgumentException e) {
            throw new RuleDataException(String.format("Capability %s has invalid %s '%s'", location, field, value), e);
        }
    }
}
