package org.carball.sqladvisor.model.capability;

import lombok.Value;

/**
 * One cell of the capability matrix: a feature in one deployment environment.
 */
@Value
public class CapabilityEntry {
    String name;
    CapabilityCategory category;
    DeploymentEnvironment environment;
    CapabilityStatus status;
}
