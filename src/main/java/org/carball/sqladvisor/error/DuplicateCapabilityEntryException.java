package org.carball.sqladvisor.error;

import lombok.Getter;
import org.carball.sqladvisor.model.capability.DeploymentEnvironment;

@Getter
public class DuplicateCapabilityEntryException extends RuleDataException {

    private final String capabilityName;
    private final DeploymentEnvironment environment;

    public DuplicateCapabilityEntryException(String capabilityName, DeploymentEnvironment environment) {
        super(String.format("Capability '%s' is listed more than once for %s", capabilityName, environment));
        this.capabilityName = capabilityName;
        this.environment = environment;
    }
}
