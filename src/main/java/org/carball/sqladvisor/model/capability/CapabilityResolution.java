package org.carball.sqladvisor.model.capability;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder(toBuilder = true)
public class CapabilityResolution {
    String capabilityName;
    CapabilityCategory category;
    DeploymentEnvironment environment;
    CapabilityStatus status;
    List<String> rationale;
}
