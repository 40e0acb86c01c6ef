package org.carball.sqladvisor.error;

import lombok.Getter;

/**
 * Either the environment name is not recognised, or the capability has no row
 * for that environment. The second case is a completeness gap in the matrix.
 */
@Getter
public class UnknownEnvironmentException extends AdvisorException {

    private final String capabilityName;
    private final String environment;

    public UnknownEnvironmentException(String capabilityName, String environment) {
        super(capabilityName == null
                ? "Unknown deployment environment: " + environment
                : String.format("Capability '%s' has no entry for environment %s", capabilityName, environment));
        this.capabilityName = capabilityName;
        this.environment = environment;
    }

    public UnknownEnvironmentException(String environment) {
        this(null, environment);
    }
}
