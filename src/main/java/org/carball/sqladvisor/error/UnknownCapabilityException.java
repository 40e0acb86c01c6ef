package org.carball.sqladvisor.error;

import lombok.Getter;

@Getter
public class UnknownCapabilityException extends AdvisorException {

    private final String capabilityName;

    public UnknownCapabilityException(String capabilityName) {
        super("Unknown capability: " + capabilityName);
        this.capabilityName = capabilityName;
    }
}
