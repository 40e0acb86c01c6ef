package org.carball.sqladvisor.model.capability;

public enum Availability {
    FULL,
    PARTIAL,
    NOT_AVAILABLE,
    MANAGED_EXTERNALLY
}
