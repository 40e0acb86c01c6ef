package org.carball.sqladvisor.model.capability;

import lombok.NonNull;
import lombok.Value;

import java.util.Optional;

@Value
public class CapabilityStatus {
    @NonNull
    Availability availability;
    String constraintNote;

    public static CapabilityStatus of(Availability availability) {
        return new CapabilityStatus(availability, null);
    }

    public Optional<String> note() {
        return Optional.ofNullable(constraintNote);
    }

    @Override
    public String toString() {
        return constraintNote == null ? availability.name() : availability + " (" + constraintNote + ")";
    }
}
