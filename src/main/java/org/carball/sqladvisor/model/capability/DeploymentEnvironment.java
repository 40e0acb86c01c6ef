package org.carball.sqladvisor.model.capability;

import org.carball.sqladvisor.error.UnknownEnvironmentException;

import java.util.Locale;

public enum DeploymentEnvironment {
    ON_PREM("On-premises SQL Server"),
    AZURE_IAAS("SQL Server on Azure VM"),
    MANAGED_INSTANCE("Azure SQL Managed Instance");

    private final String displayName;

    DeploymentEnvironment(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * Parses an environment name, ignoring case and treating '-' and ' ' like '_'.
     */
    public static DeploymentEnvironment fromName(String name) {
        if (name == null || name.isBlank()) {
            throw new UnknownEnvironmentException(String.valueOf(name));
        }
        String normalized = name.trim().toUpperCase(Locale.ROOT).replace('-', '_').replace(' ', '_');
        for (DeploymentEnvironment environment : values()) {
            if (environment.name().equals(normalized)) {
                return environment;
            }
        }
        throw new UnknownEnvironmentException(name);
    }
}
