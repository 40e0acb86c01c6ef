package org.carball.sqladvisor.model.capability;

public enum CapabilityCategory {
    INDEXING,
    BACKUP_RESTORE,
    HIGH_AVAILABILITY,
    SECURITY,
    PLATFORM,
    PERFORMANCE
}
