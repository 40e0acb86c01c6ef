package org.carball.sqladvisor.capability;

import org.carball.sqladvisor.error.UnknownCapabilityException;
import org.carball.sqladvisor.error.UnknownEnvironmentException;
import org.carball.sqladvisor.model.capability.Availability;
import org.carball.sqladvisor.model.capability.CapabilityCategory;
import org.carball.sqladvisor.model.capability.CapabilityEntry;
import org.carball.sqladvisor.model.capability.CapabilityStatus;
import org.carball.sqladvisor.model.capability.DeploymentEnvironment;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class CapabilityResolverTest {

    private CapabilityResolver resolver;

    @BeforeEach
    void setUp() {
        resolver = new CapabilityResolver(new CapabilityMatrixLoader().loadDefault());
    }

    @Test
    void shouldResolveQueryStoreOnManagedInstance() {
        // When
        CapabilityStatus status = resolver.resolve("Query Store", "MANAGED_INSTANCE");

        // Then
        assertThat(status.getAvailability()).isEqualTo(Availability.FULL);
        assertThat(status.note()).contains("always enabled");
    }

    @Test
    void shouldReportOsAccessUnavailableOnManagedInstance() {
        assertThat(resolver.resolve("OS Access", "MANAGED_INSTANCE").getAvailability())
                .isEqualTo(Availability.NOT_AVAILABLE);
        assertThat(resolver.resolve("OS Access", DeploymentEnvironment.ON_PREM).getAvailability())
                .isEqualTo(Availability.FULL);
    }

    @Test
    void shouldMatchNamesAndEnvironmentsLoosely() {
        CapabilityStatus status = resolver.resolve("  query store ", "managed-instance");

        assertThat(status.getAvailability()).isEqualTo(Availability.FULL);
    }

    @Test
    void shouldFailForUnknownCapability() {
        assertThatThrownBy(() -> resolver.resolve("Stretch Database", "ON_PREM"))
                .isInstanceOfSatisfying(UnknownCapabilityException.class,
                        e -> assertThat(e.getCapabilityName()).isEqualTo("Stretch Database"));
    }

    @Test
    void shouldPreferUnknownCapabilityOverUnknownEnvironment() {
        assertThatThrownBy(() -> resolver.resolve("Stretch Database", "MAINFRAME"))
                .isInstanceOf(UnknownCapabilityException.class);
    }

    @Test
    void shouldFailForUnparseableEnvironment() {
        assertThatThrownBy(() -> resolver.resolve("Query Store", "AZURE_SQL_DATABASE"))
                .isInstanceOf(UnknownEnvironmentException.class)
                .hasMessageContaining("AZURE_SQL_DATABASE");
    }

    @Test
    void shouldSurfaceMissingEnvironmentRowInsteadOfNotAvailable() {
        // Given - a matrix with an on-premises row only
        CapabilityMatrix partial = CapabilityMatrix.of(List.of(
                new CapabilityEntry("Log Shipping", CapabilityCategory.HIGH_AVAILABILITY,
                        DeploymentEnvironment.ON_PREM, CapabilityStatus.of(Availability.FULL))));
        CapabilityResolver partialResolver = new CapabilityResolver(partial);

        // When / Then
        assertThatThrownBy(() -> partialResolver.resolve("Log Shipping", DeploymentEnvironment.MANAGED_INSTANCE))
                .isInstanceOfSatisfying(UnknownEnvironmentException.class, e -> {
                    assertThat(e.getCapabilityName()).isEqualTo("Log Shipping");
                    assertThat(e.getEnvironment()).isEqualTo("MANAGED_INSTANCE");
                });
    }

    @Test
    void shouldCompareAcrossEnvironments() {
        // When
        Map<DeploymentEnvironment, CapabilityStatus> statuses = resolver.compare("Failover Cluster Instance");

        // Then
        assertThat(statuses.keySet()).containsExactly(
                DeploymentEnvironment.ON_PREM, DeploymentEnvironment.AZURE_IAAS, DeploymentEnvironment.MANAGED_INSTANCE);
        assertThat(statuses.get(DeploymentEnvironment.AZURE_IAAS).getAvailability()).isEqualTo(Availability.PARTIAL);
        assertThat(statuses.get(DeploymentEnvironment.MANAGED_INSTANCE).getAvailability())
                .isEqualTo(Availability.NOT_AVAILABLE);
    }

    @Test
    void shouldListEveryCapabilityForEachEnvironment() {
        int names = resolver.capabilityNames().size();

        for (DeploymentEnvironment environment : DeploymentEnvironment.values()) {
            List<CapabilityEntry> entries = resolver.listCapabilities(environment);
            assertThat(entries).hasSize(names)
                    .allMatch(entry -> entry.getEnvironment() == environment);
        }
    }

    @Test
    void shouldListByCategory() {
        List<CapabilityEntry> backup = resolver.listByCategory(CapabilityCategory.BACKUP_RESTORE);

        assertThat(backup).isNotEmpty()
                .allMatch(entry -> entry.getCategory() == CapabilityCategory.BACKUP_RESTORE);
        assertThat(backup).extracting(CapabilityEntry::getName).contains("Native Backup", "Backup to URL");
    }
}
