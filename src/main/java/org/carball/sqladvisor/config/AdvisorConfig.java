package org.carball.sqladvisor.config;

import lombok.Builder;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Files;
import java.nio.file.Path;

@Data
@Builder(toBuilder = true)
@Slf4j
public class AdvisorConfig {

    // null means the bundled classpath resource
    private Path rulesFile;

    private Path capabilitiesFile;

    @Builder.Default
    private OutputFormat outputFormat = OutputFormat.TEXT;

    @Builder.Default
    private boolean verbose = false;

    public static AdvisorConfig defaults() {
        return AdvisorConfig.builder().build();
    }

    /**
     * Rejects file locations that do not exist. Runs before anything is loaded.
     */
    public void validate() {
        if (rulesFile != null && !Files.isRegularFile(rulesFile)) {
            throw new IllegalArgumentException("Rules file not found: " + rulesFile);
        }
        if (capabilitiesFile != null && !Files.isRegularFile(capabilitiesFile)) {
            throw new IllegalArgumentException("Capabilities file not found: " + capabilitiesFile);
        }
        log.debug("Using rules: {}, capabilities: {}, format: {}",
                rulesFile != null ? rulesFile : "bundled",
                capabilitiesFile != null ? capabilitiesFile : "bundled",
                outputFormat);
    }

    public String getConfigurationSummary() {
        return String.format("Rules: %s | Capabilities: %s | Format: %s | Verbose: %s",
                rulesFile != null ? rulesFile : "bundled",
                capabilitiesFile != null ? capabilitiesFile : "bundled",
                outputFormat, verbose);
    }
}
