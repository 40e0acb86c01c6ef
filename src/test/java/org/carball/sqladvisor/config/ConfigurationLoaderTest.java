package org.carball.sqladvisor.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class ConfigurationLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldLoadDefaultConfiguration() {
        // When
        AdvisorConfig config = new ConfigurationLoader(Map.of()).loadConfiguration(new String[0]);

        // Then
        assertThat(config.getRulesFile()).isNull();
        assertThat(config.getCapabilitiesFile()).isNull();
        assertThat(config.getOutputFormat()).isEqualTo(OutputFormat.TEXT);
        assertThat(config.isVerbose()).isFalse();
    }

    @Test
    void shouldApplyEnvironmentVariables() throws IOException {
        // Given
        Path rules = Files.writeString(tempDir.resolve("rules.yml"), "rules: []");
        Map<String, String> env = Map.of(
                ConfigurationLoader.ENV_RULES_FILE, rules.toString(),
                ConfigurationLoader.ENV_OUTPUT_FORMAT, "markdown");

        // When
        AdvisorConfig config = new ConfigurationLoader(env).loadConfiguration(new String[0]);

        // Then
        assertThat(config.getRulesFile()).isEqualTo(rules);
        assertThat(config.getOutputFormat()).isEqualTo(OutputFormat.MARKDOWN);
    }

    @Test
    void shouldPreferCliArgumentsOverEnvironment() throws IOException {
        // Given
        Path envMatrix = Files.writeString(tempDir.resolve("env.yml"), "capabilities: []");
        Path cliMatrix = Files.writeString(tempDir.resolve("cli.yml"), "capabilities: []");
        Map<String, String> env = Map.of(
                ConfigurationLoader.ENV_CAPABILITIES_FILE, envMatrix.toString(),
                ConfigurationLoader.ENV_OUTPUT_FORMAT, "markdown");
        String[] args = {"capability", "OS Access", "on-prem",
                "--capabilities", cliMatrix.toString(), "--format", "json", "-v"};

        // When
        AdvisorConfig config = new ConfigurationLoader(env).loadConfiguration(args);

        // Then - CLI > env vars > defaults
        assertThat(config.getCapabilitiesFile()).isEqualTo(cliMatrix);
        assertThat(config.getOutputFormat()).isEqualTo(OutputFormat.JSON);
        assertThat(config.isVerbose()).isTrue();
    }

    @Test
    void shouldIgnoreInvalidFormat() {
        // Given
        String[] args = {"--format", "yaml"};

        // When
        AdvisorConfig config = new ConfigurationLoader(Map.of(ConfigurationLoader.ENV_OUTPUT_FORMAT, "json"))
                .loadConfiguration(args);

        // Then - invalid CLI value ignored, environment value kept
        assertThat(config.getOutputFormat()).isEqualTo(OutputFormat.JSON);
    }

    @Test
    void shouldRejectMissingRulesFile() {
        String[] args = {"--rules", tempDir.resolve("missing.yml").toString()};

        assertThatThrownBy(() -> new ConfigurationLoader(Map.of()).loadConfiguration(args))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Rules file not found");
    }

    @Test
    void shouldProvideConfigurationHelp() {
        String help = ConfigurationLoader.getConfigurationHelp();

        assertThat(help).contains("Configuration Options:");
        assertThat(help).contains("--rules");
        assertThat(help).contains("SQL_ADVISOR_CAPABILITIES_FILE");
        assertThat(help).contains("Priority Order");
    }
}
