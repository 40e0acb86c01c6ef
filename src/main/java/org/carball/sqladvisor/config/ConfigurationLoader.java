package org.carball.sqladvisor.config;

import lombok.extern.slf4j.Slf4j;

import java.nio.file.Paths;
import java.util.Locale;
import java.util.Map;

@Slf4j
public class ConfigurationLoader {

    public static final String ENV_RULES_FILE = "SQL_ADVISOR_RULES_FILE";
    public static final String ENV_CAPABILITIES_FILE = "SQL_ADVISOR_CAPABILITIES_FILE";
    public static final String ENV_OUTPUT_FORMAT = "SQL_ADVISOR_OUTPUT_FORMAT";

    private final Map<String, String> environment;

    public ConfigurationLoader() {
        this(System.getenv());
    }

    public ConfigurationLoader(Map<String, String> environment) {
        this.environment = environment;
    }

    /**
     * Loads configuration using the hierarchy: CLI args > env vars > defaults
     */
    public AdvisorConfig loadConfiguration(String[] args) {
        log.debug("Loading configuration");

        AdvisorConfig.AdvisorConfigBuilder builder = AdvisorConfig.defaults().toBuilder();

        applyEnvironmentVariables(builder);
        applyCLIArguments(builder, args);

        AdvisorConfig config = builder.build();
        config.validate();

        log.debug("Configuration loaded: {}", config.getConfigurationSummary());
        return config;
    }

    private void applyEnvironmentVariables(AdvisorConfig.AdvisorConfigBuilder builder) {
        if (hasValue(ENV_RULES_FILE)) {
            builder.rulesFile(Paths.get(environment.get(ENV_RULES_FILE)));
        }
        if (hasValue(ENV_CAPABILITIES_FILE)) {
            builder.capabilitiesFile(Paths.get(environment.get(ENV_CAPABILITIES_FILE)));
        }
        if (hasValue(ENV_OUTPUT_FORMAT)) {
            applyFormat(builder, ENV_OUTPUT_FORMAT, environment.get(ENV_OUTPUT_FORMAT));
        }
    }

    private void applyCLIArguments(AdvisorConfig.AdvisorConfigBuilder builder, String[] args) {
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            boolean hasValue = i + 1 < args.length;

            switch (arg) {
                case "--verbose":
                case "-v":
                    builder.verbose(true);
                    break;
                case "--rules":
                    if (hasValue) {
                        builder.rulesFile(Paths.get(args[++i]));
                    }
                    break;
                case "--capabilities":
                    if (hasValue) {
                        builder.capabilitiesFile(Paths.get(args[++i]));
                    }
                    break;
                case "--format":
                case "-f":
                    if (hasValue) {
                        applyFormat(builder, arg, args[++i]);
                    }
                    break;
                default:
                    break;
            }
        }
    }

    private void applyFormat(AdvisorConfig.AdvisorConfigBuilder builder, String source, String value) {
        try {
            builder.outputFormat(OutputFormat.valueOf(value.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            log.warn("Invalid output format for {}: {}", source, value);
        }
    }

    private boolean hasValue(String key) {
        String value = environment.get(key);
        return value != null && !value.isBlank();
    }

    /**
     * Returns help text for configuration options.
     */
    public static String getConfigurationHelp() {
        return """
            Configuration Options:

            CLI Arguments:
              --rules <file>          YAML rule file (default: bundled rules)
              --capabilities <file>   YAML capability matrix (default: bundled matrix)
              --format, -f <fmt>      Output format: text|markdown|json (default: text)
              --verbose, -v           Enable debug logging

            Environment Variables:
              SQL_ADVISOR_RULES_FILE          Same as --rules
              SQL_ADVISOR_CAPABILITIES_FILE   Same as --capabilities
              SQL_ADVISOR_OUTPUT_FORMAT       Same as --format

            Priority Order (highest to lowest):
              1. CLI arguments
              2. Environment variables
              3. Built-in defaults
            """;
    }
}
