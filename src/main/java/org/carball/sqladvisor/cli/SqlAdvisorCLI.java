package org.carball.sqladvisor.cli;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import lombok.extern.slf4j.Slf4j;
import org.carball.sqladvisor.advisor.SqlServerAdvisor;
import org.carball.sqladvisor.config.AdvisorConfig;
import org.carball.sqladvisor.config.ConfigurationLoader;
import org.carball.sqladvisor.error.AdvisorException;
import org.carball.sqladvisor.error.RuleDataException;
import org.carball.sqladvisor.model.capability.DeploymentEnvironment;
import org.carball.sqladvisor.model.fact.CardinalityHint;
import org.carball.sqladvisor.model.fact.MergeDecisionFact;
import org.carball.sqladvisor.model.fact.QueryShapeFact;
import org.carball.sqladvisor.model.fact.RowCountEstimate;
import org.carball.sqladvisor.output.AdvisoryReport;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Command-line front end: turns arguments into facts, asks the advisor and
 * prints the result.
 */
@Slf4j
public class SqlAdvisorCLI {

    static final int EXIT_OK = 0;
    static final int EXIT_USAGE = 1;
    static final int EXIT_ADVISORY_ERROR = 2;

    private static final String VERSION = "1.0.0";
    private static final Set<String> GLOBAL_VALUE_OPTIONS = Set.of("--rules", "--capabilities", "--format", "-f");
    private static final Set<String> GLOBAL_FLAGS = Set.of("--verbose", "-v");

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    static int run(String[] args, PrintStream out, PrintStream err) {
        if (args.length == 0 || isHelpRequested(args)) {
            printUsage(out);
            return args.length == 0 ? EXIT_USAGE : EXIT_OK;
        }

        try {
            AdvisorConfig config = new ConfigurationLoader().loadConfiguration(args);
            if (config.isVerbose()) {
                ((Logger) LoggerFactory.getLogger("org.carball.sqladvisor")).setLevel(Level.DEBUG);
            }

            List<String> command = stripGlobalOptions(args);
            if (command.isEmpty()) {
                throw new IllegalArgumentException("No command given");
            }

            SqlServerAdvisor advisor = SqlServerAdvisor.create(config);
            AdvisoryReport report = new AdvisoryReport(config.getOutputFormat());
            out.print(execute(advisor, report, command.get(0), command.subList(1, command.size())));
            return EXIT_OK;

        } catch (RuleDataException e) {
            err.println("Rule data error: " + e.getMessage());
            log.debug("Rule data error details", e);
            return EXIT_USAGE;
        } catch (AdvisorException e) {
            err.println("Advisor error: " + e.getMessage());
            log.debug("Advisor error details", e);
            return EXIT_ADVISORY_ERROR;
        } catch (IllegalArgumentException e) {
            err.println("Configuration error: " + e.getMessage());
            err.println("Run with --help for usage information.");
            log.debug("Configuration error details", e);
            return EXIT_USAGE;
        }
    }

    private static String execute(SqlServerAdvisor advisor, AdvisoryReport report, String command, List<String> args) {
        switch (command) {
            case "construct":
                return report.render(advisor.recommendConstruct(parseQueryShape(args)));
            case "fragmentation":
                requireArgs(args, 1, "fragmentation <percent>");
                return report.render(advisor.recommendFragmentationAction(parseDouble(args.get(0), "percent")));
            case "merge":
                return report.render(advisor.recommendMergeStrategy(parseMergeDecision(args)));
            case "capability":
                requireArgs(args, 2, "capability <name> <environment>");
                String name = String.join(" ", args.subList(0, args.size() - 1));
                return report.render(advisor.resolveCapability(name, args.get(args.size() - 1)));
            case "compare":
                requireArgs(args, 1, "compare <name>");
                String capability = String.join(" ", args);
                return report.renderComparison(capability, advisor.compareCapability(capability));
            case "capabilities":
                requireArgs(args, 1, "capabilities <environment>");
                DeploymentEnvironment environment = DeploymentEnvironment.fromName(args.get(0));
                return report.renderCapabilityList(environment, advisor.listCapabilities(environment));
            default:
                throw new IllegalArgumentException("Unknown command: " + command);
        }
    }

    static QueryShapeFact parseQueryShape(List<String> args) {
        QueryShapeFact.QueryShapeFactBuilder builder = QueryShapeFact.builder()
                .resultCardinalityHint(CardinalityHint.SCALAR);
        for (int i = 0; i < args.size(); i++) {
            switch (args.get(i)) {
                case "--recursive":
                    builder.needsRecursion(true);
                    break;
                case "--correlated":
                    builder.correlated(true);
                    break;
                case "--tvf":
                    builder.invokesTableValuedFunction(true);
                    break;
                case "--optional":
                    builder.relationOptional(true);
                    break;
                case "--reuse":
                    builder.reuseCount(parseInt(valueOf(args, ++i, "--reuse"), "--reuse"));
                    break;
                case "--cardinality":
                    builder.resultCardinalityHint(parseEnum(CardinalityHint.class, valueOf(args, ++i, "--cardinality")));
                    break;
                default:
                    throw new IllegalArgumentException("Unknown construct option: " + args.get(i));
            }
        }
        return builder.build();
    }

    static MergeDecisionFact parseMergeDecision(List<String> args) {
        MergeDecisionFact.MergeDecisionFactBuilder builder = MergeDecisionFact.builder();
        for (int i = 0; i < args.size(); i++) {
            switch (args.get(i)) {
                case "--branches":
                    builder.conditionalBranchCount(parseInt(valueOf(args, ++i, "--branches"), "--branches"));
                    break;
                case "--audit":
                    builder.needsRowLevelAudit(true);
                    break;
                case "--rows":
                    builder.estimatedRowCount(parseEnum(RowCountEstimate.class, valueOf(args, ++i, "--rows")));
                    break;
                default:
                    throw new IllegalArgumentException("Unknown merge option: " + args.get(i));
            }
        }
        return builder.build();
    }

    static List<String> stripGlobalOptions(String[] args) {
        List<String> remaining = new ArrayList<>();
        for (int i = 0; i < args.length; i++) {
            if (GLOBAL_VALUE_OPTIONS.contains(args[i])) {
                i++;
            } else if (!GLOBAL_FLAGS.contains(args[i])) {
                remaining.add(args[i]);
            }
        }
        return remaining;
    }

    private static String valueOf(List<String> args, int index, String option) {
        if (index >= args.size()) {
            throw new IllegalArgumentException("Value for " + option + " not specified");
        }
        return args.get(index);
    }

    private static void requireArgs(List<String> args, int count, String usage) {
        if (args.size() < count) {
            throw new IllegalArgumentException("Usage: " + usage);
        }
    }

    private static int parseInt(String value, String option) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid number for " + option + ": " + value);
        }
    }

    private static double parseDouble(String value, String option) {
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid number for " + option + ": " + value);
        }
    }

    private static <E extends Enum<E>> E parseEnum(Class<E> type, String value) {
        try {
            return Enum.valueOf(type, value.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(String.format("Invalid value '%s'. Use one of: %s",
                    value, Arrays.toString(type.getEnumConstants()).toLowerCase(Locale.ROOT)));
        }
    }

    private static boolean isHelpRequested(String[] args) {
        return "help".equals(args[0]) ||
                Arrays.asList(args).contains("--help") ||
                Arrays.asList(args).contains("-h");
    }

    private static void printUsage(PrintStream out) {
        out.println("SQL Server Engineering Advisor v" + VERSION);
        out.println();
        out.println("Usage: java -jar sql-server-advisor.jar <command> [arguments] [options]");
        out.println();
        out.println("Commands:");
        out.println("  construct [--recursive] [--correlated] [--tvf] [--optional] [--reuse <n>]");
        out.println("            [--cardinality scalar|set]     Pick CTE, subquery or APPLY for a query shape");
        out.println("  fragmentation <percent>                  Index maintenance action for a fragmentation level");
        out.println("  merge [--branches <n>] [--audit] [--rows small|large]");
        out.println("                                           MERGE or UPDATE + INSERT for an upsert");
        out.println("  capability <name> <environment>          Availability of a feature in one environment");
        out.println("  compare <name>                           Availability of a feature in every environment");
        out.println("  capabilities <environment>               All features listed for an environment");
        out.println();
        out.println("Environments: on-prem, azure-iaas, managed-instance");
        out.println();
        out.print(ConfigurationLoader.getConfigurationHelp());
        out.println();
        out.println("Examples:");
        out.println("  java -jar sql-server-advisor.jar construct --correlated --cardinality scalar");
        out.println("  java -jar sql-server-advisor.jar fragmentation 35");
        out.println("  java -jar sql-server-advisor.jar capability \"Query Store\" managed-instance --format json");
    }
}
