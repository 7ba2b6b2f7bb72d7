package org.carball.tuner.cli;

import ch.qos.logback.classic.Level;
import lombok.extern.slf4j.Slf4j;
import org.carball.tuner.advisor.ExtendIndexAdvisor;
import org.carball.tuner.config.ConfigurationLoader;
import org.carball.tuner.config.OutputFormat;
import org.carball.tuner.config.TuningParameters;
import org.carball.tuner.model.schema.DatabaseSchema;
import org.carball.tuner.model.tuning.Route;
import org.carball.tuner.model.tuning.TuningResult;
import org.carball.tuner.model.workload.Workload;
import org.carball.tuner.output.TuningReport;
import org.carball.tuner.parser.ColumnExtractor;
import org.carball.tuner.parser.ReplicaRosterReader;
import org.carball.tuner.parser.SchemaParser;
import org.carball.tuner.parser.TraceWorkloadReader;
import org.carball.tuner.parser.WorkloadFileReader;
import org.carball.tuner.replica.CostOracleException;
import org.carball.tuner.replica.PostgresCostOracle;
import org.carball.tuner.replica.Replica;
import org.carball.tuner.replica.ReplicaEndpoint;
import org.carball.tuner.replica.RetryPolicy;
import org.carball.tuner.replica.RetryingCostOracle;
import org.carball.tuner.tuning.ReplicaTuner;
import org.carball.tuner.tuning.TuningException;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

@Slf4j
public class ReplicaTunerCLI {

    private static final String VERSION = "1.0.0";
    private static final String BANNER = """
        ╔═══════════════════════════════════════════════════════════════╗
        ║          Read Replica Workload Tuner v%s                   ║
        ╚═══════════════════════════════════════════════════════════════╝
        """;

    private static final Set<String> TUNING_OPTIONS = Set.of(
            "--threshold", "-t", "--space-budget", "-b", "--max-index-width", "-w", "--parallelism",
            "--max-tune-iterations", "--max-refine-iterations", "--retry-attempts", "--query-timeout");

    public static void main(String[] args) {
        System.exit(run(args));
    }

    static int run(String[] args) {
        System.out.printf((BANNER) + "%n", VERSION);

        if (isHelpRequested(args)) {
            printUsage();
            return 0;
        }
        if (args.length < 2) {
            printUsage();
            return 1;
        }

        try {
            CliOptions options = parseArgs(args);
            if (options.verbose()) {
                enableVerboseLogging();
            }
            TuningParameters parameters = new ConfigurationLoader().loadConfiguration(options.configFile(), args);

            System.out.println("\n🔍 Starting tuning run...");
            System.out.println("   Replica roster: " + options.rosterFile());
            System.out.println("   Workload: " + options.workloadFile() + (options.trace() ? " (trace)" : ""));
            System.out.println("   Output: " + String.join(", ", outputFiles(options).keySet()));
            System.out.println();

            List<ReplicaEndpoint> endpoints = ReplicaRosterReader.read(options.rosterFile());
            List<Replica> replicas = connect(endpoints, parameters);
            try {
                System.out.print("📚 Reading schema and workload... ");
                DatabaseSchema schema = options.schemaFile() != null
                        ? SchemaParser.parseDDL(options.schemaFile())
                        : replicas.get(0).listColumns();
                Workload workload = readWorkload(options, new ColumnExtractor(schema));
                System.out.println("✓");

                System.out.print("⚙️  Tuning " + replicas.size() + " replicas for " + workload.size() + " queries... ");
                TuningResult result;
                try (ReplicaTuner tuner = new ReplicaTuner(replicas, new ExtendIndexAdvisor(), parameters)) {
                    result = tuner.run(workload);
                }
                System.out.println("✓");

                System.out.print("📝 Writing results... ");
                writeResults(new TuningReport(result, parameters, workload.size()), options);
                System.out.println("✓");

                printSummary(result);
                System.out.println("\n✅ Tuning complete!");
                return 0;
            } finally {
                replicas.forEach(Replica::close);
            }

        } catch (IllegalArgumentException e) {
            System.err.println("\n❌ Configuration error: " + e.getMessage());
            System.err.println("\nRun with --help for usage information.");
            log.debug("Configuration error details", e);
            return 1;
        } catch (TuningException e) {
            System.err.println("\n❌ Tuning failed: " + e.getMessage());
            log.debug("Tuning failure details", e);
            return 1;
        } catch (CostOracleException e) {
            System.err.println("\n❌ Replica error: " + e.getMessage());
            log.debug("Replica error details", e);
            return 1;
        } catch (IOException e) {
            System.err.println("\n❌ IO error: " + e.getMessage());
            log.debug("IO error details", e);
            return 1;
        } catch (Exception e) {
            System.err.println("\n❌ Unexpected error: " + e.getMessage());
            log.debug("Unexpected error details", e);
            return 1;
        }
    }

    private static boolean isHelpRequested(String[] args) {
        return Arrays.asList(args).contains("--help") ||
                Arrays.asList(args).contains("-h") ||
                Arrays.asList(args).contains("help");
    }

    private static void printUsage() {
        System.out.println("\nUsage: java -jar replica-tuner.jar <replicas.csv> <workload> [options]");
        System.out.println();
        System.out.println("Arguments:");
        System.out.println("  replicas.csv        Replica roster: id,host,port,dbname,user[,password] per line");
        System.out.println("  workload            SQL file (statements separated by ';' or one per line)");
        System.out.println();
        System.out.println("Options:");
        System.out.println("  --trace             Read the workload as a JSON query trace export");
        System.out.println("  --schema            DDL file listing the tables (default: read from the first replica)");
        System.out.println("  --config            YAML file with tuning parameters");
        System.out.println("  --output, -o        Output file for the report (default: tuning-report.json)");
        System.out.println("  --format, -f        Output format: json|markdown|both (default: json)");
        System.out.println("  --verbose, -v       Enable debug logging");
        System.out.println("  --help, -h          Show this help message");
        System.out.println();
        System.out.println(ConfigurationLoader.getConfigurationHelp());
        System.out.println("Examples:");
        System.out.println("  # Tune three replicas for a TPC-H workload");
        System.out.println("  java -jar replica-tuner.jar replicas.csv queries.sql");
        System.out.println();
        System.out.println("  # Favour balance over per-query cost, offline schema, markdown report");
        System.out.println("  java -jar replica-tuner.jar replicas.csv queries.sql -t 0.8 --schema schema.sql -f markdown");
    }

    static CliOptions parseArgs(String[] args) {
        Path rosterFile = Paths.get(args[0]);
        Path workloadFile = Paths.get(args[1]);
        Path schemaFile = null;
        Path configFile = null;
        boolean trace = false;
        boolean verbose = false;
        String outputFile = "tuning-report.json";
        OutputFormat format = OutputFormat.JSON;

        for (int i = 2; i < args.length; i++) {
            String arg = args[i];
            if (TUNING_OPTIONS.contains(arg)) {
                // Values are read by ConfigurationLoader
                requireValue(args, i, arg);
                i++;
                continue;
            }
            switch (arg) {
                case "--output":
                case "-o":
                    outputFile = requireValue(args, i++, "Output file");
                    break;

                case "--format":
                case "-f":
                    String value = requireValue(args, i++, "Output format");
                    try {
                        format = OutputFormat.valueOf(value.toUpperCase());
                    } catch (IllegalArgumentException e) {
                        throw new IllegalArgumentException("Invalid output format. Use: json, markdown, or both");
                    }
                    break;

                case "--schema":
                    schemaFile = Paths.get(requireValue(args, i++, "Schema file"));
                    break;

                case "--config":
                    configFile = Paths.get(requireValue(args, i++, "Config file"));
                    break;

                case "--trace":
                    trace = true;
                    break;

                case "--verbose":
                case "-v":
                    verbose = true;
                    break;

                default:
                    throw new IllegalArgumentException("Unknown option: " + arg);
            }
        }

        CliOptions options = new CliOptions(rosterFile, workloadFile, schemaFile, configFile, trace, verbose,
                removeFileExtension(outputFile), format);
        validate(options);
        return options;
    }

    private static String requireValue(String[] args, int position, String what) {
        if (position + 1 >= args.length) {
            throw new IllegalArgumentException(what + " not specified");
        }
        return args[position + 1];
    }

    private static void validate(CliOptions options) {
        if (!Files.exists(options.rosterFile())) {
            throw new IllegalArgumentException("Replica roster not found: " + options.rosterFile());
        }
        if (!Files.exists(options.workloadFile())) {
            throw new IllegalArgumentException("Workload file not found: " + options.workloadFile());
        }
        if (options.schemaFile() != null && !Files.exists(options.schemaFile())) {
            throw new IllegalArgumentException("Schema file not found: " + options.schemaFile());
        }

        Path outputDir = Paths.get(options.outputBase()).toAbsolutePath().getParent();
        if (outputDir != null && !Files.exists(outputDir)) {
            throw new IllegalArgumentException("Output directory does not exist: " + outputDir);
        }
    }

    private static String removeFileExtension(String filename) {
        int lastDotIndex = filename.lastIndexOf('.');
        if (lastDotIndex > 0 && lastDotIndex < filename.length() - 1) {
            int lastSeparatorIndex = Math.max(filename.lastIndexOf('/'), filename.lastIndexOf('\\'));
            if (lastDotIndex > lastSeparatorIndex) {
                return filename.substring(0, lastDotIndex);
            }
        }
        return filename;
    }

    private static void enableVerboseLogging() {
        ch.qos.logback.classic.Logger tunerLogger =
                (ch.qos.logback.classic.Logger) LoggerFactory.getLogger("org.carball.tuner");
        tunerLogger.setLevel(Level.DEBUG);
    }

    private static List<Replica> connect(List<ReplicaEndpoint> endpoints, TuningParameters parameters) {
        RetryPolicy retryPolicy = RetryPolicy.builder()
                .maxAttempts(parameters.getRetryAttempts())
                .initialBackoff(Duration.ofMillis(parameters.getRetryBackoffMillis()))
                .build();

        List<Replica> replicas = new ArrayList<>();
        for (ReplicaEndpoint endpoint : endpoints) {
            PostgresCostOracle oracle = new PostgresCostOracle(endpoint, parameters.getQueryTimeoutSeconds());
            replicas.add(new Replica(endpoint, new RetryingCostOracle(oracle, retryPolicy)));
        }
        return replicas;
    }

    private static Workload readWorkload(CliOptions options, ColumnExtractor extractor) throws IOException {
        Workload workload = options.trace()
                ? new TraceWorkloadReader(extractor).read(options.workloadFile())
                : new WorkloadFileReader(extractor).read(options.workloadFile());
        if (workload.isEmpty()) {
            throw new IllegalArgumentException("Workload contains no queries: " + options.workloadFile());
        }
        return workload;
    }

    /**
     * Report file names keyed to the content they receive, in writing order.
     */
    private static Map<String, OutputFormat> outputFiles(CliOptions options) {
        Map<String, OutputFormat> files = new LinkedHashMap<>();
        if (options.format() == OutputFormat.JSON || options.format() == OutputFormat.BOTH) {
            files.put(options.outputBase() + ".json", OutputFormat.JSON);
        }
        if (options.format() == OutputFormat.MARKDOWN || options.format() == OutputFormat.BOTH) {
            files.put(options.outputBase() + ".md", OutputFormat.MARKDOWN);
        }
        return files;
    }

    private static void writeResults(TuningReport report, CliOptions options) throws IOException {
        // Render everything before touching the file system
        Map<Path, String> contents = new LinkedHashMap<>();
        for (Map.Entry<String, OutputFormat> file : outputFiles(options).entrySet()) {
            String content = file.getValue() == OutputFormat.JSON ? report.toJson() : report.toMarkdown();
            contents.put(Paths.get(file.getKey()), content);
        }
        for (Map.Entry<Path, String> file : contents.entrySet()) {
            Files.writeString(file.getKey(), file.getValue());
        }
    }

    private static void printSummary(TuningResult result) {
        System.out.println("\n" + "=".repeat(60));
        System.out.println("📊 TUNING SUMMARY");
        System.out.println("=".repeat(60));

        System.out.printf("%nCluster-and-tune cost:   %,.2f%n", result.clusteredState().totalCost());
        System.out.printf("Refined cost:            %,.2f%n", result.refinedState().totalCost());
        System.out.printf("Routed cost:             %,.2f%n", result.routingTable().totalCost());

        System.out.println("\n🎯 Replicas:");
        System.out.println("-".repeat(60));
        Map<String, Double> loads = result.routingTable().loadByReplica();
        for (String replicaId : result.routingTable().replicaIds()) {
            long routed = result.routingTable().routes().stream()
                    .map(Route::replicaId)
                    .filter(replicaId::equals)
                    .count();
            System.out.printf("%-20s %3d queries  load %,.2f%n", replicaId, routed, loads.get(replicaId));
            result.configurations().forReplica(replicaId)
                    .forEach(index -> System.out.printf("  └─ %s%n", index));
        }
    }

    record CliOptions(Path rosterFile, Path workloadFile, Path schemaFile, Path configFile,
                      boolean trace, boolean verbose, String outputBase, OutputFormat format) {}
}
