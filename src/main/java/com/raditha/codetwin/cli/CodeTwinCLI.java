package com.raditha.codetwin.cli;

import com.raditha.codetwin.analyzer.ComparisonAnalyzer;
import com.raditha.codetwin.analyzer.ComparisonReport;
import com.raditha.codetwin.collector.RepositoryTree;
import com.raditha.codetwin.config.ComparisonConfig;
import com.raditha.codetwin.config.ComparisonSettings;
import com.raditha.codetwin.config.Settings;
import com.raditha.codetwin.metrics.ReportExporter;
import com.raditha.codetwin.model.FileFingerprint;
import com.raditha.codetwin.model.PairwiseResult;
import com.raditha.codetwin.model.ProcessingWarning;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.ITypeConverter;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Command-line interface for the similarity detector.
 * <p>
 * Usage:
 * java -jar codetwin.jar [options] &lt;repoA&gt; &lt;repoB&gt;
 * <p>
 * Configuration priority: CLI arguments > codetwin.yml > defaults
 */
@Command(name = "codetwin", mixinStandardHelpOptions = true, version = "codetwin v1.0.0",
        description = "Structural similarity detector for two source-code collections")
@SuppressWarnings("java:S106")
public class CodeTwinCLI implements Callable<Integer> {

    static final String REPORT_BASE_NAME = "similarity-report";

    @Parameters(index = "0", description = "Root directory of collection A", paramLabel = "<repoA>")
    private String repoA;

    @Parameters(index = "1", description = "Root directory of collection B", paramLabel = "<repoB>")
    private String repoB;

    @Option(names = { "-k", "--shingle-size" }, description = "Tokens per shingle (default: 5)", paramLabel = "<n>")
    private Integer shingleSize; // null = use YAML/default

    @Option(names = "--preset", description = "Preset: standard (k=5), fine (k=3) or coarse (k=8)", paramLabel = "<name>")
    private String preset;

    @Option(names = "--threads", description = "Worker threads (default: available processors)", paramLabel = "<n>")
    private Integer threads; // null = use YAML/default

    @Option(names = "--config-file", description = "Use custom configuration file", paramLabel = "<path>")
    private String configFile;

    @Option(names = "--output", description = "Directory for report files", paramLabel = "<path>")
    private String outputPath;

    @Option(names = "--export", description = "Report files to write: ${COMPLETION-CANDIDATES}", paramLabel = "<format>",
            converter = ExportFormatConverter.class)
    private ExportFormat exportFormat = ExportFormat.JSON;

    @Option(names = "--json", description = "Print the full report as JSON instead of the text summary")
    private boolean jsonOutput = false;

    @Option(names = "--top", description = "Most similar pairs listed in the text summary (default: 10)", paramLabel = "<n>")
    private int top = 10;

    @Option(names = { "-v", "--verbose" }, description = "Print repository trees and per-file statistics")
    private boolean verbose = false;

    /**
     * Picocli call method - executes the main logic.
     *
     * @return exit code (0 for success, non-zero for errors)
     */
    @Override
    public Integer call() throws Exception {
        validateConfiguration();

        if (configFile != null) {
            Settings.loadConfigMap(new File(configFile));
        } else {
            Settings.loadConfigMap();
        }
        if (outputPath != null) {
            Settings.setProperty(Settings.OUTPUT_PATH, outputPath);
        }

        ComparisonConfig config = ComparisonSettings.loadConfig(shingleSize, threads, preset);
        Path rootA = Paths.get(repoA);
        Path rootB = Paths.get(repoB);

        if (verbose) {
            printTree(rootA, config);
            printTree(rootB, config);
        }

        ComparisonReport report = new ComparisonAnalyzer(config).compare(rootA, rootB);
        ReportExporter exporter = new ReportExporter();

        if (jsonOutput) {
            System.out.println(exporter.toJson(report));
        } else {
            printTextReport(report, top, verbose);
        }

        exportReport(exporter, report);
        return 0;
    }

    public static void main(String[] args) {
        int exitCode = createCommandLine().execute(args);
        System.exit(exitCode);
    }

    /**
     * Command line with the exit-code policy applied: configuration errors 2,
     * I/O errors 3, interruption 4, anything else 1.
     */
    static CommandLine createCommandLine() {
        CommandLine cmd = new CommandLine(new CodeTwinCLI());

        cmd.setExecutionExceptionHandler((ex, commandLine, parseResult) -> {
            if (ex instanceof IllegalArgumentException) {
                commandLine.getErr().println("Configuration error: " + ex.getMessage());
                return 2;
            } else if (ex instanceof IOException) {
                commandLine.getErr().println("I/O error: " + ex.getMessage());
                return 3;
            } else if (ex instanceof InterruptedException) {
                Thread.currentThread().interrupt();
                commandLine.getErr().println("Process interrupted: " + ex.getMessage());
                return 4;
            } else {
                commandLine.getErr().println("Error: " + ex.getMessage());
                ex.printStackTrace(commandLine.getErr());
                return 1;
            }
        });

        cmd.setParameterExceptionHandler((ex, args1) -> {
            CommandLine.Help.ColorScheme colorScheme = CommandLine.Help.defaultColorScheme(CommandLine.Help.Ansi.AUTO);
            cmd.getErr().println(colorScheme.errorText(ex.getMessage()));
            CommandLine.UnmatchedArgumentException.printSuggestions(ex, cmd.getErr());
            cmd.getErr().print(cmd.getUsageMessage(colorScheme));
            return 2; // Invalid command line arguments
        });

        return cmd;
    }

    /**
     * Validate CLI configuration before execution.
     *
     * @throws IllegalArgumentException if configuration is invalid
     */
    private void validateConfiguration() {
        if (shingleSize != null && shingleSize < 1) {
            throw new IllegalArgumentException("Shingle size must be at least 1, got: " + shingleSize);
        }
        if (threads != null && threads < 1) {
            throw new IllegalArgumentException("Threads must be positive, got: " + threads);
        }
        if (top < 0) {
            throw new IllegalArgumentException("Top must not be negative, got: " + top);
        }
        if (!Files.isDirectory(Paths.get(repoA))) {
            throw new IllegalArgumentException("Repository A not found: " + repoA);
        }
        if (!Files.isDirectory(Paths.get(repoB))) {
            throw new IllegalArgumentException("Repository B not found: " + repoB);
        }
        if (configFile != null && !new File(configFile).exists()) {
            throw new IllegalArgumentException("Config file not found: " + configFile);
        }
        if (outputPath != null) {
            File outputDir = new File(outputPath);
            if (outputDir.exists() && !outputDir.isDirectory()) {
                throw new IllegalArgumentException("Output path exists but is not a directory: " + outputPath);
            }
        }
    }

    private static void printTree(Path root, ComparisonConfig config) throws IOException {
        RepositoryTree tree = RepositoryTree.scan(root, config.excludedDirectories());
        System.out.println(tree.render(root.toAbsolutePath().normalize().toString()));
    }

    static void printTextReport(ComparisonReport report, int top, boolean verbose) {
        System.out.println("=".repeat(80));
        System.out.println("SIMILARITY REPORT");
        System.out.println("=".repeat(80));
        System.out.println();
        System.out.printf("Repository A: %s (%d files)%n", report.repoA(), report.filesA().size());
        System.out.printf("Repository B: %s (%d files)%n", report.repoB(), report.filesB().size());
        System.out.printf("Configuration: k=%d, comparisons=%d%n", report.shingleSize(), report.totalComparisons());
        System.out.println();

        if (verbose) {
            System.out.println("-".repeat(80));
            System.out.println("Per-file statistics");
            System.out.println("-".repeat(80));
            for (FileFingerprint file : report.allFiles()) {
                System.out.printf("  %s: raw=%d, normalized=%d, identifiers=%d, fingerprints=%d%n",
                        file.key(),
                        file.rawTokenCount(),
                        file.normalizedTokenCount(),
                        file.uniqueIdentifiers(),
                        file.fingerprints().size());
            }
            System.out.println();
        }

        if (report.hasWarnings()) {
            System.out.printf("Skipped files: %d%n", report.warnings().size());
            for (ProcessingWarning warning : report.warnings()) {
                System.out.println("  " + warning);
            }
            System.out.println();
        }

        if (!report.aggregate().defined()) {
            System.out.println("Similarity is undefined: at least one repository has no comparable files.");
            System.out.println();
            return;
        }

        List<PairwiseResult> best = report.getTopPairs(top);
        if (!best.isEmpty()) {
            System.out.println("Most similar file pairs:");
            for (int i = 0; i < best.size(); i++) {
                PairwiseResult pair = best.get(i);
                System.out.printf("  #%d %6.2f%%  %s  <->  %s%n",
                        i + 1, pair.similarityPercent(), pair.fileA(), pair.fileB());
            }
            System.out.println();
        }

        System.out.printf("A -> B similarity: %.2f%%%n", report.aggregate().aToB() * 100);
        System.out.printf("B -> A similarity: %.2f%%%n", report.aggregate().bToA() * 100);
        System.out.printf("Overall similarity: %.2f%%%n", report.aggregate().percent());
        System.out.println();
    }

    private void exportReport(ReportExporter exporter, ComparisonReport report) throws IOException {
        Object configured = Settings.getProperty(Settings.OUTPUT_PATH);
        Path outputDir = configured != null ? Paths.get(configured.toString()) : Paths.get(".");

        if (exportFormat.includesJson()) {
            Path jsonPath = outputDir.resolve(REPORT_BASE_NAME + ".json");
            exporter.exportToJson(report, jsonPath);
            announceExport(jsonPath);
        }

        if (exportFormat.includesCsv()) {
            Path csvPath = outputDir.resolve(REPORT_BASE_NAME + ".csv");
            exporter.exportToCsv(report, csvPath);
            announceExport(csvPath);
        }
    }

    /**
     * Keeps stdout pure JSON when --json is given.
     */
    private void announceExport(Path path) {
        String message = "✓ Report exported to: " + path.toAbsolutePath();
        if (jsonOutput) {
            System.err.println(message);
        } else {
            System.out.println(message);
        }
    }

    /**
     * Custom converter for ExportFormat enum to handle CLI string values.
     */
    public static class ExportFormatConverter implements ITypeConverter<ExportFormat> {
        @Override
        public ExportFormat convert(String value) throws Exception {
            return ExportFormat.fromString(value);
        }
    }
}
