package com.leakguard;

import ch.qos.logback.classic.Level;
import com.leakguard.config.Config;
import com.leakguard.config.ConfigManager;
import com.leakguard.config.ConfigurationException;
import com.leakguard.logging.LogSetup;
import com.leakguard.report.ConsoleReporter;
import com.leakguard.report.SarifReporter;
import com.leakguard.rules.RuleDefinitionException;
import com.leakguard.rules.RuleRegistry;
import com.leakguard.scanner.Finding;
import com.leakguard.scanner.SecretScanner;
import com.leakguard.scanner.StagedFiles;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.File;
import java.io.IOException;
import java.io.PrintWriter;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

@Command(name = "leakguard", mixinStandardHelpOptions = true, version = "LeakGuard 1.0.0",
        description = "Scans files for potential secrets before they are committed.%n"
                + "Exits with 1 when something is found so a pre-commit hook can ask for confirmation.",
        exitCodeListHeading = "%nExit codes:%n",
        exitCodeList = {
                "0:No potential secrets found",
                "1:Potential secrets found, or no files given",
                "2:Invalid configuration or git failure"})
public class LeakGuard implements Callable<Integer> {
    private static final Logger logger = LoggerFactory.getLogger(LeakGuard.class);

    public static final int EXIT_CLEAN = 0;
    public static final int EXIT_FINDINGS = 1;
    public static final int EXIT_USAGE = 1;
    public static final int EXIT_ERROR = 2;

    @Spec
    private CommandSpec spec;

    @Parameters(arity = "0..*", paramLabel = "FILE", description = "Files to scan")
    private List<String> files = new ArrayList<>();

    @Option(names = {"-c", "--config"}, description = "YAML configuration file (optional)")
    private File configFile;

    @Option(names = {"--staged"}, description = "Also scan the files staged in the git index of the current directory")
    private boolean staged;

    @Option(names = {"--sarif"}, paramLabel = "FILE", description = "Also write the findings as a SARIF 2.1.0 file")
    private File sarifFile;

    @Option(names = {"-t", "--threads"}, description = "Worker threads (overrides the configuration)")
    private Integer threads;

    @Option(names = {"--list-rules"}, description = "Print the active rules in evaluation order and exit")
    private boolean listRules;

    @Option(names = {"-v", "--verbose"}, description = "Debug logging on stderr")
    private boolean verbose;

    public static void main(String[] args) {
        int exitCode = new CommandLine(new LeakGuard()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        if (verbose) {
            LogSetup.setRootLevel(Level.DEBUG);
        }
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        // 1. Configuration and rules; any defect here aborts before scanning
        Config config;
        RuleRegistry registry;
        try {
            ConfigManager configManager = new ConfigManager();
            configManager.init(configFile);
            config = configManager.getConfig();
            if (threads != null) {
                if (threads < 1) {
                    throw new ConfigurationException("--threads must be at least 1, got " + threads);
                }
                config.getScanConfig().setThreads(threads);
            }
            registry = RuleRegistry.fromConfig(config);
        } catch (ConfigurationException | RuleDefinitionException e) {
            logger.debug("Invalid configuration", e);
            err.println("Configuration error: " + e.getMessage());
            err.flush();
            return EXIT_ERROR;
        }

        if (listRules) {
            registry.ruleNames().forEach(out::println);
            out.flush();
            return EXIT_CLEAN;
        }

        // 2. Targets
        List<String> targets = new ArrayList<>(files);
        if (staged) {
            try {
                targets.addAll(new StagedFiles(null).list());
            } catch (IOException e) {
                logger.debug("Could not list staged files", e);
                err.println("Could not list staged files: " + e.getMessage());
                err.flush();
                return EXIT_ERROR;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                err.println("Interrupted while listing staged files");
                err.flush();
                return EXIT_ERROR;
            }
        } else if (targets.isEmpty()) {
            err.println("No files to scan.");
            spec.commandLine().usage(err);
            err.flush();
            return EXIT_USAGE;
        }

        // 3. Scan
        List<Finding> findings = new SecretScanner(registry, config.getScanConfig()).scan(targets);

        if (sarifFile != null) {
            try {
                new SarifReporter(sarifFile).generate(findings, registry.rules());
            } catch (IOException e) {
                // The console report below still carries the result
                logger.error("Failed to write SARIF report: {}", sarifFile, e);
            }
        }

        if (findings.isEmpty()) {
            return EXIT_CLEAN;
        }
        new ConsoleReporter(out).report(findings);
        return EXIT_FINDINGS;
    }
}
