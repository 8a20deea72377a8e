package org.flagcleaner.cli.commands;

import com.typesafe.config.Config;
import org.flagcleaner.cleaner.CleanerSettings;
import org.flagcleaner.cleaner.CleanupReport;
import org.flagcleaner.cleaner.CleanupService;
import org.flagcleaner.cleaner.Discovery;
import org.flagcleaner.cleaner.io.LocalSourceFileSystem;
import org.flagcleaner.cleaner.rewrite.EvaluationMode;
import org.flagcleaner.cli.CommandLineInterface;
import org.flagcleaner.cli.config.LoggingConfigurator;
import org.flagcleaner.cli.rendering.CleanupSummaryRenderer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import java.util.regex.Pattern;

@Command(
    name = "clean",
    description = "Removes a feature flag from every Swift and Objective-C file under a directory",
    mixinStandardHelpOptions = true
)
public class CleanCommand implements Callable<Integer> {

    private static final Logger LOG = LoggerFactory.getLogger(CleanCommand.class);
    private static final Pattern FLAG_NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURES = 1;
    static final int EXIT_USAGE = 2;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Option(names = {"-f", "--flag"}, required = true,
        description = "Name of the feature flag to remove, treated as enabled")
    private String flag;

    @Option(names = {"-p", "--path"}, defaultValue = ".",
        description = "Root directory to scan (default: ${DEFAULT-VALUE})")
    private Path path;

    @Option(names = {"-v", "--verbose"},
        description = "Log every resolved block")
    private boolean verbose;

    @Option(names = {"-t", "--threads"},
        description = "Worker threads (default: flagcleaner.threads, 0 means one per processor)")
    private Integer threads;

    @Option(names = "--evaluator",
        description = "Condition evaluator: ${COMPLETION-CANDIDATES} (default: flagcleaner.evaluator)")
    private EvaluationMode evaluator;

    @Override
    public Integer call() {
        final PrintWriter out = spec.commandLine().getOut();
        final PrintWriter err = spec.commandLine().getErr();

        if (!FLAG_NAME.matcher(flag).matches()) {
            err.println("Invalid flag name '" + flag + "': expected an identifier such as FEATURE_X");
            return EXIT_USAGE;
        }
        if (!Files.isDirectory(path)) {
            err.println("Not a directory: " + path.toAbsolutePath());
            return EXIT_USAGE;
        }

        final Config config;
        final CleanerSettings settings;
        try {
            config = parent.getConfig();
            settings = applyOverrides(CleanerSettings.fromConfig(config));
        } catch (final RuntimeException e) {
            err.println("Invalid configuration: " + e.getMessage());
            return EXIT_USAGE;
        }
        if (verbose) {
            LoggingConfigurator.setLevel("org.flagcleaner", "DEBUG");
        }

        final CleanupSummaryRenderer renderer = new CleanupSummaryRenderer(
            out, spec.commandLine().getColorScheme().ansi(), config);
        final CleanupService service = new CleanupService(settings, new LocalSourceFileSystem());
        final Path root = path.toAbsolutePath().normalize();

        try {
            renderer.renderHeader(root, flag);
            final Discovery discovery = service.discover(root, flag);
            renderer.renderDiscovery(discovery);
            final CleanupReport report = service.process(discovery, flag);
            renderer.renderReport(report);
            out.flush();
            return report.hasFailures() ? EXIT_FAILURES : EXIT_OK;
        } catch (final IOException e) {
            LOG.error("Failed to scan {}", root, e);
            err.println("Failed to scan " + root + ": " + e.getMessage());
            return EXIT_FAILURES;
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            err.println("Interrupted while cleaning " + root);
            return EXIT_FAILURES;
        }
    }

    private CleanerSettings applyOverrides(final CleanerSettings settings) {
        CleanerSettings result = settings;
        if (threads != null) {
            if (threads < 0) {
                throw new IllegalArgumentException("--threads must not be negative: " + threads);
            }
            result = result.withThreads(threads);
        }
        if (evaluator != null) {
            result = result.withEvaluationMode(evaluator);
        }
        return result;
    }
}
