package org.flagcleaner.cli.rendering;

import com.typesafe.config.Config;
import org.flagcleaner.cleaner.CleanupReport;
import org.flagcleaner.cleaner.Discovery;
import org.flagcleaner.cleaner.api.FileOutcome;
import picocli.CommandLine.Help.Ansi;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Writes the console summary of a cleanup run.
 * <p>
 * Matched files that needed no change are listed for manual review, grouped by extension. A group larger
 * than {@code flagcleaner.report.collapse-threshold} is cut after {@code flagcleaner.report.list-limit} entries.
 */
public class CleanupSummaryRenderer {

    private final PrintWriter out;
    private final Ansi ansi;
    private final int listLimit;
    private final int collapseThreshold;

    /**
     * Creates a renderer.
     * @param out Where to print.
     * @param ansi Whether to emit colors.
     * @param config The configuration containing {@code flagcleaner.report}.
     */
    public CleanupSummaryRenderer(PrintWriter out, Ansi ansi, Config config) {
        this(out, ansi,
            config.getInt("flagcleaner.report.list-limit"),
            config.getInt("flagcleaner.report.collapse-threshold"));
    }

    CleanupSummaryRenderer(PrintWriter out, Ansi ansi, int listLimit, int collapseThreshold) {
        this.out = out;
        this.ansi = ansi;
        this.listLimit = listLimit;
        this.collapseThreshold = collapseThreshold;
    }

    /**
     * Prints the banner, the scanned directory and the flag.
     * @param root The directory being scanned.
     * @param flag The flag being removed.
     */
    public void renderHeader(Path root, String flag) {
        out.println(ansi.string("@|bold Welcome to FlagCleaner!|@"));
        out.println("Scanning directory: " + root);
        out.println("Searching for files containing: \"" + flag + "\"");
    }

    /**
     * Prints how many source files mention the flag.
     * @param discovery The discovered files.
     */
    public void renderDiscovery(Discovery discovery) {
        out.println(String.format("Found %d matching source files out of %d total.",
            discovery.matchingFiles().size(), discovery.totalFiles()));
        if (!discovery.matchingFiles().isEmpty()) {
            out.println("Processing matching files...");
        }
        out.flush();
    }

    /**
     * Prints failures, the success count, the elapsed time and the unchanged files.
     * @param report The finished run.
     */
    public void renderReport(CleanupReport report) {
        renderFailures(report.root(), report.failures());

        String processed = String.format("Successfully processed %d out of %d files.",
            report.changedFiles(), report.matchedFiles());
        out.println(ansi.string(report.hasFailures()
            ? "@|yellow " + processed + "|@"
            : "@|green " + processed + "|@"));
        out.println(String.format(Locale.ROOT, "Total processing time: %.2f seconds",
            report.elapsed().toMillis() / 1000.0));

        renderUnchanged(report.root(), report.unchangedFiles());
        out.flush();
    }

    private void renderUnchanged(Path root, List<Path> unchanged) {
        if (unchanged.isEmpty()) {
            return;
        }
        out.println();
        out.println("The following " + unchanged.size() + " files were matched but had no changes:");
        out.println("These files may need manual review as they might contain the flag in a different format:");

        Map<String, List<Path>> byExtension = new TreeMap<>();
        for (Path file : unchanged) {
            byExtension.computeIfAbsent(extensionOf(file), key -> new ArrayList<>()).add(file);
        }
        byExtension.forEach((extension, files) -> {
            out.println();
            out.println(extension + " files (" + files.size() + "):");
            boolean collapse = files.size() > collapseThreshold;
            files.stream()
                .sorted()
                .limit(collapse ? listLimit : files.size())
                .forEach(file -> out.println(" - " + relativize(root, file)));
            if (collapse) {
                out.println(" - ... and " + (files.size() - listLimit) + " more files");
            }
        });
    }

    private void renderFailures(Path root, Map<Path, FileOutcome.Failed> failures) {
        failures.forEach((file, failed) -> out.println(ansi.string(
            "@|red Error processing " + relativize(root, file) + ":|@ ")
            + "[" + failed.kind() + "] " + failed.reason()));
    }

    private static Path relativize(Path root, Path file) {
        return file.startsWith(root) ? root.relativize(file) : file;
    }

    private static String extensionOf(Path file) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot < 0 ? "Unknown" : name.substring(dot);
    }
}
