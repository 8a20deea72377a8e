package org.flagcleaner.cleaner;

import org.flagcleaner.cleaner.api.FailureKind;
import org.flagcleaner.cleaner.api.FileOutcome;
import org.flagcleaner.cleaner.api.FlagCleaner;
import org.flagcleaner.cleaner.io.ISourceFileSystem;
import org.flagcleaner.cleaner.io.SourceFileFinder;
import org.flagcleaner.cleaner.objc.ObjcSourceCleaner;
import org.flagcleaner.cleaner.swift.SwiftSourceCleaner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs a cleanup over a directory tree.
 * <p>
 * Discovery collects the source files under the root and keeps those mentioning the flag. Processing
 * dispatches each of them by extension to the Swift or Objective-C cleaner on a fixed thread pool and
 * folds the outcomes into a {@link CleanupReport} once every task has been joined. A file that times out
 * before its write or delete has started is left unchanged on disk.
 */
public class CleanupService {

    private static final Logger LOG = LoggerFactory.getLogger(CleanupService.class);

    private final CleanerSettings settings;
    private final ISourceFileSystem fileSystem;

    /**
     * Creates a service.
     * @param settings The run settings.
     * @param fileSystem The file system to read and write through.
     */
    public CleanupService(CleanerSettings settings, ISourceFileSystem fileSystem) {
        this.settings = settings;
        this.fileSystem = fileSystem;
    }

    /**
     * Discovers and cleans every file under {@code root} that mentions {@code flag}.
     * @param root The directory to scan.
     * @param flag The flag to remove.
     * @return The report of the run.
     * @throws IOException if the directory tree cannot be walked.
     * @throws InterruptedException if the calling thread is interrupted while waiting for workers.
     */
    public CleanupReport run(Path root, String flag) throws IOException, InterruptedException {
        return process(discover(root, flag), flag);
    }

    /**
     * Collects the source files under {@code root} and keeps those containing {@code flag}.
     * @param root The directory to scan.
     * @param flag The flag to look for.
     * @return The discovered files.
     * @throws IOException if the directory tree cannot be walked.
     * @throws IllegalArgumentException if {@code root} is not a directory.
     */
    public Discovery discover(Path root, String flag) throws IOException {
        List<String> extensions = new ArrayList<>(settings.swiftExtensions());
        extensions.addAll(settings.objcExtensions());
        SourceFileFinder finder = new SourceFileFinder(extensions, settings.excludedPathPatterns(), fileSystem);

        List<Path> allFiles = finder.collect(root);
        List<Path> matching = finder.filterContaining(allFiles, flag);
        LOG.info("Found {} source files containing {} out of {} total", matching.size(), flag, allFiles.size());
        return new Discovery(root, allFiles.size(), matching);
    }

    /**
     * Cleans the discovered files in parallel.
     * @param discovery The files to clean.
     * @param flag The flag to remove.
     * @return The report of the run.
     * @throws InterruptedException if the calling thread is interrupted while waiting for workers.
     */
    public CleanupReport process(Discovery discovery, String flag) throws InterruptedException {
        long startNanos = System.nanoTime();
        List<Path> files = discovery.matchingFiles();
        Map<Path, FileOutcome> outcomes = new LinkedHashMap<>();

        if (!files.isEmpty()) {
            FlagCleaner flagCleaner = new FlagCleaner(settings.evaluationMode().createEvaluator());

            int threadCount = Math.min(settings.effectiveThreads(), files.size());
            LOG.debug("Cleaning {} files on {} threads", files.size(), threadCount);
            ExecutorService executorService = Executors.newFixedThreadPool(threadCount);
            try {
                Map<Path, Future<FileOutcome>> futures = new LinkedHashMap<>();
                Map<Path, AbandonableFileSystem> guards = new LinkedHashMap<>();
                for (Path file : files) {
                    AbandonableFileSystem guard = new AbandonableFileSystem(fileSystem);
                    ISourceCleaner cleaner = isSwift(file)
                            ? new SwiftSourceCleaner(guard, flagCleaner, flag)
                            : new ObjcSourceCleaner(guard, flag);
                    guards.put(file, guard);
                    futures.put(file, executorService.submit(() -> cleaner.processFile(file)));
                }
                for (Map.Entry<Path, Future<FileOutcome>> entry : futures.entrySet()) {
                    Path file = entry.getKey();
                    outcomes.put(file, await(file, entry.getValue(), guards.get(file)));
                }
            } finally {
                executorService.shutdownNow();
            }
        }

        Duration elapsed = Duration.ofNanos(System.nanoTime() - startNanos);
        CleanupReport report = new CleanupReport(discovery.root(), flag, discovery.totalFiles(), outcomes, elapsed);
        LOG.info("Changed {} of {} matched files in {} ms", report.changedFiles(), report.matchedFiles(),
                elapsed.toMillis());
        return report;
    }

    /**
     * Waits for one file. A file still unchanged at its deadline is abandoned and reported as timed out;
     * a file whose write or delete has already started is waited for.
     */
    private FileOutcome await(Path file, Future<FileOutcome> future, AbandonableFileSystem guard)
            throws InterruptedException {
        Duration timeout = settings.fileTimeout();
        try {
            if (timeout.isZero()) {
                return future.get();
            }
            try {
                return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            } catch (TimeoutException e) {
                if (!guard.abandon()) {
                    LOG.debug("{} passed its deadline while being changed, waiting for it", file);
                    return future.get();
                }
                future.cancel(true);
                LOG.warn("Timed out waiting for {} after {} ms", file, timeout.toMillis());
                return new FileOutcome.Failed(FailureKind.TIMED_OUT, "No result after " + timeout.toMillis() + " ms");
            }
        } catch (ExecutionException e) {
            LOG.error("Unexpected error while cleaning {}", file, e.getCause());
            return new FileOutcome.Failed(FailureKind.UNEXPECTED, ISourceCleaner.describe(e.getCause()));
        }
    }

    private boolean isSwift(Path file) {
        String name = file.getFileName().toString();
        return settings.swiftExtensions().stream().anyMatch(name::endsWith);
    }
}
