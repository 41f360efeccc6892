package com.raditha.cocotb.cli;

import com.raditha.cocotb.cst.ParseException;
import com.raditha.cocotb.engine.Detection;
import com.raditha.cocotb.engine.MigrationEngine;
import com.raditha.cocotb.engine.MigrationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Runs the engine over a list of files and writes the changed ones.
 *
 * <p>
 * A file that cannot be read, parsed or written becomes a {@link UnitOutcome.Status#FAILED}
 * outcome; the other files are processed regardless. With more than one thread files are
 * migrated in parallel, and outcomes are still returned in input order.
 */
public class BatchMigrator {
    private static final Logger logger = LoggerFactory.getLogger(BatchMigrator.class);

    private final MigrationEngine engine;
    private final OutputPlacement placement;
    private final boolean scanFirst;
    private final int threads;

    /**
     * @param scanFirst also record the pre-scan detections of each file (check mode)
     */
    public BatchMigrator(MigrationEngine engine, OutputPlacement placement, boolean scanFirst, int threads) {
        if (threads < 1) {
            throw new IllegalArgumentException("threads must be at least 1, got " + threads);
        }
        this.engine = engine;
        this.placement = placement;
        this.scanFirst = scanFirst;
        this.threads = threads;
    }

    public List<UnitOutcome> migrate(List<Path> files) {
        if (threads == 1 || files.size() < 2) {
            List<UnitOutcome> outcomes = new ArrayList<>();
            for (Path file : files) {
                outcomes.add(migrateFile(file));
            }
            return outcomes;
        }

        ExecutorService executor = Executors.newFixedThreadPool(Math.min(threads, files.size()));
        try {
            List<Callable<UnitOutcome>> tasks = new ArrayList<>();
            for (Path file : files) {
                tasks.add(() -> migrateFile(file));
            }
            List<Future<UnitOutcome>> futures = executor.invokeAll(tasks);
            List<UnitOutcome> outcomes = new ArrayList<>();
            for (int i = 0; i < futures.size(); i++) {
                outcomes.add(await(futures.get(i), files.get(i)));
            }
            return outcomes;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while migrating files", e);
        } finally {
            executor.shutdownNow();
        }
    }

    private static UnitOutcome await(Future<UnitOutcome> future, Path file) throws InterruptedException {
        try {
            return future.get();
        } catch (ExecutionException e) {
            logger.error("Unexpected failure migrating {}", file, e.getCause());
            return UnitOutcome.failed(file, String.valueOf(e.getCause()));
        }
    }

    public UnitOutcome migrateFile(Path file) {
        try {
            String text = Files.readString(file, StandardCharsets.UTF_8);
            List<Detection> detections = scanFirst ? engine.scan(text) : List.of();
            MigrationResult result = engine.migrate(text);

            if (!result.changed()) {
                logger.info("Unchanged: {}", file);
                return new UnitOutcome(file, UnitOutcome.Status.UNCHANGED, result.diagnostics(), detections,
                        null, null);
            }

            Optional<Path> target = placement.target(file);
            if (target.isPresent()) {
                Files.writeString(target.get(), result.rewrittenText(), StandardCharsets.UTF_8);
                logger.info("Migrated: {} -> {}", file, target.get());
            } else {
                logger.info("Would change: {}", file);
            }
            return new UnitOutcome(file, UnitOutcome.Status.CHANGED, result.diagnostics(), detections,
                    target.orElse(null), null);

        } catch (ParseException e) {
            logger.warn("Cannot parse {}: {}", file, e.getMessage());
            return UnitOutcome.failed(file, "Parse error: " + e.getMessage());
        } catch (IOException e) {
            logger.warn("I/O error on {}: {}", file, e.getMessage());
            return UnitOutcome.failed(file, "I/O error: " + e.getMessage());
        } catch (RuntimeException | StackOverflowError e) {
            logger.error("Internal error migrating {}", file, e);
            return UnitOutcome.failed(file, "Internal error: " + e);
        }
    }
}
