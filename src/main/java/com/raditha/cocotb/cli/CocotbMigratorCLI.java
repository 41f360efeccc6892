package com.raditha.cocotb.cli;

import com.raditha.cocotb.config.MigrationSettings;
import com.raditha.cocotb.engine.MigrationEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.ArgGroup;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Command-line interface for migrating cocotb 1.x testbenches to cocotb 2.x.
 *
 * <p>
 * <strong>Usage Examples:</strong>
 *
 * <pre>
 * # List what would change, touching nothing
 * cocotb-migrator --check tests/
 *
 * # Write tb.migrated.py next to every changed tb.py
 * cocotb-migrator --apply tests/
 *
 * # Overwrite the sources, four files at a time, with a JSON report
 * cocotb-migrator --apply --inplace --threads 4 --json-report report.json tests/
 *
 * # Show the effective rule tables
 * cocotb-migrator --print-config --config my-rules.yml
 * </pre>
 */
@SuppressWarnings("java:S106")
@Command(name = "cocotb-migrator", mixinStandardHelpOptions = true, version = "1.0",
        description = "Rewrites cocotb 1.x testbench sources to the cocotb 2.x API")
public class CocotbMigratorCLI implements Callable<Integer> {
    private static final Logger logger = LoggerFactory.getLogger(CocotbMigratorCLI.class);

    static class Mode {
        @Option(names = "--check", required = true, description = "Report the files that would change without writing")
        boolean check;

        @Option(names = "--apply", required = true, description = "Write the migrated sources")
        boolean apply;

        @Option(names = "--print-config", required = true, description = "Print the effective configuration and exit")
        boolean printConfig;
    }

    @ArgGroup(exclusive = true, multiplicity = "1")
    Mode mode;

    @Option(names = "--inplace", description = "With --apply, overwrite the source files instead of writing *.migrated.py")
    boolean inplace;

    @Option(names = "--config", paramLabel = "<yml>", description = "YAML file overriding the default rule tables")
    Path config;

    @Option(names = "--json-report", paramLabel = "<file>", description = "Also write the report as JSON")
    Path jsonReport;

    @Option(names = "--threads", paramLabel = "<n>", defaultValue = "1", description = "Files migrated in parallel (default: ${DEFAULT-VALUE})")
    int threads;

    @Option(names = "--max-iterations", paramLabel = "<n>", description = "Repeat the pass list until nothing changes, at most n times")
    Integer maxIterations;

    @Parameters(index = "0", arity = "0..1", paramLabel = "<path>", description = "A Python file or a directory to search")
    Path path;

    @Spec
    CommandSpec spec;

    public static void main(String[] args) {
        System.exit(new CommandLine(new CocotbMigratorCLI()).execute(args));
    }

    @Override
    public Integer call() {
        if (threads < 1) {
            throw new CommandLine.ParameterException(spec.commandLine(), "--threads must be at least 1");
        }
        if (maxIterations != null && maxIterations < 1) {
            throw new CommandLine.ParameterException(spec.commandLine(), "--max-iterations must be at least 1");
        }
        if (!mode.printConfig && path == null) {
            throw new CommandLine.ParameterException(spec.commandLine(), "Missing required parameter: '<path>'");
        }

        MigrationSettings settings;
        try {
            settings = loadSettings();
        } catch (IOException | IllegalArgumentException e) {
            System.err.println("Error: invalid configuration: " + e.getMessage());
            return 1;
        }

        if (mode.printConfig) {
            System.out.print(settings.toYaml());
            return 0;
        }

        try {
            MigrationEngine engine = new MigrationEngine(settings);
            List<Path> files = new SourceFileFinder(settings.getExcludeDirectories()).find(path);
            if (files.isEmpty()) {
                System.out.println("No Python sources found under " + path);
            }

            BatchMigrator migrator = new BatchMigrator(engine, placement(), mode.check, threads);
            MigrationReport report = new MigrationReport(migrator.migrate(files), mode.check);
            System.out.println(report.generateReport(CommandLine.Help.Ansi.AUTO));

            if (jsonReport != null) {
                report.writeJson(jsonReport);
                System.out.println("JSON report written to " + jsonReport);
            }
            return report.isSuccessful() ? 0 : 1;
        } catch (IOException e) {
            logger.error("Migration aborted", e);
            System.err.println("Error: " + e.getMessage());
            return 1;
        } catch (IllegalArgumentException e) {
            System.err.println("Error: " + e.getMessage());
            return 1;
        }
    }

    private MigrationSettings loadSettings() throws IOException {
        MigrationSettings settings = config == null ? MigrationSettings.loadDefault() : MigrationSettings.load(config);
        if (maxIterations != null) {
            settings = settings.withMaxIterations(maxIterations);
        }
        return settings;
    }

    OutputPlacement placement() {
        if (mode.check) {
            return OutputPlacement.REPORT_ONLY;
        }
        return inplace ? OutputPlacement.IN_PLACE : OutputPlacement.SIDE_BY_SIDE;
    }
}
