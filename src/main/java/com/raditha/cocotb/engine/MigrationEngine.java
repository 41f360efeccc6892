package com.raditha.cocotb.engine;

import com.raditha.cocotb.config.MigrationSettings;
import com.raditha.cocotb.cst.ParseException;
import com.raditha.cocotb.cst.PythonParser;
import com.raditha.cocotb.cst.SourcePrinter;
import com.raditha.cocotb.cst.SyntaxNode;
import com.raditha.cocotb.pass.PassCatalogue;
import com.raditha.cocotb.pass.TransformationPass;

import java.util.List;

/**
 * Migrates the text of one source file: parse, run the passes, print, compare.
 *
 * <p>
 * An engine holds only the pass list and runner settings, both read-only, so one instance can
 * serve any number of threads.
 */
public class MigrationEngine {
    private final List<TransformationPass> passes;
    private final PassRunner runner;

    public MigrationEngine(MigrationSettings settings) {
        this(PassCatalogue.build(settings), new PassRunner(settings.getMaxIterations()));
    }

    public MigrationEngine(List<TransformationPass> passes, PassRunner runner) {
        this.passes = List.copyOf(passes);
        this.runner = runner;
    }

    /**
     * @throws ParseException when the text is not valid Python; nothing is rewritten then
     */
    public MigrationResult migrate(String text) throws ParseException {
        SyntaxNode tree = PythonParser.parse(text);
        PassRunResult run = runner.run(tree, passes);
        String rewritten = SourcePrinter.print(run.tree());
        return new MigrationResult(rewritten, ChangeReporter.decide(text, rewritten), run.diagnostics());
    }

    public List<Detection> scan(String text) throws ParseException {
        return ChangeReporter.scan(PythonParser.parse(text), passes);
    }

    public List<TransformationPass> getPasses() {
        return passes;
    }
}
