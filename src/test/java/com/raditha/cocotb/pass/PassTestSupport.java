package com.raditha.cocotb.pass;

import com.raditha.cocotb.cst.ParseException;
import com.raditha.cocotb.cst.PythonParser;
import com.raditha.cocotb.cst.SourcePrinter;
import com.raditha.cocotb.engine.Diagnostic;
import com.raditha.cocotb.engine.DiagnosticKind;
import com.raditha.cocotb.engine.PassRunResult;
import com.raditha.cocotb.engine.PassRunner;

import java.util.List;

/**
 * Runs one pass over source text.
 */
final class PassTestSupport {

    private PassTestSupport() {
        // Utility class
    }

    static PassRunResult run(TransformationPass pass, String source) throws ParseException {
        return new PassRunner().run(PythonParser.parse(source), List.of(pass));
    }

    static String rewrite(TransformationPass pass, String source) throws ParseException {
        return SourcePrinter.print(run(pass, source).tree());
    }

    static List<Diagnostic> diagnostics(PassRunResult result, DiagnosticKind kind) {
        return result.diagnostics().stream().filter(d -> d.kind() == kind).toList();
    }
}
