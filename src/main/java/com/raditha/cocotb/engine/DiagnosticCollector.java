package com.raditha.cocotb.engine;

import com.raditha.cocotb.cst.NodeKind;
import com.raditha.cocotb.cst.SyntaxNode;
import com.raditha.cocotb.cst.Trivia;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Ordered record of the diagnostics of one run, and the place where advisory notices are
 * written into the output as comments at the top of the file.
 */
public class DiagnosticCollector {
    private static final Logger logger = LoggerFactory.getLogger(DiagnosticCollector.class);

    private final List<Diagnostic> diagnostics = new ArrayList<>();

    public void report(Diagnostic diagnostic) {
        logger.debug("{}", diagnostic);
        diagnostics.add(diagnostic);
    }

    public void report(String passName, DiagnosticKind kind, Severity severity, String message, int line) {
        report(new Diagnostic(passName, kind, severity, message, line));
    }

    public void manualReview(String passName, String message, int line) {
        report(passName, DiagnosticKind.MANUAL_REVIEW, Severity.WARNING, message, line);
    }

    public void addAll(Collection<Diagnostic> more) {
        more.forEach(this::report);
    }

    /**
     * Adds only those diagnostics whose {@link Diagnostic#identity()} has not been recorded yet.
     *
     * @return the number added
     */
    public int addAllNew(Collection<Diagnostic> more) {
        Set<String> known = new HashSet<>();
        for (Diagnostic d : diagnostics) {
            known.add(d.identity());
        }
        int added = 0;
        for (Diagnostic d : more) {
            if (known.add(d.identity())) {
                report(d);
                added++;
            }
        }
        return added;
    }

    public List<Diagnostic> diagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    public boolean isEmpty() {
        return diagnostics.isEmpty();
    }

    public boolean hasErrors() {
        return diagnostics.stream().anyMatch(d -> d.severity() == Severity.ERROR);
    }

    /**
     * Inserts one comment line per notice at the top of the module, after a shebang or encoding
     * line if the file starts with one. A notice already present among the comments at the top
     * of the file is skipped. Each inserted notice is recorded as an {@link DiagnosticKind#ADVISORY}.
     *
     * @return the module with the comments added, or the same instance when nothing was inserted
     */
    public SyntaxNode injectAdvisories(SyntaxNode module, String passName, Collection<String> notices) {
        if (!module.is(NodeKind.MODULE)) {
            throw new IllegalArgumentException("Advisories go into a module, not " + module.kind());
        }
        if (notices.isEmpty()) {
            return module;
        }
        List<Trivia> header = module.leadingTrivia();
        Set<String> present = new HashSet<>();
        for (Trivia t : header) {
            if (t.kind() == Trivia.Kind.COMMENT) {
                present.add(t.text().strip());
            }
        }

        String lineEnding = module.toSource().contains("\r\n") ? "\r\n" : "\n";
        List<Trivia> inserted = new ArrayList<>();
        for (String notice : notices) {
            String comment = notice.startsWith("#") ? notice : "# " + notice;
            if (!present.add(comment.strip())) {
                logger.debug("Advisory already present: {}", comment);
                continue;
            }
            inserted.add(Trivia.comment(comment));
            inserted.add(Trivia.newline(lineEnding));
            report(passName, DiagnosticKind.ADVISORY, Severity.INFO, "Inserted advisory: " + comment, 1);
        }
        if (inserted.isEmpty()) {
            return module;
        }

        int at = preambleEnd(header);
        List<Trivia> trivia = new ArrayList<>(header.subList(0, at));
        trivia.addAll(inserted);
        trivia.addAll(header.subList(at, header.size()));
        return module.withLeadingTrivia(trivia);
    }

    /**
     * Index just past a byte order mark, a shebang line and an encoding declaration.
     */
    private static int preambleEnd(List<Trivia> header) {
        int start = !header.isEmpty() && header.get(0).text().equals("\uFEFF") ? 1 : 0;
        int i = start;
        while (i + 1 < header.size()
                && header.get(i).kind() == Trivia.Kind.COMMENT
                && header.get(i + 1).kind() == Trivia.Kind.NEWLINE
                && isPreamble(header.get(i).text(), i == start)) {
            i += 2;
        }
        return i;
    }

    private static boolean isPreamble(String comment, boolean firstLine) {
        return (firstLine && comment.startsWith("#!")) || comment.matches("^#.*coding[:=].*");
    }
}
