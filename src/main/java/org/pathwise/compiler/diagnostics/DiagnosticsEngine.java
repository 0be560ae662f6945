package org.pathwise.compiler.diagnostics;

import org.pathwise.compiler.api.SourceLocation;
import org.pathwise.compiler.frontend.semantics.Declaration;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Collects diagnostics from every resolution pass.
 *
 * <p>Reporting is thread-safe because per-module work runs on the pass worker pool.
 * {@link #getDiagnostics()} always returns the same order for the same set of reports,
 * independent of the order in which workers reported them.</p>
 */
public class DiagnosticsEngine {

    private final List<Diagnostic> diagnostics = new ArrayList<>();

    /**
     * Records a diagnostic.
     * @param diagnostic The diagnostic to add.
     */
    public synchronized void report(Diagnostic diagnostic) {
        diagnostics.add(diagnostic);
    }

    public void reportError(DiagnosticKind kind, String message, SourceLocation location) {
        report(new Diagnostic(Severity.ERROR, kind, message, location, null, List.of()));
    }

    /**
     * Reports an error against a specific path occurrence.
     *
     * @param kind        The error kind.
     * @param message     Human-readable description.
     * @param location    Where the path appears.
     * @param surfaceText The path as written.
     * @param candidates  Declarations that caused an ambiguity or collision.
     */
    public void reportError(DiagnosticKind kind, String message, SourceLocation location,
                            String surfaceText, List<Declaration> candidates) {
        report(new Diagnostic(Severity.ERROR, kind, message, location, surfaceText, candidates));
    }

    public void reportWarning(DiagnosticKind kind, String message, SourceLocation location) {
        report(new Diagnostic(Severity.WARNING, kind, message, location, null, List.of()));
    }

    /**
     * @return True if at least one error (not warning) was reported.
     */
    public synchronized boolean hasErrors() {
        return diagnostics.stream().anyMatch(Diagnostic::isError);
    }

    public synchronized int errorCount() {
        return (int) diagnostics.stream().filter(Diagnostic::isError).count();
    }

    /**
     * @return All diagnostics, ordered by location, kind and message.
     */
    public synchronized List<Diagnostic> getDiagnostics() {
        return diagnostics.stream().sorted(Diagnostic.ORDER).toList();
    }

    /**
     * @return The diagnostics of the given kind, in the same order as {@link #getDiagnostics()}.
     */
    public List<Diagnostic> ofKind(DiagnosticKind kind) {
        return getDiagnostics().stream().filter(d -> d.kind() == kind).toList();
    }

    /**
     * Formats all diagnostics, one per line.
     * @return The summary, or an empty string if nothing was reported.
     */
    public String summary() {
        return getDiagnostics().stream().map(Diagnostic::toString).collect(Collectors.joining("\n"));
    }
}
