package org.pathwise.compiler.diagnostics;

import org.pathwise.compiler.api.SourceLocation;
import org.pathwise.compiler.frontend.semantics.Declaration;

import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * A single reported problem.
 *
 * @param severity    ERROR or WARNING.
 * @param kind        What went wrong.
 * @param message     Human-readable description.
 * @param location    Where it went wrong.
 * @param surfaceText The path text of the offending use-site or import, or null.
 * @param candidates  Declarations involved in an ambiguity or collision; empty otherwise.
 */
public record Diagnostic(
        Severity severity,
        DiagnosticKind kind,
        String message,
        SourceLocation location,
        String surfaceText,
        List<Declaration> candidates
) {

    static final Comparator<Diagnostic> ORDER = Comparator
            .comparing(Diagnostic::location)
            .thenComparing(Diagnostic::kind)
            .thenComparing(Diagnostic::message);

    public Diagnostic {
        Objects.requireNonNull(severity, "severity");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(location, "location");
        candidates = List.copyOf(candidates);
    }

    public boolean isError() {
        return severity == Severity.ERROR;
    }

    @Override
    public String toString() {
        return location + ": " + severity.name().toLowerCase(Locale.ROOT)
                + "[" + kind + "]: " + message;
    }
}
