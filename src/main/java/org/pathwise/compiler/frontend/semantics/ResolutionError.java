package org.pathwise.compiler.frontend.semantics;

import org.pathwise.compiler.diagnostics.DiagnosticKind;

import java.util.List;

/**
 * Why a path could not be resolved to a single declaration.
 *
 * @param kind       The error kind.
 * @param message    Human-readable description.
 * @param candidates Declarations that made the lookup ambiguous; empty otherwise.
 */
public record ResolutionError(DiagnosticKind kind, String message, List<Declaration> candidates) {

    public ResolutionError {
        candidates = List.copyOf(candidates);
    }

    static ResolutionError of(DiagnosticKind kind, String message) {
        return new ResolutionError(kind, message, List.of());
    }
}
