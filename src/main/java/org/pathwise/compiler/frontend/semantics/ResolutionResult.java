package org.pathwise.compiler.frontend.semantics;

import org.pathwise.compiler.diagnostics.Diagnostic;
import org.pathwise.compiler.diagnostics.DiagnosticsEngine;
import org.pathwise.compiler.frontend.module.ModuleTree;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * The outcome of name resolution for one compilation unit: the frozen tables, every
 * use-site of the unit with its resolution, and the diagnostics. Later phases keep
 * querying it through {@link #resolve(UseSite)}.
 */
public final class ResolutionResult {

    private final ModuleTree tree;
    private final SymbolTable symbolTable;
    private final Map<UseSite, ResolvedReference> references;
    private final DiagnosticsEngine diagnostics;
    private final PathResolver pathResolver;

    ResolutionResult(ModuleTree tree, SymbolTable symbolTable, Map<UseSite, ResolvedReference> references,
                     DiagnosticsEngine diagnostics, PathResolver pathResolver) {
        this.tree = tree;
        this.symbolTable = symbolTable;
        this.references = Collections.unmodifiableMap(references);
        this.diagnostics = diagnostics;
        this.pathResolver = pathResolver;
    }

    public ModuleTree tree() {
        return tree;
    }

    public SymbolTable symbolTable() {
        return symbolTable;
    }

    /**
     * @return Use-site to resolution, in module arena order and source order within a module.
     */
    public Map<UseSite, ResolvedReference> references() {
        return references;
    }

    public List<Diagnostic> diagnostics() {
        return diagnostics.getDiagnostics();
    }

    public boolean hasErrors() {
        return diagnostics.hasErrors();
    }

    /**
     * Resolves an additional use-site against the frozen tables. Failures are added to this
     * result's diagnostics.
     */
    public ResolvedReference resolve(UseSite useSite) {
        return pathResolver.resolve(useSite);
    }

    public PathResolver pathResolver() {
        return pathResolver;
    }
}
