package org.pathwise.compiler.frontend.semantics;

import org.pathwise.compiler.api.ModuleSource;
import org.pathwise.compiler.diagnostics.DiagnosticKind;
import org.pathwise.compiler.diagnostics.DiagnosticsEngine;
import org.pathwise.compiler.frontend.PassWorkerPool;
import org.pathwise.compiler.frontend.module.ModuleNode;
import org.pathwise.compiler.frontend.module.ModuleTree;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Phase 2: registers every module's top-level items in its {@link ModuleScope}.
 *
 * <p>Items are inserted in source order, so of two items with the same (name, kind) the one
 * written first is kept and the later one is reported as {@code DUPLICATE_DECLARATION},
 * whatever order the item list arrived in. Each module only touches its own scope,
 * which lets modules be collected in parallel.</p>
 */
public class DeclarationCollector {

    private static final Logger LOG = LoggerFactory.getLogger(DeclarationCollector.class);

    private static final Comparator<ModuleSource.ItemDecl> SOURCE_ORDER =
            Comparator.comparing(ModuleSource.ItemDecl::location);

    private final DiagnosticsEngine diagnostics;

    public DeclarationCollector(DiagnosticsEngine diagnostics) {
        this.diagnostics = diagnostics;
    }

    /**
     * Collects the declarations of every module of the tree. Returns once all modules are done.
     *
     * @param tree        The module tree.
     * @param symbolTable The table whose scopes receive the declarations.
     * @param pool        The pool running per-module work.
     */
    public void collectAll(ModuleTree tree, SymbolTable symbolTable, PassWorkerPool pool) {
        pool.dispatch(tree.size(), (from, to) -> {
            for (int i = from; i < to; i++) {
                ModuleNode node = tree.node(i);
                collect(node, symbolTable.scope(node));
            }
        });
    }

    /**
     * Collects the top-level items of one module into its scope.
     *
     * @param node  The module.
     * @param scope The module's scope.
     */
    public void collect(ModuleNode node, ModuleScope scope) {
        List<ModuleSource.ItemDecl> items = node.source().items().stream().sorted(SOURCE_ORDER).toList();
        for (ModuleSource.ItemDecl item : items) {
            Declaration declaration = new Declaration(new SymbolId(node.id(), item.name(), item.kind()), item.location());
            Optional<Declaration> existing = scope.define(declaration);
            existing.ifPresent(first -> diagnostics.reportError(DiagnosticKind.DUPLICATE_DECLARATION,
                    item.kind().keyword() + " '" + item.name() + "' is already declared in module '" + node.id()
                            + "' at " + first.location() + ".",
                    item.location(), item.name(), List.of(first)));
        }
        LOG.debug("Collected {} declaration(s) in module {}", items.size(), node.id());
    }
}
