package org.pathwise.compiler.frontend.semantics;

import org.pathwise.compiler.api.ModuleSource;
import org.pathwise.compiler.diagnostics.DiagnosticKind;
import org.pathwise.compiler.diagnostics.DiagnosticsEngine;
import org.pathwise.compiler.frontend.PassWorkerPool;
import org.pathwise.compiler.frontend.module.ModuleId;
import org.pathwise.compiler.frontend.module.ModuleNode;
import org.pathwise.compiler.frontend.module.ModuleTree;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Phase 3: binds the {@code use} statements of every module into the module's import scope.
 *
 * <p>Runs after all declarations are collected and proceeds in rounds until a fixed point.
 * Within a round every pending import of every module is attempted in parallel against the
 * bindings committed by earlier rounds; nothing is written during the attempt. After the round
 * barrier the outcomes are committed sequentially in module order, so the result does not
 * depend on the parallelism.</p>
 *
 * <p>A terminal lookup in the target module finds its local declarations of the name, then
 * its re-exported binding of the name. If neither exists but the target still has a pending
 * {@code pub use} of that name, the import waits for the next round. A round without progress
 * leaves only imports waiting on each other; those on a cycle are reported as
 * {@code CYCLIC_IMPORT} and the ones merely leading into a cycle as {@code UNRESOLVED_IMPORT}.</p>
 */
public class ImportResolver {

    private static final Logger LOG = LoggerFactory.getLogger(ImportResolver.class);

    private final DiagnosticsEngine diagnostics;
    private final ResolverOptions options;

    public ImportResolver(DiagnosticsEngine diagnostics, ResolverOptions options) {
        this.diagnostics = diagnostics;
        this.options = options;
    }

    /**
     * A name in a module's import scope, used to track which re-exports are still pending.
     */
    private record BindingKey(ModuleId module, String name) {
        @Override
        public String toString() {
            return module + "::" + name;
        }
    }

    /**
     * A {@code use} statement that has been parsed but not bound yet.
     */
    private record PendingImport(ModuleNode module, ModuleSource.UseDecl use, QualifiedPath path) {
        String boundName() {
            return use.alias() != null ? use.alias() : path.name();
        }

        BindingKey key() {
            return new BindingKey(module.id(), boundName());
        }
    }

    private sealed interface Outcome permits Bound, Failed, Blocked {}

    private record Bound(Set<Declaration> targets) implements Outcome {}

    private record Failed(ResolutionError error) implements Outcome {}

    private record Blocked(BindingKey waitingOn) implements Outcome {}

    /**
     * Resolves all imports of the tree and freezes nothing; the caller freezes the table
     * once this returns.
     *
     * @param tree        The module tree.
     * @param symbolTable The table holding every module's declarations.
     * @param pool        The pool running per-module work of each round.
     */
    public void resolveAll(ModuleTree tree, SymbolTable symbolTable, PassWorkerPool pool) {
        List<List<PendingImport>> pending = parseImports(tree);

        int round = 0;
        int total = pending.stream().mapToInt(List::size).sum();
        int bound = 0;
        int failed = 0;
        while (pending.stream().anyMatch(list -> !list.isEmpty())) {
            round++;
            Set<BindingKey> pendingReexports = pendingReexports(pending);
            List<List<PendingImport>> snapshot = pending;
            Outcome[][] outcomes = new Outcome[tree.size()][];

            pool.dispatch(tree.size(), (from, to) -> {
                for (int i = from; i < to; i++) {
                    List<PendingImport> imports = snapshot.get(i);
                    Outcome[] moduleOutcomes = new Outcome[imports.size()];
                    for (int j = 0; j < imports.size(); j++) {
                        moduleOutcomes[j] = attempt(tree, symbolTable, imports.get(j), pendingReexports);
                    }
                    outcomes[i] = moduleOutcomes;
                }
            });

            // Commit in module order, then source order within the module.
            List<List<PendingImport>> next = new ArrayList<>(tree.size());
            Map<PendingImport, BindingKey> blocked = new HashMap<>();
            int progress = 0;
            for (int i = 0; i < tree.size(); i++) {
                List<PendingImport> imports = snapshot.get(i);
                List<PendingImport> stillPending = new ArrayList<>();
                for (int j = 0; j < imports.size(); j++) {
                    PendingImport imp = imports.get(j);
                    Outcome outcome = outcomes[i][j];
                    if (outcome instanceof Bound b) {
                        commit(symbolTable.scope(imp.module()), imp, b.targets());
                        bound++;
                        progress++;
                    } else if (outcome instanceof Failed f) {
                        reportUnresolved(imp, f.error());
                        failed++;
                        progress++;
                    } else {
                        stillPending.add(imp);
                        blocked.put(imp, ((Blocked) outcome).waitingOn());
                    }
                }
                next.add(stillPending);
            }
            LOG.debug("Import round {}: {} settled, {} waiting", round, progress, blocked.size());

            if (progress == 0) {
                reportCycles(next, blocked);
                failed += blocked.size();
                break;
            }
            pending = next;
        }
        LOG.debug("Import resolution reached a fixed point after {} round(s): {} import(s), {} bound, {} failed",
                round, total, bound, failed);
    }

    private List<List<PendingImport>> parseImports(ModuleTree tree) {
        List<List<PendingImport>> pending = new ArrayList<>(tree.size());
        for (ModuleNode node : tree.nodes()) {
            List<PendingImport> imports = new ArrayList<>();
            for (ModuleSource.UseDecl use : node.source().uses()) {
                try {
                    imports.add(new PendingImport(node, use, QualifiedPath.parse(use.path())));
                } catch (MalformedPathException e) {
                    diagnostics.reportError(DiagnosticKind.MALFORMED_PATH, e.getMessage(), use.location(), use.path(), List.of());
                }
            }
            pending.add(imports);
        }
        return pending;
    }

    private static Set<BindingKey> pendingReexports(List<List<PendingImport>> pending) {
        Set<BindingKey> keys = new HashSet<>();
        for (List<PendingImport> imports : pending) {
            for (PendingImport imp : imports) {
                if (imp.use().reexported()) {
                    keys.add(imp.key());
                }
            }
        }
        return keys;
    }

    /**
     * Attempts one import against the current committed bindings. Reads only.
     */
    private Outcome attempt(ModuleTree tree, SymbolTable symbolTable, PendingImport imp, Set<BindingKey> pendingReexports) {
        QualifiedPath path = imp.path();
        if (path.isBare()) {
            return new Failed(ResolutionError.of(DiagnosticKind.UNRESOLVED_IMPORT,
                    "An import needs a module path; write 'use self::" + path.name() + "' or 'use crate::...::"
                            + path.name() + "'."));
        }

        PathResolver.ModuleWalk walk = PathResolver.walk(tree, imp.module(), path);
        if (walk instanceof PathResolver.ModuleWalk.Failed f) {
            return new Failed(f.error());
        }
        ModuleNode target = ((PathResolver.ModuleWalk.Reached) walk).target();
        ModuleScope scope = symbolTable.scope(target);
        String name = path.name();

        Collection<Declaration> locals = scope.declarationsNamed(name);
        if (!locals.isEmpty()) {
            return new Bound(new LinkedHashSet<>(locals));
        }

        ImportBinding reexport = scope.reexport(name).orElse(null);
        if (reexport != null) {
            if (reexport.ambiguous()) {
                return new Failed(new ResolutionError(DiagnosticKind.UNRESOLVED_IMPORT,
                        "'" + name + "' is re-exported ambiguously by module '" + target.id() + "'.",
                        reexport.targets()));
            }
            return new Bound(new LinkedHashSet<>(reexport.targets()));
        }

        BindingKey key = new BindingKey(target.id(), name);
        if (pendingReexports.contains(key)) {
            return new Blocked(key);
        }

        String hint = tree.child(target, name).isPresent()
                ? " ('" + name + "' is a module; only items can be imported)"
                : "";
        return new Failed(ResolutionError.of(DiagnosticKind.UNKNOWN_DECLARATION,
                "Module '" + target.id() + "' has no item named '" + name + "'" + hint + "."));
    }

    private void commit(ModuleScope scope, PendingImport imp, Set<Declaration> targets) {
        String name = imp.boundName();
        ModuleSource.UseDecl use = imp.use();

        Collection<Declaration> locals = scope.declarationsNamed(name);
        if (!locals.isEmpty()) {
            if (new LinkedHashSet<>(locals).equals(targets)) {
                LOG.debug("'{}' in module {} imports the module's own declaration(s); ignored", use.surface(), scope.moduleId());
                return;
            }
            if (options.localImportCollision() == ResolverOptions.LocalImportCollision.SHADOW) {
                LOG.debug("'{}' in module {} is shadowed by a local declaration of '{}'", use.surface(), scope.moduleId(), name);
                return;
            }
            List<Declaration> candidates = new ArrayList<>(locals);
            targets.stream().filter(d -> !candidates.contains(d)).forEach(candidates::add);
            diagnostics.reportError(DiagnosticKind.DUPLICATE_IMPORT,
                    "'" + use.surface() + "' binds '" + name + "', which module '" + scope.moduleId()
                            + "' already declares; the local declaration is kept.",
                    use.location(), use.path(), candidates);
            return;
        }

        ImportBinding existing = scope.importBinding(name).orElse(null);
        if (existing == null) {
            scope.bind(ImportBinding.of(name, targets, use));
        } else if (existing.hasOriginBinding(targets)) {
            scope.bind(existing.withOrigin(use, targets));
        } else {
            ImportBinding conflicted = existing.withConflict(targets, use);
            ModuleSource.UseDecl first = existing.firstOriginOtherThan(targets).orElseThrow().use();
            diagnostics.reportError(DiagnosticKind.DUPLICATE_IMPORT,
                    "'" + use.surface() + "' binds '" + name + "' in module '" + scope.moduleId()
                            + "', which '" + first.surface() + "' at " + first.location()
                            + " already binds to different declaration(s).",
                    use.location(), use.path(), conflicted.targets());
            scope.bind(conflicted);
        }
    }

    private void reportUnresolved(PendingImport imp, ResolutionError cause) {
        ModuleSource.UseDecl use = imp.use();
        diagnostics.reportError(DiagnosticKind.UNRESOLVED_IMPORT,
                "Unresolved import '" + use.surface() + "' in module '" + imp.module().id() + "': " + cause.message(),
                use.location(), use.path(), cause.candidates());
    }

    /**
     * Reports the imports left after a round without progress. Each of them waits on a pending
     * re-export; an import whose wait chain comes back to itself is on a cycle.
     */
    private void reportCycles(List<List<PendingImport>> remaining, Map<PendingImport, BindingKey> blocked) {
        Map<BindingKey, List<PendingImport>> byKey = new HashMap<>();
        for (List<PendingImport> imports : remaining) {
            for (PendingImport imp : imports) {
                if (imp.use().reexported()) {
                    byKey.computeIfAbsent(imp.key(), k -> new ArrayList<>()).add(imp);
                }
            }
        }

        for (List<PendingImport> imports : remaining) {
            for (PendingImport imp : imports) {
                ModuleSource.UseDecl use = imp.use();
                if (isOnCycle(imp, blocked, byKey)) {
                    diagnostics.reportError(DiagnosticKind.CYCLIC_IMPORT,
                            "Import '" + use.surface() + "' in module '" + imp.module().id()
                                    + "' never resolves; it is part of an import cycle: " + chain(imp, blocked, byKey) + ".",
                            use.location(), use.path(), List.of());
                } else {
                    diagnostics.reportError(DiagnosticKind.UNRESOLVED_IMPORT,
                            "Unresolved import '" + use.surface() + "' in module '" + imp.module().id()
                                    + "': it depends on a cyclic import of " + blocked.get(imp) + ".",
                            use.location(), use.path(), List.of());
                }
            }
        }
    }

    private static boolean isOnCycle(PendingImport start, Map<PendingImport, BindingKey> blocked,
                                     Map<BindingKey, List<PendingImport>> byKey) {
        Set<PendingImport> seen = new HashSet<>();
        Deque<PendingImport> work = new ArrayDeque<>(byKey.getOrDefault(blocked.get(start), List.of()));
        while (!work.isEmpty()) {
            PendingImport imp = work.pop();
            if (imp.equals(start)) {
                return true;
            }
            if (seen.add(imp)) {
                work.addAll(byKey.getOrDefault(blocked.get(imp), List.of()));
            }
        }
        return false;
    }

    /**
     * Renders the wait chain of a cyclic import, e.g. {@code crate::a::X -> crate::b::X -> crate::a::X}.
     */
    private static String chain(PendingImport start, Map<PendingImport, BindingKey> blocked,
                                Map<BindingKey, List<PendingImport>> byKey) {
        List<BindingKey> keys = new ArrayList<>();
        Set<BindingKey> visited = new HashSet<>();
        BindingKey key = start.key();
        PendingImport current = start;
        while (visited.add(key)) {
            keys.add(key);
            key = blocked.get(current);
            List<PendingImport> waitedOn = byKey.getOrDefault(key, List.of());
            if (waitedOn.isEmpty()) {
                break;
            }
            current = waitedOn.get(0);
        }
        keys.add(key);
        return keys.stream().map(BindingKey::toString).collect(Collectors.joining(" -> "));
    }
}
