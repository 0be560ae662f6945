package org.pathwise.compiler.frontend.semantics;

import org.pathwise.compiler.api.Namespace;
import org.pathwise.compiler.api.SourceLocation;
import org.pathwise.compiler.diagnostics.DiagnosticKind;
import org.pathwise.compiler.diagnostics.DiagnosticsEngine;
import org.pathwise.compiler.frontend.module.ModuleId;
import org.pathwise.compiler.frontend.module.ModuleNode;
import org.pathwise.compiler.frontend.module.ModuleTree;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Resolves use-sites against the frozen symbol table.
 *
 * <p>A qualified path walks the module tree from its root ({@code crate}, {@code self},
 * {@code super}, or for a plain leading segment a child of the originating module and then a
 * child of the crate root) and looks the terminal name up in the target module: its local
 * declarations first, then its re-exported ({@code pub use}) import bindings.
 * A bare name is looked up in the originating module's local declarations, then its import
 * scope. The first scope with a hit wins; more than one candidate in that scope is an
 * ambiguity.</p>
 *
 * <p>Results are memoized per use-site. The tables are frozen, so the memo never goes stale
 * and concurrent callers need no locking. A failure is reported to the diagnostics engine
 * exactly once per use-site, the first time it is resolved.</p>
 */
public class PathResolver {

    /**
     * Outcome of walking the module prefix of a path.
     */
    sealed interface ModuleWalk permits ModuleWalk.Reached, ModuleWalk.Failed {
        record Reached(ModuleNode target) implements ModuleWalk {}

        record Failed(ResolutionError error) implements ModuleWalk {}
    }

    private final SymbolTable symbolTable;
    private final ModuleTree tree;
    private final DiagnosticsEngine diagnostics;
    private final Map<UseSite, ResolvedReference> memo = new ConcurrentHashMap<>();

    /**
     * @param symbolTable A frozen symbol table.
     * @param diagnostics Receives use-site failures.
     * @throws IllegalStateException if the table is not frozen yet.
     */
    public PathResolver(SymbolTable symbolTable, DiagnosticsEngine diagnostics) {
        if (!symbolTable.isFrozen()) {
            throw new IllegalStateException("Path resolution requires a frozen symbol table; run import resolution first");
        }
        this.symbolTable = symbolTable;
        this.tree = symbolTable.tree();
        this.diagnostics = diagnostics;
    }

    /**
     * Resolves a use-site to exactly one declaration or to an error.
     *
     * @param useSite The occurrence to resolve.
     * @return The memoized resolution of the use-site.
     */
    public ResolvedReference resolve(UseSite useSite) {
        return memo.computeIfAbsent(useSite, site -> {
            ResolvedReference reference = compute(site);
            if (!reference.isResolved()) {
                ResolutionError error = reference.error();
                diagnostics.reportError(error.kind(), error.message(), site.location(), site.path(), error.candidates());
            }
            return reference;
        });
    }

    /**
     * Convenience for callers without a source position, e.g. later phases synthesizing paths.
     */
    public ResolvedReference resolve(ModuleId module, String path, Namespace namespace) {
        return resolve(new UseSite(module, path, namespace, SourceLocation.UNKNOWN));
    }

    private ResolvedReference compute(UseSite site) {
        ModuleNode origin = tree.node(site.module()).orElse(null);
        if (origin == null) {
            return ResolvedReference.failed(site, ResolutionError.of(DiagnosticKind.UNKNOWN_MODULE,
                    "Use-site module '" + site.module() + "' is not mounted."));
        }

        QualifiedPath path;
        try {
            path = QualifiedPath.parse(site.path());
        } catch (MalformedPathException e) {
            return ResolvedReference.failed(site, ResolutionError.of(DiagnosticKind.MALFORMED_PATH, e.getMessage()));
        }

        return path.isBare()
                ? resolveBare(site, origin, path.name())
                : resolveQualified(site, origin, path);
    }

    private ResolvedReference resolveBare(UseSite site, ModuleNode origin, String name) {
        ModuleScope scope = symbolTable.scope(origin);

        LookupResult local = scope.lookupLocal(name, site.namespace());
        if (local.isFound()) {
            return toReference(site, local, name);
        }
        LookupResult imported = scope.lookupImport(name, site.namespace());
        if (imported.isFound()) {
            return toReference(site, imported, name);
        }
        return ResolvedReference.failed(site, ResolutionError.of(DiagnosticKind.UNRESOLVED_NAME,
                "Cannot find '" + name + "' in module '" + origin.id() + "': it is neither declared nor imported there."));
    }

    private ResolvedReference resolveQualified(UseSite site, ModuleNode origin, QualifiedPath path) {
        ModuleWalk walk = walk(tree, origin, path);
        if (walk instanceof ModuleWalk.Failed failed) {
            return ResolvedReference.failed(site, failed.error());
        }
        ModuleNode target = ((ModuleWalk.Reached) walk).target();

        LookupResult result = lookupInTarget(target, path.name(), site.namespace());
        if (!result.isFound()) {
            return ResolvedReference.failed(site, ResolutionError.of(DiagnosticKind.UNKNOWN_DECLARATION,
                    "Module '" + target.id() + "' has no item named '" + path.name() + "'."));
        }
        return toReference(site, result, path.name());
    }

    private LookupResult lookupInTarget(ModuleNode target, String name, Namespace namespace) {
        ModuleScope scope = symbolTable.scope(target);
        LookupResult local = scope.lookupLocal(name, namespace);
        if (local.isFound()) {
            return local;
        }
        return scope.reexport(name)
                .map(binding -> binding.lookup(namespace))
                .orElse(LookupResult.NOT_FOUND);
    }

    private static ResolvedReference toReference(UseSite site, LookupResult result, String name) {
        if (result instanceof LookupResult.Unique unique) {
            return ResolvedReference.resolved(site, unique.declaration());
        }
        if (result instanceof LookupResult.Ambiguous ambiguous) {
            return ResolvedReference.failed(site, new ResolutionError(DiagnosticKind.AMBIGUOUS_NAME,
                    "'" + name + "' is ambiguous; candidates: " + ambiguous.candidates() + ".",
                    ambiguous.candidates()));
        }
        throw new IllegalArgumentException("Cannot build a reference from " + result);
    }

    // === Path rendering ===

    /**
     * @return The absolute path of the declaration: {@code crate::a::b::Name}.
     */
    public QualifiedPath canonicalPath(Declaration declaration) {
        ModuleNode owner = tree.require(declaration.module());
        return new QualifiedPath(PathRoot.CRATE, 0, tree.segmentsFromRoot(owner), declaration.name());
    }

    /**
     * Computes the shortest {@code self::}/{@code super::} path from a module to a declaration,
     * the form generated code uses to refer to a type from inside another module.
     *
     * @param declaration The declaration to refer to.
     * @param from        The module the path will be written in.
     * @return A path that resolves to {@code declaration} when used in {@code from}.
     */
    public QualifiedPath relativePath(Declaration declaration, ModuleId from) {
        List<String> fromSegments = tree.segmentsFromRoot(tree.require(from));
        List<String> toSegments = tree.segmentsFromRoot(tree.require(declaration.module()));

        int common = 0;
        while (common < fromSegments.size() && common < toSegments.size()
                && fromSegments.get(common).equals(toSegments.get(common))) {
            common++;
        }
        int ups = fromSegments.size() - common;
        List<String> down = toSegments.subList(common, toSegments.size());
        return ups == 0
                ? new QualifiedPath(PathRoot.SELF, 0, down, declaration.name())
                : new QualifiedPath(PathRoot.SUPER, ups, down, declaration.name());
    }

    // === Shared with import resolution ===

    /**
     * Walks the module prefix of a path starting from {@code origin}.
     * For a bare name the target is the origin itself.
     */
    static ModuleWalk walk(ModuleTree tree, ModuleNode origin, QualifiedPath path) {
        ModuleNode current;
        List<String> segments = path.moduleSegments();
        int next = 0;

        switch (path.root()) {
            case CRATE -> current = tree.root();
            case SELF -> current = origin;
            case SUPER -> {
                current = origin;
                for (int i = 0; i < path.superCount(); i++) {
                    Optional<ModuleNode> parent = tree.parent(current);
                    if (parent.isEmpty()) {
                        return new ModuleWalk.Failed(ResolutionError.of(DiagnosticKind.UNKNOWN_MODULE,
                                "'super' in '" + path + "' goes above the crate root."));
                    }
                    current = parent.get();
                }
            }
            case RELATIVE -> {
                if (segments.isEmpty()) {
                    return new ModuleWalk.Reached(origin);
                }
                String first = segments.get(0);
                Optional<ModuleNode> start = tree.child(origin, first).or(() -> tree.child(tree.root(), first));
                if (start.isEmpty()) {
                    return new ModuleWalk.Failed(ResolutionError.of(DiagnosticKind.UNKNOWN_MODULE,
                            "No module named '" + first + "' in '" + origin.id() + "' or at the crate root."));
                }
                current = start.get();
                next = 1;
            }
            default -> throw new IllegalStateException("Unhandled path root " + path.root());
        }

        for (int i = next; i < segments.size(); i++) {
            String segment = segments.get(i);
            Optional<ModuleNode> child = tree.child(current, segment);
            if (child.isEmpty()) {
                return new ModuleWalk.Failed(ResolutionError.of(DiagnosticKind.UNKNOWN_MODULE,
                        "Module '" + current.id() + "' has no child module named '" + segment + "'."));
            }
            current = child.get();
        }
        return new ModuleWalk.Reached(current);
    }
}
