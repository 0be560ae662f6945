package org.pathwise.compiler.frontend.semantics;

import org.pathwise.compiler.api.ModuleSource;
import org.pathwise.compiler.api.Namespace;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * One entry of a module's import scope: a bound bare name and the declarations it stands for.
 *
 * <p>A {@code use} binds every declaration of the imported name in the target module
 * (at most one per kind), so {@code targets} may hold a struct and a function at once.
 * When two imports bind the same name to different declarations the binding is marked
 * {@code ambiguous} and keeps the union of both target sets as candidates. Each origin
 * remembers what it bound on its own, so repeating one of the conflicting imports is still
 * an idempotent re-import.</p>
 *
 * @param name       The bound bare name (the alias, if one was given).
 * @param targets    The bound declarations, in candidate order.
 * @param ambiguous  True if conflicting imports were merged into this binding.
 * @param origins    The {@code use} statements that produced the binding.
 * @param reexported True if any origin is a {@code pub use}.
 */
public record ImportBinding(
        String name,
        List<Declaration> targets,
        boolean ambiguous,
        List<Origin> origins,
        boolean reexported
) {

    /**
     * A {@code use} statement that contributed to a binding.
     *
     * @param use     The statement.
     * @param targets The declarations that statement bound.
     */
    public record Origin(ModuleSource.UseDecl use, Set<Declaration> targets) {

        public Origin {
            targets = Set.copyOf(targets);
        }
    }

    public ImportBinding {
        targets = List.copyOf(targets);
        origins = List.copyOf(origins);
    }

    static ImportBinding of(String name, Set<Declaration> targets, ModuleSource.UseDecl use) {
        return new ImportBinding(name, sorted(targets), false, List.of(new Origin(use, targets)), use.reexported());
    }

    /**
     * @return True if some origin of the binding bound exactly the given declarations.
     */
    boolean hasOriginBinding(Set<Declaration> declarations) {
        return origins.stream().anyMatch(o -> o.targets().equals(declarations));
    }

    /**
     * @return The first origin that bound something other than the given declarations.
     */
    Optional<Origin> firstOriginOtherThan(Set<Declaration> declarations) {
        return origins.stream().filter(o -> !o.targets().equals(declarations)).findFirst();
    }

    /**
     * Records an idempotent re-import of the same declarations.
     */
    ImportBinding withOrigin(ModuleSource.UseDecl use, Set<Declaration> useTargets) {
        List<Origin> merged = new ArrayList<>(origins);
        merged.add(new Origin(use, useTargets));
        return new ImportBinding(name, targets, ambiguous, merged, reexported || use.reexported());
    }

    /**
     * Merges a conflicting import into this binding, turning it into an ambiguity marker.
     */
    ImportBinding withConflict(Set<Declaration> otherTargets, ModuleSource.UseDecl use) {
        Set<Declaration> union = new LinkedHashSet<>(targets);
        union.addAll(otherTargets);
        List<Origin> merged = new ArrayList<>(origins);
        merged.add(new Origin(use, otherTargets));
        return new ImportBinding(name, sorted(union), true, merged, reexported || use.reexported());
    }

    /**
     * Looks the binding up in a namespace.
     *
     * @param namespace The expected namespace, or null for any.
     * @return Unique or NotFound for a regular binding; Ambiguous for a conflicted one
     *         (with the candidates of the requested namespace, or all of them if fewer
     *         than two are in that namespace).
     */
    public LookupResult lookup(Namespace namespace) {
        if (!ambiguous) {
            return LookupResult.of(targets, namespace);
        }
        List<Declaration> inNamespace = targets.stream()
                .filter(d -> namespace == null || d.kind().namespace() == namespace)
                .toList();
        return new LookupResult.Ambiguous(inNamespace.size() > 1 ? inNamespace : targets);
    }

    private static List<Declaration> sorted(Set<Declaration> declarations) {
        return declarations.stream().sorted(LookupResult.CANDIDATE_ORDER).toList();
    }
}
