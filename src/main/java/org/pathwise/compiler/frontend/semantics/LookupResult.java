package org.pathwise.compiler.frontend.semantics;

import org.pathwise.compiler.api.Namespace;

import java.util.Collection;
import java.util.Comparator;
import java.util.List;

/**
 * Outcome of looking a bare name up in a single scope (a module's local declarations or
 * its import scope). Callers switch over all three cases; lookups never throw.
 */
public sealed interface LookupResult permits LookupResult.Unique, LookupResult.Ambiguous, LookupResult.NotFound {

    /** Exactly one declaration matched. */
    record Unique(Declaration declaration) implements LookupResult {}

    /** More than one declaration matched; all of them are kept for reporting. */
    record Ambiguous(List<Declaration> candidates) implements LookupResult {
        public Ambiguous {
            candidates = List.copyOf(candidates);
        }
    }

    /** Nothing matched. */
    record NotFound() implements LookupResult {}

    NotFound NOT_FOUND = new NotFound();

    /** Stable order for candidate lists: module path, then kind. */
    Comparator<Declaration> CANDIDATE_ORDER = Comparator
            .comparing((Declaration d) -> d.module().path())
            .thenComparing(Declaration::kind);

    default boolean isFound() {
        return !(this instanceof NotFound);
    }

    /**
     * Builds a result from the declarations a scope holds under one name, keeping only those
     * in the requested namespace.
     *
     * @param declarations The declarations bound to the name.
     * @param namespace    The namespace to keep, or null to keep all.
     * @return Unique, Ambiguous or NotFound depending on how many survive the filter.
     */
    static LookupResult of(Collection<Declaration> declarations, Namespace namespace) {
        List<Declaration> matching = declarations.stream()
                .filter(d -> namespace == null || d.kind().namespace() == namespace)
                .sorted(CANDIDATE_ORDER)
                .toList();
        if (matching.isEmpty()) {
            return NOT_FOUND;
        }
        if (matching.size() == 1) {
            return new Unique(matching.get(0));
        }
        return new Ambiguous(matching);
    }
}
