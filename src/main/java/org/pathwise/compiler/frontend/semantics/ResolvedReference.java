package org.pathwise.compiler.frontend.semantics;

import java.util.Objects;
import java.util.Optional;

/**
 * The resolution of one use-site: exactly one declaration, or an error.
 *
 * @param useSite     The resolved occurrence.
 * @param declaration The declaration it resolves to, or null on failure.
 * @param error       The failure, or null on success.
 */
public record ResolvedReference(UseSite useSite, Declaration declaration, ResolutionError error) {

    public ResolvedReference {
        Objects.requireNonNull(useSite, "useSite");
        if ((declaration == null) == (error == null)) {
            throw new IllegalArgumentException("Exactly one of declaration and error must be set");
        }
    }

    public static ResolvedReference resolved(UseSite useSite, Declaration declaration) {
        return new ResolvedReference(useSite, declaration, null);
    }

    public static ResolvedReference failed(UseSite useSite, ResolutionError error) {
        return new ResolvedReference(useSite, null, error);
    }

    public boolean isResolved() {
        return declaration != null;
    }

    public Optional<Declaration> target() {
        return Optional.ofNullable(declaration);
    }

    /**
     * Compares two references by the identity of the declaration they resolve to, never by
     * their surface text. Unresolved references refer to nothing and are never the same.
     */
    public boolean refersToSameDeclaration(ResolvedReference other) {
        return isResolved() && other.isResolved() && declaration.equals(other.declaration);
    }
}
