package org.pathwise.compiler.frontend.semantics;

import org.pathwise.compiler.api.ModuleSource;
import org.pathwise.compiler.api.Namespace;
import org.pathwise.compiler.api.SourceLocation;
import org.pathwise.compiler.frontend.module.ModuleId;

import java.util.Objects;

/**
 * A specific occurrence of a path that requires resolution.
 *
 * @param module    The module the path occurs in. Resolution starts here.
 * @param path      The surface path text.
 * @param namespace The expected namespace, or null to accept any item kind.
 * @param location  Where the path occurs.
 */
public record UseSite(ModuleId module, String path, Namespace namespace, SourceLocation location) {

    public UseSite {
        Objects.requireNonNull(module, "module");
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(location, "location");
    }

    public static UseSite of(ModuleId module, ModuleSource.PathReference reference) {
        return new UseSite(module, reference.path(), reference.namespace(), reference.location());
    }

    @Override
    public String toString() {
        return path + " @ " + location + " in " + module;
    }
}
