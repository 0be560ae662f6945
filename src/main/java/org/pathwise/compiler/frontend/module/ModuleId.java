package org.pathwise.compiler.frontend.module;

import java.util.Objects;

/**
 * Identifies a module by its canonical path from the crate root
 * ({@code crate}, {@code crate::contract_a_types}, ...).
 * Used as a map key throughout the module-aware symbol table.
 *
 * @param path The canonical {@code ::}-separated module path.
 */
public record ModuleId(String path) {

    /** The crate root module. */
    public static final ModuleId ROOT = new ModuleId("crate");

    public ModuleId {
        Objects.requireNonNull(path, "path");
    }

    /**
     * @param name The child module name.
     * @return The id of the named child of this module.
     */
    public ModuleId child(String name) {
        return new ModuleId(path + "::" + name);
    }

    @Override
    public String toString() {
        return path;
    }
}
