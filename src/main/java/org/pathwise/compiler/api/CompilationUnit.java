package org.pathwise.compiler.api;

import java.util.List;
import java.util.Objects;

/**
 * The input of name resolution: the root module's source path and every module source
 * of the unit, in no particular order.
 *
 * @param rootPath The source path of the crate root module.
 * @param modules  All module sources, including the root.
 */
public record CompilationUnit(String rootPath, List<ModuleSource> modules) {

    public CompilationUnit {
        Objects.requireNonNull(rootPath, "rootPath");
        modules = List.copyOf(modules);
    }

    public static CompilationUnit of(String rootPath, ModuleSource... modules) {
        return new CompilationUnit(rootPath, List.of(modules));
    }
}
