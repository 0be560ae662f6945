package org.pathwise.compiler.frontend.semantics;

import org.pathwise.compiler.api.ItemKind;
import org.pathwise.compiler.frontend.module.ModuleId;

/**
 * Uniquely identifies a declaration across all modules.
 * Two declarations with the same bare name in different modules never share a SymbolId.
 *
 * @param module The module that owns the declaration.
 * @param name   The bare declaration name.
 * @param kind   The item kind.
 */
public record SymbolId(ModuleId module, String name, ItemKind kind) {

    @Override
    public String toString() {
        return module.path() + "::" + name;
    }
}
