package org.pathwise.compiler.frontend.semantics;

import org.pathwise.compiler.api.ItemKind;
import org.pathwise.compiler.api.SourceLocation;
import org.pathwise.compiler.frontend.module.ModuleId;

import java.util.Objects;

/**
 * A named item owned by exactly one module.
 *
 * <p>Equality is identity equality on {@link SymbolId} (module, name, kind). The source
 * location is carried for diagnostics only and never takes part in comparisons.</p>
 */
public final class Declaration {

    private final SymbolId id;
    private final SourceLocation location;

    public Declaration(SymbolId id, SourceLocation location) {
        this.id = Objects.requireNonNull(id, "id");
        this.location = Objects.requireNonNull(location, "location");
    }

    public SymbolId id() {
        return id;
    }

    public ModuleId module() {
        return id.module();
    }

    public String name() {
        return id.name();
    }

    public ItemKind kind() {
        return id.kind();
    }

    public SourceLocation location() {
        return location;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        return o instanceof Declaration other && id.equals(other.id);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public String toString() {
        return id.kind().keyword() + " " + id;
    }
}
