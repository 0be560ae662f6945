package org.pathwise.compiler.api;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * The structured view of one source module, as handed over by the parser (or the
 * lightweight {@code ModuleSourceScanner}): its {@code mod} declarations, {@code use}
 * statements, top-level items and the path references found in signatures.
 *
 * @param sourcePath The unique logical name of the module source (file path or resource).
 * @param mods       {@code mod name;} declarations mounting child modules.
 * @param uses       {@code use} statements, in source order.
 * @param items      Top-level items, in source order.
 * @param references Use-sites that need resolution (types in signatures, impl targets).
 */
public record ModuleSource(
        String sourcePath,
        List<ModDecl> mods,
        List<UseDecl> uses,
        List<ItemDecl> items,
        List<PathReference> references
) {

    public ModuleSource {
        Objects.requireNonNull(sourcePath, "sourcePath");
        mods = List.copyOf(mods);
        uses = List.copyOf(uses);
        items = List.copyOf(items);
        references = List.copyOf(references);
    }

    /**
     * A {@code mod name;} declaration.
     *
     * @param name       The child module name as seen from the declaring module.
     * @param targetPath The source path of the child module.
     * @param location   Where the declaration appears.
     */
    public record ModDecl(String name, String targetPath, SourceLocation location) {}

    /**
     * A {@code use} statement.
     *
     * @param path       The imported path exactly as written ({@code another_lib::VeryCommonNameStruct}).
     * @param alias      The {@code as} alias, or null.
     * @param reexported True for {@code pub use}.
     * @param location   Where the statement appears.
     */
    public record UseDecl(String path, String alias, boolean reexported, SourceLocation location) {

        /**
         * @return The surface text of the statement, for messages.
         */
        public String surface() {
            return (reexported ? "pub use " : "use ") + path + (alias != null ? " as " + alias : "");
        }
    }

    /**
     * A top-level item.
     *
     * @param name     The bare item name.
     * @param kind     The item kind.
     * @param location Where the item name appears.
     */
    public record ItemDecl(String name, ItemKind kind, SourceLocation location) {}

    /**
     * A use-site: one occurrence of a path that must resolve to a declaration.
     *
     * @param path      The surface path text (qualified or bare).
     * @param namespace The expected namespace, or null to accept any kind.
     * @param location  Where the path appears.
     */
    public record PathReference(String path, Namespace namespace, SourceLocation location) {}

    /**
     * Starts a builder. Every added element gets the next line number, which keeps
     * locations distinct and ordered without writing them out by hand.
     *
     * @param sourcePath The logical source name of the module.
     * @return A fresh builder.
     */
    public static Builder builder(String sourcePath) {
        return new Builder(sourcePath);
    }

    /**
     * Fluent builder for {@link ModuleSource}.
     */
    public static final class Builder {
        private final String sourcePath;
        private final List<ModDecl> mods = new ArrayList<>();
        private final List<UseDecl> uses = new ArrayList<>();
        private final List<ItemDecl> items = new ArrayList<>();
        private final List<PathReference> references = new ArrayList<>();
        private int line = 1;

        private Builder(String sourcePath) {
            this.sourcePath = sourcePath;
        }

        private SourceLocation next() {
            return new SourceLocation(sourcePath, line++, 1);
        }

        public Builder mod(String name, String targetPath) {
            mods.add(new ModDecl(name, targetPath, next()));
            return this;
        }

        public Builder use(String path) {
            uses.add(new UseDecl(path, null, false, next()));
            return this;
        }

        public Builder use(String path, String alias) {
            uses.add(new UseDecl(path, alias, false, next()));
            return this;
        }

        public Builder pubUse(String path) {
            uses.add(new UseDecl(path, null, true, next()));
            return this;
        }

        public Builder item(ItemKind kind, String name) {
            items.add(new ItemDecl(name, kind, next()));
            return this;
        }

        public Builder struct(String name) {
            return item(ItemKind.STRUCT, name);
        }

        public Builder function(String name) {
            return item(ItemKind.FUNCTION, name);
        }

        public Builder reference(String path) {
            return reference(path, null);
        }

        public Builder reference(String path, Namespace namespace) {
            references.add(new PathReference(path, namespace, next()));
            return this;
        }

        public ModuleSource build() {
            return new ModuleSource(sourcePath, mods, uses, items, references);
        }
    }
}
