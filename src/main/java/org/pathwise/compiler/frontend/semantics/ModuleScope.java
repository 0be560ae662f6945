package org.pathwise.compiler.frontend.semantics;

import org.pathwise.compiler.api.ItemKind;
import org.pathwise.compiler.api.Namespace;
import org.pathwise.compiler.frontend.module.ModuleId;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Holds per-module data in the module-aware symbol table: the module's own declarations
 * (its local symbol table) and its import scope.
 *
 * <p>A scope is written by exactly one pass at a time and becomes read-only once
 * {@link #freeze()} is called at the end of import resolution.</p>
 */
public final class ModuleScope {

    private final ModuleId moduleId;
    private final String sourcePath;
    private final Map<String, Map<ItemKind, Declaration>> symbols = new LinkedHashMap<>();
    private final Map<String, ImportBinding> imports = new LinkedHashMap<>();
    private volatile boolean frozen;

    public ModuleScope(ModuleId moduleId, String sourcePath) {
        this.moduleId = moduleId;
        this.sourcePath = sourcePath;
    }

    public ModuleId moduleId() {
        return moduleId;
    }

    public String sourcePath() {
        return sourcePath;
    }

    // === Local declarations ===

    /**
     * Registers a declaration under its (name, kind) key.
     *
     * @param declaration The declaration to add; must be owned by this module.
     * @return The declaration already registered under the same key, in which case nothing
     *         is added; empty if the declaration was added.
     */
    Optional<Declaration> define(Declaration declaration) {
        ensureMutable();
        if (!declaration.module().equals(moduleId)) {
            throw new IllegalArgumentException(declaration + " is not owned by module " + moduleId);
        }
        Map<ItemKind, Declaration> perKind = symbols.computeIfAbsent(declaration.name(), k -> new EnumMap<>(ItemKind.class));
        Declaration existing = perKind.putIfAbsent(declaration.kind(), declaration);
        return Optional.ofNullable(existing);
    }

    public boolean declares(String name) {
        return symbols.containsKey(name);
    }

    /**
     * @return Every local declaration named {@code name}, at most one per kind.
     */
    public Collection<Declaration> declarationsNamed(String name) {
        Map<ItemKind, Declaration> perKind = symbols.get(name);
        return perKind == null ? List.of() : Collections.unmodifiableCollection(perKind.values());
    }

    public Optional<Declaration> declaration(String name, ItemKind kind) {
        Map<ItemKind, Declaration> perKind = symbols.get(name);
        return perKind == null ? Optional.empty() : Optional.ofNullable(perKind.get(kind));
    }

    public LookupResult lookupLocal(String name, Namespace namespace) {
        return LookupResult.of(declarationsNamed(name), namespace);
    }

    /**
     * @return All local declarations in registration order.
     */
    public List<Declaration> declarations() {
        List<Declaration> all = new ArrayList<>();
        symbols.values().forEach(perKind -> all.addAll(perKind.values()));
        return all;
    }

    // === Import scope ===

    void bind(ImportBinding binding) {
        ensureMutable();
        imports.put(binding.name(), binding);
    }

    public Optional<ImportBinding> importBinding(String name) {
        return Optional.ofNullable(imports.get(name));
    }

    /**
     * @return The binding for {@code name} if it was made by a {@code pub use}, i.e. is
     *         reachable from other modules through a qualified path.
     */
    public Optional<ImportBinding> reexport(String name) {
        return importBinding(name).filter(ImportBinding::reexported);
    }

    public LookupResult lookupImport(String name, Namespace namespace) {
        ImportBinding binding = imports.get(name);
        return binding == null ? LookupResult.NOT_FOUND : binding.lookup(namespace);
    }

    /**
     * Bound name to binding, in binding order.
     */
    public Map<String, ImportBinding> imports() {
        return Collections.unmodifiableMap(imports);
    }

    // === Lifecycle ===

    void freeze() {
        frozen = true;
    }

    public boolean isFrozen() {
        return frozen;
    }

    private void ensureMutable() {
        if (frozen) {
            throw new IllegalStateException("Scope of module " + moduleId + " is frozen");
        }
    }
}
