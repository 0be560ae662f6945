package org.pathwise.compiler.frontend.semantics;

import org.pathwise.compiler.frontend.module.ModuleId;
import org.pathwise.compiler.frontend.module.ModuleNode;
import org.pathwise.compiler.frontend.module.ModuleTree;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A module-aware symbol table: one {@link ModuleScope} per mounted module of a
 * {@link ModuleTree}.
 *
 * <p>There is no notion of a "current module". Every query names the module it is about,
 * which keeps resolution a pure function of the frozen tables and the use-site.</p>
 */
public class SymbolTable {

    private final ModuleTree tree;
    private final Map<ModuleId, ModuleScope> modules = new LinkedHashMap<>();
    private volatile boolean frozen;

    /**
     * Creates an empty scope for every module in the tree.
     * @param tree The module tree of the compilation unit.
     */
    public SymbolTable(ModuleTree tree) {
        this.tree = tree;
        for (ModuleNode node : tree.nodes()) {
            modules.put(node.id(), new ModuleScope(node.id(), node.source().sourcePath()));
        }
    }

    public ModuleTree tree() {
        return tree;
    }

    /**
     * Gets the module scope for the given module ID, or empty if not mounted.
     */
    public Optional<ModuleScope> getModuleScope(ModuleId moduleId) {
        return Optional.ofNullable(modules.get(moduleId));
    }

    /**
     * @throws IllegalArgumentException if the module is not mounted.
     */
    public ModuleScope scope(ModuleId moduleId) {
        ModuleScope scope = modules.get(moduleId);
        if (scope == null) {
            throw new IllegalArgumentException("No scope for module " + moduleId);
        }
        return scope;
    }

    public ModuleScope scope(ModuleNode node) {
        return scope(node.id());
    }

    /**
     * Gets the module scope map, in arena order.
     */
    public Map<ModuleId, ModuleScope> getModules() {
        return Collections.unmodifiableMap(modules);
    }

    /**
     * @return Every declaration of every module, module by module in arena order.
     */
    public List<Declaration> getAllDeclarations() {
        List<Declaration> all = new ArrayList<>();
        modules.values().forEach(scope -> all.addAll(scope.declarations()));
        return all;
    }

    /**
     * Makes every scope read-only. Called once import resolution has reached its fixed point.
     */
    public void freeze() {
        modules.values().forEach(ModuleScope::freeze);
        frozen = true;
    }

    public boolean isFrozen() {
        return frozen;
    }
}
