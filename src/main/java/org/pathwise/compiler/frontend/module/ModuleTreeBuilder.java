package org.pathwise.compiler.frontend.module;

import org.pathwise.compiler.api.CompilationUnit;
import org.pathwise.compiler.api.ModuleSource;
import org.pathwise.compiler.api.SourceLocation;
import org.pathwise.compiler.diagnostics.DiagnosticKind;
import org.pathwise.compiler.diagnostics.DiagnosticsEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Phase 1: mounts the module sources of a compilation unit into a {@link ModuleTree}
 * by following {@code mod} declarations from the root.
 *
 * <p>Problems are reported and the offending edge is skipped, so the rest of the tree is
 * still built:</p>
 * <ul>
 *   <li>two {@code mod} declarations with the same name in one module ({@code DUPLICATE_MODULE_NAME})</li>
 *   <li>a {@code mod} edge back into the current walk path ({@code CYCLIC_MODULE_GRAPH}), also
 *       among sources the root never reaches</li>
 *   <li>a module mounted a second time under another parent ({@code CONFLICTING_MODULE_PARENT})</li>
 *   <li>a {@code mod} target that is not part of the unit ({@code MISSING_MODULE_SOURCE})</li>
 * </ul>
 */
public final class ModuleTreeBuilder {

    private static final Logger LOG = LoggerFactory.getLogger(ModuleTreeBuilder.class);

    private final DiagnosticsEngine diagnostics;

    public ModuleTreeBuilder(DiagnosticsEngine diagnostics) {
        this.diagnostics = diagnostics;
    }

    /**
     * Builds the module tree for the given unit.
     *
     * @param unit The compilation unit.
     * @return The tree of every module reachable from the root. Never null; if the root
     *         source itself is missing, the tree consists of an empty root module.
     */
    public ModuleTree build(CompilationUnit unit) {
        Map<String, ModuleSource> sources = indexSources(unit);

        ModuleSource rootSource = sources.get(unit.rootPath());
        if (rootSource == null) {
            diagnostics.reportError(DiagnosticKind.MISSING_MODULE_SOURCE,
                    "Root module source '" + unit.rootPath() + "' is not part of the compilation unit.",
                    SourceLocation.UNKNOWN);
            rootSource = ModuleSource.builder(unit.rootPath()).build();
        }

        List<ModuleNode> arena = new ArrayList<>();
        Map<String, ModuleNode> mounted = new LinkedHashMap<>();
        ModuleNode root = new ModuleNode(0, ModuleId.ROOT.path(), ModuleId.ROOT, ModuleNode.NO_PARENT, rootSource);
        arena.add(root);
        mounted.put(rootSource.sourcePath(), root);

        Set<String> walkPath = new LinkedHashSet<>();
        mountChildren(root, sources, arena, mounted, walkPath);
        reportUnmountedCycles(sources, mounted);

        for (ModuleSource source : sources.values()) {
            if (!mounted.containsKey(source.sourcePath())) {
                diagnostics.reportWarning(DiagnosticKind.ORPHAN_MODULE,
                        "Module source '" + source.sourcePath() + "' is never mounted by a 'mod' declaration and is ignored.",
                        new SourceLocation(source.sourcePath(), 0, 0));
            }
        }

        LOG.debug("Built module tree with {} module(s) from {} source(s)", arena.size(), sources.size());
        return new ModuleTree(arena);
    }

    /**
     * Walks the {@code mod} edges between sources that were never mounted. A cycle among them
     * is still a cyclic module graph even though no module of it ends up in the tree.
     */
    private void reportUnmountedCycles(Map<String, ModuleSource> sources, Map<String, ModuleNode> mounted) {
        Set<String> visited = new HashSet<>();
        for (ModuleSource source : sources.values()) {
            if (!mounted.containsKey(source.sourcePath()) && !visited.contains(source.sourcePath())) {
                walkUnmounted(source, sources, mounted, visited, new LinkedHashSet<>());
            }
        }
    }

    private void walkUnmounted(ModuleSource source, Map<String, ModuleSource> sources, Map<String, ModuleNode> mounted,
                               Set<String> visited, Set<String> walkPath) {
        visited.add(source.sourcePath());
        walkPath.add(source.sourcePath());

        for (ModuleSource.ModDecl mod : source.mods()) {
            ModuleSource target = sources.get(mod.targetPath());
            if (target == null || mounted.containsKey(target.sourcePath())) {
                continue;
            }
            if (walkPath.contains(target.sourcePath())) {
                diagnostics.reportError(DiagnosticKind.CYCLIC_MODULE_GRAPH,
                        "Module declaration '" + mod.name() + "' forms a cycle: "
                                + String.join(" -> ", walkPath) + " -> " + target.sourcePath(),
                        mod.location());
            } else if (!visited.contains(target.sourcePath())) {
                walkUnmounted(target, sources, mounted, visited, walkPath);
            }
        }

        walkPath.remove(source.sourcePath());
    }

    private Map<String, ModuleSource> indexSources(CompilationUnit unit) {
        Map<String, ModuleSource> sources = new LinkedHashMap<>();
        for (ModuleSource source : unit.modules()) {
            if (sources.putIfAbsent(source.sourcePath(), source) != null) {
                diagnostics.reportError(DiagnosticKind.DUPLICATE_MODULE_SOURCE,
                        "Module source '" + source.sourcePath() + "' is supplied more than once; the first one is used.",
                        new SourceLocation(source.sourcePath(), 0, 0));
            }
        }
        return sources;
    }

    private void mountChildren(ModuleNode parent, Map<String, ModuleSource> sources, List<ModuleNode> arena,
                               Map<String, ModuleNode> mounted, Set<String> walkPath) {
        walkPath.add(parent.source().sourcePath());
        Set<String> childNames = new HashSet<>();

        for (ModuleSource.ModDecl mod : parent.source().mods()) {
            if (!childNames.add(mod.name())) {
                diagnostics.reportError(DiagnosticKind.DUPLICATE_MODULE_NAME,
                        "Module '" + parent.id() + "' already declares a child module named '" + mod.name() + "'.",
                        mod.location());
                continue;
            }

            ModuleSource target = sources.get(mod.targetPath());
            if (target == null) {
                diagnostics.reportError(DiagnosticKind.MISSING_MODULE_SOURCE,
                        "Source '" + mod.targetPath() + "' for module '" + mod.name() + "' was not found.",
                        mod.location());
                continue;
            }

            if (walkPath.contains(target.sourcePath())) {
                diagnostics.reportError(DiagnosticKind.CYCLIC_MODULE_GRAPH,
                        "Module declaration '" + mod.name() + "' forms a cycle: "
                                + String.join(" -> ", walkPath) + " -> " + target.sourcePath(),
                        mod.location());
                continue;
            }

            ModuleNode existing = mounted.get(target.sourcePath());
            if (existing != null) {
                diagnostics.reportError(DiagnosticKind.CONFLICTING_MODULE_PARENT,
                        "Source '" + target.sourcePath() + "' is already mounted as '" + existing.id()
                                + "' and cannot also become '" + parent.id().child(mod.name()) + "'.",
                        mod.location());
                continue;
            }

            ModuleNode child = new ModuleNode(arena.size(), mod.name(), parent.id().child(mod.name()),
                    parent.index(), target);
            arena.add(child);
            mounted.put(target.sourcePath(), child);
            parent.addChild(mod.name(), child.index());

            mountChildren(child, sources, arena, mounted, walkPath);
        }

        walkPath.remove(parent.source().sourcePath());
    }
}
