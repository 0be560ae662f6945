package org.pathwise.compiler.frontend.module;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The module tree of a compilation unit, stored as an arena of {@link ModuleNode}s.
 * Index 0 is always the crate root. The tree is immutable once built.
 */
public final class ModuleTree {

    private final List<ModuleNode> nodes;
    private final Map<ModuleId, ModuleNode> byId = new HashMap<>();

    ModuleTree(List<ModuleNode> nodes) {
        this.nodes = Collections.unmodifiableList(new ArrayList<>(nodes));
        for (ModuleNode node : nodes) {
            byId.put(node.id(), node);
        }
    }

    public ModuleNode root() {
        return nodes.get(0);
    }

    public ModuleNode node(int index) {
        return nodes.get(index);
    }

    public Optional<ModuleNode> node(ModuleId id) {
        return Optional.ofNullable(byId.get(id));
    }

    /**
     * Like {@link #node(ModuleId)} but for ids that are known to be mounted.
     * @throws IllegalArgumentException if the module is not part of this tree.
     */
    public ModuleNode require(ModuleId id) {
        ModuleNode node = byId.get(id);
        if (node == null) {
            throw new IllegalArgumentException("Module is not mounted in this tree: " + id);
        }
        return node;
    }

    public Optional<ModuleNode> parent(ModuleNode node) {
        return node.isRoot() ? Optional.empty() : Optional.of(nodes.get(node.parentIndex()));
    }

    public Optional<ModuleNode> child(ModuleNode node, String name) {
        return node.childIndex(name).map(nodes::get);
    }

    /**
     * @return All mounted modules in arena order (parents before children).
     */
    public List<ModuleNode> nodes() {
        return nodes;
    }

    public int size() {
        return nodes.size();
    }

    /**
     * @return The number of edges between the root and the node.
     */
    public int depth(ModuleNode node) {
        int depth = 0;
        for (ModuleNode n = node; !n.isRoot(); n = nodes.get(n.parentIndex())) {
            depth++;
        }
        return depth;
    }

    /**
     * Returns the module names on the way from the root (exclusive) down to the node (inclusive).
     * Empty for the root itself.
     */
    public List<String> segmentsFromRoot(ModuleNode node) {
        List<String> segments = new ArrayList<>();
        for (ModuleNode n = node; !n.isRoot(); n = nodes.get(n.parentIndex())) {
            segments.add(n.name());
        }
        Collections.reverse(segments);
        return segments;
    }
}
