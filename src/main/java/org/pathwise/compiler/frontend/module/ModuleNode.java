package org.pathwise.compiler.frontend.module;

import org.pathwise.compiler.api.ModuleSource;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * One module in the {@link ModuleTree} arena. Nodes refer to their parent and children
 * by arena index, never by object reference.
 */
public final class ModuleNode {

    /** Parent index of the root node. */
    public static final int NO_PARENT = -1;

    private final int index;
    private final String name;
    private final ModuleId id;
    private final int parentIndex;
    private final ModuleSource source;
    private final Map<String, Integer> children = new LinkedHashMap<>();

    ModuleNode(int index, String name, ModuleId id, int parentIndex, ModuleSource source) {
        this.index = index;
        this.name = name;
        this.id = id;
        this.parentIndex = parentIndex;
        this.source = source;
    }

    void addChild(String childName, int childIndex) {
        children.put(childName, childIndex);
    }

    public int index() {
        return index;
    }

    /**
     * @return The module name as declared by its parent; {@code crate} for the root.
     */
    public String name() {
        return name;
    }

    public ModuleId id() {
        return id;
    }

    public ModuleSource source() {
        return source;
    }

    public boolean isRoot() {
        return parentIndex == NO_PARENT;
    }

    public int parentIndex() {
        return parentIndex;
    }

    /**
     * @param childName The child module name.
     * @return The arena index of the child, or empty if this module has no such child.
     */
    public Optional<Integer> childIndex(String childName) {
        return Optional.ofNullable(children.get(childName));
    }

    /**
     * @return Child name to arena index, in declaration order.
     */
    public Map<String, Integer> children() {
        return Collections.unmodifiableMap(children);
    }

    @Override
    public String toString() {
        return id.path() + " (" + source.sourcePath() + ")";
    }
}
