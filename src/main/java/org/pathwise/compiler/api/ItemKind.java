package org.pathwise.compiler.api;

import java.util.Locale;

/**
 * The kind of a top-level item. Two items of the same kind and name in one module are a
 * duplicate declaration; the same name with different kinds is allowed.
 */
public enum ItemKind {
    /** A struct declaration. */
    STRUCT("struct", Namespace.TYPE),
    /** An enum declaration. */
    ENUM("enum", Namespace.TYPE),
    /** A free function. */
    FUNCTION("fn", Namespace.VALUE),
    /** A {@code type X = ...;} alias. */
    TYPE_ALIAS("type", Namespace.TYPE),
    /** A trait declaration. */
    TRAIT("trait", Namespace.TYPE),
    /** A contract interface ({@code abi}) declaration. */
    ABI("abi", Namespace.TYPE),
    /** A constant. */
    CONSTANT("const", Namespace.VALUE);

    private final String keyword;
    private final Namespace namespace;

    ItemKind(String keyword, Namespace namespace) {
        this.keyword = keyword;
        this.namespace = namespace;
    }

    /**
     * @return The source keyword introducing this item.
     */
    public String keyword() {
        return keyword;
    }

    /**
     * @return The lookup namespace this kind lives in.
     */
    public Namespace namespace() {
        return namespace;
    }

    /**
     * Maps a source keyword ({@code struct}, {@code fn}, ...) to its kind.
     *
     * @param keyword The keyword as written in source.
     * @return The matching kind.
     * @throws IllegalArgumentException if the keyword introduces no known item.
     */
    public static ItemKind fromKeyword(String keyword) {
        String normalized = keyword.toLowerCase(Locale.ROOT);
        for (ItemKind kind : values()) {
            if (kind.keyword.equals(normalized)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown item keyword: " + keyword);
    }

    @Override
    public String toString() {
        return keyword;
    }
}
