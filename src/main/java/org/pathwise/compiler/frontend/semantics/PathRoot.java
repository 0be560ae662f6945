package org.pathwise.compiler.frontend.semantics;

/**
 * Where the module walk of a {@link QualifiedPath} starts.
 */
public enum PathRoot {
    /** {@code crate::a::X} or {@code ::a::X}: the crate root. */
    CRATE,
    /** {@code self::X}: the originating module. */
    SELF,
    /** {@code super::X}, {@code super::super::X}: an ancestor of the originating module. */
    SUPER,
    /** {@code a::X} or bare {@code X}: a child of the originating module, then a child of the root. */
    RELATIVE
}
