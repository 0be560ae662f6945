package org.pathwise.compiler.api;

/**
 * Lookup namespaces. A use-site in type position only considers {@link #TYPE} items,
 * a call or constant reference only {@link #VALUE} items.
 */
public enum Namespace {
    TYPE,
    VALUE
}
