package org.pathwise.compiler.diagnostics;

/**
 * Every failure the resolution passes can report. None of them aborts a pass.
 */
public enum DiagnosticKind {
    // Module tree
    DUPLICATE_MODULE_NAME,
    CYCLIC_MODULE_GRAPH,
    CONFLICTING_MODULE_PARENT,
    MISSING_MODULE_SOURCE,
    DUPLICATE_MODULE_SOURCE,
    ORPHAN_MODULE,

    // Declarations
    DUPLICATE_DECLARATION,

    // Imports
    MALFORMED_PATH,
    UNRESOLVED_IMPORT,
    DUPLICATE_IMPORT,
    CYCLIC_IMPORT,

    // Use-sites
    UNKNOWN_MODULE,
    UNKNOWN_DECLARATION,
    UNRESOLVED_NAME,
    AMBIGUOUS_NAME
}
