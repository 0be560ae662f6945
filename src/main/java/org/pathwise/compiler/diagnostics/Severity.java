package org.pathwise.compiler.diagnostics;

public enum Severity {
    ERROR,
    WARNING
}
