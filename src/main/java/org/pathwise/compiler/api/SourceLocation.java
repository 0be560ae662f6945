package org.pathwise.compiler.api;

import java.util.Comparator;
import java.util.Objects;

/**
 * A stable source position attached to every module, item, import and use-site.
 *
 * @param fileName The logical source name (file path or classpath resource).
 * @param line     1-based line number, or 0 when unknown.
 * @param column   1-based column number, or 0 when unknown.
 */
public record SourceLocation(String fileName, int line, int column) implements Comparable<SourceLocation> {

    /** Location for diagnostics that concern the whole compilation unit. */
    public static final SourceLocation UNKNOWN = new SourceLocation("<unit>", 0, 0);

    private static final Comparator<SourceLocation> ORDER = Comparator
            .comparing(SourceLocation::fileName)
            .thenComparingInt(SourceLocation::line)
            .thenComparingInt(SourceLocation::column);

    public SourceLocation {
        Objects.requireNonNull(fileName, "fileName");
    }

    @Override
    public int compareTo(SourceLocation other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return fileName + ":" + line + ":" + column;
    }
}
