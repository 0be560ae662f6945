package org.pathwise.compiler.frontend.semantics;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * A parsed surface path: a walk root, zero or more module segments and a terminal bare name.
 *
 * <pre>
 *   path     := ["::"] segment ("::" segment)*
 *   leading  := "crate" | "self" | "super" ("::" "super")*
 *   segment  := identifier
 * </pre>
 *
 * <p>{@code crate}, {@code self} and {@code super} may only appear at the start of a path and
 * never as the terminal name.</p>
 *
 * @param root           Where the module walk starts.
 * @param superCount     Number of leading {@code super} segments (0 unless root is SUPER).
 * @param moduleSegments Module names walked after the root, in order.
 * @param name           The terminal bare name.
 */
public record QualifiedPath(PathRoot root, int superCount, List<String> moduleSegments, String name) {

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");
    private static final String SEPARATOR = "::";

    public QualifiedPath {
        Objects.requireNonNull(root, "root");
        Objects.requireNonNull(name, "name");
        moduleSegments = List.copyOf(moduleSegments);
        if ((root == PathRoot.SUPER) != (superCount > 0)) {
            throw new IllegalArgumentException("superCount must be positive exactly for SUPER paths");
        }
    }

    /**
     * @return A bare name: a single RELATIVE segment.
     */
    public static QualifiedPath bare(String name) {
        return new QualifiedPath(PathRoot.RELATIVE, 0, List.of(), name);
    }

    /**
     * Parses a surface path.
     *
     * @param surface The path as written in source.
     * @return The parsed path.
     * @throws MalformedPathException if the text is not a valid path.
     */
    public static QualifiedPath parse(String surface) {
        if (surface == null || surface.isBlank()) {
            throw new MalformedPathException(String.valueOf(surface), "empty path");
        }
        String text = surface.strip();
        PathRoot root = PathRoot.RELATIVE;
        if (text.startsWith(SEPARATOR)) {
            root = PathRoot.CRATE;
            text = text.substring(SEPARATOR.length());
        }

        String[] parts = text.split(SEPARATOR, -1);
        int index = 0;
        int superCount = 0;
        if (root == PathRoot.RELATIVE && parts.length > 1) {
            switch (parts[0]) {
                case "crate" -> {
                    root = PathRoot.CRATE;
                    index = 1;
                }
                case "self" -> {
                    root = PathRoot.SELF;
                    index = 1;
                }
                case "super" -> {
                    root = PathRoot.SUPER;
                    while (index < parts.length - 1 && parts[index].equals("super")) {
                        superCount++;
                        index++;
                    }
                }
                default -> {
                }
            }
        }

        List<String> segments = new ArrayList<>();
        for (int i = index; i < parts.length; i++) {
            String part = parts[i].strip();
            if (part.isEmpty()) {
                throw new MalformedPathException(surface, "empty segment");
            }
            if (!IDENTIFIER.matcher(part).matches()) {
                throw new MalformedPathException(surface, "'" + part + "' is not an identifier");
            }
            if (isKeyword(part)) {
                throw new MalformedPathException(surface, "'" + part + "' is only allowed at the start of a path");
            }
            segments.add(part);
        }
        if (segments.isEmpty()) {
            throw new MalformedPathException(surface, "missing terminal name");
        }

        String name = segments.remove(segments.size() - 1);
        return new QualifiedPath(root, superCount, segments, name);
    }

    /**
     * @return True for a single unqualified identifier.
     */
    public boolean isBare() {
        return root == PathRoot.RELATIVE && moduleSegments.isEmpty();
    }

    private static boolean isKeyword(String segment) {
        return segment.equals("crate") || segment.equals("self") || segment.equals("super");
    }

    /**
     * Renders the path in source syntax.
     */
    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        switch (root) {
            case CRATE -> sb.append("crate").append(SEPARATOR);
            case SELF -> sb.append("self").append(SEPARATOR);
            case SUPER -> sb.append(("super" + SEPARATOR).repeat(superCount));
            case RELATIVE -> {
            }
        }
        for (String segment : moduleSegments) {
            sb.append(segment).append(SEPARATOR);
        }
        return sb.append(name).toString();
    }
}
