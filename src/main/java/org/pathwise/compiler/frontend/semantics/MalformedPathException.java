package org.pathwise.compiler.frontend.semantics;

/**
 * Thrown by {@link QualifiedPath#parse(String)} when a surface path does not follow the
 * path grammar. Resolution passes turn it into a {@code MALFORMED_PATH} diagnostic.
 */
public class MalformedPathException extends IllegalArgumentException {

    private final String surface;

    public MalformedPathException(String surface, String reason) {
        super("Malformed path '" + surface + "': " + reason);
        this.surface = surface;
    }

    public String surface() {
        return surface;
    }
}
