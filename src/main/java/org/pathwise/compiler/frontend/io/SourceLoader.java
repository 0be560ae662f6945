package org.pathwise.compiler.frontend.io;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Collectors;

/**
 * Centralizes file loading for the source scanner: local filesystem paths and classpath
 * resources. Content always comes back with {@code \n} line endings.
 */
public final class SourceLoader {

    /**
     * Result of loading a source file.
     *
     * @param content     The file content (line endings normalized to {@code \n}).
     * @param logicalName The canonical name used as module source path and in diagnostics.
     */
    public record LoadResult(String content, String logicalName) {}

    private SourceLoader() {}

    /**
     * Loads content from a local filesystem path.
     *
     * @param path The file to read; it is normalized before use.
     * @return The loaded content and the normalized path as logical name.
     * @throws IOException If the file cannot be read.
     */
    public static LoadResult loadFile(Path path) throws IOException {
        Path normalized = path.normalize();
        String content = String.join("\n", Files.readAllLines(normalized, StandardCharsets.UTF_8)) + "\n";
        return new LoadResult(content, logicalName(normalized));
    }

    /**
     * Loads content from a classpath resource.
     *
     * @param resourcePath The classpath resource path.
     * @return The loaded content and the resource path as logical name.
     * @throws IOException If the resource is not found or cannot be read.
     */
    public static LoadResult loadClasspath(String resourcePath) throws IOException {
        try (InputStream is = Thread.currentThread().getContextClassLoader().getResourceAsStream(resourcePath)) {
            if (is == null) {
                throw new IOException("Resource not found in classpath: " + resourcePath);
            }
            try (BufferedReader br = new BufferedReader(new InputStreamReader(is, StandardCharsets.UTF_8))) {
                String content = br.lines().collect(Collectors.joining("\n")) + "\n";
                return new LoadResult(content, resourcePath);
            }
        }
    }

    /**
     * @return The path with forward slashes, as used for module source names on every platform.
     */
    public static String logicalName(Path path) {
        return path.normalize().toString().replace('\\', '/');
    }
}
