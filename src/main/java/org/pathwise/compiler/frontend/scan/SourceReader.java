package org.pathwise.compiler.frontend.scan;

import org.pathwise.compiler.frontend.io.SourceLoader;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Access to module source files. The filesystem implementation is {@link #FILESYSTEM}.
 */
public interface SourceReader {

    SourceReader FILESYSTEM = new SourceReader() {
        @Override
        public SourceLoader.LoadResult read(Path path) throws IOException {
            return SourceLoader.loadFile(path);
        }

        @Override
        public boolean exists(Path path) {
            return Files.isRegularFile(path);
        }
    };

    /**
     * @throws IOException if the file cannot be read.
     */
    SourceLoader.LoadResult read(Path path) throws IOException;

    boolean exists(Path path);
}
