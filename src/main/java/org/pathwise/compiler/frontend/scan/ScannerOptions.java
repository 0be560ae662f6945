package org.pathwise.compiler.frontend.scan;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

import java.util.Set;

/**
 * Settings of the {@link ModuleSourceScanner}, read from the {@code pathwise.scanner}
 * configuration block.
 *
 * @param extension    File extension of module sources, without the dot.
 * @param builtinTypes Type names that never need resolution ({@code u64}, {@code Option}, ...).
 */
public record ScannerOptions(String extension, Set<String> builtinTypes) {

    public ScannerOptions {
        if (extension == null || extension.isBlank()) {
            throw new IllegalArgumentException("extension must not be blank");
        }
        builtinTypes = Set.copyOf(builtinTypes);
    }

    public static ScannerOptions fromConfig(Config scannerConfig) {
        return new ScannerOptions(scannerConfig.getString("extension"),
                Set.copyOf(scannerConfig.getStringList("builtin-types")));
    }

    /**
     * @return The options of the bundled {@code reference.conf}.
     */
    public static ScannerOptions defaults() {
        return fromConfig(ConfigFactory.defaultReference().getConfig("pathwise.scanner"));
    }

    public boolean isBuiltin(String typeName) {
        return builtinTypes.contains(typeName);
    }
}
