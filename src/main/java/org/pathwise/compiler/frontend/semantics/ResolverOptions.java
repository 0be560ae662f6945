package org.pathwise.compiler.frontend.semantics;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;

import java.util.Locale;

/**
 * Tuning and policy knobs of the name resolver, read from the {@code pathwise.resolver}
 * configuration block.
 *
 * @param parallelism          Threads used for per-module pass work (the caller included).
 * @param localImportCollision What happens when an import binds a name the module declares itself.
 */
public record ResolverOptions(int parallelism, LocalImportCollision localImportCollision) {

    /**
     * Policy for an import whose bound name is also a local declaration of the importing module.
     * The local declaration wins lookups under both policies.
     */
    public enum LocalImportCollision {
        /** Report the import as a {@code DUPLICATE_IMPORT} and drop it. */
        REPORT,
        /** Drop the import silently; the local declaration shadows it. */
        SHADOW
    }

    public static final ResolverOptions DEFAULTS = new ResolverOptions(1, LocalImportCollision.REPORT);

    public ResolverOptions {
        if (parallelism < 1) {
            throw new IllegalArgumentException("parallelism must be >= 1, got " + parallelism);
        }
        if (localImportCollision == null) {
            throw new IllegalArgumentException("localImportCollision must be set");
        }
    }

    /**
     * Reads the options from a resolver config block.
     *
     * @param resolverConfig The {@code pathwise.resolver} block.
     * @return The parsed options.
     * @throws ConfigException.BadValue if the collision policy is not a known value.
     */
    public static ResolverOptions fromConfig(Config resolverConfig) {
        int parallelism = effectiveParallelism(resolverConfig.getInt("parallelism"));
        String policy = resolverConfig.getString("local-import-collision");
        try {
            return new ResolverOptions(parallelism, LocalImportCollision.valueOf(policy.toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            throw new ConfigException.BadValue(resolverConfig.origin(), "local-import-collision",
                    "expected REPORT or SHADOW, got '" + policy + "'", e);
        }
    }

    /**
     * @param requested A configured or requested thread count.
     * @return The count itself, or the number of available processors if it is zero or negative.
     */
    public static int effectiveParallelism(int requested) {
        return requested <= 0 ? Runtime.getRuntime().availableProcessors() : requested;
    }

    public ResolverOptions withParallelism(int parallelism) {
        return new ResolverOptions(parallelism, localImportCollision);
    }

    public ResolverOptions withLocalImportCollision(LocalImportCollision policy) {
        return new ResolverOptions(parallelism, policy);
    }
}
